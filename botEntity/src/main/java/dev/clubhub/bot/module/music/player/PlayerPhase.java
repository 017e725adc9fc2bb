package dev.clubhub.bot.module.music.player;

/** Lifecycle phase of a session as derived from its connection and playback flags. */
public enum PlayerPhase {
  DISCONNECTED,
  CONNECTING,
  IDLE,
  PLAYING,
  PAUSED
}
