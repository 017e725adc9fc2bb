package dev.clubhub.bot.module.music.model;

/** Repeat behaviour applied when a track finishes. */
public enum LoopMode {
  NONE,
  TRACK,
  QUEUE
}
