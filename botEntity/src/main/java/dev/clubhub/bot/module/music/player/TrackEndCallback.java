package dev.clubhub.bot.module.music.player;

/** Invoked once by the audio transport when the track it was given stops. */
@FunctionalInterface
public interface TrackEndCallback {

  /** @param error failure that ended playback, or null on a normal end or stop */
  void onFinished(Throwable error);
}
