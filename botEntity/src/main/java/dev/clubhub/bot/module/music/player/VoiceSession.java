package dev.clubhub.bot.module.music.player;

import dev.clubhub.bot.module.music.model.ChannelRef;
import dev.clubhub.bot.module.music.model.VoiceMember;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * An established voice connection for one session. Implementations deliver {@link
 * TrackEndCallback}s from their own threads.
 */
public interface VoiceSession {

  ChannelRef getChannel();

  CompletableFuture<Void> moveTo(ChannelRef channel);

  /**
   * Starts streaming, replacing whatever was playing. The new audio is never paused, even if the
   * previous one was. {@code onFinished} fires exactly once for this call, including when playback
   * is ended by {@link #stop()}.
   *
   * @param volume 0-100
   */
  void play(String streamUrl, int volume, TrackEndCallback onFinished);

  /** Audio is actively being sent (started and not paused). */
  boolean isPlaying();

  boolean isPaused();

  void pause();

  void resume();

  void stop();

  /** Applies the volume to the live audio, returns false when nothing is loaded. */
  boolean setVolume(int volume);

  void disconnect();

  boolean isConnected();

  /** Members currently in the connected channel, the bot itself included. */
  List<VoiceMember> getChannelOccupants();
}
