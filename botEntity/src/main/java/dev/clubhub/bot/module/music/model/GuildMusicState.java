package dev.clubhub.bot.module.music.model;

import java.time.Clock;
import java.time.Instant;
import lombok.Getter;

/**
 * Playback flags of one session. Mutated only from the session's own serialized flow.
 *
 * <p>{@code paused} implies {@code playing}: clearing {@code playing} clears {@code paused} and
 * pausing requires playback.
 */
@Getter
public class GuildMusicState {

  private final long guildId;
  private boolean playing;
  private boolean paused;
  private int volume;
  private LoopMode loopMode = LoopMode.NONE;
  private Instant lastActivity;
  private Long channelOwnerId;

  public GuildMusicState(long guildId, int volume, Instant now) {
    this.guildId = guildId;
    this.volume = clampVolume(volume);
    this.lastActivity = now;
  }

  public static int clampVolume(int volume) {
    return Math.max(0, Math.min(100, volume));
  }

  public void setPlaying(boolean playing) {
    this.playing = playing;
    if (!playing) this.paused = false;
  }

  public void setPaused(boolean paused) {
    if (paused && !playing) throw new IllegalStateException("cannot pause while not playing");
    this.paused = paused;
  }

  /** Stores the clamped volume and returns it. */
  public int setVolume(int volume) {
    this.volume = clampVolume(volume);
    return this.volume;
  }

  public void setLoopMode(LoopMode loopMode) {
    this.loopMode = loopMode == null ? LoopMode.NONE : loopMode;
  }

  /** Records the first owner only; later calls are ignored. */
  public boolean claimOwnership(long userId) {
    if (channelOwnerId != null) return false;
    channelOwnerId = userId;
    return true;
  }

  public void touch(Clock clock) {
    this.lastActivity = clock.instant();
  }
}
