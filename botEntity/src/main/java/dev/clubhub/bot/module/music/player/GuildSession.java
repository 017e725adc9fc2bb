package dev.clubhub.bot.module.music.player;

import dev.clubhub.bot.config.ConfigurationFile;
import dev.clubhub.bot.module.music.model.GuildMusicState;
import dev.clubhub.bot.module.music.model.QueueItem;
import dev.clubhub.bot.module.music.queue.TrackQueue;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

/**
 * Everything one session owns. Fields are only touched from {@link #mailbox()}; {@link
 * MusicPlayer} holds the transitions.
 */
public final class GuildSession {

  /** Stream URL resolved ahead of time for a specific queued item. */
  record Preload(QueueItem item, String streamUrl) {}

  private final long guildId;
  private final SessionMailbox mailbox;
  private final ConfigurationFile.MusicConfig config;
  private final Clock clock;

  TrackQueue queue;
  GuildMusicState state;
  VoiceSession voice;
  CompletableFuture<VoiceSession> pendingConnect;
  /** A queue head is being resolved and will start playing when done. */
  boolean advancing;
  /** Bumped whenever the pending resolution stops being wanted, e.g. on skip. */
  long advanceToken;
  Preload preload;
  int retries;
  /** Bumped on every teardown; async results carrying an older value are dropped. */
  long generation;
  /** Identifies the audio play whose completion we are waiting for. */
  long playbackToken;

  GuildSession(long guildId, ConfigurationFile.MusicConfig config, Clock clock) {
    this.guildId = guildId;
    this.config = config;
    this.clock = clock;
    this.mailbox = new SessionMailbox("music-session-" + guildId);
    this.queue = newQueue();
    this.state = new GuildMusicState(guildId, config.defaultVolume, clock.instant());
  }

  public long guildId() {
    return guildId;
  }

  public SessionMailbox mailbox() {
    return mailbox;
  }

  /** Replaces queue and state with fresh instances and invalidates in-flight work. */
  void reset() {
    generation++;
    playbackToken++;
    queue = newQueue();
    state = new GuildMusicState(guildId, config.defaultVolume, clock.instant());
    voice = null;
    pendingConnect = null;
    advancing = false;
    advanceToken++;
    preload = null;
    retries = 0;
  }

  /** Returns the preloaded URL if it was prepared for {@code item}, clearing the slot. */
  String takePreloadFor(QueueItem item) {
    Preload p = preload;
    if (p == null || p.item() != item) return null;
    preload = null;
    return p.streamUrl();
  }

  PlayerPhase phase() {
    if (pendingConnect != null) return PlayerPhase.CONNECTING;
    if (voice == null || !voice.isConnected()) return PlayerPhase.DISCONNECTED;
    if (state.isPaused()) return PlayerPhase.PAUSED;
    if (state.isPlaying()) return PlayerPhase.PLAYING;
    return PlayerPhase.IDLE;
  }

  private TrackQueue newQueue() {
    return new TrackQueue(config.maxQueueSize, config.historyLimit, clock, new Random());
  }
}
