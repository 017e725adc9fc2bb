package dev.clubhub.bot.module.music.player;

import dev.clubhub.bot.Lang;
import dev.clubhub.bot.config.ConfigurationFile;
import dev.clubhub.bot.module.music.model.ChannelRef;
import dev.clubhub.bot.module.music.model.LoopMode;
import dev.clubhub.bot.module.music.model.QueueItem;
import dev.clubhub.bot.module.music.model.Track;
import dev.clubhub.bot.module.music.model.VoiceMember;
import dev.clubhub.bot.module.music.permission.PermissionResult;
import dev.clubhub.bot.module.music.queue.QueuePage;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-session playback state machine.
 *
 * <p>Each operation is queued into the session's {@link SessionMailbox} and answered through a
 * {@link CompletableFuture}. Audio completions from the transport and results of background stream
 * resolution are marshalled into the same mailbox, so a user {@code skip} and an organic track end
 * never race on the queue. Sessions do not share anything and run in parallel.
 */
@Slf4j
public class MusicPlayer {

  @Getter private final SessionRegistry registry;
  @Getter private final SessionEventDispatcher events = new SessionEventDispatcher();
  private final VoiceConnector connector;
  private final TrackResolver resolver;
  private final ConfigurationFile.MusicConfig config;
  private final Executor resolverExecutor;
  private final Clock clock;

  public MusicPlayer(
      VoiceConnector connector,
      TrackResolver resolver,
      ConfigurationFile.MusicConfig config,
      Executor resolverExecutor,
      Clock clock) {
    this.connector = connector;
    this.resolver = resolver;
    this.config = config;
    this.resolverExecutor = resolverExecutor;
    this.clock = clock;
    this.registry = new SessionRegistry(id -> new GuildSession(id, config, clock));
  }

  public void addListener(MusicEventListener listener) {
    events.addListener(listener);
  }

  public void removeListener(MusicEventListener listener) {
    events.removeListener(listener);
  }

  // --- connection lifecycle -------------------------------------------------------------------

  /**
   * Joins {@code channel}. Returns the existing connection when already there, moves it when
   * connected elsewhere, otherwise opens a new one. The first successful connect of a session
   * makes {@code requesterId} its owner.
   */
  public CompletableFuture<VoiceSession> connect(ChannelRef channel, long requesterId) {
    GuildSession s = registry.getOrCreate(channel.guildId());
    return s.mailbox().compose(() -> connectInSession(s, channel, requesterId));
  }

  /**
   * Like {@link #connect(ChannelRef, long)}, but first asks {@code guard} about the session's
   * current channel in the same mailbox turn. A denial fails the future with {@link
   * SessionMoveDeniedException} and leaves the session alone.
   */
  public CompletableFuture<VoiceSession> connect(
      ChannelRef channel, long requesterId, Function<Optional<SessionChannel>, PermissionResult> guard) {
    GuildSession s = registry.getOrCreate(channel.guildId());
    return s.mailbox()
        .compose(
            () -> {
              PermissionResult move = guard.apply(channelOf(s));
              if (!move.allowed()) {
                return CompletableFuture.<VoiceSession>failedFuture(new SessionMoveDeniedException(move));
              }
              return connectInSession(s, channel, requesterId);
            });
  }

  private CompletableFuture<VoiceSession> connectInSession(
      GuildSession s, ChannelRef channel, long requesterId) {
    if (s.voice != null && s.voice.isConnected()) {
      VoiceSession voice = s.voice;
      if (voice.getChannel().sameChannel(channel)) {
        s.state.touch(clock);
        return CompletableFuture.completedFuture(voice);
      }
      long generation = s.generation;
      log.info("Moving session {} from {} to {}", s.guildId(), voice.getChannel(), channel);
      return voice
          .moveTo(channel)
          .thenApplyAsync(
              ignored -> {
                if (generation != s.generation) {
                  throw new VoiceConnectException("Session was torn down while moving");
                }
                s.state.touch(clock);
                return voice;
              },
              s.mailbox());
    }
    if (s.pendingConnect != null) return s.pendingConnect;

    long generation = s.generation;
    Duration timeout = config.connectTimeout();
    CompletableFuture<VoiceSession> attempt;
    try {
      attempt = connector.connect(channel, timeout).orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RuntimeException e) {
      attempt = CompletableFuture.failedFuture(e);
    }
    CompletableFuture<VoiceSession> result =
        attempt.handleAsync(
            (voice, error) -> {
              boolean current = generation == s.generation;
              if (current) s.pendingConnect = null;
              if (error != null) {
                Throwable cause = unwrap(error);
                log.error("Could not connect session {} to {}", s.guildId(), channel, cause);
                if (cause instanceof VoiceConnectException vce) throw vce;
                String message =
                    cause instanceof TimeoutException
                        ? Lang.get("music.error.connect_timeout").formatted(channel.name(), timeout.toSeconds())
                        : Lang.get("music.error.connect_failed");
                throw new VoiceConnectException(message, cause);
              }
              if (!current) {
                log.info("Session {} was torn down while connecting, dropping connection", s.guildId());
                voice.disconnect();
                throw new VoiceConnectException("Session was torn down while connecting");
              }
              s.voice = voice;
              if (s.state.claimOwnership(requesterId)) {
                log.debug("Session {} is owned by {}", s.guildId(), requesterId);
              }
              s.state.touch(clock);
              log.info("Connected session {} to {}", s.guildId(), channel);
              return voice;
            },
            s.mailbox());
    s.pendingConnect = result;
    return result;
  }

  /** Stops audio, leaves voice and replaces queue and state with fresh ones. Idempotent. */
  public CompletableFuture<Void> disconnect(long guildId) {
    Optional<GuildSession> session = registry.find(guildId);
    if (session.isEmpty()) return CompletableFuture.completedFuture(null);
    GuildSession s = session.get();
    return s.mailbox()
        .call(
            () -> {
              disconnectInSession(s);
              return null;
            });
  }

  /** Same as {@link #disconnect(long)}. */
  public CompletableFuture<Void> stop(long guildId) {
    return disconnect(guildId);
  }

  private void disconnectInSession(GuildSession s) {
    VoiceSession voice = s.voice;
    boolean hadSession = voice != null || s.pendingConnect != null || !s.queue.isEmpty();
    s.reset();
    if (voice != null) {
      try {
        if (voice.isPlaying() || voice.isPaused()) voice.stop();
      } catch (RuntimeException e) {
        log.warn("Failed to stop audio for session {}", s.guildId(), e);
      }
      try {
        voice.disconnect();
      } catch (RuntimeException e) {
        log.warn("Failed to close voice connection for session {}", s.guildId(), e);
      }
    }
    if (hadSession) log.info("Disconnected session {}", s.guildId());
  }

  // --- queueing and transport controls --------------------------------------------------------

  /** Queues the track and starts playback if idle. Empty when the queue is full. */
  public CompletableFuture<Optional<QueueItem>> play(
      long guildId, Track track, long requesterId, String requesterName) {
    GuildSession s = registry.getOrCreate(guildId);
    return s.mailbox()
        .call(
            () -> {
              Optional<QueueItem> item = s.queue.add(track, requesterId, requesterName);
              if (item.isEmpty()) return item;
              if (!s.state.isPlaying() && !s.advancing) {
                playNext(s);
              } else {
                preloadNext(s);
              }
              s.state.touch(clock);
              return item;
            });
  }

  /** Queues as many tracks as fit; starts playback once if idle and anything was accepted. */
  public CompletableFuture<List<QueueItem>> playMultiple(
      long guildId, List<Track> tracks, long requesterId, String requesterName) {
    GuildSession s = registry.getOrCreate(guildId);
    return s.mailbox()
        .call(
            () -> {
              List<QueueItem> items = s.queue.addMultiple(tracks, requesterId, requesterName);
              if (items.size() < tracks.size()) {
                log.warn(
                    "Session {} queue filled up, accepted {} of {} tracks",
                    guildId,
                    items.size(),
                    tracks.size());
              }
              if (!items.isEmpty()) {
                if (!s.state.isPlaying() && !s.advancing) {
                  playNext(s);
                } else {
                  preloadNext(s);
                }
              }
              s.state.touch(clock);
              return items;
            });
  }

  /**
   * Stops the current audio; its completion advances the queue. Returns the queue head at the
   * moment of the skip, which is a hint only: loop mode or failed resolutions can make something
   * else play.
   */
  public CompletableFuture<Optional<QueueItem>> skip(long guildId) {
    GuildSession s = registry.getOrCreate(guildId);
    return s.mailbox().call(() -> skipInSession(s));
  }

  /**
   * Skips the current item only if {@code check} allows it. The check sees the item that is
   * current when the skip runs, not one observed earlier.
   */
  public CompletableFuture<SkipOutcome> skipIf(long guildId, Function<QueueItem, PermissionResult> check) {
    Optional<GuildSession> session = registry.find(guildId);
    if (session.isEmpty()) return CompletableFuture.completedFuture(SkipOutcome.nothingPlaying());
    GuildSession s = session.get();
    return s.mailbox()
        .call(
            () -> {
              Optional<QueueItem> current = s.queue.getCurrent();
              if (current.isEmpty()) return SkipOutcome.nothingPlaying();
              PermissionResult permission = check.apply(current.get());
              if (!permission.allowed()) return SkipOutcome.denied(current.get(), permission);
              return SkipOutcome.skipped(current.get(), permission, skipInSession(s));
            });
  }

  private Optional<QueueItem> skipInSession(GuildSession s) {
    if (s.voice == null) return Optional.empty();
    Optional<QueueItem> next = s.queue.peekNext();
    if (s.advancing) {
      // nothing is audible yet; drop the pending resolution and move on
      log.debug("Skipping {} before it started in session {}", s.queue.getCurrent().orElse(null), s.guildId());
      s.advancing = false;
      s.advanceToken++;
      playNext(s);
    } else if (s.voice.isPlaying() || s.voice.isPaused()) {
      s.voice.stop();
    }
    s.state.touch(clock);
    return next;
  }

  /** Pauses actively playing audio. False in any other state. */
  public CompletableFuture<Boolean> pause(long guildId) {
    GuildSession s = registry.getOrCreate(guildId);
    return s.mailbox()
        .call(
            () -> {
              if (s.voice == null || !s.state.isPlaying() || !s.voice.isPlaying()) return false;
              s.voice.pause();
              s.state.setPaused(true);
              s.state.touch(clock);
              log.debug("Paused session {}", guildId);
              return true;
            });
  }

  /** Resumes paused audio. False in any other state. */
  public CompletableFuture<Boolean> resume(long guildId) {
    GuildSession s = registry.getOrCreate(guildId);
    return s.mailbox()
        .call(
            () -> {
              if (s.voice == null || !s.state.isPaused() || !s.voice.isPaused()) return false;
              s.voice.resume();
              s.state.setPaused(false);
              s.state.touch(clock);
              log.debug("Resumed session {}", guildId);
              return true;
            });
  }

  /** Clamps into 0-100, stores it and applies it to live audio. Returns the stored value. */
  public CompletableFuture<Integer> setVolume(long guildId, int volume) {
    GuildSession s = registry.getOrCreate(guildId);
    return s.mailbox()
        .call(
            () -> {
              int applied = s.state.setVolume(volume);
              if (s.voice != null) s.voice.setVolume(applied);
              return applied;
            });
  }

  /** Takes effect at the next track completion. */
  public CompletableFuture<Void> setLoopMode(long guildId, LoopMode mode) {
    GuildSession s = registry.getOrCreate(guildId);
    return s.mailbox()
        .call(
            () -> {
              s.state.setLoopMode(mode);
              log.info("Loop mode of session {} set to {}", guildId, s.state.getLoopMode());
              return null;
            });
  }

  public CompletableFuture<LoopMode> getLoopMode(long guildId) {
    return registry
        .find(guildId)
        .map(s -> s.mailbox().call(() -> s.state.getLoopMode()))
        .orElseGet(() -> CompletableFuture.completedFuture(LoopMode.NONE));
  }

  /** Drops every queued item, keeping the current one. Returns how many were removed. */
  public CompletableFuture<Integer> clearQueue(long guildId) {
    GuildSession s = registry.getOrCreate(guildId);
    return s.mailbox()
        .call(
            () -> {
              int removed = s.queue.clearPending();
              s.preload = null;
              log.info("Cleared {} queued track(s) in session {}", removed, guildId);
              return removed;
            });
  }

  public CompletableFuture<Optional<QueueItem>> removeAt(long guildId, int position) {
    GuildSession s = registry.getOrCreate(guildId);
    return s.mailbox()
        .call(
            () -> {
              Optional<QueueItem> removed = s.queue.removeAt(position);
              if (removed.isPresent() && s.state.isPlaying()) preloadNext(s);
              return removed;
            });
  }

  public CompletableFuture<Void> shuffle(long guildId) {
    GuildSession s = registry.getOrCreate(guildId);
    return s.mailbox()
        .call(
            () -> {
              s.queue.shuffle();
              if (s.state.isPlaying()) preloadNext(s);
              return null;
            });
  }

  public CompletableFuture<QueuePage> getPage(long guildId, int page, int perPage) {
    GuildSession s = registry.getOrCreate(guildId);
    return s.mailbox().call(() -> s.queue.getPage(page, perPage));
  }

  public CompletableFuture<SessionSnapshot> snapshot(long guildId) {
    GuildSession s = registry.getOrCreate(guildId);
    return s.mailbox().call(() -> snapshotOf(s));
  }

  /** Playing and not paused. */
  public CompletableFuture<Boolean> isPlaying(long guildId) {
    return registry
        .find(guildId)
        .map(s -> s.mailbox().call(() -> s.state.isPlaying() && !s.state.isPaused()))
        .orElseGet(() -> CompletableFuture.completedFuture(false));
  }

  public CompletableFuture<Boolean> isConnected(long guildId) {
    return registry
        .find(guildId)
        .map(s -> s.mailbox().call(() -> s.voice != null && s.voice.isConnected()))
        .orElseGet(() -> CompletableFuture.completedFuture(false));
  }

  /** Channel, owner and occupants of a connected session; empty when it is not connected. */
  public CompletableFuture<Optional<SessionChannel>> sessionChannel(long guildId) {
    Optional<GuildSession> session = registry.find(guildId);
    if (session.isEmpty()) return CompletableFuture.completedFuture(Optional.empty());
    GuildSession s = session.get();
    return s.mailbox().call(() -> channelOf(s));
  }

  private Optional<SessionChannel> channelOf(GuildSession s) {
    if (s.voice == null || !s.voice.isConnected()) return Optional.empty();
    return Optional.of(
        new SessionChannel(s.voice.getChannel(), s.state.getChannelOwnerId(), s.voice.getChannelOccupants()));
  }

  private SessionSnapshot snapshotOf(GuildSession s) {
    return new SessionSnapshot(
        s.guildId(),
        s.phase(),
        s.queue.getCurrent(),
        s.queue.getAll(),
        s.queue.getHistory(),
        s.queue.getTotalDuration(),
        s.state.getVolume(),
        s.state.getLoopMode(),
        s.state.isPlaying(),
        s.state.isPaused(),
        s.state.getChannelOwnerId(),
        s.state.getLastActivity());
  }

  // --- inactivity -------------------------------------------------------------------------------

  /**
   * Disconnects the session when its channel has no humans left, or when it is not playing and
   * has been idle longer than the configured timeout. Returns whether it was torn down.
   */
  public CompletableFuture<Boolean> checkInactivity(long guildId) {
    Optional<GuildSession> session = registry.find(guildId);
    if (session.isEmpty()) return CompletableFuture.completedFuture(false);
    GuildSession s = session.get();
    return s.mailbox().call(() -> checkInactivityInSession(s));
  }

  private boolean checkInactivityInSession(GuildSession s) {
    if (s.voice == null || !s.voice.isConnected()) return false;
    List<VoiceMember> occupants = s.voice.getChannelOccupants();
    if (occupants.stream().allMatch(VoiceMember::bot)) {
      log.info("Channel {} is empty, leaving session {}", s.voice.getChannel(), s.guildId());
      disconnectInSession(s);
      return true;
    }
    if (!s.state.isPlaying()) {
      Duration idle = Duration.between(s.state.getLastActivity(), clock.instant());
      if (idle.compareTo(config.inactivityTimeout()) > 0) {
        log.info("Session {} idle for {}s, disconnecting", s.guildId(), idle.toSeconds());
        disconnectInSession(s);
        return true;
      }
    }
    return false;
  }

  /**
   * Tears the session down if its transport no longer reports a connection, e.g. after the bot
   * was kicked from the channel. Returns whether it was torn down.
   */
  public CompletableFuture<Boolean> voiceLost(long guildId) {
    Optional<GuildSession> session = registry.find(guildId);
    if (session.isEmpty()) return CompletableFuture.completedFuture(false);
    GuildSession s = session.get();
    return s.mailbox()
        .call(
            () -> {
              if (s.voice == null || s.voice.isConnected()) return false;
              log.info("Session {} lost its voice connection", s.guildId());
              disconnectInSession(s);
              return true;
            });
  }

  /** Runs {@link #checkInactivity(long)} for every known session; completes with the count reaped. */
  public CompletableFuture<Integer> sweepInactive() {
    List<CompletableFuture<Boolean>> checks =
        registry.all().stream().map(s -> checkInactivity(s.guildId())).toList();
    return CompletableFuture.allOf(checks.toArray(CompletableFuture[]::new))
        .thenApply(ignored -> (int) checks.stream().filter(check -> check.join()).count());
  }

  public void shutdown() {
    registry.shutdown();
  }

  // --- completion protocol ----------------------------------------------------------------------

  /** Pops the next queued item and starts it, or goes idle when the queue is empty. */
  private void playNext(GuildSession s) {
    if (s.voice == null || !s.voice.isConnected()) {
      log.warn("Session {} has no voice connection, {} track(s) wait", s.guildId(), s.queue.size());
      s.state.setPlaying(false);
      return;
    }
    Optional<QueueItem> next = s.queue.getNext();
    if (next.isEmpty()) {
      log.debug("Queue of session {} is empty", s.guildId());
      s.state.setPlaying(false);
      s.queue.setCurrent(null);
      s.preload = null;
      events.dispatch(new SessionEvent.QueueEmptied(s.guildId()));
      return;
    }
    QueueItem item = next.get();
    s.queue.setCurrent(item);
    startItem(s, item);
  }

  private void startItem(GuildSession s, QueueItem item) {
    String streamUrl = s.takePreloadFor(item);
    if (streamUrl == null) streamUrl = item.getTrack().getStreamUrl().orElse(null);
    if (streamUrl != null) {
      beginPlayback(s, item, streamUrl);
      return;
    }
    long generation = s.generation;
    long advance = ++s.advanceToken;
    s.advancing = true;
    resolveStreamUrl(item.getTrack())
        .whenCompleteAsync(
            (url, error) -> {
              if (generation != s.generation || advance != s.advanceToken) {
                log.debug("Dropping stale resolution of {} for session {}", item, s.guildId());
                return;
              }
              s.advancing = false;
              if (error != null || url == null) {
                onResolveFailed(s, item, error == null ? null : unwrap(error));
              } else {
                beginPlayback(s, item, url);
              }
            },
            s.mailbox());
  }

  private void onResolveFailed(GuildSession s, QueueItem item, Throwable error) {
    if (error != null) {
      log.error("Could not resolve a stream URL for {} in session {}", item.getTrack(), s.guildId(), error);
    } else {
      log.error("No stream URL for {} in session {}", item.getTrack(), s.guildId());
    }
    if (s.retries < config.maxRetries) {
      s.retries++;
      log.warn("Trying the next track in session {} (attempt {}/{})", s.guildId(), s.retries, config.maxRetries);
      playNext(s);
      return;
    }
    s.retries = 0;
    s.state.setPlaying(false);
    s.queue.setCurrent(null);
    log.error("Giving up on session {} after {} failed resolutions", s.guildId(), config.maxRetries + 1);
    events.dispatch(new SessionEvent.Errored(s.guildId(), Lang.get("music.error.play_failed")));
  }

  private void beginPlayback(GuildSession s, QueueItem item, String streamUrl) {
    if (s.voice == null || !s.voice.isConnected()) {
      log.warn("Session {} lost its voice connection before {} could start", s.guildId(), item);
      s.state.setPlaying(false);
      return;
    }
    long token = ++s.playbackToken;
    try {
      s.voice.play(
          streamUrl,
          s.state.getVolume(),
          error -> s.mailbox().execute(() -> onTrackFinished(s, token, error)));
    } catch (RuntimeException e) {
      log.error("Voice transport refused {} in session {}", item.getTrack(), s.guildId(), e);
      s.state.setPlaying(false);
      events.dispatch(new SessionEvent.Errored(s.guildId(), String.valueOf(e.getMessage())));
      return;
    }
    s.retries = 0;
    s.state.setPlaying(true);
    s.state.setPaused(false);
    s.state.touch(clock);
    log.info("Session {} now playing {}", s.guildId(), item.getTrack().getDisplayName());
    events.dispatch(new SessionEvent.TrackStarted(s.guildId(), item));
    preloadNext(s);
  }

  private void onTrackFinished(GuildSession s, long token, Throwable error) {
    if (token != s.playbackToken || s.voice == null) {
      log.trace("Ignoring stale completion in session {}", s.guildId());
      return;
    }
    if (error != null) log.error("Playback failed in session {}", s.guildId(), error);

    QueueItem finished = s.queue.getCurrent().orElse(null);
    if (finished != null) events.dispatch(new SessionEvent.TrackEnded(s.guildId(), finished));

    LoopMode mode = s.state.getLoopMode();
    if (mode == LoopMode.TRACK && finished != null) {
      log.debug("Repeating {} in session {}", finished.getTrack().getDisplayName(), s.guildId());
      startItem(s, finished);
      return;
    }
    if (mode == LoopMode.QUEUE && finished != null) {
      if (!s.queue.append(finished.requeue(clock.instant()))) {
        log.warn("Queue of session {} is full, {} drops out of the loop", s.guildId(), finished);
      }
    }
    playNext(s);
  }

  /** Resolves the queue head ahead of time so the next start skips the lookup. */
  private void preloadNext(GuildSession s) {
    Optional<QueueItem> head = s.queue.peekNext();
    if (head.isEmpty()) {
      s.preload = null;
      return;
    }
    QueueItem item = head.get();
    if (s.preload != null && s.preload.item() == item) return;
    Optional<String> cached = item.getTrack().getStreamUrl();
    if (cached.isPresent()) {
      s.preload = new GuildSession.Preload(item, cached.get());
      return;
    }
    long generation = s.generation;
    resolveStreamUrl(item.getTrack())
        .whenCompleteAsync(
            (url, error) -> {
              if (generation != s.generation) return;
              if (error != null || url == null) {
                log.debug("Preload of {} failed in session {}", item, s.guildId());
                return;
              }
              if (s.queue.peekNext().filter(h -> h == item).isPresent()) {
                s.preload = new GuildSession.Preload(item, url);
                log.debug("Preloaded {} for session {}", item.getTrack().getDisplayName(), s.guildId());
              }
            },
            s.mailbox());
  }

  /** Completes with the URL, or null when the resolver has none. */
  private CompletableFuture<String> resolveStreamUrl(Track track) {
    Optional<String> cached = track.getStreamUrl();
    if (cached.isPresent()) return CompletableFuture.completedFuture(cached.get());
    return CompletableFuture.supplyAsync(
            () -> resolver.getStreamUrl(track).map(track::cacheStreamUrl).orElse(null),
            resolverExecutor)
        .orTimeout(config.resolveTimeout().toMillis(), TimeUnit.MILLISECONDS);
  }

  private static Throwable unwrap(Throwable error) {
    Throwable t = error;
    while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
