package dev.clubhub.bot.module.music.player;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import dev.clubhub.bot.Lang;
import dev.clubhub.bot.config.ConfigurationFile;
import dev.clubhub.bot.module.music.model.ChannelRef;
import dev.clubhub.bot.module.music.model.LoopMode;
import dev.clubhub.bot.module.music.model.QueueItem;
import dev.clubhub.bot.module.music.model.Track;
import dev.clubhub.bot.module.music.model.VoiceMember;
import dev.clubhub.bot.module.music.permission.PermissionLevel;
import dev.clubhub.bot.module.music.permission.PermissionResult;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MusicPlayerTest {

  private static final long G = 42L;
  private static final ChannelRef LOUNGE = new ChannelRef(G, 1001L, "lounge");
  private static final ChannelRef STUDY = new ChannelRef(G, 1002L, "study");
  private static final long ALICE = 1L;
  private static final long BOB = 2L;

  @Mock private TrackResolver resolver;

  private final List<String> events = new CopyOnWriteArrayList<>();
  private final MusicEventListener recorder =
      new MusicEventListener() {
        @Override
        public void onTrackStart(long guildId, QueueItem item) {
          events.add("start:" + item.getTrack().getTitle());
        }

        @Override
        public void onTrackEnd(long guildId, QueueItem item) {
          events.add("end:" + item.getTrack().getTitle());
        }

        @Override
        public void onQueueEmpty(long guildId) {
          events.add("empty");
        }

        @Override
        public void onError(long guildId, String message) {
          events.add("error");
        }
      };

  private ConfigurationFile.MusicConfig config;
  private FakeVoiceConnector connector;
  private MutableClock clock;
  private MusicPlayer player;

  @BeforeEach
  void setup() {
    config = new ConfigurationFile.MusicConfig();
    connector = new FakeVoiceConnector();
    clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    player = newPlayer(Runnable::run);
  }

  @AfterEach
  void tearDown() {
    player.shutdown();
  }

  private MusicPlayer newPlayer(java.util.concurrent.Executor resolverExecutor) {
    MusicPlayer p = new MusicPlayer(connector, resolver, config, resolverExecutor, clock);
    p.addListener(recorder);
    return p;
  }

  private static Track cached(String title, long seconds) {
    return Track.builder()
        .title(title)
        .url("https://example.org/" + title)
        .duration(seconds)
        .streamUrl("stream:" + title)
        .build();
  }

  private static Track unresolved(String title) {
    return Track.builder().title(title).url("https://example.org/" + title).duration(30).build();
  }

  private static <T> T await(CompletableFuture<T> future) throws Exception {
    return future.get(5, TimeUnit.SECONDS);
  }

  /** Lets chained mailbox hops (resolution results, completions) run to the end. */
  private SessionSnapshot settle() throws Exception {
    SessionSnapshot snapshot = null;
    for (int i = 0; i < 12; i++) snapshot = await(player.snapshot(G));
    return snapshot;
  }

  private FakeVoiceSession connected() throws Exception {
    await(player.connect(LOUNGE, ALICE));
    return connector.last();
  }

  @Test
  @DisplayName("connect: first connect records the owner, a second one reuses the session")
  void connectReusesSession() throws Exception {
    VoiceSession first = await(player.connect(LOUNGE, ALICE));
    VoiceSession second = await(player.connect(LOUNGE, BOB));

    assertSame(first, second);
    assertEquals(1, connector.sessions.size());
    SessionSnapshot snapshot = await(player.snapshot(G));
    assertEquals(ALICE, snapshot.channelOwnerId());
    assertEquals(PlayerPhase.IDLE, snapshot.phase());
  }

  @Test
  @DisplayName("connect: another channel moves the existing connection")
  void connectElsewhereMoves() throws Exception {
    FakeVoiceSession voice = connected();
    VoiceSession moved = await(player.connect(STUDY, BOB));

    assertSame(voice, moved);
    assertEquals(STUDY, voice.getChannel());
    assertEquals(1, connector.sessions.size());
    assertEquals(ALICE, await(player.snapshot(G)).channelOwnerId());
  }

  @Test
  @DisplayName("connect: transport failure fails the future and leaves state untouched")
  void connectFailure() throws Exception {
    connector.nextResult = CompletableFuture.failedFuture(new VoiceConnectException("no access"));

    ExecutionException ex = assertThrows(ExecutionException.class, () -> await(player.connect(LOUNGE, ALICE)));
    assertInstanceOf(VoiceConnectException.class, ex.getCause());

    SessionSnapshot snapshot = await(player.snapshot(G));
    assertEquals(PlayerPhase.DISCONNECTED, snapshot.phase());
    assertNull(snapshot.channelOwnerId());
  }

  @Test
  @DisplayName("connect: a connection that never completes times out")
  void connectTimeout() throws Exception {
    config.connectTimeoutSeconds = 0;
    connector.nextResult = new CompletableFuture<>();

    ExecutionException ex = assertThrows(ExecutionException.class, () -> await(player.connect(LOUNGE, ALICE)));
    assertInstanceOf(VoiceConnectException.class, ex.getCause());
    assertInstanceOf(TimeoutException.class, ex.getCause().getCause());
    assertEquals(Lang.get("music.error.connect_timeout").formatted("lounge", 0L), ex.getCause().getMessage());
    assertEquals(PlayerPhase.DISCONNECTED, await(player.snapshot(G)).phase());
  }

  @Test
  @DisplayName("connect: a guarded connect sees the live channel and a denial leaves the session in place")
  void guardedConnectDenied() throws Exception {
    FakeVoiceSession voice = connected();
    AtomicReference<Optional<SessionChannel>> seen = new AtomicReference<>();

    ExecutionException ex =
        assertThrows(
            ExecutionException.class,
            () ->
                await(
                    player.connect(
                        STUDY,
                        BOB,
                        current -> {
                          seen.set(current);
                          return PermissionResult.deny("busy", PermissionLevel.USER);
                        })));

    SessionMoveDeniedException denied = assertInstanceOf(SessionMoveDeniedException.class, ex.getCause());
    assertEquals("busy", denied.getPermission().reason());
    assertEquals(LOUNGE, seen.get().orElseThrow().channel());
    assertEquals(LOUNGE, voice.getChannel());
    assertEquals(ALICE, await(player.snapshot(G)).channelOwnerId());
  }

  @Test
  @DisplayName("connect: an allowing guard connects as usual")
  void guardedConnectAllowed() throws Exception {
    VoiceSession voice =
        await(player.connect(LOUNGE, ALICE, current -> PermissionResult.allow("", PermissionLevel.USER)));

    assertSame(connector.last(), voice);
    assertEquals(ALICE, await(player.snapshot(G)).channelOwnerId());
  }

  @Test
  @DisplayName("play: starts immediately when idle")
  void playStartsWhenIdle() throws Exception {
    FakeVoiceSession voice = connected();
    Optional<QueueItem> item = await(player.play(G, cached("A", 100), ALICE, "alice"));

    assertTrue(item.isPresent());
    assertEquals("stream:A", voice.lastPlayed());
    assertEquals(config.defaultVolume, voice.volume);
    SessionSnapshot snapshot = await(player.snapshot(G));
    assertEquals(PlayerPhase.PLAYING, snapshot.phase());
    assertEquals("A", snapshot.current().orElseThrow().getTrack().getTitle());
    assertEquals(1, snapshot.current().orElseThrow().getPosition());
    assertEquals(List.of("start:A"), events);
  }

  @Test
  @DisplayName("play: queues behind the current track")
  void playQueuesWhilePlaying() throws Exception {
    FakeVoiceSession voice = connected();
    await(player.play(G, cached("A", 100), ALICE, "alice"));
    QueueItem b = await(player.play(G, cached("B", 60), BOB, "bob")).orElseThrow();

    assertEquals(1, voice.played.size());
    assertEquals(2, b.getPosition());
    SessionSnapshot snapshot = await(player.snapshot(G));
    assertEquals(1, snapshot.size());
    assertEquals(160, snapshot.totalDuration());
  }

  @Test
  @DisplayName("play: full queue is rejected with an empty result")
  void playRejectsWhenFull() throws Exception {
    config.maxQueueSize = 1;
    connected();
    await(player.play(G, cached("A", 10), ALICE, "alice"));
    await(player.play(G, cached("B", 10), ALICE, "alice"));

    assertTrue(await(player.play(G, cached("C", 10), ALICE, "alice")).isEmpty());
  }

  @Test
  @DisplayName("play: without a connection the track stays queued")
  void playWithoutConnectionQueues() throws Exception {
    await(player.play(G, cached("A", 10), ALICE, "alice"));

    SessionSnapshot snapshot = await(player.snapshot(G));
    assertEquals(1, snapshot.size());
    assertFalse(snapshot.playing());
  }

  @Test
  @DisplayName("playMultiple: starts once and keeps the rest queued")
  void playMultipleStartsOnce() throws Exception {
    FakeVoiceSession voice = connected();
    List<QueueItem> items =
        await(player.playMultiple(G, List.of(cached("A", 10), cached("B", 10), cached("C", 10)), ALICE, "alice"));

    assertEquals(3, items.size());
    assertEquals(List.of("stream:A"), voice.played);
    assertEquals(2, await(player.snapshot(G)).size());
  }

  @Test
  @DisplayName("completion: advances through the queue and reports when it empties")
  void completionAdvances() throws Exception {
    FakeVoiceSession voice = connected();
    await(player.playMultiple(G, List.of(cached("A", 10), cached("B", 10)), ALICE, "alice"));

    voice.finish(null);
    settle();
    assertEquals("stream:B", voice.lastPlayed());

    voice.finish(null);
    SessionSnapshot snapshot = settle();

    assertEquals(List.of("start:A", "end:A", "start:B", "end:B", "empty"), events);
    assertEquals(PlayerPhase.IDLE, snapshot.phase());
    assertTrue(snapshot.current().isEmpty());
    assertEquals(List.of("A", "B"), snapshot.history().stream().map(i -> i.getTrack().getTitle()).toList());
  }

  @Test
  @DisplayName("completion: an error from the transport still advances")
  void completionWithErrorAdvances() throws Exception {
    FakeVoiceSession voice = connected();
    await(player.playMultiple(G, List.of(cached("A", 10), cached("B", 10)), ALICE, "alice"));

    voice.finish(new IllegalStateException("decoder died"));
    settle();

    assertEquals("stream:B", voice.lastPlayed());
  }

  @Test
  @DisplayName("loop TRACK: replays the finished track and leaves the queue alone")
  void loopTrack() throws Exception {
    FakeVoiceSession voice = connected();
    await(player.playMultiple(G, List.of(cached("A", 10), cached("B", 10)), ALICE, "alice"));
    await(player.setLoopMode(G, LoopMode.TRACK));

    voice.finish(null);
    SessionSnapshot snapshot = settle();

    assertEquals(List.of("stream:A", "stream:A"), voice.played);
    assertEquals(1, snapshot.size());
    assertEquals("A", snapshot.current().orElseThrow().getTrack().getTitle());
  }

  @Test
  @DisplayName("loop QUEUE: the finished track goes back to the tail")
  void loopQueue() throws Exception {
    FakeVoiceSession voice = connected();
    await(player.playMultiple(G, List.of(cached("A", 10), cached("B", 10)), ALICE, "alice"));
    await(player.setLoopMode(G, LoopMode.QUEUE));
    assertEquals(LoopMode.QUEUE, await(player.getLoopMode(G)));

    voice.finish(null);
    SessionSnapshot snapshot = settle();

    assertEquals("stream:B", voice.lastPlayed());
    assertEquals(1, snapshot.size());
    QueueItem tail = snapshot.queued().get(0);
    assertEquals("A", tail.getTrack().getTitle());
    assertEquals(2, tail.getPosition());
  }

  @Test
  @DisplayName("skip: stops the audio, reports the head and the completion plays it")
  void skipAdvances() throws Exception {
    FakeVoiceSession voice = connected();
    await(player.playMultiple(G, List.of(cached("A", 10), cached("B", 10)), ALICE, "alice"));

    Optional<QueueItem> next = await(player.skip(G));
    settle();

    assertEquals("B", next.orElseThrow().getTrack().getTitle());
    assertEquals(1, voice.stops);
    assertEquals("stream:B", voice.lastPlayed());
  }

  @Test
  @DisplayName("skip: nothing to report without a connection")
  void skipWithoutConnection() throws Exception {
    assertTrue(await(player.skip(G)).isEmpty());
  }

  @Test
  @DisplayName("skip: an item still resolving is dropped and the next one plays")
  void skipWhileResolving() throws Exception {
    List<Runnable> pending = new CopyOnWriteArrayList<>();
    player.shutdown();
    player = newPlayer(pending::add);
    when(resolver.getStreamUrl(any())).thenReturn(Optional.of("late:A"));
    FakeVoiceSession voice = connected();

    await(player.playMultiple(G, List.of(unresolved("A"), cached("B", 10)), ALICE, "alice"));
    Optional<QueueItem> next = await(player.skip(G));
    pending.forEach(Runnable::run);
    SessionSnapshot snapshot = settle();

    assertEquals("B", next.orElseThrow().getTrack().getTitle());
    assertEquals(List.of("stream:B"), voice.played);
    assertEquals(List.of("start:B"), events);
    assertEquals("B", snapshot.current().orElseThrow().getTrack().getTitle());
  }

  @Test
  @DisplayName("skipIf: the check runs against the item current when the skip lands")
  void skipIfSeesLiveCurrent() throws Exception {
    FakeVoiceSession voice = connected();
    await(player.play(G, cached("A", 10), ALICE, "alice"));
    await(player.play(G, cached("B", 10), BOB, "bob"));

    // A ends on its own; its completion is queued ahead of the skip
    voice.finish(null);
    SkipOutcome outcome =
        await(
            player.skipIf(
                G,
                item ->
                    item.getRequesterId() == ALICE
                        ? PermissionResult.allow("", PermissionLevel.USER)
                        : PermissionResult.deny("not yours", PermissionLevel.USER)));

    assertEquals(SkipOutcome.Status.DENIED, outcome.status());
    assertEquals("B", outcome.current().orElseThrow().getTrack().getTitle());
    assertEquals("not yours", outcome.permission().reason());
    assertEquals(0, voice.stops);
    assertEquals("stream:B", voice.lastPlayed());
  }

  @Test
  @DisplayName("skipIf: an allowed skip stops the audio; an unknown session has nothing playing")
  void skipIfAllowed() throws Exception {
    assertEquals(
        SkipOutcome.Status.NOTHING_PLAYING,
        await(player.skipIf(777L, item -> PermissionResult.allow("", PermissionLevel.USER))).status());

    FakeVoiceSession voice = connected();
    await(player.playMultiple(G, List.of(cached("A", 10), cached("B", 10)), ALICE, "alice"));
    SkipOutcome outcome = await(player.skipIf(G, item -> PermissionResult.allow("", PermissionLevel.USER)));
    settle();

    assertEquals(SkipOutcome.Status.SKIPPED, outcome.status());
    assertEquals("B", outcome.next().orElseThrow().getTrack().getTitle());
    assertEquals(1, voice.stops);
    assertEquals("stream:B", voice.lastPlayed());
  }

  @Test
  @DisplayName("queries: read-only calls for an unknown session do not create one")
  void readOnlyQueriesDoNotCreateSessions() throws Exception {
    assertFalse(await(player.isPlaying(555L)));
    assertFalse(await(player.isConnected(555L)));
    assertEquals(LoopMode.NONE, await(player.getLoopMode(555L)));
    assertTrue(await(player.sessionChannel(555L)).isEmpty());

    assertEquals(0, player.getRegistry().size());
  }

  @Test
  @DisplayName("pause/resume: only valid from the matching state")
  void pauseResume() throws Exception {
    connected();
    assertFalse(await(player.pause(G)));

    await(player.play(G, cached("A", 10), ALICE, "alice"));
    assertFalse(await(player.resume(G)));
    assertTrue(await(player.pause(G)));
    assertEquals(PlayerPhase.PAUSED, await(player.snapshot(G)).phase());
    assertFalse(await(player.isPlaying(G)));
    assertFalse(await(player.pause(G)));

    assertTrue(await(player.resume(G)));
    assertTrue(await(player.isPlaying(G)));
  }

  @Test
  @DisplayName("setVolume: clamps and applies to live audio")
  void volumeClamps() throws Exception {
    FakeVoiceSession voice = connected();
    await(player.play(G, cached("A", 10), ALICE, "alice"));

    assertEquals(100, await(player.setVolume(G, 150)));
    assertEquals(100, voice.volume);
    assertEquals(0, await(player.setVolume(G, -3)));
  }

  @Test
  @DisplayName("clearQueue: removes queued items and keeps the current one")
  void clearQueueKeepsCurrent() throws Exception {
    connected();
    await(player.playMultiple(G, List.of(cached("A", 10), cached("B", 10), cached("C", 10)), ALICE, "alice"));

    assertEquals(2, await(player.clearQueue(G)));
    SessionSnapshot snapshot = await(player.snapshot(G));
    assertEquals(0, snapshot.size());
    assertEquals("A", snapshot.current().orElseThrow().getTrack().getTitle());
  }

  @Test
  @DisplayName("removeAt/shuffle/getPage: work on the session queue")
  void queueEditing() throws Exception {
    connected();
    await(player.playMultiple(G, List.of(cached("A", 10), cached("B", 10), cached("C", 10)), ALICE, "alice"));

    assertEquals("B", await(player.removeAt(G, 2)).orElseThrow().getTrack().getTitle());
    await(player.shuffle(G));
    assertEquals(1, await(player.getPage(G, 1, 10)).items().size());
  }

  @Test
  @DisplayName("resolution: failures are retried up to maxRetries, then an error halts playback")
  void retriesThenErrors() throws Exception {
    when(resolver.getStreamUrl(any())).thenReturn(Optional.empty());
    FakeVoiceSession voice = connected();
    List<Track> tracks = new ArrayList<>();
    for (String t : List.of("A", "B", "C", "D", "E")) tracks.add(unresolved(t));

    await(player.playMultiple(G, tracks, ALICE, "alice"));
    SessionSnapshot snapshot = settle();

    verify(resolver, times(config.maxRetries + 1)).getStreamUrl(any());
    assertEquals(List.of("error"), events);
    assertTrue(voice.played.isEmpty());
    assertFalse(snapshot.playing());
    assertEquals(1, snapshot.size());
  }

  @Test
  @DisplayName("resolution: a failure followed by a good track keeps playing")
  void retryRecovers() throws Exception {
    when(resolver.getStreamUrl(any())).thenReturn(Optional.empty());
    FakeVoiceSession voice = connected();

    await(player.playMultiple(G, List.of(unresolved("A"), cached("B", 10)), ALICE, "alice"));
    settle();

    assertEquals(List.of("stream:B"), voice.played);
    assertEquals(List.of("start:B"), events);
  }

  @Test
  @DisplayName("preload: the next head is resolved once while the current track plays")
  void preloadsNextHead() throws Exception {
    Track b = unresolved("B");
    when(resolver.getStreamUrl(b)).thenReturn(Optional.of("resolved:B"));
    FakeVoiceSession voice = connected();

    await(player.playMultiple(G, List.of(cached("A", 10), b), ALICE, "alice"));
    settle();
    verify(resolver, times(1)).getStreamUrl(b);

    voice.finish(null);
    settle();

    assertEquals("resolved:B", voice.lastPlayed());
    verify(resolver, times(1)).getStreamUrl(b);
  }

  @Test
  @DisplayName("disconnect: resets the session and ignores the old completion")
  void disconnectDiscardsStaleCompletion() throws Exception {
    FakeVoiceSession voice = connected();
    await(player.playMultiple(G, List.of(cached("A", 10), cached("B", 10)), ALICE, "alice"));

    await(player.disconnect(G));
    SessionSnapshot snapshot = settle();

    assertTrue(voice.disconnected);
    assertEquals(List.of("stream:A"), voice.played);
    assertEquals(List.of("start:A"), events);
    assertEquals(PlayerPhase.DISCONNECTED, snapshot.phase());
    assertEquals(0, snapshot.size());
    assertTrue(snapshot.current().isEmpty());
    assertNull(snapshot.channelOwnerId());
  }

  @Test
  @DisplayName("disconnect: idempotent and a no-op for unknown sessions")
  void disconnectIdempotent() throws Exception {
    await(player.disconnect(777L));
    connected();
    await(player.stop(G));
    await(player.stop(G));
    assertFalse(await(player.isConnected(G)));
  }

  @Test
  @DisplayName("disconnect: a resolution finishing afterwards is dropped")
  void disconnectDuringResolution() throws Exception {
    List<Runnable> pending = new CopyOnWriteArrayList<>();
    player.shutdown();
    player = newPlayer(pending::add);
    when(resolver.getStreamUrl(any())).thenReturn(Optional.of("late-url"));
    FakeVoiceSession voice = connected();

    await(player.play(G, unresolved("A"), ALICE, "alice"));
    assertEquals(PlayerPhase.IDLE, await(player.snapshot(G)).phase());
    await(player.disconnect(G));

    pending.forEach(Runnable::run);
    SessionSnapshot snapshot = settle();

    assertTrue(voice.played.isEmpty());
    assertTrue(events.isEmpty());
    assertEquals(PlayerPhase.DISCONNECTED, snapshot.phase());
    assertTrue(snapshot.current().isEmpty());
  }

  @Test
  @DisplayName("inactivity: an idle session past the timeout is disconnected")
  void idleSessionReaped() throws Exception {
    FakeVoiceSession voice = connected();
    clock.advance(Duration.ofSeconds(config.inactivityTimeoutSeconds + 1));

    assertEquals(1, await(player.sweepInactive()));
    assertTrue(voice.disconnected);
    assertEquals(0, await(player.sweepInactive()));
  }

  @Test
  @DisplayName("inactivity: recent activity or active playback keeps the session")
  void activeSessionKept() throws Exception {
    FakeVoiceSession voice = connected();
    clock.advance(Duration.ofSeconds(config.inactivityTimeoutSeconds - 10));
    assertFalse(await(player.checkInactivity(G)));

    await(player.play(G, cached("A", 10), ALICE, "alice"));
    clock.advance(Duration.ofSeconds(config.inactivityTimeoutSeconds * 2));
    assertEquals(0, await(player.sweepInactive()));
    assertFalse(voice.disconnected);
  }

  @Test
  @DisplayName("inactivity: a channel without humans is left even while playing")
  void emptyChannelReaped() throws Exception {
    FakeVoiceSession voice = connected();
    await(player.play(G, cached("A", 10), ALICE, "alice"));
    voice.occupants.removeIf(m -> !m.bot());

    assertTrue(await(player.checkInactivity(G)));
    assertTrue(voice.disconnected);
  }

  @Test
  @DisplayName("voiceLost: tears down only when the transport is gone")
  void voiceLost() throws Exception {
    FakeVoiceSession voice = connected();
    assertFalse(await(player.voiceLost(G)));

    voice.connected = false;
    assertTrue(await(player.voiceLost(G)));
    assertEquals(PlayerPhase.DISCONNECTED, await(player.snapshot(G)).phase());
  }

  @Test
  @DisplayName("sessionChannel: exposes channel, owner and occupants of a connected session")
  void sessionChannel() throws Exception {
    assertTrue(await(player.sessionChannel(G)).isEmpty());
    connected();

    SessionChannel channel = await(player.sessionChannel(G)).orElseThrow();
    assertEquals(LOUNGE, channel.channel());
    assertEquals(ALICE, channel.ownerId());
    assertTrue(channel.occupants().stream().anyMatch(VoiceMember::bot));
  }

  @Test
  @DisplayName("listeners: a failing listener does not break playback")
  void failingListener() throws Exception {
    player.addListener(
        new MusicEventListener() {
          @Override
          public void onTrackStart(long guildId, QueueItem item) {
            throw new IllegalStateException("boom");
          }
        });
    FakeVoiceSession voice = connected();
    await(player.playMultiple(G, List.of(cached("A", 10), cached("B", 10)), ALICE, "alice"));
    voice.finish(null);
    settle();

    assertEquals("stream:B", voice.lastPlayed());
  }
}
