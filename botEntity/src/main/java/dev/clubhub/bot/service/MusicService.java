package dev.clubhub.bot.service;

import dev.clubhub.bot.Lang;
import dev.clubhub.bot.config.ConfigurationFile;
import dev.clubhub.bot.module.music.PlayerTextUtil;
import dev.clubhub.bot.module.music.model.ChannelRef;
import dev.clubhub.bot.module.music.model.Track;
import dev.clubhub.bot.module.music.model.VoiceMember;
import dev.clubhub.bot.module.music.permission.PermissionChecker;
import dev.clubhub.bot.module.music.permission.PermissionResult;
import dev.clubhub.bot.module.music.player.MusicPlayer;
import dev.clubhub.bot.module.music.player.SessionChannel;
import dev.clubhub.bot.module.music.player.SessionMoveDeniedException;
import dev.clubhub.bot.module.music.player.TrackResolver;
import dev.clubhub.bot.module.music.player.VoiceConnectException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Spring-managed facade over the music player for command handlers and other layers. Applies
 * permission checks before touching a session and turns results into user-facing text.
 */
@Slf4j
@Service
public class MusicService {

  private static final int QUEUE_PAGE_SIZE = 10;

  private final MusicPlayer player;
  private final PermissionChecker permissions;
  private final TrackResolver resolver;
  private final ConfigurationFile.MusicConfig config;
  private final Executor resolverExecutor;

  public MusicService(
      MusicPlayer player,
      PermissionChecker permissions,
      TrackResolver resolver,
      ConfigurationFile.MusicConfig config,
      @Qualifier("resolverExecutor") Executor resolverExecutor) {
    this.player = player;
    this.permissions = permissions;
    this.resolver = resolver;
    this.config = config;
    this.resolverExecutor = resolverExecutor;
  }

  /**
   * Joins (or moves to) {@code target} if the requester may, resolves {@code query} as a link,
   * playlist link or search text, and queues whatever was found.
   */
  public CompletableFuture<MusicResult> play(VoiceMember requester, ChannelRef target, String query) {
    long guildId = target.guildId();
    return player
        .connect(target, requester.id(), current -> checkMove(requester, target, current))
        .thenCompose(voice -> CompletableFuture.supplyAsync(() -> resolve(query), resolverExecutor))
        .thenCompose(tracks -> enqueue(guildId, requester, query, tracks))
        .exceptionally(
            error -> {
              Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
              if (cause instanceof SessionMoveDeniedException denied) {
                log.info("{} may not take the session to {}: {}", requester.name(), target, denied.getMessage());
                return MusicResult.of(MusicResult.Status.DENIED, denied.getPermission().reason());
              }
              if (cause instanceof VoiceConnectException) {
                return MusicResult.of(MusicResult.Status.FAILED, Lang.get("music.error.connect_failed"));
              }
              log.error("Play request '{}' failed in guild {}", query, guildId, cause);
              return MusicResult.of(MusicResult.Status.FAILED, Lang.get("music.error.play_failed"));
            });
  }

  private PermissionResult checkMove(VoiceMember requester, ChannelRef target, Optional<SessionChannel> current) {
    return permissions.canMoveSession(
        requester,
        current.map(SessionChannel::channel).orElse(null),
        target,
        current.map(SessionChannel::ownerId).orElse(null),
        current.map(SessionChannel::occupants).orElse(List.of()));
  }

  private CompletableFuture<MusicResult> enqueue(
      long guildId, VoiceMember requester, String query, List<Track> tracks) {
    if (tracks.isEmpty()) {
      log.debug("Nothing found for '{}'", query);
      return CompletableFuture.completedFuture(MusicResult.of(MusicResult.Status.NOT_FOUND, Lang.get("music.play.not_found")));
    }
    return player
        .playMultiple(guildId, tracks, requester.id(), requester.name())
        .thenApply(
            items -> {
              if (items.isEmpty()) return MusicResult.of(MusicResult.Status.QUEUE_FULL, Lang.get("music.play.queue_full"));
              String message =
                  items.size() == 1
                      ? Lang.get("music.play.queued").formatted(items.get(0).getTrack().getDisplayName())
                      : Lang.get("music.play.queued_many").formatted(items.size());
              return MusicResult.ok(message, items);
            });
  }

  List<Track> resolve(String query) {
    String trimmed = query.trim();
    if (isPlaylistUrl(trimmed)) return resolver.resolvePlaylist(trimmed, config.playlistLimit);
    return resolver.resolveTrack(trimmed).map(List::of).orElse(List.of());
  }

  /** Search results to offer the user, resolved off the caller's thread. */
  public CompletableFuture<List<Track>> search(String query) {
    return CompletableFuture.supplyAsync(() -> resolver.search(query, config.searchResults), resolverExecutor);
  }

  /** The requester check runs against whatever is current when the skip lands. */
  public CompletableFuture<MusicResult> skip(VoiceMember member, long guildId) {
    return player
        .skipIf(guildId, current -> permissions.canSkip(member, current.getRequesterId()))
        .thenApply(
            outcome ->
                switch (outcome.status()) {
                  case NOTHING_PLAYING -> MusicResult.of(MusicResult.Status.FAILED, Lang.get("music.skip.nothing"));
                  case DENIED -> MusicResult.of(MusicResult.Status.DENIED, outcome.permission().reason());
                  case SKIPPED -> MusicResult.ok(Lang.get("music.skip.done"), outcome.next().map(List::of).orElse(List.of()));
                });
  }

  public CompletableFuture<MusicResult> stop(VoiceMember member, long guildId) {
    PermissionResult perm = permissions.canStop(member);
    if (!perm.allowed()) {
      return CompletableFuture.completedFuture(MusicResult.of(MusicResult.Status.DENIED, perm.reason()));
    }
    log.info("{} stopped the session in guild {}", member.name(), guildId);
    return player.stop(guildId).thenApply(ignored -> MusicResult.ok(Lang.get("music.stop.done")));
  }

  public CompletableFuture<MusicResult> clearQueue(VoiceMember member, long guildId) {
    PermissionResult perm = permissions.canClearQueue(member);
    if (!perm.allowed()) {
      return CompletableFuture.completedFuture(MusicResult.of(MusicResult.Status.DENIED, perm.reason()));
    }
    return player
        .clearQueue(guildId)
        .thenApply(removed -> MusicResult.ok(Lang.get("music.clear.done").formatted(removed)));
  }

  /** Text listing of one queue page, now-playing line first. */
  public CompletableFuture<String> describeQueue(long guildId, int page) {
    return player
        .snapshot(guildId)
        .thenCombine(
            player.getPage(guildId, page, QUEUE_PAGE_SIZE),
            (snapshot, queuePage) ->
                PlayerTextUtil.describePage(
                    snapshot.current(), queuePage, PlayerTextUtil.formatTotal(snapshot.totalDuration())));
  }

  static boolean isPlaylistUrl(String input) {
    String s = input.toLowerCase();
    if (!s.startsWith("http://") && !s.startsWith("https://")) return false;
    return s.contains("list=") || s.contains("/playlist") || s.contains("/sets/") || s.contains("/album/");
  }
}
