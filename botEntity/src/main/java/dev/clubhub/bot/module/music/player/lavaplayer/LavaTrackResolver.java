package dev.clubhub.bot.module.music.player.lavaplayer;

import com.sedmelluq.discord.lavaplayer.player.AudioLoadResultHandler;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.tools.FriendlyException;
import com.sedmelluq.discord.lavaplayer.track.AudioPlaylist;
import com.sedmelluq.discord.lavaplayer.track.AudioTrack;
import com.sedmelluq.discord.lavaplayer.track.AudioTrackInfo;
import dev.clubhub.bot.module.music.model.Track;
import dev.clubhub.bot.module.music.model.TrackSource;
import dev.clubhub.bot.module.music.player.TrackResolver;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TrackResolver} backed by LavaPlayer item loading. Free text goes through the configured
 * search prefix; the stream URL of a track is its URI, which LavaPlayer loads directly.
 */
@Slf4j
public class LavaTrackResolver implements TrackResolver {

  private final AudioPlayerManager playerManager;
  private final String searchPrefix;
  private final Duration timeout;

  public LavaTrackResolver(AudioPlayerManager playerManager, String searchPrefix, Duration timeout) {
    this.playerManager = playerManager;
    this.searchPrefix = searchPrefix;
    this.timeout = timeout;
  }

  @Override
  public Optional<Track> resolveTrack(String urlOrQuery) {
    boolean link = isLink(urlOrQuery);
    List<AudioTrack> loaded = load(link ? urlOrQuery : searchPrefix + urlOrQuery, 1);
    if (loaded.isEmpty()) return Optional.empty();
    return Optional.of(toTrack(loaded.get(0), link ? TrackSource.DIRECT : TrackSource.SEARCH));
  }

  @Override
  public List<Track> resolvePlaylist(String url, int maxTracks) {
    return load(url, maxTracks).stream().map(t -> toTrack(t, TrackSource.PLAYLIST)).toList();
  }

  @Override
  public List<Track> search(String query, int maxResults) {
    return load(searchPrefix + query, maxResults).stream().map(t -> toTrack(t, TrackSource.SEARCH)).toList();
  }

  @Override
  public Optional<String> getStreamUrl(Track track) {
    Optional<String> cached = track.getStreamUrl();
    if (cached.isPresent()) return cached;
    if (track.getUrl().isBlank()) return Optional.empty();
    return Optional.of(track.cacheStreamUrl(track.getUrl()));
  }

  private List<AudioTrack> load(String identifier, int limit) {
    List<AudioTrack> result = new ArrayList<>();
    try {
      playerManager
          .loadItem(
              identifier,
              new AudioLoadResultHandler() {
                @Override
                public void trackLoaded(AudioTrack track) {
                  result.add(track);
                }

                @Override
                public void playlistLoaded(AudioPlaylist playlist) {
                  List<AudioTrack> tracks = playlist.getTracks();
                  AudioTrack selected = playlist.getSelectedTrack();
                  if (selected != null && limit == 1) {
                    result.add(selected);
                    return;
                  }
                  for (int i = 0; i < tracks.size() && i < limit; i++) result.add(tracks.get(i));
                }

                @Override
                public void noMatches() {
                  log.debug("No matches for {}", identifier);
                }

                @Override
                public void loadFailed(FriendlyException e) {
                  log.warn("Loading {} failed: {}", identifier, e.getMessage());
                }
              })
          .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return List.of();
    } catch (ExecutionException | TimeoutException e) {
      log.warn("Loading {} did not complete: {}", identifier, e.toString());
      return List.of();
    }
    return result;
  }

  static Track toTrack(AudioTrack audioTrack, TrackSource source) {
    AudioTrackInfo info = audioTrack.getInfo();
    long seconds = info.isStream ? 0 : Math.max(0, info.length / 1000);
    return Track.builder()
        .title(info.title == null ? info.identifier : info.title)
        .url(info.uri == null ? info.identifier : info.uri)
        .duration(seconds)
        .thumbnail(info.artworkUrl)
        .artist(info.author)
        .source(source)
        .build();
  }

  static boolean isLink(String input) {
    String s = input.trim().toLowerCase();
    return s.startsWith("http://") || s.startsWith("https://");
  }
}
