package dev.clubhub.bot.module.music.model;

import dev.clubhub.bot.module.music.PlayerTextUtil;
import java.util.Objects;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;

/**
 * A playable item. All descriptive fields are fixed at creation; only the resolved stream URL is
 * filled in later and cached on the instance.
 */
@Getter
public class Track {

  private final String title;
  private final String url;
  /** Length in seconds. */
  private final long duration;

  private final String thumbnail;
  private final String artist;
  private final String album;
  private final TrackSource source;

  @Getter(lombok.AccessLevel.NONE)
  private volatile String streamUrl;

  @Builder
  public Track(
      String title,
      String url,
      long duration,
      String thumbnail,
      String artist,
      String album,
      TrackSource source,
      String streamUrl) {
    if (duration < 0) throw new IllegalArgumentException("duration must be >= 0: " + duration);
    this.title = Objects.requireNonNull(title, "title");
    this.url = Objects.requireNonNull(url, "url");
    this.duration = duration;
    this.thumbnail = thumbnail;
    this.artist = artist;
    this.album = album;
    this.source = source == null ? TrackSource.DIRECT : source;
    this.streamUrl = streamUrl;
  }

  /** Cached stream URL, if one has been resolved already. */
  public Optional<String> getStreamUrl() {
    return Optional.ofNullable(streamUrl);
  }

  /** Caches the resolved stream URL. The first non-null value wins. */
  public String cacheStreamUrl(String resolved) {
    if (resolved == null) return streamUrl;
    synchronized (this) {
      if (streamUrl == null) streamUrl = resolved;
      return streamUrl;
    }
  }

  /** {@code M:SS} or {@code H:MM:SS}. */
  public String getDurationFormatted() {
    return PlayerTextUtil.formatDuration(duration);
  }

  /** "artist - title" when the artist is known, otherwise just the title. */
  public String getDisplayName() {
    if (artist != null && !artist.isBlank()) return artist + " - " + title;
    return title;
  }

  @Override
  public String toString() {
    return "Track{" + getDisplayName() + ", " + url + ", " + duration + "s, " + source + "}";
  }
}
