package dev.clubhub.bot.module.music.player;

import dev.clubhub.bot.module.music.model.Track;
import java.util.List;
import java.util.Optional;

/** Turns links and queries into {@link Track}s and tracks into playable stream URLs. */
public interface TrackResolver {

  Optional<Track> resolveTrack(String urlOrQuery);

  List<Track> resolvePlaylist(String url, int maxTracks);

  List<Track> search(String query, int maxResults);

  /** Idempotent; a resolved URL is cached on the track. */
  Optional<String> getStreamUrl(Track track);
}
