package dev.clubhub.bot.module.music.model;

/** Where a {@link Track} came from. */
public enum TrackSource {
  /** Direct link to a single video/track. */
  DIRECT,
  /** Top result of a free-text search. */
  SEARCH,
  /** Expanded from a playlist link. */
  PLAYLIST,
  /** Looked up on a metadata service and matched to a playable search result. */
  CROSS_REFERENCE
}
