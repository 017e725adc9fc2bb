package dev.clubhub.bot.module.music.player;

import dev.clubhub.bot.module.music.model.QueueItem;

/** Receives session notifications. Called on the session's own thread; keep it short. */
public interface MusicEventListener {

  default void onTrackStart(long guildId, QueueItem item) {}

  default void onTrackEnd(long guildId, QueueItem item) {}

  default void onQueueEmpty(long guildId) {}

  default void onError(long guildId, String message) {}
}
