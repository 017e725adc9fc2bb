package dev.clubhub.bot.module.music.player;

import dev.clubhub.bot.module.music.model.QueueItem;

/** Notifications a session emits, in its serialized order. */
public sealed interface SessionEvent {

  long guildId();

  record TrackStarted(long guildId, QueueItem item) implements SessionEvent {}

  record TrackEnded(long guildId, QueueItem item) implements SessionEvent {}

  record QueueEmptied(long guildId) implements SessionEvent {}

  record Errored(long guildId, String message) implements SessionEvent {}
}
