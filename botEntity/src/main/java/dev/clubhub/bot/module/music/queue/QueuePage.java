package dev.clubhub.bot.module.music.queue;

import dev.clubhub.bot.module.music.model.QueueItem;
import java.util.List;

/** One page of queued items; {@code page} is the clamped page actually returned. */
public record QueuePage(List<QueueItem> items, int page, int totalPages) {}
