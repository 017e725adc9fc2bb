package dev.clubhub.bot.module.music.player;

import dev.clubhub.bot.module.music.model.LoopMode;
import dev.clubhub.bot.module.music.model.QueueItem;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Read-only copy of a session taken inside its mailbox. */
public record SessionSnapshot(
    long guildId,
    PlayerPhase phase,
    Optional<QueueItem> current,
    List<QueueItem> queued,
    List<QueueItem> history,
    long totalDuration,
    int volume,
    LoopMode loopMode,
    boolean playing,
    boolean paused,
    Long channelOwnerId,
    Instant lastActivity) {

  public int size() {
    return queued.size();
  }
}
