package dev.clubhub.bot.module.music.player;

import dev.clubhub.bot.module.music.model.QueueItem;
import dev.clubhub.bot.module.music.permission.PermissionResult;
import java.util.Optional;

/**
 * Result of a checked skip. {@code current} is the item the check was run against; {@code next}
 * is the queue head at the moment of the skip.
 */
public record SkipOutcome(
    Status status, Optional<QueueItem> current, PermissionResult permission, Optional<QueueItem> next) {

  public enum Status {
    NOTHING_PLAYING,
    DENIED,
    SKIPPED
  }

  static SkipOutcome nothingPlaying() {
    return new SkipOutcome(Status.NOTHING_PLAYING, Optional.empty(), null, Optional.empty());
  }

  static SkipOutcome denied(QueueItem current, PermissionResult permission) {
    return new SkipOutcome(Status.DENIED, Optional.of(current), permission, Optional.empty());
  }

  static SkipOutcome skipped(QueueItem current, PermissionResult permission, Optional<QueueItem> next) {
    return new SkipOutcome(Status.SKIPPED, Optional.of(current), permission, next);
  }
}
