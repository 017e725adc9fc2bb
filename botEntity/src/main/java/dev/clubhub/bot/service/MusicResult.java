package dev.clubhub.bot.service;

import dev.clubhub.bot.module.music.model.QueueItem;
import java.util.List;

/** Outcome of a user-facing music action, with the text to show the user. */
public record MusicResult(Status status, String message, List<QueueItem> items) {

  public enum Status {
    OK,
    DENIED,
    NOT_FOUND,
    QUEUE_FULL,
    FAILED
  }

  public static MusicResult ok(String message) {
    return new MusicResult(Status.OK, message, List.of());
  }

  public static MusicResult ok(String message, List<QueueItem> items) {
    return new MusicResult(Status.OK, message, List.copyOf(items));
  }

  public static MusicResult of(Status status, String message) {
    return new MusicResult(status, message, List.of());
  }

  public boolean isOk() {
    return status == Status.OK;
  }
}
