package dev.clubhub.bot.module.music.model;

import java.time.Instant;
import lombok.Getter;

/**
 * A {@link Track} placed in a session queue by a member. The 1-based {@code position} is owned by
 * the queue and rewritten whenever the queue changes.
 */
@Getter
public class QueueItem {

  private final Track track;
  private final long requesterId;
  private final String requesterName;
  private final Instant addedAt;
  private volatile int position;

  public QueueItem(Track track, long requesterId, String requesterName, Instant addedAt, int position) {
    this.track = track;
    this.requesterId = requesterId;
    this.requesterName = requesterName;
    this.addedAt = addedAt;
    this.position = position;
  }

  /** Fresh item carrying the same track and requester, used when looping the queue. */
  public QueueItem requeue(Instant now) {
    return new QueueItem(track, requesterId, requesterName, now, 0);
  }

  /** Written by the owning queue only. */
  public void setPosition(int position) {
    this.position = position;
  }

  @Override
  public String toString() {
    return position + ". " + track.getDisplayName() + " (" + requesterName + ")";
  }
}
