package dev.clubhub.bot.module.music.queue;

import dev.clubhub.bot.module.music.PlayerTextUtil;
import dev.clubhub.bot.module.music.model.QueueItem;
import dev.clubhub.bot.module.music.model.Track;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded FIFO of {@link QueueItem}s for one session, plus the item currently playing and a short
 * history of finished items.
 *
 * <p>Positions are 1-based. When an item is current it holds position 1 and queued items start at
 * 2. {@link #size()} never counts the current item. Not thread-safe; the owning session serializes
 * access.
 */
@Slf4j
public class TrackQueue {

  public static final int DEFAULT_HISTORY_LIMIT = 10;

  private final List<QueueItem> items = new ArrayList<>();
  private final Deque<QueueItem> history = new ArrayDeque<>();
  @Getter private final int maxSize;
  private final int historyLimit;
  private final Clock clock;
  private final Random random;
  private QueueItem current;

  public TrackQueue(int maxSize) {
    this(maxSize, DEFAULT_HISTORY_LIMIT, Clock.systemUTC(), new Random());
  }

  public TrackQueue(int maxSize, int historyLimit, Clock clock, Random random) {
    if (maxSize <= 0) throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
    this.maxSize = maxSize;
    this.historyLimit = Math.max(0, historyLimit);
    this.clock = clock;
    this.random = random;
  }

  /** The in-flight item, if any. */
  public Optional<QueueItem> getCurrent() {
    return Optional.ofNullable(current);
  }

  /**
   * Replaces the current item. The previous current item, if any, goes to history (oldest entry
   * evicted when full).
   */
  public void setCurrent(QueueItem item) {
    if (current != null && current != item && historyLimit > 0) {
      if (history.size() >= historyLimit) history.removeFirst();
      history.addLast(current);
    }
    current = item;
    updatePositions();
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public boolean isFull() {
    return items.size() >= maxSize;
  }

  /** Appends a track, or returns empty when the queue is full. */
  public Optional<QueueItem> add(Track track, long requesterId, String requesterName) {
    if (isFull()) {
      log.warn("Queue is full ({} items), rejecting {}", maxSize, track.getDisplayName());
      return Optional.empty();
    }
    QueueItem item = new QueueItem(track, requesterId, requesterName, clock.instant(), nextPosition());
    items.add(item);
    log.debug("Queued {} at position {}", track.getDisplayName(), item.getPosition());
    return Optional.of(item);
  }

  /** Appends an existing item (loop-queue re-entry). Returns false when full. */
  public boolean append(QueueItem item) {
    if (isFull()) return false;
    item.setPosition(nextPosition());
    items.add(item);
    return true;
  }

  /** Adds tracks in order until the queue fills up; partial success is not an error. */
  public List<QueueItem> addMultiple(List<Track> tracks, long requesterId, String requesterName) {
    List<QueueItem> added = new ArrayList<>();
    for (Track track : tracks) {
      if (isFull()) break;
      add(track, requesterId, requesterName).ifPresent(added::add);
    }
    return added;
  }

  /** Pops the head. Does not touch {@link #getCurrent()}. */
  public Optional<QueueItem> getNext() {
    if (items.isEmpty()) return Optional.empty();
    QueueItem item = items.remove(0);
    updatePositions();
    return Optional.of(item);
  }

  public Optional<QueueItem> peekNext() {
    return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
  }

  /** Removes the item shown at the given 1-based position. Out-of-range positions are no-ops. */
  public Optional<QueueItem> removeAt(int position) {
    int index = current != null ? position - 2 : position - 1;
    if (index < 0 || index >= items.size()) return Optional.empty();
    QueueItem removed = items.remove(index);
    updatePositions();
    return Optional.of(removed);
  }

  /** Drops all queued items and the current pointer. History is kept. */
  public void clear() {
    items.clear();
    current = null;
    log.debug("Queue cleared");
  }

  /** Drops queued items only; returns how many were removed. */
  public int clearPending() {
    int removed = items.size();
    items.clear();
    return removed;
  }

  public void shuffle() {
    Collections.shuffle(items, random);
    updatePositions();
    log.debug("Queue shuffled ({} items)", items.size());
  }

  public QueuePage getPage(int page, int perPage) {
    if (perPage <= 0) throw new IllegalArgumentException("perPage must be positive: " + perPage);
    int totalPages = Math.max(1, (items.size() + perPage - 1) / perPage);
    int actual = Math.max(1, Math.min(page, totalPages));
    int from = Math.min((actual - 1) * perPage, items.size());
    int to = Math.min(from + perPage, items.size());
    return new QueuePage(List.copyOf(items.subList(from, to)), actual, totalPages);
  }

  /** Snapshot of queued items in play order. */
  public List<QueueItem> getAll() {
    return List.copyOf(items);
  }

  /** Finished items, oldest first. */
  public List<QueueItem> getHistory() {
    return List.copyOf(history);
  }

  /** Seconds of queued audio, including the current item. */
  public long getTotalDuration() {
    long total = 0;
    for (QueueItem item : items) total += item.getTrack().getDuration();
    if (current != null) total += current.getTrack().getDuration();
    return total;
  }

  public String getTotalDurationFormatted() {
    return PlayerTextUtil.formatTotal(getTotalDuration());
  }

  private int nextPosition() {
    return items.size() + (current != null ? 2 : 1);
  }

  private void updatePositions() {
    int start = current != null ? 2 : 1;
    for (int i = 0; i < items.size(); i++) {
      items.get(i).setPosition(start + i);
    }
    if (current != null) current.setPosition(1);
  }
}
