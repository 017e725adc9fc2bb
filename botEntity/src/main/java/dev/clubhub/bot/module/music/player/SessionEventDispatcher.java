package dev.clubhub.bot.module.music.player;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/** Fans {@link SessionEvent}s out to registered {@link MusicEventListener}s. */
@Slf4j
public class SessionEventDispatcher {

  private final List<MusicEventListener> listeners = new CopyOnWriteArrayList<>();

  public void addListener(MusicEventListener listener) {
    listeners.add(listener);
  }

  public void removeListener(MusicEventListener listener) {
    listeners.remove(listener);
  }

  void dispatch(SessionEvent event) {
    log.trace("Dispatching {}", event);
    for (MusicEventListener listener : listeners) {
      try {
        deliver(listener, event);
      } catch (RuntimeException e) {
        log.error("Listener {} failed on {}", listener, event, e);
      }
    }
  }

  private static void deliver(MusicEventListener listener, SessionEvent event) {
    if (event instanceof SessionEvent.TrackStarted e) {
      listener.onTrackStart(e.guildId(), e.item());
    } else if (event instanceof SessionEvent.TrackEnded e) {
      listener.onTrackEnd(e.guildId(), e.item());
    } else if (event instanceof SessionEvent.QueueEmptied e) {
      listener.onQueueEmpty(e.guildId());
    } else if (event instanceof SessionEvent.Errored e) {
      listener.onError(e.guildId(), e.message());
    }
  }
}
