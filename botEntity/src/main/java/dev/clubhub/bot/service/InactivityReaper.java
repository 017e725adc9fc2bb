package dev.clubhub.bot.service;

import dev.clubhub.bot.module.music.player.MusicPlayer;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically disconnects sessions that are idle or whose channel emptied. */
@Slf4j
@Component
public class InactivityReaper {

  private final MusicPlayer player;

  public InactivityReaper(MusicPlayer player) {
    this.player = player;
  }

  @Scheduled(
      fixedDelayString = "${clubhub.music.inactivity-check-interval-seconds:60}",
      initialDelayString = "${clubhub.music.inactivity-check-interval-seconds:60}",
      timeUnit = TimeUnit.SECONDS)
  public void sweep() {
    player
        .sweepInactive()
        .whenComplete(
            (reaped, error) -> {
              if (error != null) {
                log.error("Inactivity sweep failed", error);
              } else if (reaped > 0) {
                log.info("Inactivity sweep disconnected {} session(s)", reaped);
              }
            });
  }
}
