package dev.clubhub.bot.module.music.player;

import dev.clubhub.bot.module.music.model.ChannelRef;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/** Opens voice connections. */
public interface VoiceConnector {

  /**
   * Connects to the channel. The returned future fails with {@link VoiceConnectException} when the
   * transport refuses or does not finish within {@code timeout}.
   */
  CompletableFuture<VoiceSession> connect(ChannelRef channel, Duration timeout);
}
