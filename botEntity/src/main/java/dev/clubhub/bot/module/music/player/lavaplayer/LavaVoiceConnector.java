package dev.clubhub.bot.module.music.player.lavaplayer;

import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import dev.clubhub.bot.module.music.model.ChannelRef;
import dev.clubhub.bot.module.music.player.VoiceConnectException;
import dev.clubhub.bot.module.music.player.VoiceConnector;
import dev.clubhub.bot.module.music.player.VoiceSession;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.audio.hooks.ConnectionListener;
import net.dv8tion.jda.api.audio.hooks.ConnectionStatus;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.middleman.AudioChannel;
import net.dv8tion.jda.api.managers.AudioManager;

/** Opens JDA voice connections with a LavaPlayer-backed send handler. */
@Slf4j
public class LavaVoiceConnector implements VoiceConnector {

  private final JDA jda;
  private final AudioPlayerManager playerManager;

  public LavaVoiceConnector(JDA jda, AudioPlayerManager playerManager) {
    this.jda = jda;
    this.playerManager = playerManager;
  }

  @Override
  public CompletableFuture<VoiceSession> connect(ChannelRef ref, Duration timeout) {
    Guild guild = jda.getGuildById(ref.guildId());
    if (guild == null) {
      return CompletableFuture.failedFuture(new VoiceConnectException("Unknown guild " + ref.guildId()));
    }
    AudioChannel channel = guild.getChannelById(AudioChannel.class, ref.channelId());
    if (channel == null) {
      return CompletableFuture.failedFuture(new VoiceConnectException("Unknown voice channel " + ref));
    }

    AudioManager audioManager = guild.getAudioManager();
    LavaVoiceSession session = new LavaVoiceSession(jda, ref, playerManager);
    CompletableFuture<VoiceSession> future = new CompletableFuture<>();

    audioManager.setSelfDeafened(true);
    audioManager.setSendingHandler(session.getSendHandler());
    audioManager.setConnectionListener(
        new ConnectionListener() {
          @Override
          public void onStatusChange(ConnectionStatus status) {
            log.debug("Voice status of guild {}: {}", ref.guildId(), status);
            if (status == ConnectionStatus.CONNECTED) {
              future.complete(session);
            } else if (isFailure(status)) {
              future.completeExceptionally(new VoiceConnectException("Voice connection failed: " + status));
            }
          }
        });
    try {
      audioManager.openAudioConnection(channel);
    } catch (RuntimeException e) {
      future.completeExceptionally(new VoiceConnectException("Cannot join " + ref, e));
    }

    future
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete(
            (connected, error) -> {
              if (error != null) {
                log.warn("Abandoning voice connection to {}: {}", ref, error.toString());
                session.disconnect();
              }
            });
    return future;
  }

  private static boolean isFailure(ConnectionStatus status) {
    String name = status.name();
    return name.startsWith("ERROR_") || name.startsWith("DISCONNECTED_");
  }
}
