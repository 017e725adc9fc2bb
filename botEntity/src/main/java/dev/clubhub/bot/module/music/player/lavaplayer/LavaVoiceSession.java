package dev.clubhub.bot.module.music.player.lavaplayer;

import com.sedmelluq.discord.lavaplayer.player.AudioLoadResultHandler;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayer;
import com.sedmelluq.discord.lavaplayer.player.AudioPlayerManager;
import com.sedmelluq.discord.lavaplayer.player.event.AudioEventAdapter;
import com.sedmelluq.discord.lavaplayer.tools.FriendlyException;
import com.sedmelluq.discord.lavaplayer.track.AudioPlaylist;
import com.sedmelluq.discord.lavaplayer.track.AudioTrack;
import com.sedmelluq.discord.lavaplayer.track.AudioTrackEndReason;
import dev.clubhub.bot.module.music.model.ChannelRef;
import dev.clubhub.bot.module.music.model.VoiceMember;
import dev.clubhub.bot.module.music.player.TrackEndCallback;
import dev.clubhub.bot.module.music.player.VoiceConnectException;
import dev.clubhub.bot.module.music.player.VoiceSession;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.middleman.AudioChannel;
import net.dv8tion.jda.api.managers.AudioManager;

/**
 * {@link VoiceSession} over a guild's JDA {@link AudioManager} and a dedicated LavaPlayer {@link
 * AudioPlayer}. Track end callbacks arrive on LavaPlayer threads.
 */
@Slf4j
public class LavaVoiceSession extends AudioEventAdapter implements VoiceSession {

  /** One {@link #play} call; finishes exactly once. */
  private static final class Playback {
    private final TrackEndCallback callback;
    private final AtomicBoolean finished = new AtomicBoolean();
    private volatile AudioTrack track;
    private volatile Throwable error;

    private Playback(TrackEndCallback callback) {
      this.callback = callback;
    }

    private void finish(Throwable failure) {
      if (finished.compareAndSet(false, true)) callback.onFinished(failure);
    }
  }

  private final JDA jda;
  private final long guildId;
  private final AudioPlayerManager playerManager;
  private final AudioPlayer player;
  @Getter private final PlayerSendHandler sendHandler;
  private volatile ChannelRef channel;
  private volatile Playback active;

  public LavaVoiceSession(JDA jda, ChannelRef channel, AudioPlayerManager playerManager) {
    this.jda = jda;
    this.guildId = channel.guildId();
    this.channel = channel;
    this.playerManager = playerManager;
    this.player = playerManager.createPlayer();
    this.player.addListener(this);
    this.sendHandler = new PlayerSendHandler(player);
  }

  @Override
  public ChannelRef getChannel() {
    AudioManager manager = audioManager();
    if (manager != null && manager.getConnectedChannel() != null) {
      channel = JdaMembers.toChannelRef(manager.getConnectedChannel());
    }
    return channel;
  }

  @Override
  public CompletableFuture<Void> moveTo(ChannelRef target) {
    Guild guild = jda.getGuildById(guildId);
    AudioChannel audioChannel = guild == null ? null : guild.getChannelById(AudioChannel.class, target.channelId());
    if (audioChannel == null) {
      return CompletableFuture.failedFuture(new VoiceConnectException("Unknown voice channel " + target));
    }
    try {
      guild.getAudioManager().openAudioConnection(audioChannel);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(new VoiceConnectException("Cannot move to " + target, e));
    }
    channel = target;
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public void play(String streamUrl, int volume, TrackEndCallback onFinished) {
    Playback playback = new Playback(onFinished);
    active = playback;
    // the paused flag survives playTrack
    player.setPaused(false);
    player.setVolume(volume);
    playerManager.loadItemOrdered(
        this,
        streamUrl,
        new AudioLoadResultHandler() {
          @Override
          public void trackLoaded(AudioTrack track) {
            start(playback, track);
          }

          @Override
          public void playlistLoaded(AudioPlaylist playlist) {
            AudioTrack track = playlist.getSelectedTrack();
            if (track == null && !playlist.getTracks().isEmpty()) track = playlist.getTracks().get(0);
            if (track == null) {
              playback.finish(new IllegalStateException("Empty playlist at " + streamUrl));
            } else {
              start(playback, track);
            }
          }

          @Override
          public void noMatches() {
            playback.finish(new IllegalStateException("Nothing playable at " + streamUrl));
          }

          @Override
          public void loadFailed(FriendlyException e) {
            playback.finish(e);
          }
        });
  }

  private void start(Playback playback, AudioTrack track) {
    if (active != playback || playback.finished.get()) {
      // stopped or replaced while loading
      playback.finish(null);
      return;
    }
    playback.track = track;
    track.setUserData(playback);
    player.playTrack(track);
  }

  @Override
  public void onTrackException(AudioPlayer player, AudioTrack track, FriendlyException exception) {
    Playback playback = track.getUserData(Playback.class);
    if (playback != null) playback.error = exception;
  }

  @Override
  public void onTrackEnd(AudioPlayer player, AudioTrack track, AudioTrackEndReason endReason) {
    Playback playback = track.getUserData(Playback.class);
    if (playback == null) return;
    if (active == playback) active = null;
    Throwable error = playback.error;
    if (error == null && endReason == AudioTrackEndReason.LOAD_FAILED) {
      error = new IllegalStateException("Track failed to load: " + track.getInfo().uri);
    }
    playback.finish(error);
  }

  @Override
  public boolean isPlaying() {
    return player.getPlayingTrack() != null && !player.isPaused();
  }

  @Override
  public boolean isPaused() {
    return player.getPlayingTrack() != null && player.isPaused();
  }

  @Override
  public void pause() {
    player.setPaused(true);
  }

  @Override
  public void resume() {
    player.setPaused(false);
  }

  @Override
  public void stop() {
    Playback playback = active;
    if (playback != null && playback.track == null) {
      active = null;
      playback.finish(null);
    }
    player.stopTrack();
  }

  @Override
  public boolean setVolume(int volume) {
    player.setVolume(volume);
    return player.getPlayingTrack() != null;
  }

  @Override
  public void disconnect() {
    stop();
    AudioManager manager = audioManager();
    if (manager != null) {
      manager.closeAudioConnection();
      manager.setSendingHandler(null);
      manager.setConnectionListener(null);
    }
    player.destroy();
    log.debug("Released voice resources of guild {}", guildId);
  }

  @Override
  public boolean isConnected() {
    AudioManager manager = audioManager();
    return manager != null && manager.isConnected();
  }

  @Override
  public List<VoiceMember> getChannelOccupants() {
    AudioManager manager = audioManager();
    if (manager == null || manager.getConnectedChannel() == null) return List.of();
    return manager.getConnectedChannel().getMembers().stream().map(JdaMembers::toVoiceMember).toList();
  }

  private AudioManager audioManager() {
    Guild guild = jda.getGuildById(guildId);
    return guild == null ? null : guild.getAudioManager();
  }
}
