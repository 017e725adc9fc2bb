package dev.clubhub.bot.module.music.player.lavaplayer;

import com.sedmelluq.discord.lavaplayer.player.AudioPlayer;
import com.sedmelluq.discord.lavaplayer.track.playback.MutableAudioFrame;
import java.nio.ByteBuffer;
import net.dv8tion.jda.api.audio.AudioSendHandler;

/** Feeds opus frames from a LavaPlayer {@link AudioPlayer} into JDA. */
public class PlayerSendHandler implements AudioSendHandler {

  private final AudioPlayer audioPlayer;
  private final ByteBuffer buffer = ByteBuffer.allocate(1024);
  private final MutableAudioFrame frame = new MutableAudioFrame();

  public PlayerSendHandler(AudioPlayer audioPlayer) {
    this.audioPlayer = audioPlayer;
    this.frame.setBuffer(buffer);
  }

  @Override
  public boolean canProvide() {
    return audioPlayer.provide(frame);
  }

  @Override
  public ByteBuffer provide20MsAudio() {
    return buffer.flip();
  }

  @Override
  public boolean isOpus() {
    return true;
  }
}
