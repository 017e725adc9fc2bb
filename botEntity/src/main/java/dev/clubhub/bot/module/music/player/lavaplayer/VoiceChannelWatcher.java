package dev.clubhub.bot.module.music.player.lavaplayer;

import dev.clubhub.bot.module.music.player.MusicPlayer;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.entities.GuildVoiceState;
import net.dv8tion.jda.api.entities.channel.middleman.AudioChannel;
import net.dv8tion.jda.api.events.guild.voice.GuildVoiceUpdateEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;

/**
 * Reacts to voice state changes: runs the inactivity check as soon as someone leaves the bot's
 * channel, and tears the session down when the bot itself is disconnected from outside.
 */
@Slf4j
public class VoiceChannelWatcher extends ListenerAdapter {

  private final MusicPlayer player;

  public VoiceChannelWatcher(MusicPlayer player) {
    this.player = player;
  }

  @Override
  public void onGuildVoiceUpdate(GuildVoiceUpdateEvent event) {
    long guildId = event.getGuild().getIdLong();
    AudioChannel left = event.getChannelLeft();
    if (left == null) return;

    if (event.getMember().getIdLong() == event.getJDA().getSelfUser().getIdLong()) {
      if (event.getChannelJoined() == null) {
        log.debug("Bot left {} in guild {}", left.getName(), guildId);
        player.voiceLost(guildId);
      }
      return;
    }

    GuildVoiceState self = event.getGuild().getSelfMember().getVoiceState();
    AudioChannel botChannel = self == null ? null : self.getChannel();
    if (botChannel != null && botChannel.getIdLong() == left.getIdLong()) {
      player.checkInactivity(guildId);
    }
  }
}
