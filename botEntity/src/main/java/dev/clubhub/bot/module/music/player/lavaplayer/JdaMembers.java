package dev.clubhub.bot.module.music.player.lavaplayer;

import dev.clubhub.bot.module.music.model.ChannelRef;
import dev.clubhub.bot.module.music.model.VoiceMember;
import java.util.Set;
import java.util.stream.Collectors;
import net.dv8tion.jda.api.entities.ISnowflake;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.channel.middleman.AudioChannel;

/** Conversions from JDA entities to music-core values. */
public final class JdaMembers {

  private JdaMembers() {}

  public static VoiceMember toVoiceMember(Member member) {
    Set<Long> roles = member.getRoles().stream().map(ISnowflake::getIdLong).collect(Collectors.toSet());
    return new VoiceMember(member.getIdLong(), member.getEffectiveName(), roles, member.getUser().isBot());
  }

  public static ChannelRef toChannelRef(AudioChannel channel) {
    return new ChannelRef(channel.getGuild().getIdLong(), channel.getIdLong(), channel.getName());
  }
}
