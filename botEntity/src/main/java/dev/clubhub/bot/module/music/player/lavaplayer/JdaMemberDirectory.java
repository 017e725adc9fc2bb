package dev.clubhub.bot.module.music.player.lavaplayer;

import dev.clubhub.bot.module.music.model.VoiceMember;
import dev.clubhub.bot.module.music.permission.MemberDirectory;
import java.util.Optional;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;

/** Looks members up in JDA's member cache. */
public class JdaMemberDirectory implements MemberDirectory {

  private final JDA jda;

  public JdaMemberDirectory(JDA jda) {
    this.jda = jda;
  }

  @Override
  public Optional<VoiceMember> findMember(long guildId, long userId) {
    Guild guild = jda.getGuildById(guildId);
    if (guild == null) return Optional.empty();
    return Optional.ofNullable(guild.getMemberById(userId)).map(JdaMembers::toVoiceMember);
  }
}
