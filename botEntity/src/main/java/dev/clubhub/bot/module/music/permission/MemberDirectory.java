package dev.clubhub.bot.module.music.permission;

import dev.clubhub.bot.module.music.model.VoiceMember;
import java.util.Optional;

/** Live guild membership lookup. */
public interface MemberDirectory {

  Optional<VoiceMember> findMember(long guildId, long userId);
}
