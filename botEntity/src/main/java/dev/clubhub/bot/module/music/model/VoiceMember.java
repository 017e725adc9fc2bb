package dev.clubhub.bot.module.music.model;

import java.util.Set;

/** Guild member as seen by the music core: identity, held role ids and the bot flag. */
public record VoiceMember(long id, String name, Set<Long> roleIds, boolean bot) {

  public VoiceMember {
    roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
  }

  public static VoiceMember human(long id, String name, Long... roleIds) {
    return new VoiceMember(id, name, Set.of(roleIds), false);
  }

  public static VoiceMember bot(long id, String name) {
    return new VoiceMember(id, name, Set.of(), true);
  }
}
