package dev.clubhub.bot.module.music.permission;

import dev.clubhub.bot.Lang;
import dev.clubhub.bot.module.music.model.ChannelRef;
import dev.clubhub.bot.module.music.model.VoiceMember;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Role-hierarchy checks for actions on a shared music session. Holds no state besides its
 * configuration; the only lookup it performs is resolving the session owner's live membership.
 */
@Slf4j
public class PermissionChecker {

  private final long mainAdminId;
  private final Map<Long, PermissionLevel> roleLevels;
  private final MemberDirectory memberDirectory;

  /**
   * @param mainAdminId user id granted {@link PermissionLevel#MAIN_ADMIN}; 0 disables it
   * @param roleLevels role id to level; zero ids are ignored
   * @param memberDirectory live lookup used to resolve a session owner's level
   */
  public PermissionChecker(
      long mainAdminId, Map<Long, PermissionLevel> roleLevels, MemberDirectory memberDirectory) {
    this.mainAdminId = mainAdminId;
    this.roleLevels =
        roleLevels.entrySet().stream()
            .filter(e -> e.getKey() != null && e.getKey() != 0L && e.getValue() != null)
            .collect(
                java.util.stream.Collectors.toUnmodifiableMap(
                    Map.Entry::getKey, Map.Entry::getValue, PermissionChecker::max));
    this.memberDirectory = memberDirectory;
  }

  /** Main admin wins outright, otherwise the highest level among the member's roles. */
  public PermissionLevel getLevel(VoiceMember member) {
    if (mainAdminId != 0L && member.id() == mainAdminId) return PermissionLevel.MAIN_ADMIN;
    PermissionLevel level = PermissionLevel.USER;
    for (Long roleId : member.roleIds()) {
      PermissionLevel mapped = roleLevels.get(roleId);
      if (mapped != null) level = max(level, mapped);
    }
    return level;
  }

  /** Everyone may use the basic commands; the result carries their level. */
  public PermissionResult canUseMusicCommands(VoiceMember member) {
    return PermissionResult.allow("", getLevel(member));
  }

  /**
   * Whether {@code requester} may pull the session from {@code currentChannel} into {@code
   * targetChannel}.
   *
   * @param currentChannel channel the session is connected to, or null when there is no session
   * @param channelOwnerId user credited with starting the session, or null
   * @param currentOccupants members currently in {@code currentChannel}
   */
  public PermissionResult canMoveSession(
      VoiceMember requester,
      ChannelRef currentChannel,
      ChannelRef targetChannel,
      Long channelOwnerId,
      List<VoiceMember> currentOccupants) {
    PermissionLevel level = getLevel(requester);

    if (currentChannel == null) return PermissionResult.allow(Lang.get("perms.move.free"), level);
    if (currentChannel.sameChannel(targetChannel)) {
      return PermissionResult.allow(Lang.get("perms.move.same_channel"), level);
    }
    if (level == PermissionLevel.MAIN_ADMIN) {
      log.info("Main admin {} moves the session to {}", requester.name(), targetChannel);
      return PermissionResult.allow(Lang.get("perms.move.main_admin"), level);
    }
    if (channelOwnerId == null) return PermissionResult.allow(Lang.get("perms.move.no_owner"), level);
    if (requester.id() == channelOwnerId) {
      return PermissionResult.allow(Lang.get("perms.move.owner"), level);
    }
    boolean noHumans = currentOccupants == null || currentOccupants.stream().allMatch(VoiceMember::bot);
    if (noHumans) return PermissionResult.allow(Lang.get("perms.move.channel_empty"), level);

    Optional<VoiceMember> owner = memberDirectory.findMember(currentChannel.guildId(), channelOwnerId);
    if (owner.isPresent()) {
      PermissionLevel ownerLevel = getLevel(owner.get());
      if (level.higherThan(ownerLevel)) {
        log.info(
            "{} ({}) takes the session over from {} ({})",
            requester.name(),
            level,
            owner.get().name(),
            ownerLevel);
        return PermissionResult.allow(Lang.get("perms.move.higher_level"), level);
      }
    }
    return PermissionResult.deny(Lang.get("perms.move.denied"), level);
  }

  /** Own tracks may always be skipped; MODERATOR and above may skip anything. */
  public PermissionResult canSkip(VoiceMember member, long trackRequesterId) {
    PermissionLevel level = getLevel(member);
    if (member.id() == trackRequesterId) {
      return PermissionResult.allow(Lang.get("perms.skip.own_track"), level);
    }
    if (level.atLeast(PermissionLevel.MODERATOR)) {
      return PermissionResult.allow(Lang.get("perms.moderator"), level);
    }
    return PermissionResult.deny(Lang.get("perms.skip.denied"), level);
  }

  /** Stopping is open to everyone. */
  public PermissionResult canStop(VoiceMember member) {
    return PermissionResult.allow("", getLevel(member));
  }

  public PermissionResult canClearQueue(VoiceMember member) {
    PermissionLevel level = getLevel(member);
    if (level.atLeast(PermissionLevel.MODERATOR)) {
      return PermissionResult.allow(Lang.get("perms.moderator"), level);
    }
    return PermissionResult.deny(Lang.get("perms.clear.denied"), level);
  }

  private static PermissionLevel max(PermissionLevel a, PermissionLevel b) {
    return a.compareTo(b) >= 0 ? a : b;
  }
}
