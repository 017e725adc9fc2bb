package dev.clubhub.bot.module.music.player;

import dev.clubhub.bot.module.music.model.ChannelRef;
import dev.clubhub.bot.module.music.model.VoiceMember;
import java.util.List;

/** Where a connected session sits, who owns it and who is listening. */
public record SessionChannel(ChannelRef channel, Long ownerId, List<VoiceMember> occupants) {}
