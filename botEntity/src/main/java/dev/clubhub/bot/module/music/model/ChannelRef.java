package dev.clubhub.bot.module.music.model;

/** Voice channel identity within a guild. */
public record ChannelRef(long guildId, long channelId, String name) {

  public boolean sameChannel(ChannelRef other) {
    return other != null && guildId == other.guildId && channelId == other.channelId;
  }

  @Override
  public String toString() {
    return name + " (" + channelId + ")";
  }
}
