package dev.clubhub.bot.module.music.player;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongFunction;

/** Session id to {@link GuildSession}; sessions are created on first reference. */
public class SessionRegistry {

  private final ConcurrentHashMap<Long, GuildSession> sessions = new ConcurrentHashMap<>();
  private final LongFunction<GuildSession> factory;

  public SessionRegistry(LongFunction<GuildSession> factory) {
    this.factory = factory;
  }

  public GuildSession getOrCreate(long guildId) {
    return sessions.computeIfAbsent(guildId, factory::apply);
  }

  public Optional<GuildSession> find(long guildId) {
    return Optional.ofNullable(sessions.get(guildId));
  }

  public Collection<GuildSession> all() {
    return List.copyOf(sessions.values());
  }

  public int size() {
    return sessions.size();
  }

  public void shutdown() {
    sessions.values().forEach(s -> s.mailbox().shutdown());
    sessions.clear();
  }
}
