package dev.clubhub.bot.module.music.permission;

/** Ordered access levels; later constants outrank earlier ones. */
public enum PermissionLevel {
  USER,
  MODERATOR,
  ADMIN,
  MAIN_ADMIN;

  public boolean atLeast(PermissionLevel other) {
    return compareTo(other) >= 0;
  }

  public boolean higherThan(PermissionLevel other) {
    return compareTo(other) > 0;
  }
}
