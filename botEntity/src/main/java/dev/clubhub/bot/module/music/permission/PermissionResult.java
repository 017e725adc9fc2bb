package dev.clubhub.bot.module.music.permission;

/** Outcome of a permission check with a human-readable reason. */
public record PermissionResult(boolean allowed, String reason, PermissionLevel level) {

  public static PermissionResult allow(String reason, PermissionLevel level) {
    return new PermissionResult(true, reason, level);
  }

  public static PermissionResult deny(String reason, PermissionLevel level) {
    return new PermissionResult(false, reason, level);
  }
}
