package dev.clubhub.bot.module.music.player;

import dev.clubhub.bot.module.music.permission.PermissionResult;
import lombok.Getter;

/** A guarded connect was refused by its move check. */
@Getter
public class SessionMoveDeniedException extends RuntimeException {

  private final PermissionResult permission;

  public SessionMoveDeniedException(PermissionResult permission) {
    super(permission.reason());
    this.permission = permission;
  }
}
