package dev.clubhub.bot.module.music.player;

/** Voice transport could not be reached, refused the connection or timed out. */
public class VoiceConnectException extends RuntimeException {

  public VoiceConnectException(String message) {
    super(message);
  }

  public VoiceConnectException(String message, Throwable cause) {
    super(message, cause);
  }
}
