package dev.clubhub.bot;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/** Access to the {@code lang/messages} bundle for the default locale. */
public final class Lang {

  private static final String BUNDLE = "lang/messages";

  private Lang() {}

  /** Message for the key, or the key itself when it is missing. */
  public static String get(String key) {
    try {
      return ResourceBundle.getBundle(BUNDLE, Locale.getDefault()).getString(key);
    } catch (MissingResourceException e) {
      return key;
    }
  }
}
