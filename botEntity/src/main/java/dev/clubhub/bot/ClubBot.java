package dev.clubhub.bot;

import dev.clubhub.bot.config.ConfigurationFile;
import dev.clubhub.bot.config.ConfigurationFileCtrl;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import lombok.Getter;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Application entry point for the club music bot.
 *
 * <p>Spring Boot is started with default properties taken from {@code config.json} (see {@link
 * ConfigurationFile}) instead of an application.yml.
 */
@SpringBootApplication(scanBasePackages = "dev.clubhub.bot")
@EnableScheduling
public class ClubBot {

  // Loaded before Spring starts, the context reads it through MusicConfiguration.
  @Getter
  private static final ConfigurationFile config =
      new ConfigurationFileCtrl("config.json").loadOrCreateDefault();

  public static void main(String[] args) {
    String mode = args.length > 0 ? args[0] : "";
    switch (mode) {
      case "--help" -> printHelp();
      default -> initMain(args);
    }
  }

  private static void printHelp() {
    System.out.println("""
        Usage:
            (no arguments)   start the bot using ./config.json
            --help           show this message
        """);
  }

  private static void initMain(String[] args) {
    Map<String, Object> props = new HashMap<>();
    props.put("discord.bot.secret", config.token);
    props.put("discord.guild.id", config.targetGuildId);
    props.put(
        "clubhub.music.inactivity-check-interval-seconds",
        config.music.inactivityCheckIntervalSeconds);
    props.put("spring.main.web-application-type", "none");

    // Apply app locale from config (affects messages bundle selection)
    if (config.language != null && !config.language.isBlank()) {
      Locale.setDefault(Locale.forLanguageTag(config.language));
    }

    SpringApplication app = new SpringApplication(ClubBot.class);
    app.setDefaultProperties(props);
    app.run(args);
  }
}
