package dev.clubhub.bot.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/** Reads {@link ConfigurationFile} from a JSON file, writing the defaults when it is missing. */
@Slf4j
public class ConfigurationFileCtrl {

  private final Path path;
  private final ObjectMapper mapper =
      new ObjectMapper()
          .enable(SerializationFeature.INDENT_OUTPUT)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  public ConfigurationFileCtrl(String path) {
    this(Path.of(path));
  }

  public ConfigurationFileCtrl(Path path) {
    this.path = path;
  }

  public ConfigurationFile loadOrCreateDefault() {
    if (Files.exists(path)) {
      try {
        ConfigurationFile config = mapper.readValue(path.toFile(), ConfigurationFile.class);
        log.info("Loaded configuration from {}", path.toAbsolutePath());
        return config;
      } catch (IOException e) {
        throw new UncheckedIOException("Cannot read configuration " + path.toAbsolutePath(), e);
      }
    }
    ConfigurationFile defaults = new ConfigurationFile();
    save(defaults);
    log.warn("Configuration {} not found, wrote defaults. Fill it in and restart.", path.toAbsolutePath());
    return defaults;
  }

  public void save(ConfigurationFile config) {
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      mapper.writeValue(path.toFile(), config);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write configuration " + path.toAbsolutePath(), e);
    }
  }
}
