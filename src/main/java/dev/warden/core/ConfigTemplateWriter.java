/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/** Keeps {@code warden.json5.example} in step with the built-in template. */
final class ConfigTemplateWriter {

  private ConfigTemplateWriter() {}

  /**
   * Rewrites the example file only when it is missing or stale.
   *
   * @param path destination path (usually {@code config/warden.json5.example})
   * @param contents template text
   */
  static void writeExample(Path path, String contents) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(contents, "contents");

    byte[] data = contents.getBytes(StandardCharsets.UTF_8);
    try {
      Path parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      if (Files.exists(path) && Arrays.equals(Files.readAllBytes(path), data)) {
        return;
      }
      Files.write(path, data);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write config example: " + path, e);
    }
  }
}
