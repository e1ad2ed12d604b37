package ca.gc.cra.geolayer.validation;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the boundary, analysis and render-rule inputs.
 * <p><strong>Why:</strong> Surfaces a precise CLI diagnostic before any adapter opens a stream.</p>
 * <p><strong>Thread-safety:</strong> Stateless; results may race with concurrent filesystem changes.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is missing, not a file, or unreadable
   */
  public static Path validateReadableFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }
}
