package ca.gc.cra.testreport.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for CLI and configuration inputs.
 * <p><strong>Why:</strong> Surfaces a missing or unreadable input file as an argument error before the parser
 * opens it, instead of as an I/O failure mid-run.
 * <p><strong>Thread-safety:</strong> Stateless methods; filesystem state may change between checks.</p>
 * <p><strong>Observability:</strong> Emits no logs; callers surface validation exceptions.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} names an existing, readable regular file.
   *
   * @param path candidate input file; must not be {@code null}
   * @return canonical path of the file
   * @throws IllegalArgumentException if the path is missing, not a regular file, or unreadable
   */
  public static Path requireReadableFile(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    Path real;
    try {
      real = path.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("input file does not exist: " + path, ex);
    }
    if (!Files.isRegularFile(real)) {
      throw new IllegalArgumentException("input is not a regular file: " + real);
    }
    if (!Files.isReadable(real)) {
      throw new IllegalArgumentException("input file is not readable: " + real);
    }
    return real;
  }
}
