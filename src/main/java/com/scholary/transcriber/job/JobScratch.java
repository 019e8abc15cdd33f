package com.scholary.transcriber.job;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scratch space owned by one job.
 *
 * <p>Every artifact a stage produces lives in one directory named after the recording id and the run
 * id, so cleanup removes all of them no matter which stage created them or how far the job got. Two
 * runs for the same recording never share a directory. Cleanup is idempotent.
 */
public class JobScratch implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobScratch.class);

  private final Path directory;

  private JobScratch(Path directory) {
    this.directory = directory;
  }

  /** Create the scratch directory for one run of a recording. */
  public static JobScratch open(Path tempDir, String recordingId, String runId) {
    Path directory = directoryFor(tempDir, recordingId, runId);
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create scratch directory: " + directory, e);
    }
    return new JobScratch(directory);
  }

  public static Path directoryFor(Path tempDir, String recordingId, String runId) {
    return tempDir.resolve("job-" + sanitize(recordingId) + "-" + sanitize(runId));
  }

  private static String sanitize(String value) {
    return value.replaceAll("[^A-Za-z0-9._-]", "_");
  }

  public Path directory() {
    return directory;
  }

  public Path inputFile() {
    return directory.resolve("input.media");
  }

  public Path audioFile() {
    return directory.resolve("audio.wav");
  }

  /** Delete everything under the scratch directory, then the directory itself. */
  public void cleanup() {
    cleanup(directory);
  }

  /**
   * Delete the scratch directory of one run.
   *
   * @return the number of paths removed
   */
  public static int cleanup(Path tempDir, String recordingId, String runId) {
    return cleanup(directoryFor(tempDir, recordingId, runId));
  }

  private static int cleanup(Path directory) {
    if (!Files.exists(directory)) {
      return 0;
    }
    int removed = 0;
    try (Stream<Path> paths = Files.walk(directory)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        try {
          if (Files.deleteIfExists(path)) {
            removed++;
          }
        } catch (IOException e) {
          LOGGER.warn("Failed to delete scratch file {}: {}", path, e.getMessage());
        }
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to walk scratch directory {}: {}", directory, e.getMessage());
    }
    LOGGER.debug("Removed {} scratch paths under {}", removed, directory);
    return removed;
  }

  @Override
  public void close() {
    cleanup();
  }
}
