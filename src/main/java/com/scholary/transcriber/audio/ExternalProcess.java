package com.scholary.transcriber.audio;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a command with a bounded wait.
 *
 * <p>Combined stdout/stderr goes to a log file instead of a pipe so a chatty process can never
 * block on a full buffer. The log file is left in place for the job's scratch cleanup.
 */
final class ExternalProcess {

  private static final int OUTPUT_TAIL_CHARS = 2000;

  private ExternalProcess() {}

  record Result(int exitCode, String output) {}

  static Result run(List<String> command, Path logFile, long timeoutSeconds) {
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    pb.redirectOutput(logFile.toFile());

    Process process;
    try {
      process = pb.start();
    } catch (IOException e) {
      throw new ConversionException("Failed to start " + command.get(0), e);
    }

    try {
      if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new ConversionException(
            String.format("%s timed out after %ds", command.get(0), timeoutSeconds));
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ConversionException(command.get(0) + " interrupted", e);
    }

    return new Result(process.exitValue(), readTail(logFile));
  }

  private static String readTail(Path logFile) {
    try {
      String output = Files.readString(logFile, StandardCharsets.UTF_8).trim();
      return output.length() > OUTPUT_TAIL_CHARS
          ? output.substring(output.length() - OUTPUT_TAIL_CHARS)
          : output;
    } catch (IOException e) {
      return "";
    }
  }
}
