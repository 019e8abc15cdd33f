package com.scholary.transcriber.audio;

import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Reads the duration of an audio file with ffprobe. */
@Component
public class DurationProbe {

  private static final Logger LOGGER = LoggerFactory.getLogger(DurationProbe.class);

  private final FfmpegProperties properties;

  public DurationProbe(FfmpegProperties properties) {
    this.properties = properties;
  }

  /**
   * Probe the duration of an audio file.
   *
   * @param audio the file to probe
   * @return duration in seconds
   * @throws ConversionException if ffprobe fails or prints something that is not a number
   */
  public double probe(Path audio) {
    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v",
            "error",
            "-show_entries",
            "format=duration",
            "-of",
            "default=noprint_wrappers=1:nokey=1",
            audio.toString());

    Path logFile = audio.resolveSibling(audio.getFileName() + ".ffprobe.log");
    ExternalProcess.Result result =
        ExternalProcess.run(command, logFile, properties.timeoutSeconds());

    if (result.exitCode() != 0) {
      throw new ConversionException(
          "ffprobe failed with exit code: " + result.exitCode() + ", output: " + result.output());
    }

    try {
      double seconds = Double.parseDouble(result.output().trim());
      LOGGER.debug("Probed duration of {}: {}s", audio.getFileName(), seconds);
      return seconds;
    } catch (NumberFormatException e) {
      throw new ConversionException("Failed to parse duration from ffprobe output", e);
    }
  }
}
