package com.scholary.transcriber.audio;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normalizes arbitrary audio or video into the recognizer's canonical input.
 *
 * <p>Output is mono 16-bit little-endian PCM WAV at the configured sample rate. Video streams are
 * dropped.
 */
@Component
public class AudioConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioConverter.class);

  private final FfmpegProperties properties;

  public AudioConverter(FfmpegProperties properties) {
    this.properties = properties;
  }

  /**
   * Convert a media file to canonical PCM.
   *
   * @param input the downloaded media file
   * @param output where to write the WAV file
   * @return the output path
   * @throws ConversionException if ffmpeg fails or times out
   */
  public Path convert(Path input, Path output) {
    List<String> command = buildCommand(input, output);
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Path logFile = output.resolveSibling(output.getFileName() + ".ffmpeg.log");
    ExternalProcess.Result result =
        ExternalProcess.run(command, logFile, properties.timeoutSeconds());

    if (result.exitCode() != 0) {
      throw new ConversionException(
          String.format("ffmpeg exited with code %d: %s", result.exitCode(), result.output()));
    }
    if (!Files.exists(output)) {
      throw new ConversionException("ffmpeg reported success but produced no output: " + output);
    }

    LOGGER.info(
        "Converted {} to {}Hz/{}ch PCM: {}",
        input.getFileName(),
        properties.sampleRate(),
        properties.channels(),
        output.getFileName());
    return output;
  }

  List<String> buildCommand(Path input, Path output) {
    return List.of(
        properties.ffmpegPath(),
        "-y",
        "-nostdin",
        "-i",
        input.toString(),
        "-vn",
        "-ac",
        String.valueOf(properties.channels()),
        "-ar",
        String.valueOf(properties.sampleRate()),
        "-acodec",
        "pcm_s16le",
        output.toString());
  }
}
