package com.scholary.transcriber.callback;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.output.FormattedTranscript;
import com.scholary.transcriber.output.TranscriptJson;
import com.scholary.transcriber.output.Utterance;
import com.scholary.transcriber.output.UtteranceWord;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResultEnvelopeTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void success_shouldSerializeTranscriptFieldsInSnakeCase() throws Exception {
    Utterance utterance =
        new Utterance(1, 0.0, 1.5, "Hello.", 0.93, List.of(new UtteranceWord("Hello.", 0.0, 1.2, 0.93)));
    FormattedTranscript transcript =
        new FormattedTranscript(
            "Speaker 1: Hello.",
            new TranscriptJson(List.of(utterance), List.of(new TranscriptJson.SpeakerSummary(1, 1))),
            List.of(utterance),
            1,
            3);

    JsonNode json =
        objectMapper.readTree(
            objectMapper.writeValueAsString(
                ResultEnvelope.success("rec-1", transcript, 1.5, "en", 4.21)));

    assertThat(json.get("recording_id").asText()).isEqualTo("rec-1");
    assertThat(json.get("status").asText()).isEqualTo("success");
    assertThat(json.get("transcript_text").asText()).isEqualTo("Speaker 1: Hello.");
    assertThat(json.get("transcript_json").get("utterances")).hasSize(1);
    assertThat(json.get("transcript_json").get("speakers").get(0).get("count").asInt())
        .isEqualTo(1);
    assertThat(json.get("transcript_utterances").get(0).get("words").get(0).get("word").asText())
        .isEqualTo("Hello.");
    assertThat(json.get("duration_seconds").asDouble()).isEqualTo(1.5);
    assertThat(json.get("word_count").asInt()).isEqualTo(3);
    assertThat(json.get("speaker_count").asInt()).isEqualTo(1);
    assertThat(json.get("processing_seconds").asDouble()).isEqualTo(4.21);
    assertThat(json.has("error")).isFalse();
  }

  @Test
  void error_shouldOmitTranscriptFields() throws Exception {
    JsonNode json =
        objectMapper.readTree(
            objectMapper.writeValueAsString(ResultEnvelope.error("rec-2", "Download failed", 0.37)));

    assertThat(json.get("status").asText()).isEqualTo("error");
    assertThat(json.get("error").asText()).isEqualTo("Download failed");
    assertThat(json.get("processing_seconds").asDouble()).isEqualTo(0.37);
    assertThat(json.has("transcript_text")).isFalse();
    assertThat(json.has("transcript_json")).isFalse();
    assertThat(json.has("transcript_utterances")).isFalse();
    assertThat(json.has("word_count")).isFalse();
    assertThat(json.has("speaker_count")).isFalse();
    assertThat(json.has("success")).isFalse();
  }
}
