package com.phillippitts.convocapture.service.stt.deepgram;

import com.phillippitts.convocapture.service.stt.TranscriptEvent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeepgramEventParserTest {

    @Test
    void shouldExtractFinalTranscriptFromFirstAlternative() {
        String json = "{\"type\":\"Results\",\"is_final\":true,"
                + "\"channel\":{\"alternatives\":[{\"transcript\":\"hello world\"},{\"transcript\":\"yellow world\"}]}}";

        TranscriptEvent event = DeepgramEventParser.parse(json);

        assertThat(event).isNotNull();
        assertThat(event.type()).isEqualTo("Results");
        assertThat(event.finalized()).isTrue();
        assertThat(event.transcript()).isEqualTo("hello world");
    }

    @Test
    void shouldHonourExplicitInterimFlag() {
        String json = "{\"type\":\"Results\",\"is_final\":false,"
                + "\"channel\":{\"alternatives\":[{\"transcript\":\"hel\"}]}}";

        TranscriptEvent event = DeepgramEventParser.parse(json);

        assertThat(event.finalized()).isFalse();
        assertThat(event.hasFinalText()).isFalse();
    }

    @Test
    void shouldTreatResultsWithoutFlagAsFinal() {
        TranscriptEvent event = DeepgramEventParser.parse(
                "{\"type\":\"Results\",\"channel\":{\"alternatives\":[{\"transcript\":\"ok\"}]}}");

        assertThat(event.finalized()).isTrue();
    }

    @Test
    void shouldTreatOtherTypesWithoutFlagAsInterim() {
        TranscriptEvent event = DeepgramEventParser.parse("{\"type\":\"Metadata\",\"request_id\":\"abc\"}");

        assertThat(event.finalized()).isFalse();
        assertThat(event.transcript()).isEmpty();
    }

    @Test
    void shouldFallBackToTopLevelTranscript() {
        TranscriptEvent event = DeepgramEventParser.parse("{\"is_final\":true,\"transcript\":\"plain text\"}");

        assertThat(event.hasFinalText()).isTrue();
        assertThat(event.transcript()).isEqualTo("plain text");
    }

    @Test
    void shouldReturnEmptyTextWhenAlternativesEmpty() {
        TranscriptEvent event = DeepgramEventParser.parse(
                "{\"type\":\"Results\",\"channel\":{\"alternatives\":[]}}");

        assertThat(event.transcript()).isEmpty();
        assertThat(event.hasFinalText()).isFalse();
    }

    @Test
    void shouldIgnoreBlankMalformedAndOversizedMessages() {
        assertThat(DeepgramEventParser.parse(null)).isNull();
        assertThat(DeepgramEventParser.parse("   ")).isNull();
        assertThat(DeepgramEventParser.parse("not-json")).isNull();
        assertThat(DeepgramEventParser.parse("[1,2,3]")).isNull();

        String huge = "{\"transcript\":\"" + "a".repeat(DeepgramEventParser.MAX_JSON_SIZE) + "\"}";
        assertThat(DeepgramEventParser.parse(huge)).isNull();
    }
}
