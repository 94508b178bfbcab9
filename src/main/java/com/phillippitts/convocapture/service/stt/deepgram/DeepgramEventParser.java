package com.phillippitts.convocapture.service.stt.deepgram;

import com.phillippitts.convocapture.service.stt.TranscriptEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses Deepgram live-transcription messages into {@link TranscriptEvent}s.
 *
 * <p>Expected shape of a result message:
 * <pre>
 * {"type":"Results","is_final":true,"channel":{"alternatives":[{"transcript":"..."}]}}
 * </pre>
 * An event is finalized when {@code is_final} is true, or when {@code is_final} is absent and
 * the type is {@code Results}. Text is read from the first alternative, falling back to a
 * top-level {@code transcript} field.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
final class DeepgramEventParser {

    private static final Logger LOG = LogManager.getLogger(DeepgramEventParser.class);

    /** Maximum accepted message size (1MB). Larger messages are rejected unparsed. */
    static final int MAX_JSON_SIZE = 1_048_576;

    static final String RESULTS_TYPE = "Results";

    private DeepgramEventParser() {
        // Utility class - prevent instantiation
    }

    /**
     * @param json raw text message
     * @return the parsed event, or {@code null} if the message is blank, oversized or not a
     *         JSON object
     */
    static TranscriptEvent parse(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Transcription message exceeds {}B cap (actual: {}B); ignoring", MAX_JSON_SIZE, json.length());
            return null;
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            LOG.debug("Ignoring non-JSON transcription message: {}", e.getMessage());
            return null;
        }

        String type = obj.optString("type", "");
        boolean finalized = obj.has("is_final")
                ? obj.optBoolean("is_final", false)
                : RESULTS_TYPE.equals(type);
        return new TranscriptEvent(type, finalized, extractTranscript(obj));
    }

    private static String extractTranscript(JSONObject obj) {
        JSONObject channel = obj.optJSONObject("channel");
        if (channel != null) {
            JSONArray alternatives = channel.optJSONArray("alternatives");
            if (alternatives != null && !alternatives.isEmpty()) {
                JSONObject first = alternatives.optJSONObject(0);
                if (first != null) {
                    return first.optString("transcript", "");
                }
            }
        }
        return obj.optString("transcript", "");
    }
}
