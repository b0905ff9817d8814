package com.phillippitts.interviewcopilot.service.recognition;

import com.phillippitts.interviewcopilot.domain.RecognitionResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Utility to parse Vosk JSON output into recognition results.
 *
 * <p>Handles the three shapes the streaming recognizer returns:
 * <ul>
 *   <li><b>Partial:</b> {@code {"partial": "..."}}</li>
 *   <li><b>Final:</b> {@code {"text": "...", "result": [...]}}</li>
 *   <li><b>Alternatives:</b> {@code {"alternatives": [{"text": "...", "confidence": ...}]}}</li>
 * </ul>
 *
 * <p>Thread-safe: All methods are static and stateless.
 *
 * <p><b>Security:</b> caps JSON input at {@link #MAX_JSON_SIZE} (1MB).
 */
final class VoskJsonParser {

    private static final Logger LOG = LogManager.getLogger(VoskJsonParser.class);

    /** Maximum accepted JSON response size (1MB). */
    static final int MAX_JSON_SIZE = 1_048_576;

    private VoskJsonParser() {
        // Utility class - prevent instantiation
    }

    /** Parses the output of {@code getPartialResult()}. */
    static RecognitionResult parsePartial(String json) {
        return RecognitionResult.partial(extract(json, "partial"));
    }

    /** Parses the output of {@code getResult()} or {@code getFinalResult()}. */
    static RecognitionResult parseFinal(String json) {
        return RecognitionResult.finalResult(extract(json, "text"));
    }

    private static String extract(String json, String field) {
        if (json == null || json.isBlank()) {
            return "";
        }
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Vosk JSON response exceeds {}B cap (actual: {}B); ignoring", MAX_JSON_SIZE, json.length());
            return "";
        }
        try {
            JSONObject obj = new JSONObject(json);
            if (obj.has("alternatives")) {
                JSONArray alternatives = obj.getJSONArray("alternatives");
                return alternatives.isEmpty() ? "" : alternatives.getJSONObject(0).optString("text", "").trim();
            }
            return obj.optString(field, "").trim();
        } catch (JSONException e) {
            LOG.warn("Failed to parse Vosk JSON response ({} chars)", json.length(), e);
            return "";
        }
    }
}
