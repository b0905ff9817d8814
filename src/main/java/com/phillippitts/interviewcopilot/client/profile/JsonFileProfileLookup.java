package com.phillippitts.interviewcopilot.client.profile;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.phillippitts.interviewcopilot.domain.ContextPayload;
import com.phillippitts.interviewcopilot.exception.InterviewCopilotException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads profiles from a snake_case JSON file.
 *
 * <p>The file holds either one profile (resume_text, star_stories, talking_points, qa_pairs) used
 * for every user, or a {@code profiles} object keyed by user id with an optional {@code default}
 * entry. The file is re-read on every lookup so edits apply to the next session.
 *
 * <p>A missing file yields {@link ContextPayload#EMPTY}; a malformed one fails the lookup.
 */
public class JsonFileProfileLookup implements ProfileLookup {

    private static final Logger LOG = LogManager.getLogger(JsonFileProfileLookup.class);

    static final String PROFILES = "profiles";
    static final String DEFAULT_PROFILE = "default";

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileProfileLookup(Path file, ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public ContextPayload lookup(String userId) {
        if (!Files.isRegularFile(file)) {
            LOG.warn("Profile file not found: {}; sending empty context", file.toAbsolutePath());
            return ContextPayload.EMPTY;
        }
        try {
            JsonNode root = mapper.readTree(file.toFile());
            JsonNode node = root;
            if (root != null && root.has(PROFILES)) {
                JsonNode profiles = root.get(PROFILES);
                node = profiles.has(userId) ? profiles.get(userId) : profiles.get(DEFAULT_PROFILE);
            }
            if (node == null || node.isNull() || node.isMissingNode()) {
                LOG.info("No profile for user {} in {}; sending empty context", userId, file);
                return ContextPayload.EMPTY;
            }
            ContextPayload payload = mapper.treeToValue(node, ContextPayload.class);
            LOG.info("Loaded profile for user {}: stories={}, talkingPoints={}, qaPairs={}, resumeChars={}",
                    userId, payload.starStories().size(), payload.talkingPoints().size(),
                    payload.qaPairs().size(), payload.resumeText().length());
            return payload;
        } catch (IOException | IllegalArgumentException e) {
            throw new InterviewCopilotException("Failed to read profile file " + file + ": " + e.getMessage(), e);
        }
    }
}
