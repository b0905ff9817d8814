package com.phillippitts.interviewcopilot.domain;

import java.util.List;

/**
 * Candidate background sent once per session activation (and again on profile change).
 *
 * <p>Immutable: a later context update installs a new generation baseline rather than
 * mutating the one captured by an in-flight or past generation.
 */
public record ContextPayload(
        String resumeText,
        List<StarStory> starStories,
        List<TalkingPoint> talkingPoints,
        List<QaPair> qaPairs
) {
    public static final ContextPayload EMPTY = new ContextPayload("", List.of(), List.of(), List.of());

    public ContextPayload {
        resumeText = resumeText == null ? "" : resumeText;
        starStories = starStories == null ? List.of() : List.copyOf(starStories);
        talkingPoints = talkingPoints == null ? List.of() : List.copyOf(talkingPoints);
        qaPairs = qaPairs == null ? List.of() : List.copyOf(qaPairs);
    }

    public boolean hasStories() {
        return !starStories.isEmpty();
    }

    /** True when resume text or at least one non-blank talking point is present. */
    public boolean hasProfile() {
        return !resumeText.isBlank()
                || talkingPoints.stream().anyMatch(p -> !p.content().isBlank());
    }

    public boolean hasAnyContext() {
        return hasStories() || hasProfile() || !qaPairs.isEmpty();
    }
}
