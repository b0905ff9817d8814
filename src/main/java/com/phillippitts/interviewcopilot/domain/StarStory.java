package com.phillippitts.interviewcopilot.domain;

import java.util.List;

/**
 * STAR-format story owned by the candidate profile and referenced read-only by a session.
 */
public record StarStory(
        String id,
        String title,
        String situation,
        String task,
        String action,
        String result,
        List<String> tags
) {
    public StarStory {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("story id must not be blank");
        }
        title = title == null ? "" : title;
        situation = situation == null ? "" : situation;
        task = task == null ? "" : task;
        action = action == null ? "" : action;
        result = result == null ? "" : result;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /** Narrative text used for keyword matching. */
    public String narrative() {
        return String.join(" ", title, situation, task, action, result);
    }
}
