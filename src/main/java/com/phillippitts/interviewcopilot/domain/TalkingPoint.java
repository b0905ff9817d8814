package com.phillippitts.interviewcopilot.domain;

/** Short point the candidate wants to make; {@code title} is optional. */
public record TalkingPoint(String title, String content) {
    public TalkingPoint {
        title = title == null ? "" : title;
        content = content == null ? "" : content;
    }
}
