package com.phillippitts.interviewcopilot.domain;

import java.util.Locale;

/** Classification attached to a detected question. */
public enum QuestionType {
    BEHAVIORAL("behavioral"),
    TECHNICAL("technical"),
    SITUATIONAL("situational"),
    OTHER("general");

    private final String wireName;

    QuestionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Lenient lookup by wire or constant name; unknown or null values map to {@link #OTHER}. */
    public static QuestionType fromWire(String value) {
        if (value == null) {
            return OTHER;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (QuestionType t : values()) {
            if (t.wireName.equals(v) || t.name().toLowerCase(Locale.ROOT).equals(v)) {
                return t;
            }
        }
        return OTHER;
    }
}
