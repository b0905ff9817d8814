package com.phillippitts.interviewcopilot.domain;

import java.util.Locale;

/** Origin of an answer: produced by the model or taken from a prepared Q&A pair. */
public enum AnswerSource {
    GENERATED,
    UPLOADED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
