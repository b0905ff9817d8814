package com.phillippitts.interviewcopilot.domain;

/** Answer the candidate prepared in advance for an expected question. */
public record QaPair(String question, String answer) {
    public QaPair {
        question = question == null ? "" : question;
        answer = answer == null ? "" : answer;
    }
}
