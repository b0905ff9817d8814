package com.phillippitts.interviewcopilot.domain;

/** Which part of the candidate context an answer was built from. */
public enum Grounding {
    /** One or more STAR stories were selected. */
    STORIES,
    /**
     * No story overlaps the question; resume text, talking points and any stories (in profile
     * order, as background) ground the answer.
     */
    PROFILE,
    /** Generic STAR-shaped answer; only when there are no stories, resume or talking points. */
    NONE
}
