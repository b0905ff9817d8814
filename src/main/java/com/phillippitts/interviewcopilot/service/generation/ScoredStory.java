package com.phillippitts.interviewcopilot.service.generation;

import com.phillippitts.interviewcopilot.domain.StarStory;

/**
 * Story with the relevance score it earned against a question.
 *
 * @param story the story
 * @param tagMatches number of story tags that appear in the question
 * @param keywordOverlap number of question keywords found in the story narrative
 * @param score weighted relevance used for ordering
 */
public record ScoredStory(StarStory story, int tagMatches, int keywordOverlap, int score) {
}
