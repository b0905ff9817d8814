package com.phillippitts.interviewcopilot.service.generation;

import com.phillippitts.interviewcopilot.domain.ContextPayload;
import com.phillippitts.interviewcopilot.domain.Grounding;
import com.phillippitts.interviewcopilot.domain.QuestionType;
import com.phillippitts.interviewcopilot.domain.StarStory;

import java.util.List;

/**
 * Everything a model client needs for one answer: the rendered prompt plus the structured
 * inputs it was rendered from (offline clients compose from the latter).
 */
public record AnswerPrompt(
        String question,
        QuestionType type,
        Grounding grounding,
        List<StarStory> stories,
        ContextPayload context,
        String systemPrompt,
        String userPrompt
) {
    public AnswerPrompt {
        stories = stories == null ? List.of() : List.copyOf(stories);
        context = context == null ? ContextPayload.EMPTY : context;
    }
}
