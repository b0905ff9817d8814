package com.phillippitts.interviewcopilot.service.generation;

import com.phillippitts.interviewcopilot.domain.ContextPayload;
import com.phillippitts.interviewcopilot.domain.Grounding;
import com.phillippitts.interviewcopilot.domain.QuestionType;
import com.phillippitts.interviewcopilot.domain.StarStory;
import com.phillippitts.interviewcopilot.domain.TalkingPoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the system and user prompts for answer generation.
 *
 * <p>Context sections ({@code RESUME}, {@code STAR STORIES}, {@code KEY TALKING POINTS}) are
 * joined with a {@code ---} separator. Under {@code PROFILE} grounding the stories are labelled as
 * background so the model weights them below a direct match. With no context the prompt says so explicitly and asks
 * for a generic STAR-shaped answer.
 */
@Component
public class PromptBuilder {

    static final String SECTION_SEPARATOR = "\n\n---\n\n";
    static final String NO_CONTEXT = "No specific context provided.";
    static final String BACKGROUND_STORIES =
            "STAR STORIES (background; none matches this question directly, use only what fits):";

    private static final String SYSTEM_PROMPT = """
            You are helping a candidate answer an interview question in real time.
            Answer in the first person, as the candidate, in 150 to 250 words.
            Structure the answer as Situation, Task, Action, Result.
            Use only facts from the provided context; never invent employers, numbers or outcomes.""";

    private static final String GENERIC_INSTRUCTION =
            "No personal context is available: give a generic, clearly structured answer the "
            + "candidate can adapt, with placeholders instead of invented specifics.";

    public AnswerPrompt build(String question, QuestionType type, Grounding grounding,
                              List<StarStory> stories, ContextPayload context) {
        StringBuilder user = new StringBuilder();
        user.append("Interview question (").append(type.wireName()).append("): ")
                .append(question.strip()).append("\n\n");
        user.append("Candidate context:\n\n").append(renderContext(grounding, stories, context));
        if (grounding == Grounding.NONE) {
            user.append("\n\n").append(GENERIC_INSTRUCTION);
        }
        return new AnswerPrompt(question, type, grounding, stories, context, SYSTEM_PROMPT, user.toString());
    }

    String renderContext(Grounding grounding, List<StarStory> stories, ContextPayload context) {
        List<String> sections = new ArrayList<>();
        if (!context.resumeText().isBlank()) {
            sections.add("RESUME:\n" + context.resumeText().strip());
        }
        if (grounding != Grounding.NONE && !stories.isEmpty()) {
            StringBuilder sb = new StringBuilder(grounding == Grounding.STORIES ? "STAR STORIES:" : BACKGROUND_STORIES);
            for (StarStory story : stories) {
                sb.append("\n\n").append(renderStory(story));
            }
            sections.add(sb.toString());
        }
        List<String> points = new ArrayList<>();
        for (TalkingPoint point : context.talkingPoints()) {
            if (!point.content().isBlank()) {
                points.add("- " + point.content().strip());
            }
        }
        if (!points.isEmpty()) {
            sections.add("KEY TALKING POINTS:\n" + String.join("\n", points));
        }
        return sections.isEmpty() ? NO_CONTEXT : String.join(SECTION_SEPARATOR, sections);
    }

    static String renderStory(StarStory story) {
        return "Story: " + story.title()
                + "\nSituation: " + story.situation()
                + "\nTask: " + story.task()
                + "\nAction: " + story.action()
                + "\nResult: " + story.result();
    }
}
