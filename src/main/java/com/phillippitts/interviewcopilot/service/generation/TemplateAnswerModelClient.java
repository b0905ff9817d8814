package com.phillippitts.interviewcopilot.service.generation;

import com.phillippitts.interviewcopilot.domain.StarStory;
import com.phillippitts.interviewcopilot.domain.TalkingPoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Offline answer composer: renders a STAR-shaped answer straight from the selected context.
 *
 * <p>Deterministic and dependency-free, which makes it the default for local runs and tests.
 */
@Component
@ConditionalOnProperty(name = "copilot.generation.provider", havingValue = "template", matchIfMissing = true)
public class TemplateAnswerModelClient implements AnswerModelClient {

    private static final Logger LOG = LogManager.getLogger(TemplateAnswerModelClient.class);

    @Override
    public String complete(AnswerPrompt prompt) {
        LOG.debug("Composing template answer: grounding={}, stories={}", prompt.grounding(), prompt.stories().size());
        return switch (prompt.grounding()) {
            case STORIES -> fromStory(prompt.stories().get(0));
            case PROFILE -> fromProfile(prompt);
            case NONE -> generic(prompt);
        };
    }

    /** Streams the composed answer one STAR line at a time. */
    @Override
    public String stream(AnswerPrompt prompt, Consumer<String> onDelta) {
        String answer = complete(prompt);
        int from = 0;
        while (from < answer.length()) {
            int nl = answer.indexOf('\n', from);
            int to = nl < 0 ? answer.length() : nl + 1;
            onDelta.accept(answer.substring(from, to));
            from = to;
        }
        return answer;
    }

    @Override
    public String name() {
        return "template";
    }

    private static String fromStory(StarStory story) {
        return "Situation: " + story.situation().strip() + "\n"
                + "Task: " + story.task().strip() + "\n"
                + "Action: " + story.action().strip() + "\n"
                + "Result: " + story.result().strip();
    }

    private static String fromProfile(AnswerPrompt prompt) {
        StringBuilder sb = new StringBuilder();
        String resume = prompt.context().resumeText().strip();
        Optional<StarStory> background = prompt.stories().stream().findFirst();
        sb.append("Situation: Drawing on my background");
        if (!resume.isEmpty()) {
            sb.append(" (").append(firstLine(resume)).append(')');
        } else if (background.isPresent()) {
            sb.append(" (").append(background.get().title().strip()).append(')');
        }
        sb.append(", this comes up often in my work.\n");
        sb.append("Task: I needed to address it directly.\n");
        sb.append("Action: ");
        String action = prompt.context().talkingPoints().stream()
                .map(TalkingPoint::content)
                .filter(c -> !c.isBlank())
                .findFirst()
                .or(() -> background.map(StarStory::action).filter(a -> !a.isBlank()))
                .orElse("I broke the problem down, aligned with the people involved, and executed step by step.");
        sb.append(action.strip()).append('\n');
        sb.append("Result: ");
        sb.append(background.map(StarStory::result).filter(r -> !r.isBlank()).map(String::strip)
                .orElse("The outcome was positive and I would take the same approach again."));
        return sb.toString();
    }

    private static String generic(AnswerPrompt prompt) {
        return "Situation: In a previous role, [describe the context relevant to: "
                + prompt.question().strip() + "].\n"
                + "Task: I was responsible for [your specific responsibility].\n"
                + "Action: I [the concrete steps you took, and why].\n"
                + "Result: As a result, [measurable outcome and what you learned].";
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        String line = nl < 0 ? text : text.substring(0, nl);
        return line.length() <= 80 ? line : line.substring(0, 80);
    }
}
