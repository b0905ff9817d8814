package com.phillippitts.interviewcopilot.service.generation;

import com.phillippitts.interviewcopilot.domain.ContextPayload;
import com.phillippitts.interviewcopilot.domain.Grounding;
import com.phillippitts.interviewcopilot.domain.QuestionType;
import com.phillippitts.interviewcopilot.testutil.TestProfiles;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder();

    @Test
    void storyGroundedPromptRendersStarSections() {
        AnswerPrompt prompt = builder.build("Tell me about a conflict", QuestionType.BEHAVIORAL,
                Grounding.STORIES, List.of(TestProfiles.CONFLICT), TestProfiles.stories());

        assertThat(prompt.userPrompt())
                .startsWith("Interview question (behavioral): Tell me about a conflict")
                .contains("STAR STORIES:")
                .contains("Story: Resolving a team conflict")
                .contains("Result: We shipped on time")
                .doesNotContain(PromptBuilder.NO_CONTEXT);
        assertThat(prompt.systemPrompt()).contains("Situation, Task, Action, Result");
        assertThat(prompt.stories()).containsExactly(TestProfiles.CONFLICT);
    }

    @Test
    void profileGroundedPromptJoinsResumeAndTalkingPoints() {
        String context = builder.renderContext(Grounding.PROFILE, List.of(), TestProfiles.profileOnly());

        assertThat(context).isEqualTo("RESUME:\nSenior engineer at Acme, 8 years in payments"
                + PromptBuilder.SECTION_SEPARATOR
                + "KEY TALKING POINTS:\n- I take ownership of outcomes");
    }

    @Test
    void profileGroundingRendersStoriesAsBackground() {
        String context = builder.renderContext(Grounding.PROFILE, List.of(TestProfiles.CONFLICT),
                TestProfiles.profileOnly());

        assertThat(context)
                .contains(PromptBuilder.BACKGROUND_STORIES)
                .contains("Story: Resolving a team conflict")
                .doesNotContain("STAR STORIES:\n");
        assertThat(context.indexOf("RESUME:")).isLessThan(context.indexOf(PromptBuilder.BACKGROUND_STORIES));
    }

    @Test
    void emptyContextAsksForGenericAnswer() {
        AnswerPrompt prompt = builder.build("Why us?", QuestionType.OTHER, Grounding.NONE, List.of(),
                ContextPayload.EMPTY);

        assertThat(prompt.userPrompt())
                .contains(PromptBuilder.NO_CONTEXT)
                .contains("placeholders");
    }
}
