package com.phillippitts.interviewcopilot.service.generation;

import java.util.function.Consumer;

/**
 * Boundary to the answer-generation model.
 *
 * <p>Implementations block until the answer is complete and must respond to thread
 * interruption, which is how a closed session cancels its in-flight generation.
 * {@link #stream} additionally reports the answer in fragments while it is produced.
 * Failures are reported as
 * {@link com.phillippitts.interviewcopilot.exception.GenerationFailureException}.
 */
public interface AnswerModelClient {

    /**
     * @param prompt rendered prompt and its structured inputs
     * @return answer text (never null)
     */
    String complete(AnswerPrompt prompt);

    /**
     * Produces the answer fragment by fragment. Fragments are handed to {@code onDelta} on the
     * calling thread in order; their concatenation is the returned text.
     *
     * <p>The default has no incremental output and reports the whole answer as one fragment.
     */
    default String stream(AnswerPrompt prompt, Consumer<String> onDelta) {
        String answer = complete(prompt);
        if (answer != null && !answer.isBlank()) {
            onDelta.accept(answer);
        }
        return answer;
    }

    /** Short provider name for logs and metrics. */
    String name();
}
