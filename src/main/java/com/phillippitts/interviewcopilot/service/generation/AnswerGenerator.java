package com.phillippitts.interviewcopilot.service.generation;

import com.phillippitts.interviewcopilot.config.properties.GenerationProperties;
import com.phillippitts.interviewcopilot.domain.AnswerRecord;
import com.phillippitts.interviewcopilot.domain.ContextPayload;
import com.phillippitts.interviewcopilot.domain.Grounding;
import com.phillippitts.interviewcopilot.domain.QaPair;
import com.phillippitts.interviewcopilot.domain.QuestionEvent;
import com.phillippitts.interviewcopilot.domain.StarStory;
import com.phillippitts.interviewcopilot.exception.GenerationFailureException;
import com.phillippitts.interviewcopilot.exception.GenerationTimeoutException;
import com.phillippitts.interviewcopilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Produces context-grounded suggested answers.
 *
 * <p><b>Grounding order:</b>
 * <ol>
 *   <li>A prepared Q&amp;A pair matching the question is served as-is ({@code source=uploaded})</li>
 *   <li>STAR stories overlapping the question by tag or keyword ground the answer</li>
 *   <li>Without relevant stories, resume text, talking points and the first stories in profile
 *       order ground it as background</li>
 *   <li>With no context at all, a generic STAR-shaped answer is produced and flagged ungrounded</li>
 * </ol>
 *
 * <p><b>Execution:</b> each call runs on the generation executor and returns a
 * {@link GenerationHandle}. A generation that outlives {@code copilot.generation.timeout-ms}
 * completes with {@link GenerationTimeoutException} and its worker is interrupted. Failures are
 * never retried; the user retries explicitly through {@code request_answer}.
 *
 * <p>The generator holds no session state. Each call receives the context baseline captured
 * when it was dispatched, so later context updates do not affect it.
 */
@Service
public class AnswerGenerator {

    private static final Logger LOG = LogManager.getLogger(AnswerGenerator.class);

    private final StorySelector storySelector;
    private final QaPairMatcher qaPairMatcher;
    private final PromptBuilder promptBuilder;
    private final AnswerModelClient modelClient;
    private final GenerationProperties props;
    private final Executor executor;

    public AnswerGenerator(StorySelector storySelector,
                           QaPairMatcher qaPairMatcher,
                           PromptBuilder promptBuilder,
                           AnswerModelClient modelClient,
                           GenerationProperties props,
                           @Qualifier("generationExecutor") Executor executor) {
        this.storySelector = Objects.requireNonNull(storySelector);
        this.qaPairMatcher = Objects.requireNonNull(qaPairMatcher);
        this.promptBuilder = Objects.requireNonNull(promptBuilder);
        this.modelClient = Objects.requireNonNull(modelClient);
        this.props = Objects.requireNonNull(props);
        this.executor = Objects.requireNonNull(executor);
    }

    /** Starts a generation without observing its fragments. */
    public GenerationHandle generate(QuestionEvent question, ContextPayload context) {
        return generate(question, context, delta -> { });
    }

    /**
     * Starts an asynchronous generation for a detected or requested question.
     *
     * @param question question to answer
     * @param context context baseline captured at dispatch time
     * @param onDelta receives answer fragments on the worker thread while the model produces
     *        them; nothing is forwarded once the result has completed, timed out or been cancelled
     * @return handle to observe or cancel the generation
     */
    public GenerationHandle generate(QuestionEvent question, ContextPayload context, Consumer<String> onDelta) {
        Objects.requireNonNull(question, "question");
        Objects.requireNonNull(onDelta, "onDelta");
        ContextPayload baseline = context == null ? ContextPayload.EMPTY : context;

        CompletableFuture<AnswerRecord> result = new CompletableFuture<>();
        Consumer<String> gated = delta -> {
            if (!result.isDone()) {
                onDelta.accept(delta);
            }
        };
        GenerationTask task = new GenerationTask(() -> compose(question, baseline, gated), result);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new GenerationFailureException("Generation executor rejected the task", e));
            return new GenerationHandle(question.questionId(), result, task);
        }

        // Timeout: fail the result first, then interrupt the worker
        CompletableFuture.runAsync(() -> {
            if (result.completeExceptionally(new GenerationTimeoutException(props.timeout()))) {
                LOG.warn("Generation timed out: questionId={}, timeoutMs={}", question.questionId(), props.timeoutMs());
                task.cancel(true);
            }
        }, CompletableFuture.delayedExecutor(props.timeoutMs(), TimeUnit.MILLISECONDS));

        return new GenerationHandle(question.questionId(), result, task);
    }

    /**
     * Builds one answer synchronously. Runs on a generation worker thread. A prepared answer is
     * returned without fragments.
     *
     * @throws GenerationFailureException if the model fails or returns nothing
     */
    AnswerRecord compose(QuestionEvent question, ContextPayload context) {
        return compose(question, context, delta -> { });
    }

    AnswerRecord compose(QuestionEvent question, ContextPayload context, Consumer<String> onDelta) {
        Optional<QaPair> prepared = qaPairMatcher.match(question.text(), context.qaPairs(), props.qaMatchThreshold());
        if (prepared.isPresent()) {
            LOG.info("Serving prepared answer: questionId={}", question.questionId());
            return AnswerRecord.uploaded(question.questionId(), question.text(), prepared.get().answer());
        }

        List<StarStory> stories = storySelector.select(question.text(), context.starStories(), props.maxStories())
                .stream()
                .map(ScoredStory::story)
                .toList();
        Grounding grounding = Grounding.STORIES;
        if (stories.isEmpty()) {
            // Nothing overlaps the question: the first stories still go in as background
            stories = context.starStories().subList(0, Math.min(props.maxStories(), context.starStories().size()));
            grounding = context.hasStories() || context.hasProfile() ? Grounding.PROFILE : Grounding.NONE;
        }

        AnswerPrompt prompt = promptBuilder.build(question.text(), question.type(), grounding, stories, context);
        long start = System.nanoTime();
        String answer = modelClient.stream(prompt, onDelta);
        if (answer == null || answer.isBlank()) {
            throw new GenerationFailureException("Model returned an empty answer");
        }
        List<String> storyIds = stories.stream().map(StarStory::id).toList();
        LOG.info("Answer generated: questionId={}, provider={}, grounding={}, stories={}, durationMs={}, preview='{}'",
                question.questionId(), modelClient.name(), grounding, storyIds,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), LogSanitizer.preview(answer, 60));
        return AnswerRecord.generated(question.questionId(), question.text(), answer.strip(), grounding, storyIds);
    }

    /** Bridges a cancellable worker task to the handle's result future. */
    private static final class GenerationTask extends FutureTask<AnswerRecord> {
        private final CompletableFuture<AnswerRecord> result;

        GenerationTask(Callable<AnswerRecord> callable, CompletableFuture<AnswerRecord> result) {
            super(callable);
            this.result = result;
        }

        @Override
        protected void done() {
            if (isCancelled()) {
                result.cancel(false);
                return;
            }
            try {
                result.complete(get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof GenerationFailureException gfe) {
                    result.completeExceptionally(gfe);
                } else {
                    result.completeExceptionally(new GenerationFailureException("Answer generation failed", cause));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.cancel(false);
            }
        }
    }
}
