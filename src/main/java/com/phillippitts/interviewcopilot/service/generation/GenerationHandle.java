package com.phillippitts.interviewcopilot.service.generation;

import com.phillippitts.interviewcopilot.domain.AnswerRecord;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * In-flight answer generation.
 *
 * <p>{@link #result()} completes with the record, or exceptionally with a
 * {@link com.phillippitts.interviewcopilot.exception.GenerationFailureException}
 * (including the timeout variant). {@link #cancel()} interrupts the worker and cancels the
 * result; a cancelled generation never completes normally.
 */
public final class GenerationHandle {

    private final String questionId;
    private final CompletableFuture<AnswerRecord> result;
    private final Future<?> task;

    GenerationHandle(String questionId, CompletableFuture<AnswerRecord> result, Future<?> task) {
        this.questionId = questionId;
        this.result = result;
        this.task = task;
    }

    public String questionId() {
        return questionId;
    }

    public CompletableFuture<AnswerRecord> result() {
        return result;
    }

    /** @return true if this call cancelled a generation that had not completed yet */
    public boolean cancel() {
        boolean cancelled = result.cancel(false);
        task.cancel(true);
        return cancelled;
    }

    public boolean isDone() {
        return result.isDone();
    }
}
