package com.phillippitts.interviewcopilot.service.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.interviewcopilot.config.properties.GenerationProperties;
import com.phillippitts.interviewcopilot.config.properties.RecognizerProperties;
import com.phillippitts.interviewcopilot.config.properties.SessionProperties;
import com.phillippitts.interviewcopilot.domain.AudioChunk;
import com.phillippitts.interviewcopilot.domain.ContextPayload;
import com.phillippitts.interviewcopilot.domain.Grounding;
import com.phillippitts.interviewcopilot.domain.QaPair;
import com.phillippitts.interviewcopilot.domain.StarStory;
import com.phillippitts.interviewcopilot.exception.SessionLimitExceededException;
import com.phillippitts.interviewcopilot.protocol.AudioFrameCodec;
import com.phillippitts.interviewcopilot.protocol.EnvelopeCodec;
import com.phillippitts.interviewcopilot.protocol.MessageType;
import com.phillippitts.interviewcopilot.protocol.Payloads;
import com.phillippitts.interviewcopilot.service.detection.HeuristicQuestionBoundaryDetector;
import com.phillippitts.interviewcopilot.service.detection.QuestionBoundaryDetector;
import com.phillippitts.interviewcopilot.service.events.GenerationFailedEvent;
import com.phillippitts.interviewcopilot.service.generation.AnswerGenerator;
import com.phillippitts.interviewcopilot.service.generation.AnswerModelClient;
import com.phillippitts.interviewcopilot.service.generation.AnswerPrompt;
import com.phillippitts.interviewcopilot.service.generation.PromptBuilder;
import com.phillippitts.interviewcopilot.service.generation.QaPairMatcher;
import com.phillippitts.interviewcopilot.service.generation.StorySelector;
import com.phillippitts.interviewcopilot.service.generation.TemplateAnswerModelClient;
import com.phillippitts.interviewcopilot.service.metrics.SessionMetrics;
import com.phillippitts.interviewcopilot.service.transcript.RecognitionGapEvent;
import com.phillippitts.interviewcopilot.testutil.EventCapturingPublisher;
import com.phillippitts.interviewcopilot.testutil.FakeSpeechRecognizer;
import com.phillippitts.interviewcopilot.testutil.RecordingSessionSink;
import com.phillippitts.interviewcopilot.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionPipelineTest {

    private static final String CONFLICT_QUESTION = "Tell me about a time you handled conflict on a team";

    private final EnvelopeCodec codec = new EnvelopeCodec(new ObjectMapper());
    private final FakeSpeechRecognizer recognizer = new FakeSpeechRecognizer();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final RecordingSessionSink sink = new RecordingSessionSink();

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(SessionProperties.defaults());
    }

    @Test
    void detectsQuestionAtBoundaryAndDeliversStoryGroundedAnswer() {
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor());
        LiveSession session = pipeline.open("s-1", "alice", sink);

        pipeline.onTextMessage(session, codec.encode(MessageType.CONTEXT, profile()));
        pipeline.onAudioFrame(session, frame(0, "Tell me about a time"));
        pipeline.onAudioFrame(session, frame(1, "you handled conflict on a team"));
        pipeline.onTextMessage(session, codec.encode(MessageType.FINALIZE, null));

        assertThat(sink.types()).containsExactly(
                MessageType.STATUS,             // connected
                MessageType.STATUS,             // context_ack
                MessageType.TRANSCRIPTION,
                MessageType.TRANSCRIPTION,
                MessageType.STATUS,             // detecting
                MessageType.QUESTION_DETECTED,
                MessageType.ANSWER_CHUNK,       // one per STAR line
                MessageType.ANSWER_CHUNK,
                MessageType.ANSWER_CHUNK,
                MessageType.ANSWER_CHUNK,
                MessageType.ANSWER);

        List<Payloads.Status> statuses = sink.payloads(MessageType.STATUS, Payloads.Status.class);
        assertThat(statuses).extracting(Payloads.Status::state)
                .containsExactly("connected", "context_ack", "detecting");
        assertThat(statuses.get(0).detail()).isEqualTo("s-1");

        List<Payloads.Transcription> transcripts = sink.payloads(MessageType.TRANSCRIPTION, Payloads.Transcription.class);
        assertThat(transcripts.get(1).accumulatedText()).isEqualTo(CONFLICT_QUESTION);
        assertThat(transcripts.get(1).isFinal()).isTrue();

        Payloads.QuestionDetected question = sink.payloads(MessageType.QUESTION_DETECTED, Payloads.QuestionDetected.class).get(0);
        assertThat(question.question()).isEqualTo(CONFLICT_QUESTION);
        assertThat(question.questionType()).isEqualTo("behavioral");

        Payloads.Answer answer = sink.payloads(MessageType.ANSWER, Payloads.Answer.class).get(0);
        assertThat(answer.questionId()).isEqualTo(question.questionId());
        assertThat(answer.grounded()).isTrue();
        assertThat(answer.grounding()).isEqualTo("STORIES");
        assertThat(answer.storyIds()).containsExactly("s1");
        assertThat(answer.source()).isEqualTo("generated");

        assertThat(session.transcript().state().accumulatedText()).isEmpty();
        assertThat(session.answers()).hasSize(1);
        assertThat(meters.get("copilot.session.answers").tag("grounding", "stories").counter().count()).isEqualTo(1.0);
    }

    @Test
    void answerChunksPrecedeAnswerAndSpellItOut() {
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor());
        LiveSession session = pipeline.open("s-1", "alice", sink);
        pipeline.onTextMessage(session, codec.encode(MessageType.CONTEXT, profile()));

        pipeline.onTextMessage(session, codec.encode(MessageType.REQUEST_ANSWER,
                new Payloads.RequestAnswer(CONFLICT_QUESTION, "behavioral")));

        Payloads.Answer answer = sink.payloads(MessageType.ANSWER, Payloads.Answer.class).get(0);
        List<Payloads.AnswerChunk> chunks = sink.payloads(MessageType.ANSWER_CHUNK, Payloads.AnswerChunk.class);
        assertThat(chunks).extracting(Payloads.AnswerChunk::index).containsExactly(0, 1, 2, 3);
        assertThat(chunks).extracting(Payloads.AnswerChunk::questionId).containsOnly(answer.questionId());
        assertThat(chunks.get(0).delta()).startsWith("Situation: Two senior engineers");
        assertThat(chunks.stream().map(Payloads.AnswerChunk::delta).reduce("", String::concat))
                .isEqualTo(answer.answer());
        assertThat(sink.types().get(sink.types().size() - 1)).isEqualTo(MessageType.ANSWER);
    }

    @Test
    void preparedAnswerIsDeliveredWithoutChunks() {
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor());
        LiveSession session = pipeline.open("s-1", "alice", sink);
        pipeline.onTextMessage(session, codec.encode(MessageType.CONTEXT, new ContextPayload("", List.of(), List.of(),
                List.of(new QaPair("Why do you want this job?", "Because the mission fits.")))));

        pipeline.onTextMessage(session, codec.encode(MessageType.REQUEST_ANSWER,
                new Payloads.RequestAnswer("Why do you want this job?", null)));

        assertThat(sink.types()).doesNotContain(MessageType.ANSWER_CHUNK);
        assertThat(sink.payloads(MessageType.ANSWER, Payloads.Answer.class).get(0).source()).isEqualTo("uploaded");
    }

    @Test
    void requestAnswerAppendsNewRecordForSameQuestion() {
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor());
        LiveSession session = pipeline.open("s-1", "alice", sink);
        pipeline.onTextMessage(session, codec.encode(MessageType.CONTEXT, profile()));

        pipeline.onTextMessage(session, codec.encode(MessageType.REQUEST_ANSWER,
                new Payloads.RequestAnswer(CONFLICT_QUESTION, null)));
        pipeline.onTextMessage(session, codec.encode(MessageType.REQUEST_ANSWER,
                new Payloads.RequestAnswer(CONFLICT_QUESTION, "behavioral")));

        List<Payloads.Answer> answers = sink.payloads(MessageType.ANSWER, Payloads.Answer.class);
        assertThat(answers).hasSize(2);
        assertThat(answers.get(0).answerId()).isNotEqualTo(answers.get(1).answerId());
        assertThat(session.answers()).hasSize(2);
        // Newest first
        assertThat(session.answers().get(0).answerId()).isEqualTo(answers.get(1).answerId());
        assertThat(sink.payloads(MessageType.QUESTION_DETECTED, Payloads.QuestionDetected.class))
                .extracting(Payloads.QuestionDetected::questionType)
                .containsExactly("behavioral", "behavioral");
    }

    @Test
    void repeatedEmptyFinalizeReturnsToIdleWithoutQuestion() {
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor());
        LiveSession session = pipeline.open("s-1", "alice", sink);
        sink.clear();

        pipeline.onTextMessage(session, codec.encode(MessageType.FINALIZE, null));
        pipeline.onTextMessage(session, codec.encode(MessageType.FINALIZE, null));

        assertThat(sink.payloads(MessageType.STATUS, Payloads.Status.class))
                .extracting(Payloads.Status::state)
                .containsExactly("detecting", "idle", "detecting", "idle");
        assertThat(sink.types()).doesNotContain(MessageType.QUESTION_DETECTED, MessageType.ANSWER);
        assertThat(session.answers()).isEmpty();
    }

    @Test
    void finalizeConfirmsPendingPartialBeforeDetection() {
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor());
        LiveSession session = pipeline.open("s-1", "alice", sink);

        pipeline.onAudioFrame(session, frame(0, "~how would you design a rate limiter"));
        assertThat(session.transcript().state().currentSegment()).isEqualTo("how would you design a rate limiter");
        pipeline.onTextMessage(session, codec.encode(MessageType.FINALIZE, null));

        Payloads.QuestionDetected question = sink.payloads(MessageType.QUESTION_DETECTED, Payloads.QuestionDetected.class).get(0);
        assertThat(question.question()).isEqualTo("how would you design a rate limiter");
        assertThat(question.questionType()).isEqualTo("technical");
    }

    @Test
    void clearCancelsAndResetsSessionState() {
        ManualExecutor generation = new ManualExecutor();
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), generation);
        LiveSession session = pipeline.open("s-1", "alice", sink);
        pipeline.onTextMessage(session, codec.encode(MessageType.CONTEXT, profile()));
        pipeline.onAudioFrame(session, frame(0, "partial words"));
        pipeline.onTextMessage(session, codec.encode(MessageType.REQUEST_ANSWER,
                new Payloads.RequestAnswer(CONFLICT_QUESTION, null)));
        assertThat(session.inFlightGenerations()).isEqualTo(1);

        pipeline.onTextMessage(session, codec.encode(MessageType.CLEAR, null));
        generation.runAll();

        assertThat(session.inFlightGenerations()).isZero();
        assertThat(session.transcript().state().accumulatedText()).isEmpty();
        assertThat(session.context().snapshot().payload()).isEqualTo(ContextPayload.EMPTY);
        assertThat(session.answers()).isEmpty();
        assertThat(sink.types()).doesNotContain(MessageType.ANSWER);
        List<Payloads.Status> statuses = sink.payloads(MessageType.STATUS, Payloads.Status.class);
        assertThat(statuses.get(statuses.size() - 1).state()).isEqualTo("cleared");
    }

    @Test
    void generationUsesContextCapturedAtDispatch() {
        ManualExecutor generation = new ManualExecutor();
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), generation);
        LiveSession session = pipeline.open("s-1", "alice", sink);

        pipeline.onTextMessage(session, codec.encode(MessageType.REQUEST_ANSWER,
                new Payloads.RequestAnswer(CONFLICT_QUESTION, null)));
        // Context arrives while the generation is still queued
        pipeline.onTextMessage(session, codec.encode(MessageType.CONTEXT, profile()));
        generation.runAll();

        Payloads.Answer answer = sink.payloads(MessageType.ANSWER, Payloads.Answer.class).get(0);
        assertThat(answer.grounding()).isEqualTo(Grounding.NONE.name());
        assertThat(answer.grounded()).isFalse();
    }

    @Test
    void closeCancelsInFlightGenerationAndReleasesRecognizer() {
        ManualExecutor generation = new ManualExecutor();
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), generation);
        LiveSession session = pipeline.open("s-1", "alice", sink);
        pipeline.onTextMessage(session, codec.encode(MessageType.REQUEST_ANSWER,
                new Payloads.RequestAnswer(CONFLICT_QUESTION, null)));

        pipeline.close(session, "test");
        generation.runAll();
        pipeline.close(session, "again");

        assertThat(session.isClosed()).isTrue();
        assertThat(session.inFlightGenerations()).isZero();
        assertThat(sink.types()).doesNotContain(MessageType.ANSWER);
        assertThat(recognizer.streams.get(0).closed).isTrue();
        assertThat(registry.size()).isZero();
        assertThat(meters.get("copilot.session.closed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void staleFrameIsDroppedAndGapIsReported() {
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor());
        LiveSession session = pipeline.open("s-1", "alice", sink);

        pipeline.onAudioFrame(session, frame(0, "one"));
        pipeline.onAudioFrame(session, frame(3, "two"));
        pipeline.onAudioFrame(session, frame(1, "late"));

        assertThat(recognizer.streams.get(0).accepted).isEqualTo(2);
        assertThat(session.transcript().state().accumulatedText()).isEqualTo("one two");
        assertThat(sink.payloads(MessageType.STATUS, Payloads.Status.class))
                .filteredOn(s -> "degraded".equals(s.state()))
                .extracting(Payloads.Status::detail)
                .containsExactly("gap: expected 1, received 3", "out_of_order: expected 4, received 1");
        assertThat(publisher.ofType(RecognitionGapEvent.class))
                .extracting(RecognitionGapEvent::kind)
                .containsExactly(RecognitionGapEvent.Kind.GAP, RecognitionGapEvent.Kind.OUT_OF_ORDER);
    }

    @Test
    void rejectsMalformedFramesAndMessages() {
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor());
        LiveSession session = pipeline.open("s-1", "alice", sink);

        pipeline.onAudioFrame(session, ByteBuffer.wrap(new byte[5]));
        pipeline.onAudioFrame(session, AudioFrameCodec.encode(
                new AudioChunk(0, System.currentTimeMillis(), 8000, new byte[4])));
        pipeline.onTextMessage(session, "{not json");
        pipeline.onTextMessage(session, codec.encode(MessageType.ANSWER, null));
        pipeline.onTextMessage(session, codec.encode(MessageType.REQUEST_ANSWER,
                new Payloads.RequestAnswer("  ", null)));

        assertThat(sink.payloads(MessageType.ERROR, Payloads.ErrorInfo.class))
                .extracting(Payloads.ErrorInfo::code)
                .containsExactly("INVALID_AUDIO", "INVALID_AUDIO", "PROTOCOL_ERROR", "PROTOCOL_ERROR", "PROTOCOL_ERROR");
        assertThat(session.isClosed()).isFalse();
    }

    @Test
    void modelFailureSurfacesAsGenerationFailedWithQuestionId() {
        AnswerModelClient failing = new AnswerModelClient() {
            @Override
            public String complete(AnswerPrompt prompt) {
                throw new IllegalStateException("model down");
            }

            @Override
            public String name() {
                return "failing";
            }
        };
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor(), failing);
        LiveSession session = pipeline.open("s-1", "alice", sink);

        pipeline.onTextMessage(session, codec.encode(MessageType.REQUEST_ANSWER,
                new Payloads.RequestAnswer(CONFLICT_QUESTION, null)));

        String questionId = sink.payloads(MessageType.QUESTION_DETECTED, Payloads.QuestionDetected.class).get(0).questionId();
        Payloads.ErrorInfo error = sink.payloads(MessageType.ERROR, Payloads.ErrorInfo.class).get(0);
        assertThat(error.code()).isEqualTo("GENERATION_FAILED");
        assertThat(error.questionId()).isEqualTo(questionId);
        assertThat(publisher.ofType(GenerationFailedEvent.class)).hasSize(1);
        assertThat(session.answers()).isEmpty();
    }

    @Test
    void detectorFailureRestoresTranscript() {
        QuestionBoundaryDetector broken = snapshot -> {
            throw new IllegalStateException("detector bug");
        };
        SessionPipeline pipeline = pipeline(broken, new SyncExecutor());
        LiveSession session = pipeline.open("s-1", "alice", sink);

        pipeline.onAudioFrame(session, frame(0, "what is your biggest strength"));
        pipeline.onTextMessage(session, codec.encode(MessageType.FINALIZE, null));

        assertThat(session.transcript().isBoundaryPending()).isFalse();
        assertThat(session.transcript().state().accumulatedText()).isEqualTo("what is your biggest strength");
        assertThat(sink.payloads(MessageType.ERROR, Payloads.ErrorInfo.class))
                .extracting(Payloads.ErrorInfo::code)
                .containsExactly("INTERNAL_ERROR");
    }

    @Test
    void configLanguageReopensRecognizerStream() {
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor());
        LiveSession session = pipeline.open("s-1", "alice", sink);
        pipeline.onAudioFrame(session, frame(0, "~tell me about"));

        pipeline.onTextMessage(session, codec.encode(MessageType.CONFIG, new Payloads.Config("DE")));

        assertThat(session.language()).contains("de");
        assertThat(recognizer.streams).hasSize(2);
        assertThat(recognizer.streams.get(0).closed).isTrue();
        assertThat(recognizer.streams.get(0).language).isNull();
        assertThat(recognizer.streams.get(1).language).isEqualTo("de");
        // The pending partial from the old stream is kept as confirmed text
        assertThat(session.transcript().state().accumulatedText()).isEqualTo("tell me about");
        Payloads.Status ack = sink.payloads(MessageType.STATUS, Payloads.Status.class).get(1);
        assertThat(ack.state()).isEqualTo("config_ack");
        assertThat(ack.detail()).isEqualTo("de");

        pipeline.onTextMessage(session, codec.encode(MessageType.CONFIG, new Payloads.Config("de")));
        assertThat(recognizer.streams).hasSize(2);
    }

    @Test
    void unsupportedLanguageKeepsCurrentStream() {
        recognizer.unsupportedLanguages.add("xx");
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor());
        LiveSession session = pipeline.open("s-1", "alice", sink);

        pipeline.onTextMessage(session, codec.encode(MessageType.CONFIG, new Payloads.Config("xx")));

        assertThat(session.language()).isEmpty();
        assertThat(recognizer.streams).hasSize(1);
        assertThat(recognizer.streams.get(0).closed).isFalse();
        assertThat(sink.payloads(MessageType.ERROR, Payloads.ErrorInfo.class))
                .extracting(Payloads.ErrorInfo::code)
                .containsExactly("INTERNAL_ERROR");
    }

    @Test
    void sessionLimitRejectsAndReleasesRecognizer() {
        registry = new SessionRegistry(new SessionProperties("/ws/session", "*", 1, false));
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor());
        pipeline.open("s-1", "alice", sink);

        assertThatThrownBy(() -> pipeline.open("s-2", "bob", new RecordingSessionSink()))
                .isInstanceOf(SessionLimitExceededException.class);
        assertThat(recognizer.streams.get(1).closed).isTrue();
        assertThat(registry.find("s-2")).isEmpty();
    }

    @Test
    void eventsAreNotSentOnceSinkIsClosed() {
        SessionPipeline pipeline = pipeline(new HeuristicQuestionBoundaryDetector(), new SyncExecutor());
        LiveSession session = pipeline.open("s-1", "alice", sink);
        sink.open = false;

        pipeline.onTextMessage(session, codec.encode(MessageType.FINALIZE, null));

        assertThat(sink.frames()).hasSize(1);
    }

    // --- helpers ---

    private SessionPipeline pipeline(QuestionBoundaryDetector detector, Executor generationExecutor) {
        return pipeline(detector, generationExecutor, new TemplateAnswerModelClient());
    }

    private SessionPipeline pipeline(QuestionBoundaryDetector detector, Executor generationExecutor,
                                     AnswerModelClient model) {
        AnswerGenerator generator = new AnswerGenerator(new StorySelector(), new QaPairMatcher(),
                new PromptBuilder(), model, GenerationProperties.defaults(), generationExecutor);
        return new SessionPipeline(recognizer, detector, generator, codec, registry,
                new SessionMetrics(meters), publisher, RecognizerProperties.defaults(), new SyncExecutor());
    }

    private static ByteBuffer frame(long sequence, String text) {
        return AudioFrameCodec.encode(new AudioChunk(sequence, System.currentTimeMillis(),
                16_000, FakeSpeechRecognizer.pcm(text)));
    }

    private static ContextPayload profile() {
        StarStory conflict = new StarStory("s1", "Resolved a team conflict over the release process",
                "Two senior engineers disagreed on trunk-based development.",
                "I had to reach a decision before the next quarter.",
                "I ran a two-week experiment and shared the metrics with both.",
                "Lead time dropped by 40% and both agreed to roll it out.",
                List.of("conflict", "leadership"));
        StarStory scaling = new StarStory("s2", "Scaled the ledger service",
                "Month-end load caused timeouts.", "Remove the bottleneck.",
                "I partitioned the write path.", "p99 latency fell to 180ms.",
                List.of("scalability", "performance"));
        return new ContextPayload("Senior backend engineer.", List.of(conflict, scaling), List.of(), List.of());
    }

    /** Holds tasks until the test decides to run them. */
    private static final class ManualExecutor implements Executor {
        private final List<Runnable> tasks = new ArrayList<>();

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        void runAll() {
            List<Runnable> pending = new ArrayList<>(tasks);
            tasks.clear();
            pending.forEach(Runnable::run);
        }
    }
}
