package com.phillippitts.interviewcopilot.service.transcript;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AudioSequenceMonitorTest {

    private final AudioSequenceMonitor monitor = new AudioSequenceMonitor("s-1");

    @Test
    void firstFrameSetsBaseline() {
        AudioSequenceMonitor.Observation obs = monitor.observe(42);

        assertThat(obs.accept()).isTrue();
        assertThat(obs.gap()).isEmpty();
        assertThat(monitor.observe(43).gap()).isEmpty();
    }

    @Test
    void skippedSequencesAreAcceptedAndReported() {
        monitor.observe(0);
        monitor.observe(1);

        AudioSequenceMonitor.Observation obs = monitor.observe(5);

        assertThat(obs.accept()).isTrue();
        assertThat(obs.gap()).hasValueSatisfying(gap -> {
            assertThat(gap.kind()).isEqualTo(RecognitionGapEvent.Kind.GAP);
            assertThat(gap.expectedSequence()).isEqualTo(2);
            assertThat(gap.receivedSequence()).isEqualTo(5);
            assertThat(gap.sessionId()).isEqualTo("s-1");
        });
        assertThat(monitor.observe(6).gap()).isEmpty();
    }

    @Test
    void staleFramesAreRejectedWithoutMovingExpectation() {
        monitor.observe(10);
        monitor.observe(11);

        AudioSequenceMonitor.Observation stale = monitor.observe(3);

        assertThat(stale.accept()).isFalse();
        assertThat(stale.gap()).hasValueSatisfying(gap ->
                assertThat(gap.kind()).isEqualTo(RecognitionGapEvent.Kind.OUT_OF_ORDER));
        assertThat(monitor.observe(12).accept()).isTrue();
    }

    @Test
    void duplicateFrameIsStale() {
        monitor.observe(0);

        assertThat(monitor.observe(0).accept()).isFalse();
    }

    @Test
    void resetStartsNewRun() {
        monitor.observe(100);
        monitor.reset();

        AudioSequenceMonitor.Observation obs = monitor.observe(0);

        assertThat(obs.accept()).isTrue();
        assertThat(obs.gap()).isEmpty();
    }
}
