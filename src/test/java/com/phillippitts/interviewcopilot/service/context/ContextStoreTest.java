package com.phillippitts.interviewcopilot.service.context;

import com.phillippitts.interviewcopilot.domain.ContextPayload;
import com.phillippitts.interviewcopilot.testutil.TestProfiles;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContextStoreTest {

    @Test
    void startsEmptyAtVersionZero() {
        ContextStore.Baseline baseline = new ContextStore().snapshot();

        assertThat(baseline.version()).isZero();
        assertThat(baseline.payload()).isEqualTo(ContextPayload.EMPTY);
    }

    @Test
    void replaceInstallsNewBaselineWithoutTouchingCapturedOne() {
        ContextStore store = new ContextStore();
        ContextStore.Baseline first = store.replace(TestProfiles.stories());

        ContextStore.Baseline second = store.replace(TestProfiles.profileOnly());

        assertThat(second.version()).isGreaterThan(first.version());
        assertThat(first.payload()).isEqualTo(TestProfiles.stories());
        assertThat(store.snapshot()).isEqualTo(second);
    }

    @Test
    void clearReturnsToEmptyWithHigherVersion() {
        ContextStore store = new ContextStore();
        ContextStore.Baseline loaded = store.replace(TestProfiles.stories());

        ContextStore.Baseline cleared = store.clear();

        assertThat(cleared.version()).isGreaterThan(loaded.version());
        assertThat(cleared.payload()).isEqualTo(ContextPayload.EMPTY);
    }
}
