package com.phillippitts.voicetutor.service.resilience;

import com.phillippitts.voicetutor.exception.BackendException;
import com.phillippitts.voicetutor.exception.BackendTimeoutException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {

    @Test
    void treatsRateLimitAndServerErrorsAsDistress() {
        assertThat(FailureClassifier.isDistress(new BackendException("slow down", 429))).isTrue();
        assertThat(FailureClassifier.isDistress(new BackendException("unavailable", 503))).isTrue();
        assertThat(FailureClassifier.isDistress(new BackendException("bad request", 400))).isFalse();
    }

    @Test
    void findsDistressStatusInCauseChain() {
        RuntimeException wrapped = new RuntimeException("wrapper",
                new BackendException("upstream", 502));

        assertThat(FailureClassifier.isDistress(wrapped)).isTrue();
    }

    @Test
    void recognizesDistressMessages() {
        assertThat(FailureClassifier.isDistress(new RuntimeException("Quota exceeded for project"))).isTrue();
        assertThat(FailureClassifier.isDistress(new RuntimeException("Rate limit reached"))).isTrue();
        assertThat(FailureClassifier.isDistress(new RuntimeException("HTTP 429"))).isTrue();
        assertThat(FailureClassifier.isDistress(new RuntimeException("parse error"))).isFalse();
        assertThat(FailureClassifier.isDistress(null)).isFalse();
    }

    @Test
    void recognizesTimeouts() {
        assertThat(FailureClassifier.isTimeout(new BackendTimeoutException(3000))).isTrue();
        assertThat(FailureClassifier.isTimeout(new RuntimeException(new TimeoutException()))).isTrue();
        assertThat(FailureClassifier.isTimeout(new IllegalStateException("boom"))).isFalse();
    }

    @Test
    void distressStatusRange() {
        assertThat(FailureClassifier.isDistressStatus(429)).isTrue();
        assertThat(FailureClassifier.isDistressStatus(500)).isTrue();
        assertThat(FailureClassifier.isDistressStatus(599)).isTrue();
        assertThat(FailureClassifier.isDistressStatus(404)).isFalse();
        assertThat(FailureClassifier.isDistressStatus(null)).isFalse();
    }
}
