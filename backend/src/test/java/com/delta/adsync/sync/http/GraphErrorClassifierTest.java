package com.delta.adsync.sync.http;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GraphErrorClassifierTest {

    @Test
    void errorCodeWinsOverHttpStatus() {
        assertThat(GraphErrorClassifier.classify(400, 17, null)).isEqualTo(GraphErrorCategory.RATE_LIMIT);
        assertThat(GraphErrorClassifier.classify(403, 4, null)).isEqualTo(GraphErrorCategory.RATE_LIMIT);
        assertThat(GraphErrorClassifier.classify(400, 80004, null)).isEqualTo(GraphErrorCategory.RATE_LIMIT);
        assertThat(GraphErrorClassifier.classify(400, 190, 463)).isEqualTo(GraphErrorCategory.AUTH);
        assertThat(GraphErrorClassifier.classify(400, 200, null)).isEqualTo(GraphErrorCategory.PERMISSION);
        assertThat(GraphErrorClassifier.classify(400, 100, 33)).isEqualTo(GraphErrorCategory.NOT_FOUND);
        assertThat(GraphErrorClassifier.classify(500, 2, null)).isEqualTo(GraphErrorCategory.TRANSIENT);
    }

    @Test
    void fallsBackToHttpStatus() {
        assertThat(GraphErrorClassifier.classify(429, null, null)).isEqualTo(GraphErrorCategory.RATE_LIMIT);
        assertThat(GraphErrorClassifier.classify(401, null, null)).isEqualTo(GraphErrorCategory.AUTH);
        assertThat(GraphErrorClassifier.classify(503, null, null)).isEqualTo(GraphErrorCategory.TRANSIENT);
        assertThat(GraphErrorClassifier.classify(400, 100, null)).isEqualTo(GraphErrorCategory.INVALID_REQUEST);
        assertThat(GraphErrorClassifier.fromHttpStatus(0)).isEqualTo(GraphErrorCategory.TRANSIENT);
    }

    @Test
    void onlyRevokedSubcodesArePermanent() {
        assertThat(GraphErrorClassifier.isPermanentlyInvalidToken(190, 460)).isTrue();
        assertThat(GraphErrorClassifier.isPermanentlyInvalidToken(190, null)).isFalse();
        assertThat(GraphErrorClassifier.isPermanentlyInvalidToken(17, 460)).isFalse();
    }
}
