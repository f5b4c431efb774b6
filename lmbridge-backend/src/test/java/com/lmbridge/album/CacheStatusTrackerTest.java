package com.lmbridge.album;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CacheStatusTracker")
class CacheStatusTrackerTest {

    private final CacheStatusTracker tracker = new CacheStatusTracker();

    @Test
    @DisplayName("reports hit, miss or mixed")
    void status() {
        assertThat(tracker.getStatus()).isNull();

        tracker.record(true);
        tracker.record(true);
        assertThat(tracker.getStatus()).isEqualTo("hit");

        tracker.record(false);
        assertThat(tracker.getStatus()).isEqualTo("mixed");

        tracker.reset();
        tracker.record(false);
        assertThat(tracker.getStatus()).isEqualTo("miss");
        tracker.reset();
    }
}
