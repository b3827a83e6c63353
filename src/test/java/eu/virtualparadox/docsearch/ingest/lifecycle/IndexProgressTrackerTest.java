package eu.virtualparadox.docsearch.ingest.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IndexProgressTrackerTest {

    private final IndexProgressTracker tracker = new IndexProgressTracker();

    @Test
    void testProgressAcrossDocuments() {
        final List<ProgressStatus> events = new ArrayList<>();
        tracker.setProgressCallback(events::add);
        tracker.start(List.of(4, 0, 6));

        tracker.step(2);
        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(20, 50, 2, 10));

        // crosses into the next document
        tracker.step(4);
        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(60, 33, 6, 10));

        tracker.step(4);
        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(100, 100, 10, 10));
        assertThat(events).hasSize(3);
    }

    @Test
    void testFinishDropsUnprocessedChunks() {
        tracker.start(List.of(10));
        tracker.step(3);
        tracker.finish();

        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(100, 100, 3, 3));
    }

    @Test
    void testEmptyRunIsComplete() {
        tracker.start(List.of());

        assertThat(tracker.getProgressStatus().totalPercent()).isEqualTo(100);
    }
}
