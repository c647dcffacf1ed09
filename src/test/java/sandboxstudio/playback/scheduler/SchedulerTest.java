package sandboxstudio.playback.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import sandboxstudio.playback.BaseIntegrationTest;
import sandboxstudio.playback.domain.CountyUpdate;
import sandboxstudio.playback.domain.Frame;
import sandboxstudio.playback.domain.PlaybackStatus;
import sandboxstudio.playback.engine.PlaybackEngine;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@DisplayName("Scheduler Integration Tests")
class SchedulerTest extends BaseIntegrationTest {

    @Autowired
    private SnapshotBroadcastScheduler snapshotBroadcastScheduler;

    private PlaybackEngine engine;

    @BeforeEach
    void setUp() {
        engine = simulationService.loadScenario(sampleScenario());
    }

    @Nested
    @DisplayName("SnapshotBroadcastScheduler")
    class SnapshotBroadcastTests {

        @Test
        @DisplayName("Should clear the dirty flag after broadcasting")
        void shouldClearDirtyFlag() {
            // Given
            engine.seekToTime(20);

            // When
            snapshotBroadcastScheduler.broadcastSnapshots();

            // Then
            assertThat(engine.isDirtyAndClear()).isFalse();
        }

        @Test
        @DisplayName("Should drain newsroom events on the scheduled run")
        void shouldDrainNewsroomEvents() {
            // Given
            engine.ingest(Frame.of(10, CountyUpdate.of("01001", 40, 60, 100, 100)));

            // When
            engine.seekToTime(10);

            // Then
            await().atMost(Duration.ofSeconds(5)).until(() -> engine.drainNewEvents().isEmpty()
                    && !engine.getNewsroomEvents().isEmpty());
        }

        @Test
        @DisplayName("Should handle broadcast with no scenario loaded")
        void shouldHandleNoScenario() {
            // Given
            simulationService.reset();

            // When/Then - should not throw
            snapshotBroadcastScheduler.broadcastSnapshots();
        }
    }

    @Nested
    @DisplayName("Manual ticking")
    class ManualTicking {

        @Test
        @DisplayName("Should advance a running scenario when ticked")
        void shouldAdvanceWhenTicked() {
            // Given
            engine.setSpeed(1000);
            engine.play();

            // When/Then
            await().atMost(Duration.ofSeconds(5)).until(() -> {
                simulationService.tick();
                return engine.status() == PlaybackStatus.COMPLETED;
            });
            assertThat(engine.cursor()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Should ignore ticks after reset")
        void shouldIgnoreTicksAfterReset() {
            // Given
            engine.play();
            simulationService.reset();

            // When
            simulationService.tick();

            // Then
            assertThat(engine.isDisposed()).isTrue();
            assertThat(simulationService.currentEngine()).isEmpty();
        }
    }
}
