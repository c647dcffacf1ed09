package sandboxstudio.playback.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import sandboxstudio.playback.domain.PlaybackStatus;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimelineController Unit Tests")
class TimelineControllerTest {

    private AtomicLong nanos;
    private List<Double> derivations;
    private TimelineController timeline;

    @BeforeEach
    void setUp() {
        nanos = new AtomicLong(TimeUnit.SECONDS.toNanos(1_000));
        derivations = new CopyOnWriteArrayList<>();
        timeline = new TimelineController(100, nanos::get, derivations::add);
    }

    private void advanceWallClock(double seconds) {
        nanos.addAndGet((long) (seconds * TimeUnit.SECONDS.toNanos(1)));
    }

    private static void awaitRelease(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Derivation was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Nested
    @DisplayName("Ticking")
    class Ticking {

        @Test
        @DisplayName("Should advance the cursor by speed times wall-clock delta")
        void shouldAdvanceBySpeed() {
            // Given
            timeline.setSpeed(4);
            timeline.play();

            // When
            advanceWallClock(2.5);
            boolean moved = timeline.tick();

            // Then
            assertThat(moved).isTrue();
            assertThat(timeline.cursor()).isEqualTo(10.0);
            assertThat(derivations).containsExactly(10.0);
        }

        @Test
        @DisplayName("Should not move while paused")
        void shouldNotMoveWhilePaused() {
            // Given
            timeline.play();
            advanceWallClock(1);
            timeline.tick();
            timeline.pause();

            // When
            advanceWallClock(5);
            boolean moved = timeline.tick();

            // Then
            assertThat(moved).isFalse();
            assertThat(timeline.cursor()).isEqualTo(1.0);
            assertThat(timeline.status()).isEqualTo(PlaybackStatus.PAUSED);
        }

        @Test
        @DisplayName("Should complete at the end of the scenario")
        void shouldCompleteAtEnd() {
            // Given
            timeline.setSpeed(10);
            timeline.play();

            // When
            advanceWallClock(60);
            timeline.tick();

            // Then
            assertThat(timeline.cursor()).isEqualTo(100.0);
            assertThat(timeline.status()).isEqualTo(PlaybackStatus.COMPLETED);
            assertThat(timeline.progressPercent()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Should restart from zero when played after completion")
        void shouldRestartAfterCompletion() {
            // Given
            timeline.seekToTime(100);
            timeline.play();
            advanceWallClock(1);
            timeline.tick();
            assertThat(timeline.status()).isEqualTo(PlaybackStatus.COMPLETED);

            // When
            timeline.play();

            // Then
            assertThat(timeline.cursor()).isZero();
            assertThat(timeline.status()).isEqualTo(PlaybackStatus.RUNNING);
        }
    }

    @Nested
    @DisplayName("Seeking")
    class Seeking {

        @Test
        @DisplayName("Should clamp seek targets to the scenario duration")
        void shouldClampSeek() {
            timeline.seekToTime(500);
            assertThat(timeline.cursor()).isEqualTo(100.0);

            timeline.seekToTime(-20);
            assertThat(timeline.cursor()).isZero();
        }

        @Test
        @DisplayName("Should seek to a percentage of the duration")
        void shouldSeekToPercent() {
            timeline.seekToPercent(25);

            assertThat(timeline.cursor()).isEqualTo(25.0);
            assertThat(derivations).containsExactly(25.0);
        }

        @Test
        @DisplayName("Should keep running after a seek while running")
        void shouldKeepRunningAfterSeek() {
            // Given
            timeline.play();
            advanceWallClock(3);

            // When
            timeline.seekToTime(50);
            advanceWallClock(1);
            timeline.tick();

            // Then
            assertThat(timeline.status()).isEqualTo(PlaybackStatus.RUNNING);
            assertThat(timeline.cursor()).isEqualTo(51.0);
        }

        @Test
        @DisplayName("Should pause when seeking back from completed")
        void shouldPauseWhenSeekingBackFromCompleted() {
            // Given
            timeline.play();
            timeline.seekToTime(100);
            assertThat(timeline.status()).isEqualTo(PlaybackStatus.COMPLETED);

            // When
            timeline.seekToTime(40);

            // Then
            assertThat(timeline.status()).isEqualTo(PlaybackStatus.PAUSED);
            assertThat(timeline.cursor()).isEqualTo(40.0);
        }

        @Test
        @DisplayName("Should ignore percent seeks when the duration is unknown")
        void shouldIgnorePercentSeekWithoutDuration() {
            // Given
            TimelineController unknown = new TimelineController(0, nanos::get, derivations::add);

            // When
            unknown.seekToPercent(50);

            // Then
            assertThat(unknown.cursor()).isZero();
            assertThat(derivations).isEmpty();
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should reject non-positive speeds")
        void shouldRejectNonPositiveSpeed() {
            assertThatThrownBy(() -> timeline.setSpeed(0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> timeline.setSpeed(-2)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> timeline.setSpeed(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
            assertThat(timeline.speed()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should freeze the cursor on failure")
        void shouldFreezeOnFailure() {
            // Given
            timeline.play();
            advanceWallClock(2);
            timeline.tick();

            // When
            timeline.fail("connection lost");
            advanceWallClock(5);
            timeline.tick();
            timeline.seekToTime(80);

            // Then
            assertThat(timeline.status()).isEqualTo(PlaybackStatus.ERROR);
            assertThat(timeline.errorMessage()).isEqualTo("connection lost");
            assertThat(timeline.cursor()).isEqualTo(2.0);
            assertThatThrownBy(timeline::play).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Should stop deriving after disposal")
        void shouldStopAfterDisposal() {
            // Given
            timeline.play();
            timeline.dispose();
            derivations.clear();

            // When
            advanceWallClock(5);
            boolean moved = timeline.tick();
            timeline.seekToTime(30);

            // Then
            assertThat(moved).isFalse();
            assertThat(derivations).isEmpty();
            assertThat(timeline.status()).isEqualTo(PlaybackStatus.IDLE);
        }

        @Test
        @DisplayName("Should clamp the cursor when the duration shrinks")
        void shouldClampOnDurationUpdate() {
            // Given
            timeline.seekToTime(90);

            // When
            timeline.updateTotalDuration(60);

            // Then
            assertThat(timeline.totalDuration()).isEqualTo(60.0);
            assertThat(timeline.cursor()).isEqualTo(60.0);
        }
    }

    @Nested
    @DisplayName("Concurrent derivation")
    class ConcurrentDerivation {

        private CountDownLatch started;
        private CountDownLatch release;
        private AtomicInteger inFlight;
        private AtomicInteger maxInFlight;
        private List<Double> seen;
        private TimelineController blocking;
        private ExecutorService executor;

        @BeforeEach
        void setUp() {
            started = new CountDownLatch(1);
            release = new CountDownLatch(1);
            inFlight = new AtomicInteger();
            maxInFlight = new AtomicInteger();
            seen = new CopyOnWriteArrayList<>();
            executor = Executors.newSingleThreadExecutor();
            // the first derivation blocks until released
            blocking = new TimelineController(100, nanos::get, cursor -> {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                seen.add(cursor);
                if (seen.size() == 1) {
                    started.countDown();
                    awaitRelease(release);
                }
                inFlight.decrementAndGet();
            });
        }

        @AfterEach
        void tearDown() {
            release.countDown();
            executor.shutdownNow();
        }

        @Test
        @DisplayName("Should coalesce seeks made during a derivation into one pass at the latest cursor")
        void shouldCoalesceSeeksDuringDerivation() throws Exception {
            // Given
            Future<?> firstSeek = executor.submit(() -> blocking.seekToTime(10));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            blocking.seekToTime(20);
            blocking.seekToTime(30);
            blocking.seekToPercent(40);

            // Then
            assertThat(seen).containsExactly(10.0);

            release.countDown();
            firstSeek.get(5, TimeUnit.SECONDS);
            assertThat(seen).containsExactly(10.0, 40.0);
            assertThat(maxInFlight.get()).isEqualTo(1);
            assertThat(blocking.cursor()).isEqualTo(40.0);
        }

        @Test
        @DisplayName("Should drop a queued derivation once disposed")
        void shouldDropQueuedDerivationAfterDisposal() throws Exception {
            // Given
            Future<?> firstSeek = executor.submit(() -> blocking.seekToTime(10));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            blocking.seekToTime(50);

            // When
            blocking.dispose();
            release.countDown();
            firstSeek.get(5, TimeUnit.SECONDS);

            // Then
            assertThat(seen).containsExactly(10.0);
            assertThat(blocking.status()).isEqualTo(PlaybackStatus.IDLE);
        }
    }
}
