package sandboxstudio.playback.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import sandboxstudio.playback.BaseIntegrationTest;
import sandboxstudio.playback.domain.CountyOverride;
import sandboxstudio.playback.domain.CountyUpdate;
import sandboxstudio.playback.domain.PlaybackStatus;
import sandboxstudio.playback.dto.FramePayload;
import sandboxstudio.playback.dto.ScenarioLoadRequest;
import sandboxstudio.playback.engine.PlaybackEngine;
import sandboxstudio.playback.exception.ScenarioNotLoadedException;
import sandboxstudio.playback.exception.TransportException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SimulationService Integration Tests")
class SimulationServiceTest extends BaseIntegrationTest {

    @Nested
    @DisplayName("Scenario lifecycle")
    class ScenarioLifecycle {

        @Test
        @DisplayName("Should create a ready engine from the bootstrap payload")
        void shouldLoadScenario() {
            // When
            PlaybackEngine engine = simulationService.loadScenario(sampleScenario());

            // Then
            assertThat(engine.status()).isEqualTo(PlaybackStatus.READY);
            assertThat(engine.catalog().countyIds()).containsExactly("01001", "01003", "02013");
            assertThat(engine.scenario().name()).isEqualTo("Sample");
            assertThat(simulationService.currentEngine()).contains(engine);
        }

        @Test
        @DisplayName("Should dispose the previous engine when a new scenario loads")
        void shouldDisposePrevious() {
            // Given
            PlaybackEngine first = simulationService.loadScenario(sampleScenario());
            first.setManualOverride("01001", new CountyOverride(1L, 1L, null, null, null, null));

            // When
            PlaybackEngine second = simulationService.loadScenario(sampleScenario());

            // Then
            assertThat(first.isDisposed()).isTrue();
            assertThat(second.scenario().scenarioId()).isNotEqualTo(first.scenario().scenarioId());
            assertThat(second.editedCounties()).isEmpty();
            assertThat(second.getNewsroomEvents()).isEmpty();
        }

        @Test
        @DisplayName("Should require a loaded scenario")
        void shouldRequireScenario() {
            assertThatThrownBy(() -> simulationService.play())
                    .isInstanceOf(ScenarioNotLoadedException.class);
            assertThat(simulationService.reset()).isFalse();
        }
    }

    @Nested
    @DisplayName("Frame ingestion")
    class FrameIngestion {

        @Test
        @DisplayName("Should skip entries with invalid FIPS codes")
        void shouldSkipInvalidFips() {
            // Given
            PlaybackEngine engine = simulationService.loadScenario(sampleScenario());

            // When
            simulationService.ingestFrame(new FramePayload(3.0, List.of(
                    CountyUpdate.of("1001", 5, 5, 10, 10),
                    CountyUpdate.of("", 1, 1, 2, 1),
                    CountyUpdate.of("123456", 1, 1, 2, 1)
            )));
            engine.seekToTime(3);

            // Then
            assertThat(engine.getCurrentCountyState()).containsOnlyKeys("01001", "01003", "02013");
            assertThat(engine.getCounty("01001").orElseThrow().totalVotes()).isEqualTo(10);
        }

        @Test
        @DisplayName("Should reject frames without a timestamp")
        void shouldRejectMissingTimestamp() {
            simulationService.loadScenario(sampleScenario());

            assertThatThrownBy(() -> simulationService.ingestFrame(new FramePayload(null, List.of())))
                    .isInstanceOf(TransportException.class);
        }

        @Test
        @DisplayName("Should carry the reporting plan into the newsroom")
        void shouldCarryReportingPlan() {
            // Given
            ScenarioLoadRequest request = sampleScenario();
            ScenarioLoadRequest planned = new ScenarioLoadRequest(request.name(),
                    request.totalDurationSeconds(), request.counties(), Map.of("pattern", "east-to-west"));

            // When
            PlaybackEngine engine = simulationService.loadScenario(planned);

            // Then
            assertThat(engine.scenario().reportingConfig().isPresent()).isTrue();
            assertThat(engine.getNewsroomEvents())
                    .singleElement()
                    .satisfies(event -> assertThat(event.detail()).isEqualTo("Custom reporting order in effect"));
        }
    }
}
