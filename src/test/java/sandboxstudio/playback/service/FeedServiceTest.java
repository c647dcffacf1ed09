package sandboxstudio.playback.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import sandboxstudio.playback.BaseIntegrationTest;
import sandboxstudio.playback.domain.PlaybackStatus;
import sandboxstudio.playback.dto.FeedEnvelope;
import sandboxstudio.playback.engine.PlaybackEngine;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FeedService Integration Tests")
class FeedServiceTest extends BaseIntegrationTest {

    @Autowired
    private FeedService feedService;

    @Autowired
    private ObjectMapper objectMapper;

    private PlaybackEngine engine;

    @BeforeEach
    void setUp() {
        engine = simulationService.loadScenario(sampleScenario());
    }

    private FeedEnvelope envelope(String json) throws Exception {
        return objectMapper.readValue(json, FeedEnvelope.class);
    }

    @Nested
    @DisplayName("Frames")
    class Frames {

        @Test
        @DisplayName("Should buffer frame and delta envelopes alike")
        void shouldBufferFrameAndDelta() throws Exception {
            // When
            feedService.handleEnvelope(envelope("""
                    {"type":"frame","payload":{"simulationTimeSeconds":5,
                     "counties":[{"fips":"01001","demVotes":10,"gopVotes":20,"totalVotes":35,"reportingPercent":25}]}}
                    """));
            feedService.handleEnvelope(envelope("""
                    {"type":"delta","payload":{"simulationTimeSeconds":9,
                     "counties":[{"fips":"01001","demVotes":30,"gopVotes":40,"isFullyReported":true}]}}
                    """));

            // Then
            assertThat(engine.framesBuffered()).isEqualTo(2);
            engine.seekToTime(9);
            var county = engine.getCounty("01001").orElseThrow();
            assertThat(county.otherVotes()).isEqualTo(5);
            assertThat(county.totalVotes()).isEqualTo(75);
            assertThat(county.reportingPercent()).isEqualTo(100.0);
            assertThat(county.fullyReported()).isTrue();
        }

        @Test
        @DisplayName("Should fail playback on a negative timestamp")
        void shouldFailOnNegativeTimestamp() throws Exception {
            // When
            feedService.handleEnvelope(envelope("""
                    {"type":"frame","payload":{"simulationTimeSeconds":-1,"counties":[]}}
                    """));

            // Then
            assertThat(engine.status()).isEqualTo(PlaybackStatus.ERROR);
            assertThat(engine.framesBuffered()).isZero();
        }

        @Test
        @DisplayName("Should fail playback on an undecodable payload")
        void shouldFailOnUndecodablePayload() throws Exception {
            // When
            feedService.handleEnvelope(envelope("""
                    {"type":"frame","payload":{"simulationTimeSeconds":"soon","counties":"none"}}
                    """));

            // Then
            assertThat(engine.status()).isEqualTo(PlaybackStatus.ERROR);
            assertThat(engine.errorMessage()).startsWith("Malformed FramePayload");
        }
    }

    @Nested
    @DisplayName("Lifecycle signals")
    class LifecycleSignals {

        @Test
        @DisplayName("Should accept the effective duration alias")
        void shouldAcceptEffectiveDuration() throws Exception {
            feedService.handleEnvelope(envelope("""
                    {"type":"metadata","payload":{"effectiveDurationSeconds":42}}
                    """));

            assertThat(engine.totalDuration()).isEqualTo(42.0);
        }

        @Test
        @DisplayName("Should ignore unknown envelope types")
        void shouldIgnoreUnknownTypes() throws Exception {
            feedService.handleEnvelope(envelope("""
                    {"type":"heartbeat","payload":{}}
                    """));

            assertThat(engine.status()).isEqualTo(PlaybackStatus.READY);
        }

        @Test
        @DisplayName("Should drop messages when no scenario is loaded")
        void shouldDropWithoutScenario() throws Exception {
            // Given
            simulationService.reset();

            // When/Then - should not throw
            feedService.handleEnvelope(envelope("""
                    {"type":"completed","payload":{}}
                    """));
            assertThat(simulationService.currentEngine()).isEmpty();
        }
    }
}
