package sandboxstudio.playback.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import sandboxstudio.playback.dto.FeedEnvelope;
import sandboxstudio.playback.dto.FramePayload;
import sandboxstudio.playback.exception.ScenarioNotLoadedException;
import sandboxstudio.playback.exception.TransportException;

/**
 * Decodes feed envelopes and hands them to the active scenario.
 *
 * <p>{@code frame} and {@code delta} both carry absolute county snapshots and are buffered alike.
 * A malformed envelope or an upstream {@code error} moves playback into the error state.
 */
@Service
public class FeedService {

    private static final Logger log = LoggerFactory.getLogger(FeedService.class);

    public static final String FRAME = "frame";
    public static final String DELTA = "delta";
    public static final String METADATA = "metadata";
    public static final String COMPLETED = "completed";
    public static final String ERROR = "error";

    private final SimulationService simulationService;
    private final ObjectMapper objectMapper;

    public FeedService(SimulationService simulationService, ObjectMapper objectMapper) {
        this.simulationService = simulationService;
        this.objectMapper = objectMapper;
    }

    public void handleEnvelope(FeedEnvelope envelope) {
        if (simulationService.currentEngine().isEmpty()) {
            log.warn("Dropping feed message with no scenario loaded: type={}",
                    envelope == null ? null : envelope.type());
            return;
        }

        try {
            dispatch(envelope);
        } catch (TransportException e) {
            log.error("Feed transport failure: {}", e.getMessage());
            simulationService.failFeed(e.getMessage());
        } catch (ScenarioNotLoadedException e) {
            log.warn("Scenario was reset while handling feed message: type={}", envelope.type());
        }
    }

    private void dispatch(FeedEnvelope envelope) {
        if (envelope == null || envelope.type() == null) {
            throw new TransportException("Feed message has no type");
        }

        switch (envelope.type()) {
            case FRAME, DELTA -> simulationService.ingestFrame(decode(envelope.payload(), FramePayload.class));
            case METADATA -> {
                JsonNode duration = durationOf(envelope.payload());
                if (duration != null && duration.isNumber()) {
                    simulationService.updateTotalDuration(duration.asDouble());
                } else {
                    log.debug("Metadata without totalDurationSeconds ignored");
                }
            }
            case COMPLETED -> simulationService.markFeedCompleted();
            case ERROR -> {
                JsonNode message = envelope.payload() == null ? null : envelope.payload().get("message");
                simulationService.failFeed(message != null && message.isTextual()
                        ? message.asText()
                        : "Simulation feed reported an error");
            }
            default -> log.debug("Ignoring feed message of unknown type: {}", envelope.type());
        }
    }

    private static JsonNode durationOf(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        JsonNode duration = payload.get("totalDurationSeconds");
        return duration != null ? duration : payload.get("effectiveDurationSeconds");
    }

    private <T> T decode(JsonNode payload, Class<T> type) {
        if (payload == null || payload.isNull()) {
            throw new TransportException("Feed message has no payload");
        }
        try {
            return objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new TransportException("Malformed " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
