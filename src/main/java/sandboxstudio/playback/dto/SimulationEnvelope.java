package sandboxstudio.playback.dto;

import sandboxstudio.playback.domain.AggregateSnapshot;
import sandboxstudio.playback.domain.NewsroomEvent;

/**
 * Outbound message on {@code /topic/simulation/{scenarioId}}.
 */
public record SimulationEnvelope(
        String type,
        Object payload
) {
    public static SimulationEnvelope snapshot(PlaybackStateResponse playback, AggregateSnapshot national) {
        return new SimulationEnvelope("snapshot", new SnapshotPayload(playback, national));
    }

    public static SimulationEnvelope newsroom(NewsroomEvent event) {
        return new SimulationEnvelope("newsroom", event);
    }

    public record SnapshotPayload(PlaybackStateResponse playback, AggregateSnapshot national) {}
}
