package sandboxstudio.playback.dto;

import sandboxstudio.playback.domain.CountyUpdate;

import java.util.List;

/**
 * Frame as delivered by the simulation feed.
 */
public record FramePayload(
        Double simulationTimeSeconds,
        List<CountyUpdate> counties
) {}
