package sandboxstudio.playback.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Typed wrapper used on the simulation feed, in both directions.
 * Inbound types: frame, delta, metadata, completed, error.
 */
public record FeedEnvelope(
        String type,
        JsonNode payload
) {}
