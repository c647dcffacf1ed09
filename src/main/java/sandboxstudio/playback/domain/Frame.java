package sandboxstudio.playback.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A timestamped batch of absolute per-county snapshots.
 */
public record Frame(
        double timestamp,
        Map<String, CountyUpdate> updates
) {
    public Frame {
        if (!Double.isFinite(timestamp) || timestamp < 0) {
            throw new IllegalArgumentException("Frame timestamp must be a non-negative number: " + timestamp);
        }
        timestamp = timestamp + 0.0; // folds -0.0 into 0.0
        updates = Collections.unmodifiableMap(new LinkedHashMap<>(updates));
    }

    public static Frame of(double timestamp, CountyUpdate... updates) {
        Map<String, CountyUpdate> byId = new LinkedHashMap<>();
        for (CountyUpdate update : updates) {
            String id = EntityIds.normalize(update.fips());
            byId.put(id, update.withFips(id));
        }
        return new Frame(timestamp, byId);
    }
}
