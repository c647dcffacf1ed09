package sandboxstudio.playback.domain;

/**
 * Immutable per-county baseline, loaded once per scenario.
 */
public record BaselineEntity(
        String id,
        String stateId,
        String stateCode,
        String countyName,
        long expectedTotalVotes,
        double demShare,
        double gopShare
) {
    public BaselineEntity {
        String normalized = EntityIds.normalize(id);
        if (normalized == null) {
            throw new IllegalArgumentException("Invalid county id: " + id);
        }
        if (expectedTotalVotes < 0) {
            throw new IllegalArgumentException("Expected total votes must be non-negative for county " + id);
        }
        id = normalized;
        stateId = EntityIds.stateIdOf(normalized);
    }

    public static BaselineEntity of(String id, long expectedTotalVotes) {
        return new BaselineEntity(id, null, null, null, expectedTotalVotes, 0, 0);
    }

    /** GOP-minus-DEM baseline share in percentage points. */
    public double baselineMarginPercent() {
        return (gopShare - demShare) * 100;
    }
}
