package sandboxstudio.playback.domain;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The national rollup plus one rollup per known state, computed from the same county snapshot.
 */
public record Rollups(
        AggregateSnapshot national,
        Map<String, AggregateSnapshot> states,
        long unassignedVotes
) {
    public Rollups {
        states = Collections.unmodifiableMap(new TreeMap<>(states));
    }

    public Optional<AggregateSnapshot> scope(String scope) {
        if (AggregateSnapshot.NATIONAL.equalsIgnoreCase(scope)) {
            return Optional.of(national);
        }
        String stateId = EntityIds.normalizeState(scope);
        return stateId == null ? Optional.empty() : Optional.ofNullable(states.get(stateId));
    }
}
