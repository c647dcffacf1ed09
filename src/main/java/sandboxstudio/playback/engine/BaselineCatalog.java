package sandboxstudio.playback.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sandboxstudio.playback.domain.BaselineEntity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable set of county baselines for the active scenario.
 */
public final class BaselineCatalog {

    private static final Logger log = LoggerFactory.getLogger(BaselineCatalog.class);

    private final Map<String, BaselineEntity> entities;
    private final Map<String, List<BaselineEntity>> byState;
    private final long expectedTotalVotes;

    public BaselineCatalog(Collection<BaselineEntity> baselines) {
        Map<String, BaselineEntity> entityMap = new TreeMap<>();
        for (BaselineEntity entity : baselines) {
            if (entityMap.put(entity.id(), entity) != null) {
                log.warn("Duplicate baseline for county {}, keeping the last one", entity.id());
            }
        }

        Map<String, List<BaselineEntity>> stateMap = new TreeMap<>();
        long expected = 0;
        for (BaselineEntity entity : entityMap.values()) {
            stateMap.computeIfAbsent(entity.stateId(), k -> new ArrayList<>()).add(entity);
            expected += entity.expectedTotalVotes();
        }
        Map<String, List<BaselineEntity>> frozen = new LinkedHashMap<>();
        stateMap.forEach((stateId, list) -> frozen.put(stateId, List.copyOf(list)));

        this.entities = Collections.unmodifiableMap(entityMap);
        this.byState = Collections.unmodifiableMap(frozen);
        this.expectedTotalVotes = expected;
    }

    public static BaselineCatalog empty() {
        return new BaselineCatalog(List.of());
    }

    public Optional<BaselineEntity> get(String countyId) {
        return Optional.ofNullable(entities.get(countyId));
    }

    public boolean contains(String countyId) {
        return entities.containsKey(countyId);
    }

    /** Counties in id order. */
    public Collection<BaselineEntity> entities() {
        return entities.values();
    }

    public Set<String> countyIds() {
        return entities.keySet();
    }

    public Set<String> stateIds() {
        return byState.keySet();
    }

    public List<BaselineEntity> countiesInState(String stateId) {
        return byState.getOrDefault(stateId, List.of());
    }

    public long expectedTotalVotes(String countyId) {
        BaselineEntity entity = entities.get(countyId);
        return entity == null ? 0 : entity.expectedTotalVotes();
    }

    public long expectedTotalVotes() {
        return expectedTotalVotes;
    }

    public int size() {
        return entities.size();
    }
}
