package sandboxstudio.playback.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sandboxstudio.playback.domain.CountyUpdate;
import sandboxstudio.playback.domain.Frame;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Timestamp-ordered store of every frame received for the active scenario.
 *
 * <p>Frames may arrive out of order and several frames may share a timestamp. Entries for the
 * same county at the same timestamp are resolved by ingestion order: the later one wins.
 * Lookups never fail on sparse data; asking for a time before the first frame yields nothing.
 *
 * <p>The buffer grows for the life of a scenario. A new scenario gets a new buffer.
 */
public class FrameBuffer {

    private static final Logger log = LoggerFactory.getLogger(FrameBuffer.class);

    private final NavigableMap<Double, Map<String, CountyUpdate>> frames = new TreeMap<>();
    private final Map<String, NavigableMap<Double, CountyUpdate>> byCounty = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private long ingestedFrames;
    private boolean feedCompleted;
    private boolean disposed;

    public void ingest(Frame frame) {
        lock.writeLock().lock();
        try {
            if (disposed) {
                log.debug("Dropping frame at t={} for a disposed buffer", frame.timestamp());
                return;
            }
            Map<String, CountyUpdate> atTimestamp = frames.computeIfAbsent(frame.timestamp(), k -> new LinkedHashMap<>());
            frame.updates().forEach((countyId, update) -> {
                atTimestamp.put(countyId, update);
                byCounty.computeIfAbsent(countyId, k -> new TreeMap<>()).put(frame.timestamp(), update);
            });
            ingestedFrames++;
            log.trace("Ingested frame t={} with {} counties", frame.timestamp(), frame.updates().size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Most recent frame whose timestamp is at or before the given time, merged across
     * duplicate ingestions of that timestamp.
     */
    public Optional<Frame> frameAtOrBefore(double timestamp) {
        lock.readLock().lock();
        try {
            Map.Entry<Double, Map<String, CountyUpdate>> entry = frames.floorEntry(timestamp);
            return entry == null ? Optional.empty() : Optional.of(new Frame(entry.getKey(), entry.getValue()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<BufferedUpdate> updateAtOrBefore(String countyId, double timestamp) {
        lock.readLock().lock();
        try {
            NavigableMap<Double, CountyUpdate> history = byCounty.get(countyId);
            if (history == null) {
                return Optional.empty();
            }
            Map.Entry<Double, CountyUpdate> entry = history.floorEntry(timestamp);
            return entry == null ? Optional.empty() : Optional.of(new BufferedUpdate(entry.getKey(), entry.getValue()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * For every county seen at or before the given time, the updates needed to resolve its state
     * there, oldest first: the latest self-contained update (or the county's first update) followed
     * by every later update up to the given time.
     */
    public Map<String, List<BufferedUpdate>> historiesAtOrBefore(double timestamp) {
        lock.readLock().lock();
        try {
            Map<String, List<BufferedUpdate>> result = new HashMap<>();
            byCounty.forEach((countyId, history) -> {
                Deque<BufferedUpdate> chain = new ArrayDeque<>();
                for (Map.Entry<Double, CountyUpdate> entry : history.headMap(timestamp, true).descendingMap().entrySet()) {
                    chain.addFirst(new BufferedUpdate(entry.getKey(), entry.getValue()));
                    if (entry.getValue().isSelfContained()) {
                        break;
                    }
                }
                if (!chain.isEmpty()) {
                    result.put(countyId, List.copyOf(chain));
                }
            });
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> countyIds() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(byCounty.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Number of distinct timestamps held. */
    public int size() {
        lock.readLock().lock();
        try {
            return frames.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public long ingestedFrames() {
        lock.readLock().lock();
        try {
            return ingestedFrames;
        } finally {
            lock.readLock().unlock();
        }
    }

    public OptionalDouble lastTimestamp() {
        lock.readLock().lock();
        try {
            return frames.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(frames.lastKey());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void markFeedCompleted() {
        lock.writeLock().lock();
        try {
            feedCompleted = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isFeedCompleted() {
        lock.readLock().lock();
        try {
            return feedCompleted;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void dispose() {
        lock.writeLock().lock();
        try {
            disposed = true;
            frames.clear();
            byCounty.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
