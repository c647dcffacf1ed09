package sandboxstudio.playback.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sandboxstudio.playback.domain.CountyOverride;
import sandboxstudio.playback.domain.CountyState;
import sandboxstudio.playback.domain.CountyUpdate;
import sandboxstudio.playback.exception.InvalidOverrideException;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.ToLongFunction;

/**
 * Owner of the per-county state as of the playback cursor.
 *
 * <p>State changes through two entry points only: {@link #applyUpToCursor(double)}, which rebuilds
 * every county from the frame buffer, and {@link #setManualOverride(String, CountyOverride, double)}.
 * Overrides are layered on top of every rebuild until cleared, so replay never undoes them.
 * Readers get unmodifiable snapshots.
 */
public class CountyStateStore {

    private static final Logger log = LoggerFactory.getLogger(CountyStateStore.class);

    private final BaselineCatalog catalog;
    private final FrameBuffer buffer;

    private final Map<String, CountyState> overrides = new TreeMap<>();
    private final Set<String> unknownCounties = new TreeSet<>();
    private final Set<String> correctedUpdates = new TreeSet<>();

    private Map<String, CountyState> current;
    private int fingerprint;
    private boolean disposed;

    public CountyStateStore(BaselineCatalog catalog, FrameBuffer buffer) {
        this.catalog = catalog;
        this.buffer = buffer;
        Map<String, CountyState> initial = new TreeMap<>();
        catalog.countyIds().forEach(id -> initial.put(id, CountyState.initial(id)));
        commit(initial);
    }

    /**
     * Rebuilds every county from the latest buffered update at or before the cursor. Fields the
     * update leaves out are carried over from the county's earlier updates. Counties without an
     * update yet fall back to their zero state. Repeated calls with no new frames or overrides
     * produce equal snapshots.
     */
    public Map<String, CountyState> applyUpToCursor(double cursor) {
        Map<String, List<BufferedUpdate>> histories = buffer.historiesAtOrBefore(cursor);
        Map<String, CountyState> next = new TreeMap<>();

        for (String countyId : catalog.countyIds()) {
            List<BufferedUpdate> history = histories.get(countyId);
            next.put(countyId, history == null ? CountyState.initial(countyId) : resolve(countyId, history));
        }
        histories.forEach((countyId, history) -> {
            if (!catalog.contains(countyId)) {
                flagUnknown(countyId);
                next.put(countyId, resolve(countyId, history));
            }
        });

        synchronized (this) {
            if (disposed) {
                return current;
            }
            overrides.forEach(next::put);
            commit(next);
            return current;
        }
    }

    /**
     * Merges the given fields into the county's current state and pins the result until the
     * override is cleared or the scenario is reset.
     *
     * @throws InvalidOverrideException for negative counts, out-of-range percentages or an
     *                                  empty override; county state is left untouched
     */
    public synchronized CountyState setManualOverride(String countyId, CountyOverride fields, double cursor) {
        if (!isKnown(countyId)) {
            throw new InvalidOverrideException(countyId, "unknown county");
        }
        validate(countyId, fields);

        CountyState base = current.getOrDefault(countyId, CountyState.initial(countyId));
        long dem = fields.demVotes() != null ? fields.demVotes() : base.demVotes();
        long gop = fields.gopVotes() != null ? fields.gopVotes() : base.gopVotes();
        long other;
        long total;

        if (fields.totalVotes() != null) {
            total = fields.totalVotes();
            if (dem + gop > total) {
                throw new InvalidOverrideException(countyId, "demVotes + gopVotes exceeds totalVotes");
            }
            other = fields.otherVotes() != null ? fields.otherVotes() : total - dem - gop;
            if (dem + gop + other > total) {
                throw new InvalidOverrideException(countyId, "vote components exceed totalVotes");
            }
        } else if (fields.touchesVoteComponents()) {
            other = fields.otherVotes() != null ? fields.otherVotes() : base.otherVotes();
            total = dem + gop + other;
        } else {
            other = base.otherVotes();
            total = base.totalVotes();
        }

        double reporting = fields.reportingPercent() != null ? fields.reportingPercent() : base.reportingPercent();
        boolean full;
        if (fields.fullyReported() != null) {
            full = fields.fullyReported();
        } else if (fields.reportingPercent() != null) {
            full = reporting >= CountyState.FULLY_REPORTED_PERCENT;
        } else {
            full = base.fullyReported();
        }

        CountyState overridden = new CountyState(countyId, dem, gop, other, total, reporting, full, cursor, true);
        overrides.put(countyId, overridden);

        Map<String, CountyState> next = new TreeMap<>(current);
        next.put(countyId, overridden);
        commit(next);

        log.info("Manual override set for county {}: dem={}, gop={}, other={}, total={}, reporting={}",
                countyId, dem, gop, other, total, reporting);
        return overridden;
    }

    /**
     * Drops the override; the county reverts to frame-derived state on the next rebuild.
     */
    public synchronized boolean clearOverride(String countyId) {
        boolean removed = overrides.remove(countyId) != null;
        if (removed) {
            log.info("Manual override cleared for county {}", countyId);
        }
        return removed;
    }

    public synchronized boolean isOverridden(String countyId) {
        return overrides.containsKey(countyId);
    }

    public synchronized Set<String> editedCounties() {
        return Collections.unmodifiableSet(new TreeSet<>(overrides.keySet()));
    }

    public synchronized Map<String, CountyState> snapshot() {
        return current;
    }

    public Optional<CountyState> get(String countyId) {
        return Optional.ofNullable(snapshot().get(countyId));
    }

    public synchronized int fingerprint() {
        return fingerprint;
    }

    public synchronized Set<String> unknownCounties() {
        return Collections.unmodifiableSet(new TreeSet<>(unknownCounties));
    }

    public synchronized int invariantCorrections() {
        return correctedUpdates.size();
    }

    public boolean isKnown(String countyId) {
        return catalog.contains(countyId) || snapshot().containsKey(countyId);
    }

    public synchronized void dispose() {
        disposed = true;
        overrides.clear();
    }

    private void commit(Map<String, CountyState> next) {
        current = Collections.unmodifiableMap(next);
        fingerprint = next.hashCode();
    }

    private synchronized void flagUnknown(String countyId) {
        if (unknownCounties.add(countyId)) {
            log.warn("Frame references county {} missing from the baseline catalog; counted nationally only", countyId);
        }
    }

    private synchronized void flagCorrection(String countyId, double timestamp, String reason) {
        if (correctedUpdates.add(countyId + "@" + timestamp)) {
            log.warn("Corrected update for county {} at t={}: {}", countyId, timestamp, reason);
        }
    }

    private CountyState resolve(String countyId, List<BufferedUpdate> history) {
        CountyState state = null;
        for (BufferedUpdate buffered : history) {
            state = materialize(countyId, buffered, state);
        }
        return state;
    }

    /**
     * Resolves a raw update into a consistent state. Missing vote counts and reporting are taken
     * from {@code previous}, the county's state as of its prior update, or 0 when there is none.
     * Inconsistent input is corrected rather than dropped: negative counts become 0, and
     * components exceeding the total raise the total.
     */
    CountyState materialize(String countyId, BufferedUpdate buffered, CountyState previous) {
        CountyUpdate update = buffered.update();
        double timestamp = buffered.timestamp();

        long dem = update.demVotes() == null
                ? carried(previous, CountyState::demVotes)
                : nonNegative(countyId, timestamp, "demVotes", update.demVotes());
        long gop = update.gopVotes() == null
                ? carried(previous, CountyState::gopVotes)
                : nonNegative(countyId, timestamp, "gopVotes", update.gopVotes());
        Long suppliedOther = update.otherVotes() == null
                ? null
                : nonNegative(countyId, timestamp, "otherVotes", update.otherVotes());
        long other;
        long total;

        if (update.totalVotes() == null) {
            other = suppliedOther == null ? carried(previous, CountyState::otherVotes) : suppliedOther;
            total = dem + gop + other;
        } else {
            total = nonNegative(countyId, timestamp, "totalVotes", update.totalVotes());
            if (dem + gop > total) {
                flagCorrection(countyId, timestamp, "demVotes + gopVotes > totalVotes, total recomputed from parts");
                other = 0;
                total = dem + gop;
            } else if (suppliedOther == null) {
                other = total - dem - gop;
            } else if (dem + gop + suppliedOther > total) {
                flagCorrection(countyId, timestamp, "otherVotes exceeds the remainder of totalVotes");
                other = total - dem - gop;
            } else {
                other = suppliedOther;
            }
        }

        boolean reportingSupplied = update.reportingPercent() != null && !update.reportingPercent().isNaN();
        double reporting;
        if (reportingSupplied) {
            reporting = Math.max(0.0, Math.min(100.0, update.reportingPercent()));
        } else if (Boolean.TRUE.equals(update.fullyReported())) {
            reporting = 100.0;
        } else {
            reporting = previous == null ? 0.0 : previous.reportingPercent();
        }

        boolean full;
        if (update.fullyReported() != null) {
            full = update.fullyReported();
        } else if (!reportingSupplied && previous != null) {
            full = previous.fullyReported();
        } else {
            full = reporting >= CountyState.FULLY_REPORTED_PERCENT;
        }

        return new CountyState(countyId, dem, gop, other, total, reporting, full, timestamp, false);
    }

    private static long carried(CountyState previous, ToLongFunction<CountyState> field) {
        return previous == null ? 0 : field.applyAsLong(previous);
    }

    private long nonNegative(String countyId, double timestamp, String field, Long value) {
        if (value == null) {
            return 0;
        }
        if (value < 0) {
            flagCorrection(countyId, timestamp, field + " was negative");
            return 0;
        }
        return value;
    }

    private static void validate(String countyId, CountyOverride fields) {
        if (fields == null || fields.isEmpty()) {
            throw new InvalidOverrideException(countyId, "no fields supplied");
        }
        requireNonNegative(countyId, "demVotes", fields.demVotes());
        requireNonNegative(countyId, "gopVotes", fields.gopVotes());
        requireNonNegative(countyId, "otherVotes", fields.otherVotes());
        requireNonNegative(countyId, "totalVotes", fields.totalVotes());
        Double reporting = fields.reportingPercent();
        if (reporting != null && (reporting.isNaN() || reporting < 0 || reporting > 100)) {
            throw new InvalidOverrideException(countyId, "reportingPercent must be within [0, 100]");
        }
    }

    private static void requireNonNegative(String countyId, String field, Long value) {
        if (value != null && value < 0) {
            throw new InvalidOverrideException(countyId, field + " must not be negative");
        }
    }
}
