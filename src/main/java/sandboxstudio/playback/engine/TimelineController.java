package sandboxstudio.playback.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sandboxstudio.playback.domain.PlaybackStatus;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Owns the playback cursor (simulated seconds since scenario start).
 *
 * <p>Lifecycle: {@code ready -> running <-> paused -> completed}, with {@code error} reachable from
 * any loaded state and {@code idle} after disposal. While running, each {@link #tick()} advances
 * the cursor by {@code speed x wall-clock delta}.
 *
 * <p>Every cursor change asks the {@link Deriver} to rebuild state. At most one derivation runs at a
 * time; requests made while one is in flight are coalesced and the next pass always reads the
 * latest cursor, so only the most recent target survives.
 */
public class TimelineController {

    private static final Logger log = LoggerFactory.getLogger(TimelineController.class);

    @FunctionalInterface
    public interface Deriver {
        void deriveAt(double cursorSeconds);
    }

    private final LongSupplier nanoClock;
    private final Deriver deriver;
    private final ReentrantLock derivationLock = new ReentrantLock();
    private final AtomicBoolean derivationRequested = new AtomicBoolean();

    private PlaybackStatus status = PlaybackStatus.READY;
    private double cursor;
    private double totalDuration;
    private double speed = 1.0;
    private long lastTickNanos;
    private String errorMessage;
    private boolean disposed;

    public TimelineController(double totalDurationSeconds, LongSupplier nanoClock, Deriver deriver) {
        this.totalDuration = Math.max(0, totalDurationSeconds);
        this.nanoClock = nanoClock;
        this.deriver = deriver;
    }

    /**
     * Starts or resumes playback. Resuming from {@code completed} restarts from 0.
     *
     * @throws IllegalStateException when no scenario is loaded or the feed failed
     */
    public void play() {
        boolean restart = false;
        synchronized (this) {
            switch (status) {
                case RUNNING -> {
                    return;
                }
                case COMPLETED -> {
                    cursor = 0;
                    restart = true;
                }
                case READY, PAUSED -> {
                }
                default -> throw new IllegalStateException("Cannot play while " + status.getValue());
            }
            lastTickNanos = nanoClock.getAsLong();
            transition(PlaybackStatus.RUNNING);
        }
        if (restart) {
            requestDerivation();
        }
    }

    public synchronized void pause() {
        if (status == PlaybackStatus.RUNNING) {
            transition(PlaybackStatus.PAUSED);
        }
    }

    /**
     * Changes the speed multiplier; applies from the next tick.
     */
    public synchronized void setSpeed(double multiplier) {
        if (!Double.isFinite(multiplier) || multiplier <= 0) {
            throw new IllegalArgumentException("Speed must be a positive number: " + multiplier);
        }
        speed = multiplier;
        log.debug("Playback speed set to {}x", multiplier);
    }

    /**
     * Moves the cursor (clamped to the scenario duration) and rebuilds state from the start of the
     * buffer. A seek while running behaves as pause, seek, resume.
     */
    public void seekToTime(double seconds) {
        synchronized (this) {
            if (disposed || status == PlaybackStatus.ERROR) {
                log.debug("Ignoring seek to {}s while {}", seconds, status.getValue());
                return;
            }
            if (Double.isNaN(seconds)) {
                throw new IllegalArgumentException("Seek target must be a number");
            }
            cursor = clamp(seconds);
            if (status == PlaybackStatus.RUNNING) {
                lastTickNanos = nanoClock.getAsLong();
                if (cursor >= totalDuration) {
                    transition(PlaybackStatus.COMPLETED);
                }
            } else if (status == PlaybackStatus.COMPLETED && cursor < totalDuration) {
                transition(PlaybackStatus.PAUSED);
            }
        }
        requestDerivation();
    }

    public void seekToPercent(double percent) {
        double target;
        synchronized (this) {
            if (totalDuration <= 0) {
                log.debug("Ignoring seek to {}% with unknown duration", percent);
                return;
            }
            if (Double.isNaN(percent)) {
                throw new IllegalArgumentException("Seek percent must be a number");
            }
            target = Math.max(0, Math.min(100, percent)) / 100.0 * totalDuration;
        }
        seekToTime(target);
    }

    /**
     * Advances the cursor when running.
     *
     * @return whether the cursor moved
     */
    public boolean tick() {
        synchronized (this) {
            if (disposed || status != PlaybackStatus.RUNNING) {
                return false;
            }
            long now = nanoClock.getAsLong();
            double wallSeconds = (now - lastTickNanos) / (double) TimeUnit.SECONDS.toNanos(1);
            lastTickNanos = now;
            if (wallSeconds <= 0) {
                return false;
            }
            cursor = clamp(cursor + speed * wallSeconds);
            if (cursor >= totalDuration) {
                transition(PlaybackStatus.COMPLETED);
            }
        }
        requestDerivation();
        return true;
    }

    /**
     * Rebuilds state at the current cursor without moving it.
     */
    public void rederive() {
        requestDerivation();
    }

    public void updateTotalDuration(double seconds) {
        synchronized (this) {
            if (!Double.isFinite(seconds) || seconds <= 0) {
                return;
            }
            totalDuration = seconds;
            if (cursor > totalDuration) {
                cursor = totalDuration;
            }
            log.info("Scenario duration set to {}s", seconds);
        }
        requestDerivation();
    }

    /**
     * Freezes the cursor after an upstream failure.
     */
    public synchronized void fail(String message) {
        if (disposed) {
            return;
        }
        errorMessage = message;
        transition(PlaybackStatus.ERROR);
    }

    /**
     * Stops the timeline for good. Later ticks and seeks are no-ops, and a derivation still in
     * flight has its result discarded by the deriver.
     */
    public synchronized void dispose() {
        disposed = true;
        transition(PlaybackStatus.IDLE);
    }

    public synchronized boolean isDisposed() {
        return disposed;
    }

    public synchronized PlaybackStatus status() {
        return status;
    }

    public synchronized double cursor() {
        return cursor;
    }

    public synchronized double speed() {
        return speed;
    }

    public synchronized double totalDuration() {
        return totalDuration;
    }

    public synchronized double progressPercent() {
        return totalDuration > 0 ? Math.min(100.0, cursor / totalDuration * 100.0) : 0.0;
    }

    public synchronized String errorMessage() {
        return errorMessage;
    }

    private void requestDerivation() {
        derivationRequested.set(true);
        while (derivationRequested.get()) {
            if (!derivationLock.tryLock()) {
                // the thread holding the lock re-checks the flag before leaving
                return;
            }
            try {
                if (derivationRequested.getAndSet(false) && !isDisposed()) {
                    deriver.deriveAt(cursor());
                }
            } finally {
                derivationLock.unlock();
            }
        }
    }

    private double clamp(double seconds) {
        return Math.max(0, Math.min(totalDuration, seconds));
    }

    private void transition(PlaybackStatus next) {
        if (status != next) {
            log.info("Playback {} -> {} at {}s", status.getValue(), next.getValue(), cursor);
            status = next;
        }
    }
}
