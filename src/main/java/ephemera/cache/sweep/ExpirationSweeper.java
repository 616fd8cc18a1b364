package ephemera.cache.sweep;

import ephemera.cache.EntryTable;
import ephemera.common.NamedThreadFactory;
import ephemera.common.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically removes expired entries from an {@link EntryTable} so that
 * entries nobody reads again do not pile up.
 */
public class ExpirationSweeper implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ExpirationSweeper.class);

    private enum State {NEW, STARTED, CLOSED}

    private final EntryTable<?> table;
    private final Clock clock;
    private final Duration shutdownTimeout;

    // Guarded by this.
    private State state = State.NEW;
    private ScheduledExecutorService executor;

    public ExpirationSweeper(EntryTable<?> table, Clock clock, Duration shutdownTimeout) {
        this.table = table;
        this.clock = clock;
        this.shutdownTimeout = shutdownTimeout;
    }

    public synchronized void start(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must be positive: " + interval);
        }
        if (state != State.NEW) {
            throw new IllegalStateException("Sweeper already " + state.name().toLowerCase());
        }

        // Intervals beyond the nanosecond range are capped, they never fire in practice.
        long intervalNanos = Timestamps.saturatedNanos(interval);
        executor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("ephemera-sweeper"));
        executor.scheduleWithFixedDelay(this::runSweep, intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
        state = State.STARTED;
        logger.info("Expiration sweeper started with interval {}", interval);
    }

    public synchronized boolean isRunning() {
        return state == State.STARTED && !executor.isShutdown();
    }

    private void runSweep() {
        try {
            sweep();
        } catch (RuntimeException ex) {
            // A failed pass must not cancel the schedule.
            logger.error("Expiration sweep failed", ex);
        }
    }

    /**
     * Runs a single pass: collects expired keys under the read lock and removes
     * those still expired under the write lock.
     *
     * @return number of removed entries
     */
    int sweep() {
        List<String> expired = table.expiredKeys(Timestamps.epochNanos(clock));
        if (expired.isEmpty()) {
            return 0;
        }

        int removed = table.removeExpired(expired, Timestamps.epochNanos(clock));
        logger.debug("Swept {} expired entries ({} candidates)", removed, expired.size());
        return removed;
    }

    @Override
    public synchronized void close() {
        State previous = state;
        state = State.CLOSED;
        if (previous != State.STARTED) {
            return;
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(Timestamps.saturatedNanos(shutdownTimeout), TimeUnit.NANOSECONDS)) {
                logger.warn("Expiration sweeper did not stop within {}. Forcing shutdown.", shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            logger.error("Interrupted while stopping expiration sweeper", ex);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Expiration sweeper stopped");
    }
}
