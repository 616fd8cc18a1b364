package ephemera.cache.sweep;

import ephemera.cache.Entry;
import ephemera.cache.EntryTable;
import ephemera.common.ManualClock;
import ephemera.common.Timestamps;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExpirationSweeperTest {

    private ManualClock clock;
    private EntryTable<String> table;
    private ExpirationSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = ManualClock.atEpochSecond(1_700_000_000L);
        table = new EntryTable<>();
        sweeper = new ExpirationSweeper(table, clock, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        sweeper.close();
    }

    private void put(String key, Duration ttl) {
        long now = Timestamps.epochNanos(clock);
        table.put(key, new Entry<>(key, clock.instant(), Timestamps.expirationOf(now, ttl)));
    }

    @Test
    void testSweepRemovesOnlyExpiredEntries() {
        put("short", Duration.ofSeconds(1));
        put("long", Duration.ofMinutes(1));
        put("forever", Duration.ZERO);

        clock.advance(Duration.ofSeconds(2));

        assertEquals(1, sweeper.sweep());
        assertNull(table.get("short"));
        assertNotNull(table.get("long"));
        assertNotNull(table.get("forever"));
    }

    @Test
    void testSweepWithNothingExpiredIsNoop() {
        put("k1", Duration.ofMinutes(1));

        assertEquals(0, sweeper.sweep());
        assertEquals(1, table.size());
    }

    @Test
    void testSweepOnEmptyTable() {
        assertEquals(0, sweeper.sweep());
    }

    @Test
    void testStartRequiresPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> sweeper.start(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> sweeper.start(Duration.ofSeconds(-1)));
    }

    @Test
    void testStartTwiceFails() {
        sweeper.start(Duration.ofMinutes(1));
        assertThrows(IllegalStateException.class, () -> sweeper.start(Duration.ofMinutes(1)));
    }

    @Test
    void testCloseStopsSweeper() {
        assertFalse(sweeper.isRunning());

        sweeper.start(Duration.ofMinutes(1));
        assertTrue(sweeper.isRunning());

        sweeper.close();
        assertFalse(sweeper.isRunning());
        assertThrows(IllegalStateException.class, () -> sweeper.start(Duration.ofMinutes(1)));
    }

    @Test
    void testScheduledSweepRunsInBackground() throws InterruptedException {
        put("k1", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        sweeper.start(Duration.ofMillis(20));

        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (table.size() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, table.size());
    }

    @Test
    void testCloseBeforeStartIsNoop() {
        sweeper.close();

        assertFalse(sweeper.isRunning());
        assertThrows(IllegalStateException.class, () -> sweeper.start(Duration.ofMinutes(1)));
    }

    @Test
    void testIntervalBeyondNanosecondRangeIsAccepted() {
        assertDoesNotThrow(() -> sweeper.start(Duration.ofDays(365L * 300)));
        assertTrue(sweeper.isRunning());
    }

    @Test
    void testCloseWhileInterruptedRestoresInterruptFlag() {
        sweeper.start(Duration.ofMinutes(1));

        Thread.currentThread().interrupt();
        sweeper.close();

        assertTrue(Thread.interrupted());
        assertFalse(sweeper.isRunning());
    }

    @Test
    void testCloseReturnsWhenPassOverrunsShutdownTimeout() throws InterruptedException {
        BlockingClock blockingClock = new BlockingClock(clock.instant());
        ExpirationSweeper blocked = new ExpirationSweeper(table, blockingClock, Duration.ofMillis(50));
        try {
            blocked.start(Duration.ofMillis(10));
            assertTrue(blockingClock.entered.await(5, TimeUnit.SECONDS));

            assertTimeoutPreemptively(Duration.ofSeconds(5), blocked::close);
            assertFalse(blocked.isRunning());
        } finally {
            blockingClock.release.countDown();
        }
    }

    @Test
    void testFailedPassDoesNotCancelSchedule() throws InterruptedException {
        put("k1", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        FailingOnceClock failingClock = new FailingOnceClock(clock);
        ExpirationSweeper failing = new ExpirationSweeper(table, failingClock, Duration.ofSeconds(5));
        try {
            failing.start(Duration.ofMillis(20));

            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (table.size() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }

            assertEquals(1, failingClock.failures.get());
            assertEquals(0, table.size());
        } finally {
            failing.close();
        }
    }

    private static class BlockingClock extends Clock {
        private final Instant now;
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        BlockingClock(Instant now) {
            this.now = now;
        }

        @Override
        public Instant instant() {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }

    private static class FailingOnceClock extends Clock {
        private final Clock delegate;
        private final AtomicInteger failures = new AtomicInteger();

        FailingOnceClock(Clock delegate) {
            this.delegate = delegate;
        }

        @Override
        public Instant instant() {
            if (failures.compareAndSet(0, 1)) {
                throw new IllegalStateException("clock unavailable");
            }
            return delegate.instant();
        }

        @Override
        public ZoneId getZone() {
            return delegate.getZone();
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
