package ephemera.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NamedThreadFactoryTest {

    @Test
    void testThreadsAreNumberedPerFactory() {
        NamedThreadFactory factory = new NamedThreadFactory("worker");

        assertEquals("worker-0", factory.newThread(() -> {}).getName());
        assertEquals("worker-1", factory.newThread(() -> {}).getName());
    }

    @Test
    void testThreadsAreDaemons() {
        assertTrue(new NamedThreadFactory("sweeper").newThread(() -> {}).isDaemon());
    }
}
