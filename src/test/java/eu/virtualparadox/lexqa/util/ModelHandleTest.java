package eu.virtualparadox.lexqa.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ModelHandleTest {

    private static final class FakeModel implements AutoCloseable {
        private boolean closed;

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    @DisplayName("the model is loaded once, on first use")
    void acquire_loadsLazilyOnce() {
        final AtomicInteger loads = new AtomicInteger();
        final ModelHandle<FakeModel> handle = new ModelHandle<>("fake", () -> {
            loads.incrementAndGet();
            return new FakeModel();
        });
        assertEquals(0, loads.get());

        try (ModelHandle<FakeModel>.Lease a = handle.acquire(); ModelHandle<FakeModel>.Lease b = handle.acquire()) {
            assertSame(a.get(), b.get());
            assertEquals(2, handle.activeLeases());
        }
        assertEquals(1, loads.get());
        assertEquals(0, handle.activeLeases());
    }

    @Test
    @DisplayName("closing with an outstanding lease defers the release until it is returned")
    void close_withLease_defersRelease() {
        final ModelHandle<FakeModel> handle = new ModelHandle<>("fake", FakeModel::new);
        final ModelHandle<FakeModel>.Lease lease = handle.acquire();
        final FakeModel model = lease.get();

        handle.close();
        assertFalse(model.closed);

        lease.close();
        lease.close();
        assertTrue(model.closed);
        assertEquals(0, handle.activeLeases());
        assertThrows(IllegalStateException.class, handle::acquire);
    }

    @Test
    @DisplayName("a failed load is remembered and not retried")
    void ensureLoaded_failureRemembered() {
        final AtomicInteger attempts = new AtomicInteger();
        final ModelHandle<FakeModel> handle = new ModelHandle<>("missing", () -> {
            attempts.incrementAndGet();
            throw new java.io.FileNotFoundException("model.onnx");
        });

        assertFalse(handle.ensureLoaded());
        assertFalse(handle.ensureLoaded());
        final IllegalStateException e = assertThrows(IllegalStateException.class, handle::acquire);
        assertInstanceOf(java.io.FileNotFoundException.class, e.getCause());
        assertEquals(1, attempts.get());
    }
}
