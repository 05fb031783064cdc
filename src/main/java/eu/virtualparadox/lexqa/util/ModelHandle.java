package eu.virtualparadox.lexqa.util;

import lombok.extern.slf4j.Slf4j;

/**
 * Lazily loaded, reference-counted holder for an expensive model resource.
 * <p>
 * The model is loaded on first use and kept for the lifetime of the owner. Callers borrow it
 * through a {@link Lease}; closing the handle while leases are outstanding defers the release
 * of the model until the last lease is returned. A failed load is remembered so that a missing
 * model is reported once instead of on every page.
 *
 * @param <T> model type
 */
@Slf4j
public final class ModelHandle<T extends AutoCloseable> implements AutoCloseable {

    @FunctionalInterface
    public interface Loader<T> {
        T load() throws Exception;
    }

    private final String name;
    private final Loader<T> loader;

    private T model;
    private Exception loadFailure;
    private int leases;
    private boolean closed;

    public ModelHandle(final String name, final Loader<T> loader) {
        this.name = name;
        this.loader = loader;
    }

    /**
     * Loads the model if it is not loaded yet.
     *
     * @return {@code true} when the model is available
     */
    public synchronized boolean ensureLoaded() {
        if (closed || loadFailure != null) {
            return false;
        }
        if (model != null) {
            return true;
        }
        try {
            model = loader.load();
            log.info("Loaded model {}", name);
            return true;
        } catch (Exception e) {
            loadFailure = e;
            log.warn("Model {} could not be loaded: {}", name, e.getMessage());
            log.debug("Model {} load failure", name, e);
            return false;
        }
    }

    /**
     * Borrows the model, loading it on first use.
     *
     * @return lease that must be closed after use
     * @throws IllegalStateException if the handle is closed or the model failed to load
     */
    public synchronized Lease acquire() {
        if (!ensureLoaded()) {
            throw new IllegalStateException("Model " + name + " is unavailable", loadFailure);
        }
        leases++;
        return new Lease(model);
    }

    public synchronized int activeLeases() {
        return leases;
    }

    private synchronized void release() {
        leases--;
        if (closed && leases == 0) {
            closeModel();
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (leases == 0) {
            closeModel();
        }
    }

    private void closeModel() {
        if (model == null) {
            return;
        }
        try {
            model.close();
            log.info("Released model {}", name);
        } catch (Exception e) {
            log.error("Unable to release model {}", name, e);
        } finally {
            model = null;
        }
    }

    /**
     * Borrowed reference to the loaded model.
     */
    public final class Lease implements AutoCloseable {

        private final T value;
        private boolean returned;

        private Lease(final T value) {
            this.value = value;
        }

        public T get() {
            return value;
        }

        @Override
        public void close() {
            if (!returned) {
                returned = true;
                release();
            }
        }
    }
}
