package fun.fengwk.lss.core.service.browser.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Per-worker session registry, indexed by worker id.
 *
 * <p>A slot is only ever filled by its owning worker, so creation needs no locking. Release
 * swaps the slot to {@code null} first, which guarantees every session is closed exactly once
 * even when a worker and the pool release concurrently.
 *
 * @author fengwk
 */
public class BrowserSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(BrowserSessionRegistry.class);

    private final BrowserSessionFactory sessionFactory;
    private final AtomicReferenceArray<BrowserSession> sessions;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public BrowserSessionRegistry(BrowserSessionFactory sessionFactory, int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1");
        }
        this.sessionFactory = sessionFactory;
        this.sessions = new AtomicReferenceArray<>(workerCount);
    }

    /**
     * Return the session owned by the worker, creating it on first use.
     *
     * @throws SessionCreationException if the session cannot be created; nothing is cached so the
     *                                  next call from the same worker tries again
     */
    public BrowserSession acquireSession(int workerId) {
        checkWorkerId(workerId);
        if (released.get()) {
            throw new IllegalStateException("session registry is released");
        }

        BrowserSession session = sessions.get(workerId);
        if (session != null) {
            return session;
        }

        try {
            session = sessionFactory.create(workerId);
        } catch (SessionCreationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new SessionCreationException(
                "failed to create browser session for worker " + workerId + ": " + ex.getMessage(), ex);
        }
        if (session == null) {
            throw new SessionCreationException("session factory returned null for worker " + workerId);
        }
        sessions.set(workerId, session);

        // Lost the race against releaseAll, the session must not outlive the registry.
        if (released.get() && sessions.compareAndSet(workerId, session, null)) {
            session.close();
            throw new IllegalStateException("session registry is released");
        }
        return session;
    }

    /**
     * Close the session of one worker, if it has one.
     */
    public void releaseSession(int workerId) {
        checkWorkerId(workerId);
        BrowserSession session = sessions.getAndSet(workerId, null);
        if (session != null) {
            closeSession(session);
        }
    }

    /**
     * Close every remaining session. Idempotent.
     */
    public void releaseAll() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        for (int workerId = 0; workerId < sessions.length(); workerId++) {
            releaseSession(workerId);
        }
    }

    public int activeSessionCount() {
        int count = 0;
        for (int workerId = 0; workerId < sessions.length(); workerId++) {
            if (sessions.get(workerId) != null) {
                count++;
            }
        }
        return count;
    }

    private void closeSession(BrowserSession session) {
        try {
            session.close();
        } catch (RuntimeException ex) {
            log.warn("failed to release browser session, workerId={}", session.getWorkerId(), ex);
        }
    }

    private void checkWorkerId(int workerId) {
        if (workerId < 0 || workerId >= sessions.length()) {
            throw new IllegalArgumentException("invalid worker id: " + workerId);
        }
    }

}
