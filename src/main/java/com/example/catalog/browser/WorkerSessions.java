package com.example.catalog.browser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily opens one session per worker thread and closes them all together.
 *
 * The owner of this object owns every session it hands out; callers of
 * {@link #current()} must not close what they get.
 */
public class WorkerSessions implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerSessions.class);

    private final PageSessionFactory factory;
    private final Map<Thread, PageSession> sessions = new ConcurrentHashMap<>();

    public WorkerSessions(PageSessionFactory factory) {
        this.factory = factory;
    }

    public PageSession current() {
        Thread worker = Thread.currentThread();
        PageSession session = sessions.get(worker);
        if (session == null) {
            // opened outside the map; only this thread writes its own key
            session = factory.open();
            sessions.put(worker, session);
        }
        return session;
    }

    public int opened() {
        return sessions.size();
    }

    @Override
    public void close() {
        RuntimeException first = null;
        for (PageSession session : sessions.values()) {
            try {
                session.close();
            } catch (RuntimeException e) {
                log.warn("Closing shared session failed: {}", e.getMessage());
                if (first == null) {
                    first = e;
                }
            }
        }
        sessions.clear();
        if (first != null) {
            throw first;
        }
    }
}
