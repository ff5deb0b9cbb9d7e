package com.example.catalog.browser;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class WorkerSessionsTest {

    private final List<FakePageSession> opened = new CopyOnWriteArrayList<>();

    private final PageSessionFactory factory = () -> {
        FakePageSession session = new FakePageSession();
        opened.add(session);
        return session;
    };

    @Test
    public void sameThreadGetsSameSession() {
        try (WorkerSessions sessions = new WorkerSessions(factory)) {
            Assertions.assertSame(sessions.current(), sessions.current());
            Assertions.assertEquals(1, sessions.opened());
        }
        Assertions.assertTrue(opened.get(0).isClosed());
    }

    @Test
    public void eachThreadGetsItsOwnSession() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try (WorkerSessions sessions = new WorkerSessions(factory)) {
            Callable<PageSession> fromWorker = sessions::current;
            PageSession first = pool.submit(fromWorker).get();
            PageSession mine = sessions.current();

            Assertions.assertNotSame(first, mine);
            Assertions.assertEquals(2, sessions.opened());
        } finally {
            pool.shutdown();
        }
        Assertions.assertEquals(2, opened.size());
        Assertions.assertTrue(opened.stream().allMatch(FakePageSession::isClosed));
    }

    @Test
    public void closeFailureIsRethrownAfterClosingTheRest() {
        WorkerSessions sessions = new WorkerSessions(() -> new FakePageSession() {
            @Override
            public void close() {
                super.close();
                throw new PageSessionException("browser already gone");
            }
        });
        sessions.current();

        PageSessionException e = Assertions.assertThrows(PageSessionException.class, sessions::close);
        Assertions.assertEquals("browser already gone", e.getMessage());
        Assertions.assertEquals(0, sessions.opened());
    }

    @Test
    public void slowLaunchDoesNotHoldUpOtherWorkers() throws Exception {
        CountDownLatch secondOpened = new CountDownLatch(1);
        AtomicInteger launches = new AtomicInteger();
        WorkerSessions sessions = new WorkerSessions(() -> {
            if (launches.incrementAndGet() == 1) {
                // first launch finishes only once another worker got its session
                try {
                    Assertions.assertTrue(secondOpened.await(5, TimeUnit.SECONDS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            } else {
                secondOpened.countDown();
            }
            return new FakePageSession();
        });
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Callable<PageSession> fromWorker = sessions::current;
            Future<PageSession> slow = pool.submit(fromWorker);
            while (launches.get() == 0) {
                Thread.sleep(5);
            }
            Future<PageSession> fast = pool.submit(fromWorker);

            Assertions.assertNotNull(fast.get(5, TimeUnit.SECONDS));
            Assertions.assertNotNull(slow.get(5, TimeUnit.SECONDS));
            Assertions.assertEquals(2, sessions.opened());
        } finally {
            pool.shutdown();
            sessions.close();
        }
    }
}
