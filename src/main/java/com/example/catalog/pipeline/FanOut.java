package com.example.catalog.pipeline;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs one task over many inputs on a bounded worker pool.
 *
 * Units complete in any order; {@link #map} always reports them in input
 * order. A failing unit never cancels its siblings.
 */
public class FanOut implements AutoCloseable {

    private final ExecutorService pool;

    public FanOut(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1");
        }
        this.pool = Executors.newFixedThreadPool(workers,
                new ThreadFactoryBuilder().setNameFormat("harvest-worker-%d").setDaemon(true).build());
    }

    public <I, O> List<UnitOutcome<I, O>> map(List<I> inputs, Function<? super I, ? extends O> task) {
        List<Future<O>> futures = new ArrayList<>(inputs.size());
        for (I input : inputs) {
            Callable<O> unit = () -> task.apply(input);
            futures.add(pool.submit(unit));
        }

        List<UnitOutcome<I, O>> outcomes = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            I input = inputs.get(i);
            try {
                outcomes.add(UnitOutcome.success(input, futures.get(i).get()));
            } catch (ExecutionException e) {
                outcomes.add(UnitOutcome.failure(input, e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for fan-out units", e);
            }
        }
        return outcomes;
    }

    /**
     * Concatenates per-input lists, keeping input order.
     */
    public static <T> List<T> flatten(List<? extends List<? extends T>> nested) {
        List<T> flat = new ArrayList<>();
        for (List<? extends T> part : nested) {
            flat.addAll(part);
        }
        return flat;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }
}
