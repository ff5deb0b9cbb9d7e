package com.example.catalog.task;

import io.github.resilience4j.core.registry.EntryAddedEvent;
import io.github.resilience4j.core.registry.EntryRemovedEvent;
import io.github.resilience4j.core.registry.EntryReplacedEvent;
import io.github.resilience4j.core.registry.RegistryEventConsumer;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs task bodies through the cache and the retry policy.
 *
 * The cache sits outside the retry: one fingerprint gets one computation, and
 * that computation may make up to {@code maxAttempts} attempts. Only the final
 * outcome is cached, and only when it is a success.
 */
public class TaskInvoker {

    private static final Logger log = LoggerFactory.getLogger(TaskInvoker.class);

    private final TaskCache cache;
    private final Fingerprinter fingerprinter;
    private final RetryRegistry retryRegistry;

    public TaskInvoker(TaskCache cache, Fingerprinter fingerprinter, RetryConfig retryConfig) {
        this.cache = cache;
        this.fingerprinter = fingerprinter;
        this.retryRegistry = RetryRegistry.of(retryConfig, new RetryLogging());
    }

    public <T> T invoke(TaskSpec spec, Map<String, ?> arguments, Supplier<T> body) {
        Fingerprint fingerprint = fingerprinter.fingerprint(spec, arguments);
        return cache.getOrCompute(fingerprint, () -> withRetry(spec, fingerprint, body));
    }

    private <T> T withRetry(TaskSpec spec, Fingerprint fingerprint, Supplier<T> body) {
        Retry retry = retryRegistry.retry(spec.name());
        Supplier<T> decorated = Retry.decorateSupplier(retry, () -> {
            log.debug("Running {}", fingerprint);
            return body.get();
        });
        return decorated.get();
    }

    public TaskCache cache() {
        return cache;
    }

    private static final class RetryLogging implements RegistryEventConsumer<Retry> {

        @Override
        public void onEntryAddedEvent(EntryAddedEvent<Retry> event) {
            attach(event.getAddedEntry());
        }

        @Override
        public void onEntryRemovedEvent(EntryRemovedEvent<Retry> event) {
            // publisher goes away with the entry
        }

        @Override
        public void onEntryReplacedEvent(EntryReplacedEvent<Retry> event) {
            attach(event.getNewEntry());
        }

        private static void attach(Retry retry) {
            retry.getEventPublisher()
                    .onRetry(e -> log.warn("{} attempt {} failed, retrying: {}",
                            retry.getName(), e.getNumberOfRetryAttempts(), String.valueOf(e.getLastThrowable())))
                    .onError(e -> log.warn("{} failed after {} attempt(s): {}",
                            retry.getName(), e.getNumberOfRetryAttempts(), String.valueOf(e.getLastThrowable())));
        }
    }
}
