package com.tuorg.programservice.service;

import com.tuorg.programservice.config.GenerationProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounded pool for blocking repository and LLM calls. Callers wait for the
 * result, so work submitted from one generation run stays ordered.
 */
@Component
public class BlockingCallExecutor {

    private final Logger log = LoggerFactory.getLogger(BlockingCallExecutor.class);

    private final ExecutorService pool;

    public BlockingCallExecutor(GenerationProperties properties) {
        int size = Math.max(1, properties.getWorkerPoolSize());
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "program-gen-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Blocking call pool started with {} threads", size);
    }

    /** Runs {@code call} on the pool and rethrows its unchecked failure as-is. */
    public <T> T call(String label, Supplier<T> call) {
        try {
            return CompletableFuture.supplyAsync(call, pool).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.debug("{} failed on worker: {}", label, cause.toString());
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw e;
        }
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) pool.shutdownNow();
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
