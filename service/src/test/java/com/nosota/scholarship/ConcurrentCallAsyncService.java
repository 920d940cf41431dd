package com.nosota.scholarship;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs service calls on the test executor so several of them hit the same record at once.
 */
@Service
public class ConcurrentCallAsyncService {

    @Async("testTaskExecutor")
    public <T> CompletableFuture<T> callWhenReleased(CountDownLatch start, Supplier<T> call) {
        try {
            if (!start.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Concurrent call was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        return CompletableFuture.completedFuture(call.get());
    }
}
