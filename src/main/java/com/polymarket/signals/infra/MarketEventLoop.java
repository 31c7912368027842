package com.polymarket.signals.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-threaded scheduler that owns all market state. Socket callbacks,
 * timers, routing, detection and execution continuations are all hopped onto
 * this loop, so the market and position maps are only ever touched by one
 * thread.
 * <p>
 * A task that throws is logged and dropped; the loop keeps running.
 */
@Slf4j
public class MarketEventLoop implements Executor {

    private static final ThreadLocal<Boolean> ON_LOOP = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final ScheduledExecutorService scheduler;

    public MarketEventLoop() {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "market-event-loop");
            t.setDaemon(true);
            return t;
        }));
    }

    public MarketEventLoop(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void execute(Runnable task) {
        scheduler.execute(guard(task));
    }

    /**
     * Runs the task on the loop after everything already queued and blocks
     * until it has finished. Called from the loop itself, the task runs
     * inline. Once the loop is shut down the task runs on the caller.
     */
    public void runAndWait(Runnable task, long timeoutMillis) {
        if (ON_LOOP.get()) {
            task.run();
            return;
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            execute(() -> {
                try {
                    task.run();
                    done.complete(null);
                } catch (RuntimeException e) {
                    done.completeExceptionally(e);
                    throw e;
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Event loop is shut down, running task on {}", Thread.currentThread().getName());
            task.run();
            return;
        }
        try {
            done.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Event loop task failed", e.getCause());
        } catch (TimeoutException e) {
            log.warn("Event loop task did not finish within {} ms", timeoutMillis);
        }
    }

    public ScheduledFuture<?> schedule(Runnable task, long delayMillis) {
        return scheduler.schedule(guard(task), delayMillis, TimeUnit.MILLISECONDS);
    }

    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, long periodMillis) {
        return scheduler.scheduleAtFixedRate(guard(task), periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    public void shutdown() {
        scheduler.shutdownNow();
    }

    private static Runnable guard(Runnable task) {
        return () -> {
            boolean nested = ON_LOOP.get();
            ON_LOOP.set(Boolean.TRUE);
            try {
                task.run();
            } catch (Exception e) {
                log.error("Event loop task failed", e);
            } finally {
                ON_LOOP.set(nested);
            }
        };
    }
}
