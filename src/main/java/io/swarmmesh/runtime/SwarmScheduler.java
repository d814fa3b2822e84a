package io.swarmmesh.runtime;

import io.swarmmesh.observability.StructuredLogger;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.LongConsumer;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

public final class SwarmScheduler {
    private static final StructuredLogger LOG = StructuredLogger.of(SwarmScheduler.class);

    private final LongConsumer step;
    private final long tickMs;
    private final LongSupplier wallClock;
    private final BlockingQueue<Pending> commands = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread thread;

    public SwarmScheduler(LongConsumer step, long tickMs) {
        this(step, tickMs, System::currentTimeMillis);
    }

    public SwarmScheduler(LongConsumer step, long tickMs, LongSupplier wallClock) {
        this.step = step;
        this.tickMs = Math.max(1L, tickMs);
        this.wallClock = wallClock;
    }

    public static SwarmScheduler forRuntime(SwarmRuntime runtime) {
        return new SwarmScheduler(runtime::advance, runtime.settings().messageTickMs());
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread worker = new Thread(this::loop, "swarmmesh-scheduler");
        worker.setDaemon(true);
        thread = worker;
        worker.start();
    }

    public <T> CompletableFuture<T> submit(Supplier<T> command) {
        CompletableFuture<T> future = new CompletableFuture<>();
        if (!running.get()) {
            future.completeExceptionally(new IllegalStateException("Scheduler is not running"));
            return future;
        }
        commands.add(new Pending(() -> {
            try {
                future.complete(command.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        }, future::completeExceptionally));
        return future;
    }

    public boolean isRunning() {
        return running.get();
    }

    public void stop(long timeoutMs) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread worker = thread;
        if (worker != null) {
            worker.interrupt();
            try {
                worker.join(Math.max(1L, timeoutMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        Pending leftover;
        while ((leftover = commands.poll()) != null) {
            leftover.reject().accept(new IllegalStateException("Scheduler stopped before the command ran"));
        }
    }

    private void loop() {
        long nextStep = wallClock.getAsLong();
        while (running.get()) {
            try {
                // due step first, then at most one command
                long now = wallClock.getAsLong();
                if (now >= nextStep) {
                    step.accept(now);
                    nextStep = now + tickMs;
                }
                long wait = nextStep - wallClock.getAsLong();
                Pending command = wait > 0L ? commands.poll(wait, TimeUnit.MILLISECONDS) : commands.poll();
                if (command != null) {
                    command.task().run();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                LOG.error("Scheduler step failed", StructuredLogger.fields("tickMs", tickMs), e);
                nextStep = wallClock.getAsLong() + tickMs;
            }
        }
    }

    private record Pending(Runnable task, Consumer<Throwable> reject) {
    }
}
