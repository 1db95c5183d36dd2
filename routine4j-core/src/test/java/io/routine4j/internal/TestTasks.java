package io.routine4j.internal;

import io.routine4j.JobTask;
import io.routine4j.TaskContext;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

final class TestTasks {

    private TestTasks() {
    }

    static JobTask failing(String name, String message) {
        return task(name, ctx -> {
            ctx.out().println("starting");
            throw new IllegalStateException(message);
        });
    }

    static JobTask sleeping(String name, long millis) {
        return task(name, ctx -> Thread.sleep(millis));
    }

    static JobTask chatty(String name, int chars) {
        return task(name, ctx -> ctx.out().print("x".repeat(chars)));
    }

    /**
     * Keeps running for {@code millis} even when interrupted. Tracks how many copies run at once.
     */
    static JobTask stubborn(String name, long millis, AtomicInteger active, AtomicInteger maxActive) {
        return task(name, ctx -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                long end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
                while (System.nanoTime() < end) {
                    Thread.interrupted();
                    Thread.onSpinWait();
                }
            } finally {
                active.decrementAndGet();
            }
        });
    }

    /**
     * Signals {@code started}, then blocks until {@code release} opens.
     */
    static JobTask gated(String name, CountDownLatch started, CountDownLatch release) {
        return task(name, ctx -> {
            started.countDown();
            if (!release.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate never opened");
            }
            ctx.out().print("released");
        });
    }

    interface Body {
        void run(TaskContext ctx) throws Exception;
    }

    static JobTask task(String name, Body body) {
        return new JobTask() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void execute(TaskContext context) throws Exception {
                body.run(context);
            }
        };
    }

    static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
