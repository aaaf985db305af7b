package org.carball.pivot.validator;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Runs {@link FunctionRunner} calls on worker threads with a per-call deadline. Calls that
 * overrun are cancelled and reported as timed out; they never propagate to the caller.
 */
@Slf4j
public class TimedInvoker implements Closeable {

    private final LongSupplier nanoClock;
    private final ExecutorService executor;
    private final AtomicInteger threadCounter = new AtomicInteger();

    public TimedInvoker(LongSupplier nanoClock, String threadPrefix) {
        this.nanoClock = nanoClock;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, threadPrefix + "-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public record Outcome(Object value, double durationMs, boolean timedOut, Throwable error) {

        public boolean succeeded() {
            return !timedOut && error == null;
        }

        public String describeFailure() {
            if (timedOut) {
                return "Timed out";
            }
            if (error == null) {
                return null;
            }
            return error.getClass().getSimpleName() + ": " + error.getMessage();
        }
    }

    public Outcome call(FunctionRunner runner, List<Object> arguments, Duration timeout) {
        Future<Outcome> future = executor.submit(() -> {
            long start = nanoClock.getAsLong();
            Object value = runner.invoke(arguments);
            long elapsed = nanoClock.getAsLong() - start;
            return new Outcome(value, elapsed / 1_000_000.0, false, null);
        });

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Call with {} exceeded {}ms", arguments, timeout.toMillis());
            return new Outcome(null, 0.0, true, null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            // A runner that enforces its own deadline reports it the same way
            if (cause instanceof TimeoutException) {
                return new Outcome(null, 0.0, true, null);
            }
            log.debug("Call with {} failed: {}", arguments, cause.toString());
            return new Outcome(null, 0.0, false, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new Outcome(null, 0.0, false, e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
