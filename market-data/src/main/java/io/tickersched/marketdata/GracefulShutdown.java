package io.tickersched.marketdata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * Turns SIGINT/SIGTERM into an interrupt of the running command, then ends the JVM with the command's own exit
 * code once it has saved its state. {@code System.exit} from the command thread would block for as long as the
 * shutdown hook runs, so the hook halts the JVM itself.
 */
final class GracefulShutdown {
    private static final Logger log = LoggerFactory.getLogger(GracefulShutdown.class);
    static final Duration GRACE = Duration.ofSeconds(30);

    private final Thread worker;
    private final Duration grace;
    private final IntConsumer halt;
    private final CountDownLatch done = new CountDownLatch(1);
    private final AtomicInteger exitCode = new AtomicInteger(SchedulerMain.EXIT_INTERRUPTED);
    private final AtomicBoolean signalled = new AtomicBoolean();
    private volatile Thread hook;

    GracefulShutdown(Thread worker, Duration grace, IntConsumer halt) {
        this.worker = worker;
        this.grace = grace;
        this.halt = halt;
    }

    static GracefulShutdown install(Thread worker) {
        GracefulShutdown shutdown = new GracefulShutdown(worker, GRACE, code -> Runtime.getRuntime().halt(code));
        Thread hook = new Thread(shutdown::onSignal, "scheduler-shutdown");
        shutdown.hook = hook;
        Runtime.getRuntime().addShutdownHook(hook);
        return shutdown;
    }

    /** Hook body: interrupt the worker and wait for {@link #finished(int)}. */
    void onSignal() {
        signalled.set(true);
        log.info("Shutdown requested; stopping after the current item");
        worker.interrupt();
        try {
            if (done.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                halt.accept(exitCode.get());
            } else {
                log.warn("Run did not stop within {}; progress up to the last recorded item is kept", grace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Called by the worker once its state is on disk. */
    void finished(int code) {
        exitCode.set(code);
        done.countDown();
        Thread h = hook;
        if (h == null || signalled.get()) return;
        try {
            Runtime.getRuntime().removeShutdownHook(h);
        } catch (IllegalStateException shuttingDown) {
            log.debug("JVM shutdown already in progress");
        }
    }
}
