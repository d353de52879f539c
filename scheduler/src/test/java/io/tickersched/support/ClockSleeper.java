package io.tickersched.support;

import io.tickersched.runtime.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Advances a {@link TestClock} instead of blocking and remembers every requested wait. */
public class ClockSleeper implements Sleeper {
    private final TestClock clock;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    public ClockSleeper(TestClock clock) { this.clock = clock; }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) throw new InterruptedException();
        sleeps.add(duration);
        clock.advance(duration);
    }

    public List<Duration> sleeps() { return sleeps; }

    public Duration total() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }
}
