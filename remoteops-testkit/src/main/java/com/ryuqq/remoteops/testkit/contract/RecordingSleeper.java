package com.ryuqq.remoteops.testkit.contract;

import com.ryuqq.remoteops.application.poller.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that advances a {@link ManualClock} instead of blocking, recording every wait.
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final ManualClock clock;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    public RecordingSleeper(ManualClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        clock.advance(duration);
    }

    public List<Duration> getSleeps() {
        return List.copyOf(sleeps);
    }

    public int getSleepCount() {
        return sleeps.size();
    }

    public Duration getTotalSlept() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }

    public void clear() {
        sleeps.clear();
    }
}
