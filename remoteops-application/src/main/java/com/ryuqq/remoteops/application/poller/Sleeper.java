package com.ryuqq.remoteops.application.poller;

import java.time.Duration;

/**
 * 폴링 간 대기 추상화.
 *
 * <p>JobPoller의 유일한 대기 지점입니다. 테스트에서는 실제로 잠들지 않고
 * 주입된 시계를 앞당기는 구현으로 대체합니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 주어진 시간 동안 대기.
     *
     * @param duration 대기 시간
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * 현재 스레드를 블로킹하는 기본 구현.
     *
     * @return {@link Thread#sleep(long, int)} 기반 Sleeper
     */
    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
    }
}
