package com.marketpool.adapter;

import com.marketpool.error.TransientFetchException;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Fixed pause between consecutive requests to the same platform.
 */
public final class CoolDown {

    public static final CoolDown NONE = new CoolDown(Duration.ZERO);

    private final Duration delay;

    private CoolDown(Duration delay) {
        this.delay = delay;
    }

    public static CoolDown of(Duration delay) {
        return delay.isZero() || delay.isNegative() ? NONE : new CoolDown(delay);
    }

    public static CoolDown ofMillis(long millis) {
        return of(Duration.ofMillis(millis));
    }

    public Duration getDelay() {
        return delay;
    }

    public void pause() {
        if (delay.isZero()) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFetchException("Interrupted during cool-down");
        }
    }
}
