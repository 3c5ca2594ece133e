package org.surveygrid.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Sleeps for a fixed interval, regardless of how the previous fetch went.
 */
public class FixedDelayPacer implements Pacer {

    private static final Logger LOG = LoggerFactory.getLogger(FixedDelayPacer.class);

    private final Duration delay;

    public FixedDelayPacer(Duration delay) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        this.delay = delay;
    }

    @Override
    public void pause() throws InterruptedException {
        LOG.trace("Pausing {} ms before next fetch", delay.toMillis());
        Thread.sleep(delay.toMillis());
    }

    public Duration getDelay() {
        return delay;
    }
}
