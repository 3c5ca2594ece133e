package org.surveygrid.pipeline;

/**
 * Delay applied between consecutive upstream fetches.
 */
@FunctionalInterface
public interface Pacer {

    /**
     * Block until the next fetch may start.
     *
     * @throws InterruptedException if the run is being cancelled
     */
    void pause() throws InterruptedException;
}
