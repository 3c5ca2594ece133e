package org.surveygrid.source;

import org.surveygrid.models.RawObservation;

import java.util.Iterator;

/**
 * Upstream provider of raw survey observations.
 */
public interface ObservationSource {

    /**
     * Lazily stream every observation for one survey and year.
     * Failures surface as {@link UpstreamFetchException}, either from this call
     * or later from the returned iterator.
     *
     * @param presenceOnly when true, zero-catch records are excluded
     */
    Iterator<RawObservation> fetch(String survey, int year, boolean presenceOnly);
}
