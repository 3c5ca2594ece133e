package org.surveygrid.sinks;

import org.surveygrid.models.SimplifiedRecord;
import org.surveygrid.models.SurveyYear;

/**
 * Destination for finalized aggregates. One call per unit of work; either every
 * record of the call is stored or none is.
 */
public interface AggregateSink {

    /**
     * @return number of rows written
     * @throws PersistenceException if the batch could not be committed
     */
    int persist(SurveyYear unit, Iterable<SimplifiedRecord> records);
}
