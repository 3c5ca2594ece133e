package org.surveygrid.pipeline;

import org.apache.flink.api.common.functions.util.ListCollector;
import org.surveygrid.functions.CellAggregateFunction;
import org.surveygrid.functions.KeyedReducer;
import org.surveygrid.functions.RecordSimplifier;
import org.surveygrid.models.AggregateKey;
import org.surveygrid.models.PairResult;
import org.surveygrid.models.RawObservation;
import org.surveygrid.models.RunSummary;
import org.surveygrid.models.SimplifiedRecord;
import org.surveygrid.models.SurveyYear;
import org.surveygrid.models.YearRange;
import org.surveygrid.sinks.AggregateSink;
import org.surveygrid.sinks.PersistenceException;
import org.surveygrid.source.ObservationSource;
import org.surveygrid.source.UpstreamFetchException;
import org.surveygrid.utils.GeoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Drives the fetch, reduce and persist cycle over every (survey, year) pair.
 *
 * <p>Pairs run strictly one after another, years in the outer loop and surveys in
 * the inner loop. The {@link Pacer} runs exactly once between consecutive pairs,
 * whatever the outcome of the previous one.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>{@link UpstreamFetchException}, including a record with an off-globe coordinate:
 *       the pair is recorded as failed and the run continues</li>
 *   <li>{@link PersistenceException}: the pair was rolled back and the run stops</li>
 *   <li>interruption: the run stops before the next pair and is reported as cancelled</li>
 * </ul>
 */
public class FetchOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(FetchOrchestrator.class);

    private final ObservationSource source;
    private final AggregateSink sink;
    private final Pacer pacer;
    private final int precision;
    private final RecordSimplifier simplifier = new RecordSimplifier();
    private final KeyedReducer<SimplifiedRecord, AggregateKey, CellAggregateFunction.CellAccumulator, SimplifiedRecord> reducer =
            new KeyedReducer<>(SimplifiedRecord::getKey, new CellAggregateFunction());

    public FetchOrchestrator(ObservationSource source, AggregateSink sink, Pacer pacer, int precision) {
        GeoUtils.requireValidPrecision(precision);
        this.source = source;
        this.sink = sink;
        this.pacer = pacer;
        this.precision = precision;
    }

    /**
     * Deterministic processing order: year-major, then surveys in the given order.
     */
    public static List<SurveyYear> plan(List<String> surveys, YearRange years) {
        return years.years()
                .boxed()
                .flatMap(year -> surveys.stream().map(survey -> new SurveyYear(survey, year)))
                .collect(Collectors.toList());
    }

    public RunSummary run(List<String> surveys, YearRange years) {
        List<SurveyYear> pairs = plan(surveys, years);
        List<PairResult> results = new ArrayList<>();
        boolean cancelled = false;
        String abortReason = null;

        LOG.info("Starting download of {} pairs ({} surveys x {}) at geohash precision {}",
                pairs.size(), surveys.size(), years, precision);

        for (int i = 0; i < pairs.size(); i++) {
            if (i > 0) {
                try {
                    pacer.pause();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (Thread.currentThread().isInterrupted()) {
                LOG.warn("Interrupted; cancelling with {} pairs remaining", pairs.size() - i);
                cancelled = true;
                break;
            }

            SurveyYear pair = pairs.get(i);
            AtomicLong fetched = new AtomicLong();
            try {
                PairResult result = process(pair, fetched);
                results.add(result);
            } catch (PersistenceException e) {
                results.add(PairResult.failed(pair, fetched.get(), e));
                abortReason = e.getMessage();
                LOG.error("Aborting run: {}", abortReason, e);
                break;
            }
        }

        RunSummary summary = new RunSummary(pairs, results, cancelled, abortReason);
        if (!summary.getFailedPairs().isEmpty()) {
            LOG.warn("Pairs needing manual retry: {}", summary.getFailedPairs());
        }
        LOG.info("Finished: {}", summary);
        return summary;
    }

    private PairResult process(SurveyYear pair, AtomicLong fetched) {
        List<SimplifiedRecord> aggregates = new ArrayList<>();

        LOG.debug("Fetching {}", pair);
        long simplified;
        try {
            Iterator<RawObservation> raw = source.fetch(pair.getSurvey(), pair.getYear(), false);
            Iterator<SimplifiedRecord> records = StreamSupport
                    .stream(Spliterators.spliteratorUnknownSize(raw, Spliterator.ORDERED), false)
                    .map(obs -> {
                        fetched.incrementAndGet();
                        if (!GeoUtils.isValidCoordinate(obs.getLatitude(), obs.getLongitude())) {
                            throw new UpstreamFetchException("Malformed record for " + pair
                                    + ": coordinate out of range: lat=" + obs.getLatitude()
                                    + ", lon=" + obs.getLongitude());
                        }
                        return simplifier.simplify(obs, precision);
                    })
                    .flatMap(Optional::stream)
                    .iterator();

            simplified = reducer.reduce(records, new ListCollector<>(aggregates));
        } catch (UpstreamFetchException e) {
            LOG.error("Fetch failed for {} after {} records; skipping pair for manual retry",
                    pair, fetched.get(), e);
            return PairResult.failed(pair, fetched.get(), e);
        }

        long dropped = fetched.get() - simplified;
        LOG.debug("Persisting {} aggregates for {}", aggregates.size(), pair);
        int persisted = sink.persist(pair, aggregates);

        LOG.info("Completed {} for {}: {} records, {} dropped, {} rows",
                pair.getYear(), pair.getSurvey(), fetched.get(), dropped, persisted);
        return PairResult.succeeded(pair, fetched.get(), dropped, persisted);
    }
}
