package org.surveygrid;

import org.surveygrid.models.PairResult;
import org.surveygrid.models.RawObservation;
import org.surveygrid.models.RunSummary;
import org.surveygrid.models.SimplifiedRecord;
import org.surveygrid.models.SurveyYear;
import org.surveygrid.models.YearRange;
import org.surveygrid.pipeline.FetchOrchestrator;
import org.surveygrid.pipeline.Pacer;
import org.surveygrid.sinks.AggregateSink;
import org.surveygrid.sinks.JdbcAggregateSink;
import org.surveygrid.sinks.PersistenceException;
import org.surveygrid.sinks.StoreConnector;
import org.surveygrid.source.ObservationSource;
import org.surveygrid.source.UpstreamFetchException;
import org.surveygrid.utils.ConfigurationException;
import org.surveygrid.utils.GeoUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.surveygrid.TestObservations.observation;
import static org.surveygrid.TestObservations.observationAt;

class FetchOrchestratorTest {

    private static final List<String> SURVEYS = Arrays.asList("NBS", "EBS");

    private final List<String> events = new ArrayList<>();
    private final Map<SurveyYear, List<RawObservation>> data = new HashMap<>();
    private final Map<SurveyYear, List<SimplifiedRecord>> persisted = new HashMap<>();

    private final ObservationSource source = (survey, year, presenceOnly) -> {
        events.add("fetch " + survey + "/" + year);
        assertThat(presenceOnly).isFalse();
        return data.getOrDefault(new SurveyYear(survey, year), Collections.emptyList()).iterator();
    };

    private final AggregateSink sink = (unit, records) -> {
        List<SimplifiedRecord> rows = new ArrayList<>();
        records.forEach(rows::add);
        persisted.put(unit, rows);
        return rows.size();
    };

    private final Pacer pacer = () -> events.add("pause");

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void testPlanIsYearMajor() {
        List<SurveyYear> plan = FetchOrchestrator.plan(SURVEYS, new YearRange(2020, 2021));

        assertThat(plan).containsExactly(
                new SurveyYear("NBS", 2020), new SurveyYear("EBS", 2020),
                new SurveyYear("NBS", 2021), new SurveyYear("EBS", 2021));
    }

    @Test
    void testOneFetchPerPairWithPausesBetween() {
        RunSummary summary = new FetchOrchestrator(source, sink, pacer, 5)
                .run(SURVEYS, new YearRange(2019, 2021));

        assertThat(events).containsExactly(
                "fetch NBS/2019", "pause", "fetch EBS/2019", "pause",
                "fetch NBS/2020", "pause", "fetch EBS/2020", "pause",
                "fetch NBS/2021", "pause", "fetch EBS/2021");
        assertThat(summary.isSuccessful()).isTrue();
        assertThat(summary.getCompletedPairs()).hasSize(6);
    }

    @Test
    void testSinglePairHasNoPause() {
        new FetchOrchestrator(source, sink, pacer, 5)
                .run(Collections.singletonList("GOA"), new YearRange(2021, 2021));

        assertThat(events).containsExactly("fetch GOA/2021");
    }

    @Test
    void testPipelineAggregatesPerPair() {
        data.put(new SurveyYear("EBS", 2021), Arrays.asList(
                observation("EBS", 2021, "cod", 6.0, 2.0, 10.0, 4L),
                observation("EBS", 2021, "cod", 8.0, 3.0, 5.0, 1L),
                observation("EBS", 2021, "cod", null, 3.0, 5.0, 1L),
                observation("EBS", 2021, "pollock", 7.0, 2.5, 50.0, 100L)));

        RunSummary summary = new FetchOrchestrator(source, sink, pacer, 5)
                .run(Collections.singletonList("EBS"), new YearRange(2021, 2021));

        PairResult result = summary.getResults().get(0);
        assertThat(result.getFetched()).isEqualTo(4);
        assertThat(result.getDropped()).isEqualTo(1);
        assertThat(result.getPersisted()).isEqualTo(2);

        List<SimplifiedRecord> rows = persisted.get(new SurveyYear("EBS", 2021));
        assertThat(rows).hasSize(2);
        SimplifiedRecord cod = rows.stream().filter(r -> r.getSpecies().equals("cod")).findFirst().get();
        assertThat(cod.getNumAggregated()).isEqualTo(2);
        assertThat(cod.getSurfaceTemperature()).isCloseTo(7.0, within(1e-9));
        assertThat(cod.getWeight()).isCloseTo(15.0, within(1e-9));
        assertThat(cod.getCount()).isEqualTo(5);
    }

    @Test
    void testUpstreamFailureIsolatedToPair() {
        ObservationSource flaky = (survey, year, presenceOnly) -> {
            events.add("fetch " + survey + "/" + year);
            if (survey.equals("EBS") && year == 2020) {
                throw new UpstreamFetchException("HTTP 503");
            }
            if (survey.equals("NBS") && year == 2021) {
                return failingAfterOne();
            }
            return Collections.singletonList(observation(survey, year, "cod")).iterator();
        };

        RunSummary summary = new FetchOrchestrator(flaky, sink, pacer, 5)
                .run(SURVEYS, new YearRange(2020, 2021));

        // Pacing is unconditional, even after failures
        assertThat(events).containsExactly(
                "fetch NBS/2020", "pause", "fetch EBS/2020", "pause",
                "fetch NBS/2021", "pause", "fetch EBS/2021");
        assertThat(summary.getFailedPairs())
                .containsExactly(new SurveyYear("EBS", 2020), new SurveyYear("NBS", 2021));
        assertThat(summary.getCompletedPairs())
                .containsExactly(new SurveyYear("NBS", 2020), new SurveyYear("EBS", 2021));
        assertThat(summary.isSuccessful()).isFalse();
        assertThat(summary.isAborted()).isFalse();
        assertThat(persisted).doesNotContainKey(new SurveyYear("NBS", 2021));
    }

    @Test
    void testOffGlobeCoordinateFailsOnlyItsPair() {
        data.put(new SurveyYear("NBS", 2021), Arrays.asList(
                observationAt(57.6491, -165.4074, "Gadus macrocephalus", 10.0),
                observationAt(91.0, -165.0, "Gadus macrocephalus", 10.0)));
        data.put(new SurveyYear("GOA", 2021), Collections.singletonList(
                observation("GOA", 2021, "cod")));

        RunSummary summary = new FetchOrchestrator(source, sink, pacer, 5)
                .run(Arrays.asList("NBS", "EBS", "GOA"), new YearRange(2021, 2021));

        assertThat(events).containsExactly(
                "fetch NBS/2021", "pause", "fetch EBS/2021", "pause", "fetch GOA/2021");
        assertThat(summary.getFailedPairs()).containsExactly(new SurveyYear("NBS", 2021));
        assertThat(summary.getCompletedPairs())
                .containsExactly(new SurveyYear("EBS", 2021), new SurveyYear("GOA", 2021));
        assertThat(summary.isAborted()).isFalse();

        PairResult failed = summary.getResults().get(0);
        assertThat(failed.getFetched()).isEqualTo(2);
        assertThat(failed.getError()).contains("lat=91.0");
        assertThat(persisted).doesNotContainKey(new SurveyYear("NBS", 2021));
        assertThat(persisted.get(new SurveyYear("GOA", 2021))).hasSize(1);
    }

    @Test
    void testPersistenceFailureAbortsRun() {
        data.put(new SurveyYear("EBS", 2020), Arrays.asList(
                observation("EBS", 2020, "cod"),
                observation("EBS", 2020, "pollock"),
                observation("EBS", 2020, "cod", null, 1.0, 1.0, 1L)));
        AggregateSink failing = (unit, records) -> {
            if (unit.getYear() == 2020 && unit.getSurvey().equals("EBS")) {
                throw new PersistenceException("disk full", new RuntimeException("disk full"));
            }
            return 0;
        };

        RunSummary summary = new FetchOrchestrator(source, failing, pacer, 5)
                .run(SURVEYS, new YearRange(2020, 2021));

        assertThat(events).containsExactly("fetch NBS/2020", "pause", "fetch EBS/2020");
        assertThat(summary.isAborted()).isTrue();
        assertThat(summary.getAbortReason()).isEqualTo("disk full");
        assertThat(summary.getCompletedPairs()).containsExactly(new SurveyYear("NBS", 2020));
        assertThat(summary.getFailedPairs()).containsExactly(new SurveyYear("EBS", 2020));
        assertThat(summary.getResults().get(1).getFetched()).isEqualTo(3);
    }

    @Test
    void testInterruptDuringPauseCancelsRun() {
        Pacer interrupting = () -> {
            events.add("pause");
            throw new InterruptedException("stop");
        };

        RunSummary summary = new FetchOrchestrator(source, sink, interrupting, 5)
                .run(SURVEYS, new YearRange(2020, 2021));

        assertThat(events).containsExactly("fetch NBS/2020", "pause");
        assertThat(summary.isCancelled()).isTrue();
        assertThat(summary.isSuccessful()).isFalse();
        assertThat(summary.getCompletedPairs()).containsExactly(new SurveyYear("NBS", 2020));
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void testInvalidPrecisionRejectedBeforeAnyFetch() {
        assertThatThrownBy(() -> new FetchOrchestrator(source, sink, pacer, 13))
                .isInstanceOf(ConfigurationException.class);
        assertThat(events).isEmpty();
    }

    @Test
    void testEndToEndIntoStore(@TempDir Path tempDir) throws Exception {
        data.put(new SurveyYear("EBS", 2021), Arrays.asList(
                observationAt(57.6491, -165.4074, "Gadus macrocephalus", 10.0),
                observationAt(57.6491, -165.4074, "Gadus macrocephalus", 30.0),
                observationAt(57.6491, -165.4074, "Hippoglossus stenolepis", 5.0)));
        String url = StoreConnector.toJdbcUrl(tempDir.resolve("e2e.db").toString());

        RunSummary summary;
        try (JdbcAggregateSink store = new JdbcAggregateSink(DriverManager.getConnection(url))) {
            store.createTable();
            summary = new FetchOrchestrator(source, store, pacer, 5)
                    .run(Collections.singletonList("EBS"), new YearRange(2021, 2021));
        }

        assertThat(summary.isSuccessful()).isTrue();
        try (Connection connection = DriverManager.getConnection(url);
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(
                     "SELECT species, geohash, weight, num_aggregated FROM records ORDER BY species")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getString("species")).isEqualTo("Gadus macrocephalus");
            assertThat(rs.getString("geohash")).isEqualTo(GeoUtils.geohash(57.6491, -165.4074, 5));
            assertThat(rs.getDouble("weight")).isCloseTo(40.0, within(1e-9));
            assertThat(rs.getInt("num_aggregated")).isEqualTo(2);

            assertThat(rs.next()).isTrue();
            assertThat(rs.getString("species")).isEqualTo("Hippoglossus stenolepis");
            assertThat(rs.getInt("num_aggregated")).isEqualTo(1);

            assertThat(rs.next()).isFalse();
        }
    }

    // Helper methods
    private static Iterator<RawObservation> failingAfterOne() {
        return new Iterator<RawObservation>() {
            private boolean served;

            @Override
            public boolean hasNext() {
                if (served) {
                    throw new UpstreamFetchException("connection reset on page 2");
                }
                return true;
            }

            @Override
            public RawObservation next() {
                served = true;
                return observation("NBS", 2021, "cod");
            }
        };
    }
}
