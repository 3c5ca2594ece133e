package org.surveygrid;

import org.apache.flink.api.common.functions.util.ListCollector;
import org.surveygrid.functions.CellAggregateFunction;
import org.surveygrid.functions.KeyedReducer;
import org.surveygrid.models.AggregateKey;
import org.surveygrid.models.SimplifiedRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.surveygrid.TestObservations.record;

class KeyedReducerTest {

    private KeyedReducer<SimplifiedRecord, AggregateKey, CellAggregateFunction.CellAccumulator, SimplifiedRecord> reducer;

    @BeforeEach
    void setUp() {
        reducer = new KeyedReducer<>(SimplifiedRecord::getKey, new CellAggregateFunction());
    }

    @Test
    void testOneOutputPerDistinctKey() {
        List<SimplifiedRecord> input = Arrays.asList(
                record("cod", "b6fkq", 6.0, 2.0, 1.0, 1, 1.0),
                record("pollock", "b6fkq", 6.0, 2.0, 1.0, 1, 1.0),
                record("cod", "b6fkr", 6.0, 2.0, 1.0, 1, 1.0),
                record("cod", "b6fkq", 7.0, 2.0, 1.0, 1, 1.0),
                record("cod", "b6fkq", 8.0, 2.0, 1.0, 1, 1.0),
                record("pollock", "b6fkq", 6.0, 2.0, 1.0, 1, 1.0));

        List<SimplifiedRecord> output = new ArrayList<>();
        long consumed = reducer.reduce(input.iterator(), new ListCollector<>(output));

        assertThat(consumed).isEqualTo(6);
        assertThat(output).hasSize(3);
        assertThat(output).extracting(SimplifiedRecord::getKey).doesNotHaveDuplicates();

        Map<AggregateKey, Long> expectedCounts = input.stream()
                .collect(Collectors.groupingBy(SimplifiedRecord::getKey, Collectors.counting()));
        for (SimplifiedRecord aggregate : output) {
            assertThat((long) aggregate.getNumAggregated()).isEqualTo(expectedCounts.get(aggregate.getKey()));
        }
    }

    @Test
    void testAccumulatorsClearedAfterReduce() {
        List<SimplifiedRecord> output = new ArrayList<>();
        reducer.reduce(Collections.singletonList(record("cod", "b6fkq", 6.0, 2.0, 1.0, 1, 1.0)).iterator(),
                new ListCollector<>(output));

        assertThat(reducer.openAccumulators()).isZero();

        // A second unit of work starts from scratch
        List<SimplifiedRecord> second = new ArrayList<>();
        reducer.reduce(Collections.singletonList(record("cod", "b6fkq", 6.0, 2.0, 1.0, 1, 1.0)).iterator(),
                new ListCollector<>(second));
        assertThat(second).singleElement()
                .extracting(SimplifiedRecord::getNumAggregated).isEqualTo(1);
    }

    @Test
    void testEmptyInput() {
        List<SimplifiedRecord> output = new ArrayList<>();

        assertThat(reducer.reduce(Collections.<SimplifiedRecord>emptyIterator(), new ListCollector<>(output)))
                .isZero();
        assertThat(output).isEmpty();
    }

    @Test
    void testFailingInputEmitsNothingAndClears() {
        Iterator<SimplifiedRecord> failing = new Iterator<SimplifiedRecord>() {
            private int served = 0;

            @Override
            public boolean hasNext() {
                if (served == 2) {
                    throw new IllegalStateException("source broke");
                }
                return true;
            }

            @Override
            public SimplifiedRecord next() {
                served++;
                return record("cod", "b6fk" + served, 6.0, 2.0, 1.0, 1, 1.0);
            }
        };
        List<SimplifiedRecord> output = new ArrayList<>();

        assertThatThrownBy(() -> reducer.reduce(failing, new ListCollector<>(output)))
                .hasMessage("source broke");
        assertThat(output).isEmpty();
        assertThat(reducer.openAccumulators()).isZero();
    }
}
