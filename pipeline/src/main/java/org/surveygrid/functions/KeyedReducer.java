package org.surveygrid.functions;

import org.apache.flink.api.common.functions.AggregateFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Single-pass group-by-key reduction over a bounded input.
 *
 * <p>Holds one accumulator per distinct key seen during a {@link #reduce} call and
 * emits one result per key, in first-seen order, once the input is exhausted.
 * The accumulators are dropped when the call returns, whether or not it succeeded,
 * so memory is bounded by the distinct keys of a single unit of work.
 *
 * <p>Not thread-safe: a reducer belongs to one consuming thread.
 */
public class KeyedReducer<IN, KEY, ACC, OUT> {

    private static final Logger LOG = LoggerFactory.getLogger(KeyedReducer.class);

    private final Function<IN, KEY> keySelector;
    private final AggregateFunction<IN, ACC, OUT> aggregateFunction;
    private final Map<KEY, ACC> accumulators = new LinkedHashMap<>();

    public KeyedReducer(Function<IN, KEY> keySelector, AggregateFunction<IN, ACC, OUT> aggregateFunction) {
        this.keySelector = keySelector;
        this.aggregateFunction = aggregateFunction;
    }

    /**
     * Fold every input into its key's accumulator, then emit the results.
     *
     * @return number of inputs consumed
     */
    public long reduce(Iterator<? extends IN> input, Collector<OUT> out) {
        long consumed = 0;
        try {
            while (input.hasNext()) {
                IN value = input.next();
                KEY key = keySelector.apply(value);
                ACC acc = accumulators.get(key);
                if (acc == null) {
                    acc = aggregateFunction.createAccumulator();
                }
                accumulators.put(key, aggregateFunction.add(value, acc));
                consumed++;
            }

            LOG.debug("Reduced {} inputs into {} keys", consumed, accumulators.size());
            for (ACC acc : accumulators.values()) {
                OUT result = aggregateFunction.getResult(acc);
                if (result != null) {
                    out.collect(result);
                }
            }
            return consumed;
        } finally {
            accumulators.clear();
        }
    }

    /**
     * Number of accumulators currently held. Zero outside of {@link #reduce}.
     */
    public int openAccumulators() {
        return accumulators.size();
    }
}
