package org.surveygrid.functions;

import org.apache.flink.api.common.functions.AggregateFunction;
import org.surveygrid.models.AggregateKey;
import org.surveygrid.models.SimplifiedRecord;

import java.io.Serializable;

/**
 * Combines {@link SimplifiedRecord}s that share an {@link AggregateKey}.
 *
 * <p>Combine rule, applied field by field:
 * <ul>
 *   <li>numAggregated, weight, count, area swept: summed</li>
 *   <li>surface and bottom temperature: mean weighted by numAggregated</li>
 *   <li>common name: lexicographically smallest non-null value</li>
 * </ul>
 * Temperatures are held as weighted sums in the accumulator and divided only in
 * {@link #getResult}, so the result does not depend on the order of add/merge calls.
 */
public class CellAggregateFunction
        implements AggregateFunction<SimplifiedRecord, CellAggregateFunction.CellAccumulator, SimplifiedRecord> {

    private static final long serialVersionUID = 1L;

    @Override
    public CellAccumulator createAccumulator() {
        return new CellAccumulator();
    }

    @Override
    public CellAccumulator add(SimplifiedRecord record, CellAccumulator acc) {
        AggregateKey key = record.getKey();
        if (acc.key == null) {
            acc.key = key;
        } else if (!acc.key.equals(key)) {
            throw new KeyMismatchException(acc.key, key);
        }

        int n = record.getNumAggregated();
        acc.commonName = smallerName(acc.commonName, record.getCommonName());
        acc.surfaceTemperatureSum += record.getSurfaceTemperature() * n;
        acc.bottomTemperatureSum += record.getBottomTemperature() * n;
        acc.weight += record.getWeight();
        acc.count += record.getCount();
        acc.areaSwept += record.getAreaSwept();
        acc.numAggregated += n;
        return acc;
    }

    @Override
    public SimplifiedRecord getResult(CellAccumulator acc) {
        if (acc.numAggregated == 0) {
            return null;
        }

        return new SimplifiedRecord(
                acc.key.getYear(),
                acc.key.getSurvey(),
                acc.key.getSpecies(),
                acc.commonName,
                acc.key.getGeohash(),
                acc.surfaceTemperatureSum / acc.numAggregated,
                acc.bottomTemperatureSum / acc.numAggregated,
                acc.weight,
                acc.count,
                acc.areaSwept,
                acc.numAggregated
        );
    }

    @Override
    public CellAccumulator merge(CellAccumulator a, CellAccumulator b) {
        if (b.key == null) {
            return a;
        }
        if (a.key == null) {
            return b;
        }
        if (!a.key.equals(b.key)) {
            throw new KeyMismatchException(a.key, b.key);
        }

        a.commonName = smallerName(a.commonName, b.commonName);
        a.surfaceTemperatureSum += b.surfaceTemperatureSum;
        a.bottomTemperatureSum += b.bottomTemperatureSum;
        a.weight += b.weight;
        a.count += b.count;
        a.areaSwept += b.areaSwept;
        a.numAggregated += b.numAggregated;
        return a;
    }

    /**
     * Pairwise combine of two records with equal keys.
     *
     * @throws KeyMismatchException if the keys differ
     */
    public SimplifiedRecord combine(SimplifiedRecord a, SimplifiedRecord b) {
        CellAccumulator left = add(a, createAccumulator());
        CellAccumulator right = add(b, createAccumulator());
        return getResult(merge(left, right));
    }

    private static String smallerName(String current, String candidate) {
        if (current == null) return candidate;
        if (candidate == null) return current;
        return candidate.compareTo(current) < 0 ? candidate : current;
    }

    /**
     * Running state for one geohash cell.
     * Static and public like other Flink accumulators.
     */
    public static class CellAccumulator implements Serializable {
        private static final long serialVersionUID = 1L;

        public AggregateKey key;
        public String commonName;
        public double surfaceTemperatureSum = 0.0;
        public double bottomTemperatureSum = 0.0;
        public double weight = 0.0;
        public long count = 0;
        public double areaSwept = 0.0;
        public int numAggregated = 0;
    }
}
