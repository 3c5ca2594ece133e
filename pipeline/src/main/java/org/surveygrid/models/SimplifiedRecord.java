package org.surveygrid.models;

/**
 * Aggregate-ready record for one geohash cell.
 *
 * <p>Produced from exactly one {@link RawObservation} with {@code numAggregated = 1},
 * or from combining several records that share an {@link AggregateKey}.
 * Temperatures are means, weight/count/area are totals.
 */
public final class SimplifiedRecord {

    private final int year;
    private final String survey;
    private final String species;
    private final String commonName;
    private final String geohash;
    private final double surfaceTemperature;
    private final double bottomTemperature;
    private final double weight;
    private final long count;
    private final double areaSwept;
    private final int numAggregated;

    public SimplifiedRecord(int year, String survey, String species, String commonName, String geohash,
                            double surfaceTemperature, double bottomTemperature, double weight,
                            long count, double areaSwept, int numAggregated) {
        this.year = year;
        this.survey = survey;
        this.species = species;
        this.commonName = commonName;
        this.geohash = geohash;
        this.surfaceTemperature = surfaceTemperature;
        this.bottomTemperature = bottomTemperature;
        this.weight = weight;
        this.count = count;
        this.areaSwept = areaSwept;
        this.numAggregated = numAggregated;
    }

    public AggregateKey getKey() {
        return new AggregateKey(year, survey, species, geohash);
    }

    public int getYear() { return year; }
    public String getSurvey() { return survey; }
    public String getSpecies() { return species; }
    public String getCommonName() { return commonName; }
    public String getGeohash() { return geohash; }
    public double getSurfaceTemperature() { return surfaceTemperature; }
    public double getBottomTemperature() { return bottomTemperature; }
    public double getWeight() { return weight; }
    public long getCount() { return count; }
    public double getAreaSwept() { return areaSwept; }
    public int getNumAggregated() { return numAggregated; }

    @Override
    public String toString() {
        return String.format(
                "SimplifiedRecord{key=%s, surface=%.2f, bottom=%.2f, weight=%.3f, count=%d, area=%.3f, n=%d}",
                getKey(), surfaceTemperature, bottomTemperature, weight, count, areaSwept, numAggregated);
    }
}
