package org.surveygrid.models;

import java.util.Objects;

/**
 * Identity of one output row: (year, survey, species, geohash).
 */
public final class AggregateKey {

    private final int year;
    private final String survey;
    private final String species;
    private final String geohash;

    public AggregateKey(int year, String survey, String species, String geohash) {
        this.year = year;
        this.survey = survey;
        this.species = species;
        this.geohash = geohash;
    }

    public int getYear() { return year; }
    public String getSurvey() { return survey; }
    public String getSpecies() { return species; }
    public String getGeohash() { return geohash; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateKey)) return false;
        AggregateKey that = (AggregateKey) o;
        return year == that.year
                && Objects.equals(survey, that.survey)
                && Objects.equals(species, that.species)
                && Objects.equals(geohash, that.geohash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, survey, species, geohash);
    }

    @Override
    public String toString() {
        return year + "/" + survey + "/" + species + "/" + geohash;
    }
}
