package org.surveygrid.models;

import java.util.Objects;

/**
 * One unit of work: all observations for a single survey in a single year.
 */
public final class SurveyYear {

    private final String survey;
    private final int year;

    public SurveyYear(String survey, int year) {
        this.survey = Objects.requireNonNull(survey, "survey");
        this.year = year;
    }

    public String getSurvey() { return survey; }
    public int getYear() { return year; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SurveyYear)) return false;
        SurveyYear that = (SurveyYear) o;
        return year == that.year && survey.equals(that.survey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(survey, year);
    }

    @Override
    public String toString() {
        return survey + "/" + year;
    }
}
