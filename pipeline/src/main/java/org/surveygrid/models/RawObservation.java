package org.surveygrid.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One catch record as returned by the FOSS groundfish survey endpoint.
 * The four measurement fields are nullable; everything else is required.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RawObservation {

    private final double latitude;
    private final double longitude;
    private final String survey;
    private final double year;
    private final String scientificName;
    private final String commonName;
    private final Double surfaceTemperatureC;
    private final Double bottomTemperatureC;
    private final Double weightKg;
    private final Long count;
    private final double areaSweptHa;

    @JsonCreator
    public RawObservation(
            @JsonProperty("latitude_dd") double latitude,
            @JsonProperty("longitude_dd") double longitude,
            @JsonProperty("srvy") String survey,
            @JsonProperty("year") double year,
            @JsonProperty("scientific_name") String scientificName,
            @JsonProperty("common_name") String commonName,
            @JsonProperty("surface_temperature_c") Double surfaceTemperatureC,
            @JsonProperty("bottom_temperature_c") Double bottomTemperatureC,
            @JsonProperty("weight_kg") Double weightKg,
            @JsonProperty("count") Long count,
            @JsonProperty("area_swept_ha") double areaSweptHa) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.survey = survey;
        this.year = year;
        this.scientificName = scientificName;
        this.commonName = commonName;
        this.surfaceTemperatureC = surfaceTemperatureC;
        this.bottomTemperatureC = bottomTemperatureC;
        this.weightKg = weightKg;
        this.count = count;
        this.areaSweptHa = areaSweptHa;
    }

    public double getLatitude() { return latitude; }
    public double getLongitude() { return longitude; }
    public String getSurvey() { return survey; }
    public double getYear() { return year; }
    public String getScientificName() { return scientificName; }
    public String getCommonName() { return commonName; }
    public Double getSurfaceTemperatureC() { return surfaceTemperatureC; }
    public Double getBottomTemperatureC() { return bottomTemperatureC; }
    public Double getWeightKg() { return weightKg; }
    public Long getCount() { return count; }
    public double getAreaSweptHa() { return areaSweptHa; }

    /**
     * True when the record reports an actual catch (non-zero count or weight).
     */
    public boolean isPresence() {
        return (count != null && count > 0) || (weightKg != null && weightKg > 0);
    }

    @Override
    public String toString() {
        return String.format("RawObservation{srvy=%s, year=%.1f, species='%s', lat=%.4f, lon=%.4f}",
                survey, year, scientificName, latitude, longitude);
    }
}
