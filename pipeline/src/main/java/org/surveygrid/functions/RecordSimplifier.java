package org.surveygrid.functions;

import org.surveygrid.models.RawObservation;
import org.surveygrid.models.SimplifiedRecord;
import org.surveygrid.utils.GeoUtils;

import java.util.Optional;

/**
 * Narrows a {@link RawObservation} into a single-observation {@link SimplifiedRecord}.
 *
 * <p>Observations missing surface temperature, bottom temperature, weight or count
 * are dropped. Missing values are never substituted. Years round half to even.
 */
public class RecordSimplifier {

    public Optional<SimplifiedRecord> simplify(RawObservation obs, int precision) {
        String geohash = GeoUtils.geohash(obs.getLatitude(), obs.getLongitude(), precision);

        Double surfaceTemperature = obs.getSurfaceTemperatureC();
        if (surfaceTemperature == null) {
            return Optional.empty();
        }

        Double bottomTemperature = obs.getBottomTemperatureC();
        if (bottomTemperature == null) {
            return Optional.empty();
        }

        Double weight = obs.getWeightKg();
        if (weight == null) {
            return Optional.empty();
        }

        Long count = obs.getCount();
        if (count == null) {
            return Optional.empty();
        }

        return Optional.of(new SimplifiedRecord(
                (int) Math.rint(obs.getYear()),
                obs.getSurvey(),
                obs.getScientificName(),
                obs.getCommonName(),
                geohash,
                surfaceTemperature,
                bottomTemperature,
                weight,
                count,
                obs.getAreaSweptHa(),
                1
        ));
    }
}
