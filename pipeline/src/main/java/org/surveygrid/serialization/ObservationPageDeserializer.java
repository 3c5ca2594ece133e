package org.surveygrid.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.surveygrid.models.ObservationPage;
import org.surveygrid.source.UpstreamFetchException;

/**
 * JSON decoder for upstream observation pages.
 * Malformed pages are surfaced, not skipped.
 */
public class ObservationPageDeserializer {

    private final ObjectMapper mapper;

    public ObservationPageDeserializer() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
    }

    public ObservationPage deserialize(String body) {
        if (body == null || body.isBlank()) {
            throw new UpstreamFetchException("Empty response body");
        }

        ObservationPage page;
        try {
            page = mapper.readValue(body, ObservationPage.class);
        } catch (JsonProcessingException e) {
            throw new UpstreamFetchException("Malformed observation page: " + e.getOriginalMessage(), e);
        }
        if (page == null) {
            throw new UpstreamFetchException("Response body decoded to null");
        }
        return page;
    }

    /**
     * Build the JSON filter expression for a survey-year query.
     */
    public String queryFilter(String survey, int year) {
        return mapper.createObjectNode()
                .put("srvy", survey)
                .put("year", year)
                .toString();
    }
}
