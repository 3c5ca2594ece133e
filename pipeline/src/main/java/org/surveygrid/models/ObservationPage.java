package org.surveygrid.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of an upstream query response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ObservationPage {

    @JsonProperty("items")
    private List<RawObservation> items = new ArrayList<>();

    @JsonProperty("hasMore")
    private boolean hasMore;

    @JsonProperty("offset")
    private int offset;

    // Default constructor for Jackson
    public ObservationPage() {}

    public List<RawObservation> getItems() { return items; }
    public boolean isHasMore() { return hasMore; }
    public int getOffset() { return offset; }

    public void setItems(List<RawObservation> items) {
        this.items = items == null ? new ArrayList<>() : items;
    }
    public void setHasMore(boolean hasMore) { this.hasMore = hasMore; }
    public void setOffset(int offset) { this.offset = offset; }
}
