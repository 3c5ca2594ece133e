package org.surveygrid.source;

import org.surveygrid.models.ObservationPage;
import org.surveygrid.models.RawObservation;
import org.surveygrid.serialization.ObservationPageDeserializer;
import org.surveygrid.utils.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Pages through the FOSS groundfish survey REST endpoint.
 *
 * <p>Pages are requested on demand as the returned iterator is consumed, so only
 * one page is held in memory at a time.
 */
public class FossApiSource implements ObservationSource {

    private static final Logger LOG = LoggerFactory.getLogger(FossApiSource.class);

    private final String baseUrl;
    private final int pageSize;
    private final PageFetcher fetcher;
    private final ObservationPageDeserializer deserializer = new ObservationPageDeserializer();

    public FossApiSource(String baseUrl, int pageSize, PageFetcher fetcher) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.baseUrl = baseUrl;
        this.pageSize = pageSize;
        this.fetcher = fetcher;
    }

    public static FossApiSource fromConfig() {
        return new FossApiSource(
                ConfigLoader.fossApiUrl(),
                ConfigLoader.fossPageSize(),
                new HttpPageFetcher(
                        Duration.ofSeconds(ConfigLoader.fossTimeoutSeconds()),
                        ConfigLoader.fossMaxRetries(),
                        ConfigLoader.fossRetryDelayMs()));
    }

    @Override
    public Iterator<RawObservation> fetch(String survey, int year, boolean presenceOnly) {
        return new PagingIterator(survey, year, presenceOnly);
    }

    URI pageUri(String survey, int year, int offset) {
        String query = "q=" + URLEncoder.encode(deserializer.queryFilter(survey, year), StandardCharsets.UTF_8)
                + "&offset=" + offset
                + "&limit=" + pageSize;
        String separator = baseUrl.contains("?") ? "&" : "?";
        return URI.create(baseUrl + separator + query);
    }

    private class PagingIterator implements Iterator<RawObservation> {

        private final String survey;
        private final int year;
        private final boolean presenceOnly;

        private Iterator<RawObservation> current = Collections.emptyIterator();
        private int offset = 0;
        private int pages = 0;
        private boolean hasMore = true;

        PagingIterator(String survey, int year, boolean presenceOnly) {
            this.survey = survey;
            this.year = year;
            this.presenceOnly = presenceOnly;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext() && hasMore) {
                fetchNextPage();
            }
            return current.hasNext();
        }

        @Override
        public RawObservation next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        private void fetchNextPage() {
            URI uri = pageUri(survey, year, offset);
            String body;
            try {
                body = fetcher.fetch(uri);
            } catch (IOException e) {
                throw new UpstreamFetchException("Failed to fetch " + uri, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamFetchException("Interrupted while fetching " + uri, e);
            }

            ObservationPage page = deserializer.deserialize(body);
            List<RawObservation> items = page.getItems();
            pages++;
            offset += items.size();
            // An empty page ends the query even if the server claims more.
            hasMore = page.isHasMore() && !items.isEmpty();
            LOG.debug("{}/{} page {}: {} items, hasMore={}", survey, year, pages, items.size(), hasMore);

            if (presenceOnly) {
                items = items.stream().filter(RawObservation::isPresence).collect(Collectors.toList());
            }
            current = items.iterator();
        }
    }
}
