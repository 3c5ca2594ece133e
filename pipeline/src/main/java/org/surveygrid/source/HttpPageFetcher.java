package org.surveygrid.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link PageFetcher} over the JDK HTTP client.
 * Retries 429 and 5xx responses and IO failures up to {@code maxRetries} times with a fixed delay,
 * so a request is attempted at most {@code maxRetries + 1} times.
 */
public class HttpPageFetcher implements PageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);

    private final HttpClient httpClient;
    private final Duration timeout;
    private final int maxRetries;
    private final long retryDelayMs;

    public HttpPageFetcher(Duration timeout, int maxRetries, long retryDelayMs) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.timeout = timeout;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryDelayMs = Math.max(0, retryDelayMs);
    }

    @Override
    public String fetch(URI uri) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        for (int attempt = 1; ; attempt++) {
            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                if (attempt > maxRetries) {
                    throw e;
                }
                LOG.warn("Request to {} failed: {} - retrying in {} ms (retry {}/{})",
                        uri, e.getMessage(), retryDelayMs, attempt, maxRetries);
                Thread.sleep(retryDelayMs);
                continue;
            }

            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return response.body();
            }
            if ((status == 429 || status >= 500) && attempt <= maxRetries) {
                LOG.warn("HTTP {} from {} - retrying in {} ms (retry {}/{})",
                        status, uri, retryDelayMs, attempt, maxRetries);
                Thread.sleep(retryDelayMs);
                continue;
            }
            throw new IOException("HTTP " + status + " from " + uri);
        }
    }
}
