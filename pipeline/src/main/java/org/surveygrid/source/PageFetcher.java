package org.surveygrid.source;

import java.io.IOException;
import java.net.URI;

/**
 * Retrieves the body of one upstream page.
 */
@FunctionalInterface
public interface PageFetcher {

    String fetch(URI uri) throws IOException, InterruptedException;
}
