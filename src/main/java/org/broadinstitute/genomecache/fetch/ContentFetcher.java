package org.broadinstitute.genomecache.fetch;

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.DateUtils;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.inventory.RevalidationToken;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Date;

/**
 * Downloads a remote resource to a local file, revalidating any previous copy with the origin first.
 *
 * If the target exists and has stored validators, they are sent as {@code If-None-Match} and
 * {@code If-Modified-Since}. A 304 answer leaves the target alone and transfers nothing. A 200 answer is streamed
 * to a temporary sibling that is then renamed over the target, after which the new validators are stored.
 * Anything else, including a timeout, is a {@link GenomeCacheException.FetchFailure}; there is no retry here.
 *
 * {@code file:} URLs are served from the local file system, with size and modification time standing in for
 * the entity tag.
 */
public final class ContentFetcher {
    private static final Logger logger = LogManager.getLogger(ContentFetcher.class);

    private static final int BUFFER_SIZE_BYTES = 1024 * 1024;
    private static final long PROGRESS_INTERVAL_BYTES = 100L * 1024 * 1024;

    private final CloseableHttpClient client;

    public ContentFetcher(final CloseableHttpClient client) {
        this.client = Utils.nonNull(client);
    }

    /**
     * Makes {@code localTarget} a current copy of {@code url}.
     *
     * @return whether the local copy changed and how many bytes were transferred
     * @throws GenomeCacheException.FetchFailure if the origin answered with anything but 200 or 304, or the transfer failed;
     *         the existing target and its validators are untouched in that case
     */
    public FetchResult fetch(final String url, final Path localTarget) {
        Utils.nonEmpty(url, "url");
        Utils.nonNull(localTarget);
        final URI uri = parse(url);
        if ("file".equalsIgnoreCase(uri.getScheme())) {
            return fetchLocal(url, Paths.get(uri), localTarget);
        }
        return fetchHttp(url, uri, localTarget);
    }

    private FetchResult fetchHttp(final String url, final URI uri, final Path localTarget) {
        final RevalidationToken stored = Files.exists(localTarget) ? RevalidationSidecars.read(localTarget) : RevalidationToken.EMPTY;

        final HttpGet request = new HttpGet(uri);
        if (stored.getEtag() != null) {
            request.setHeader(HttpHeaders.IF_NONE_MATCH, stored.getEtag());
        }
        if (stored.getLastModified() != null) {
            request.setHeader(HttpHeaders.IF_MODIFIED_SINCE, stored.getLastModified());
        }

        logger.info("Fetching " + url + " -> " + localTarget.toUri() + (stored.isEmpty() ? "" : " (revalidating)"));
        try (final CloseableHttpResponse response = client.execute(request)) {
            final int status = response.getStatusLine().getStatusCode();
            if (status == HttpStatus.SC_NOT_MODIFIED) {
                EntityUtils.consume(response.getEntity());
                logger.info("Not modified: " + url);
                return FetchResult.notModified(localTarget, stored);
            }
            if (status != HttpStatus.SC_OK) {
                EntityUtils.consume(response.getEntity());
                throw new GenomeCacheException.FetchFailure(url, status, response.getStatusLine().getReasonPhrase());
            }
            final HttpEntity entity = response.getEntity();
            if (entity == null) {
                throw new GenomeCacheException.FetchFailure(url, status, "response has no body");
            }
            final RevalidationToken token = new RevalidationToken(
                    headerValue(response.getFirstHeader(HttpHeaders.ETAG)),
                    headerValue(response.getFirstHeader(HttpHeaders.LAST_MODIFIED)));
            final long bytes;
            try (final InputStream in = entity.getContent()) {
                bytes = streamToTarget(url, in, localTarget, entity.getContentLength());
            }
            RevalidationSidecars.write(localTarget, token);
            logger.info(String.format("Fetched %s (%d bytes)", url, bytes));
            return new FetchResult(localTarget, true, bytes, token);
        } catch (final IOException e) {
            throw new GenomeCacheException.FetchFailure(url, e);
        }
    }

    private FetchResult fetchLocal(final String url, final Path source, final Path localTarget) {
        final RevalidationToken current;
        try {
            current = new RevalidationToken(
                    "\"" + Files.size(source) + "-" + Files.getLastModifiedTime(source).toMillis() + "\"",
                    DateUtils.formatDate(new Date(Files.getLastModifiedTime(source).toMillis())));
        } catch (final NoSuchFileException e) {
            throw new GenomeCacheException.FetchFailure(url, HttpStatus.SC_NOT_FOUND, "no such file");
        } catch (final IOException e) {
            throw new GenomeCacheException.FetchFailure(url, e);
        }
        if (Files.exists(localTarget) && current.equals(RevalidationSidecars.read(localTarget))) {
            logger.info("Not modified: " + url);
            return FetchResult.notModified(localTarget, current);
        }
        logger.info("Copying " + url + " -> " + localTarget.toUri());
        final long bytes;
        try (final InputStream in = Files.newInputStream(source)) {
            bytes = streamToTarget(url, in, localTarget, Files.size(source));
        } catch (final IOException e) {
            throw new GenomeCacheException.FetchFailure(url, e);
        }
        RevalidationSidecars.write(localTarget, current);
        return new FetchResult(localTarget, true, bytes, current);
    }

    /**
     * Copies {@code in} to a temporary sibling of {@code target} and renames it into place.
     */
    private static long streamToTarget(final String url, final InputStream in, final Path target, final long expectedLength) throws IOException {
        final Path tmp = IOUtils.createSiblingTempPath(target);
        boolean moved = false;
        try {
            long total = 0;
            long sinceLastReport = 0;
            final byte[] copyBuffer = new byte[BUFFER_SIZE_BYTES];
            try (final OutputStream out = Files.newOutputStream(tmp)) {
                int bytesRead;
                while ((bytesRead = in.read(copyBuffer)) != -1) {
                    out.write(copyBuffer, 0, bytesRead);
                    total += bytesRead;
                    sinceLastReport += bytesRead;
                    if (sinceLastReport >= PROGRESS_INTERVAL_BYTES) {
                        logger.info("Bytes downloaded: " + total + (expectedLength > 0 ? " of " + expectedLength : ""));
                        sinceLastReport = 0;
                    }
                }
            }
            if (expectedLength >= 0 && total != expectedLength) {
                throw new IOException(String.format("truncated body from %s: expected %d bytes but read %d", url, expectedLength, total));
            }
            IOUtils.atomicReplace(tmp, target);
            moved = true;
            return total;
        } finally {
            if (!moved) {
                IOUtils.deleteQuietly(tmp);
            }
        }
    }

    private static String headerValue(final Header header) {
        return header == null ? null : header.getValue();
    }

    private static URI parse(final String url) {
        try {
            final URI uri = new URI(url);
            if (uri.getScheme() == null) {
                throw new GenomeCacheException.FetchFailure(url, new URISyntaxException(url, "URL has no scheme"));
            }
            return uri;
        } catch (final URISyntaxException e) {
            throw new GenomeCacheException.FetchFailure(url, e);
        }
    }
}
