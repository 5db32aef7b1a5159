package org.broadinstitute.genomecache.utils;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;

/**
 * Utilities for talking to remote genome providers over HTTP.
 *
 * Clients built here never retry and never decompress response bodies; the bytes written to disk are exactly
 * the bytes the origin served.
 */
public class HttpUtils {
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_SOCKET_TIMEOUT_MS = 300_000;

    private HttpUtils() {}

    /**
     * Builds a new, unshared client with the given timeouts. The caller owns and must close it.
     */
    public static CloseableHttpClient makeClient(final int connectTimeoutMillis, final int socketTimeoutMillis) {
        Utils.validateArg(connectTimeoutMillis >= 0, "connect timeout must be non-negative");
        Utils.validateArg(socketTimeoutMillis >= 0, "socket timeout must be non-negative");
        final RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(connectTimeoutMillis)
                .setConnectionRequestTimeout(connectTimeoutMillis)
                .setSocketTimeout(socketTimeoutMillis)
                .build();
        return HttpClientBuilder.create()
                .setConnectionManager(new PoolingHttpClientConnectionManager())
                .setDefaultRequestConfig(requestConfig)
                .disableContentCompression()
                .disableAutomaticRetries()
                .build();
    }
}
