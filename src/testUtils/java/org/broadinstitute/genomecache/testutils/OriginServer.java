package org.broadinstitute.genomecache.testutils;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.DefaultServlet;
import org.eclipse.jetty.servlet.FilterHolder;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import javax.servlet.DispatcherType;
import javax.servlet.Filter;
import javax.servlet.FilterChain;
import javax.servlet.FilterConfig;
import javax.servlet.ServletException;
import javax.servlet.ServletRequest;
import javax.servlet.ServletResponse;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A local HTTP origin for tests: a Jetty server on a free port serving the files of one directory with
 * {@code ETag} and {@code Last-Modified} validators, so conditional requests are answered with 304.
 *
 * Every request is recorded as it arrives, before it is answered. Paths can be switched to fail with a 500.
 *
 * <pre>
 * try (OriginServer origin = OriginServer.serving(dir)) {
 *     String url = origin.urlFor("genome.fa.gz");
 *     ...
 *     Assert.assertEquals(origin.countRequests("/genome.fa.gz"), 1);
 * }
 * </pre>
 */
public final class OriginServer implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(OriginServer.class);

    /** One received request. */
    public static final class Exchange {
        private final String path;
        private final boolean conditional;

        Exchange(final String path, final boolean conditional) {
            this.path = path;
            this.conditional = conditional;
        }

        public String getPath() {
            return path;
        }

        /**
         * @return true if the request carried {@code If-None-Match} or {@code If-Modified-Since}
         */
        public boolean isConditional() {
            return conditional;
        }

        @Override
        public String toString() {
            return path + (conditional ? " (conditional)" : "");
        }
    }

    private final Path root;
    private final Server server;
    private final List<Exchange> exchanges = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> failingPaths = ConcurrentHashMap.newKeySet();

    private OriginServer(final Path root) {
        this.root = root;
        this.server = new Server();
        final ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(0);
        server.addConnector(connector);

        final ServletContextHandler context = new ServletContextHandler();
        context.setContextPath("/");
        context.setResourceBase(root.toAbsolutePath().toString());

        final ServletHolder defaultServlet = new ServletHolder("default", DefaultServlet.class);
        defaultServlet.setInitParameter("dirAllowed", "false");
        defaultServlet.setInitParameter("precompressed", "false");
        defaultServlet.setInitParameter("etags", "true");
        defaultServlet.setInitParameter("useFileMappedBuffer", "false");
        context.addServlet(defaultServlet, "/");
        context.addFilter(new FilterHolder(new RecordingFilter()), "/*", EnumSet.of(DispatcherType.REQUEST));
        server.setHandler(context);
    }

    /**
     * Starts a server for the files under {@code root}.
     */
    public static OriginServer serving(final Path root) {
        final OriginServer origin = new OriginServer(root);
        try {
            origin.server.start();
        } catch (final Exception e) {
            throw new IllegalStateException("Failed to start the origin server", e);
        }
        logger.debug("Origin server on port " + origin.getPort() + " serving " + root);
        return origin;
    }

    public int getPort() {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * @return the URL under which {@code relativePath} is served
     */
    public String urlFor(final String relativePath) {
        return "http://127.0.0.1:" + getPort() + "/" + relativePath;
    }

    /**
     * Replaces a served file, moving its modification time forward so validators change.
     */
    public void replace(final String relativePath, final byte[] content) throws IOException {
        final Path file = root.resolve(relativePath);
        final FileTime previous = Files.exists(file) ? Files.getLastModifiedTime(file) : FileTime.from(Instant.now());
        Files.write(file, content);
        Files.setLastModifiedTime(file, FileTime.fromMillis(previous.toMillis() + 60_000));
    }

    /**
     * Makes requests for {@code relativePath} fail with 500 until {@link #heal} is called.
     */
    public void breakPath(final String relativePath) {
        failingPaths.add("/" + relativePath);
    }

    public void heal(final String relativePath) {
        failingPaths.remove("/" + relativePath);
    }

    public List<Exchange> getExchanges() {
        synchronized (exchanges) {
            return new ArrayList<>(exchanges);
        }
    }

    public int countRequests(final String path) {
        return (int) getExchanges().stream().filter(e -> e.getPath().equals(path)).count();
    }

    public int countUnconditionalRequests(final String path) {
        return (int) getExchanges().stream().filter(e -> e.getPath().equals(path) && !e.isConditional()).count();
    }

    public void clearExchanges() {
        exchanges.clear();
    }

    @Override
    public void close() {
        try {
            server.stop();
        } catch (final Exception e) {
            throw new IllegalStateException("Failed to stop the origin server", e);
        }
    }

    private final class RecordingFilter implements Filter {
        @Override
        public void init(final FilterConfig filterConfig) {
        }

        @Override
        public void doFilter(final ServletRequest request, final ServletResponse response, final FilterChain chain) throws IOException, ServletException {
            final HttpServletRequest httpRequest = (HttpServletRequest) request;
            final String path = httpRequest.getRequestURI();
            exchanges.add(new Exchange(path,
                    httpRequest.getHeader("If-None-Match") != null || httpRequest.getHeader("If-Modified-Since") != null));
            if (failingPaths.contains(path)) {
                ((HttpServletResponse) response).sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "broken on purpose");
                return;
            }
            chain.doFilter(request, response);
        }

        @Override
        public void destroy() {
        }
    }
}
