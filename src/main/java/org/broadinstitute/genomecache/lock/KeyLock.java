package org.broadinstitute.genomecache.lock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.io.IOUtils;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Cross-process mutual exclusion for one genome key, implemented as a lock file created with
 * {@link StandardOpenOption#CREATE_NEW}. Only one process can create the file; everyone else polls at a fixed
 * interval until it disappears.
 *
 * The lock has no lease: a holder that dies without closing leaves the file behind and the key stays locked
 * until the file is removed by hand. The owner recorded in the file is logged while waiting to make that easy.
 *
 * Use with try-with-resources; {@link #close()} releases the lock.
 */
public final class KeyLock implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(KeyLock.class);

    public static final String LOCK_FILE_NAME = ".lock";

    private final Path lockFile;
    private final boolean contended;
    private boolean released = false;

    private KeyLock(final Path lockFile, final boolean contended) {
        this.lockFile = lockFile;
        this.contended = contended;
    }

    /**
     * Blocks until the lock file at {@code lockFile} can be created.
     *
     * @param pollIntervalMillis fixed delay between attempts
     * @param timeoutMillis give up after this long; 0 or less waits forever
     * @throws GenomeCacheException.LockTimeout if {@code timeoutMillis} elapsed first
     */
    public static KeyLock acquire(final Path lockFile, final long pollIntervalMillis, final long timeoutMillis) {
        Utils.nonNull(lockFile);
        Utils.validateArg(pollIntervalMillis > 0, "poll interval must be positive");
        IOUtils.createDirectories(lockFile.toAbsolutePath().getParent());

        final long start = System.currentTimeMillis();
        boolean contended = false;
        while (true) {
            if (tryCreate(lockFile)) {
                if (contended) {
                    logger.info(String.format("Acquired %s after waiting %d ms", lockFile, System.currentTimeMillis() - start));
                }
                return new KeyLock(lockFile, contended);
            }
            final long waited = System.currentTimeMillis() - start;
            if (!contended) {
                logger.info(String.format("Waiting for %s held by %s", lockFile, describeHolder(lockFile)));
                contended = true;
            } else {
                logger.debug(String.format("Still waiting for %s (%d ms)", lockFile, waited));
            }
            if (timeoutMillis > 0 && waited >= timeoutMillis) {
                throw new GenomeCacheException.LockTimeout(lockFile, waited, describeHolder(lockFile));
            }
            try {
                Thread.sleep(pollIntervalMillis);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GenomeCacheException("Interrupted while waiting for " + lockFile, e);
            }
        }
    }

    private static boolean tryCreate(final Path lockFile) {
        final String owner = ownerIdentity() + " " + Instant.now() + "\n";
        try {
            Files.write(lockFile, owner.getBytes(StandardCharsets.UTF_8), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (final FileAlreadyExistsException e) {
            return false;
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(lockFile, "cannot create lock file", e);
        }
    }

    /**
     * @return the recorded owner of a lock file, or a placeholder if it cannot be read
     */
    public static String describeHolder(final Path lockFile) {
        try {
            return new String(Files.readAllBytes(lockFile), StandardCharsets.UTF_8).trim();
        } catch (final NoSuchFileException e) {
            return "<released>";
        } catch (final IOException e) {
            return "<unreadable: " + e.getMessage() + ">";
        }
    }

    /**
     * @return {@code pid@host} of this JVM
     */
    public static String ownerIdentity() {
        return ManagementFactory.getRuntimeMXBean().getName();
    }

    public Path getLockFile() {
        return lockFile;
    }

    /**
     * @return true if another holder had the lock when we first asked for it
     */
    public boolean wasContended() {
        return contended;
    }

    @Override
    public synchronized void close() {
        if (!released) {
            released = true;
            IOUtils.deleteIfExists(lockFile);
        }
    }
}
