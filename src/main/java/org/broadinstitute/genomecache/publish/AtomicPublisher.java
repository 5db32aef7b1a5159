package org.broadinstitute.genomecache.publish;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.inventory.ArtifactSet;
import org.broadinstitute.genomecache.inventory.GenomeKey;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.io.IOUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies staged artifacts into the public tree under {@code {provider}/{species}/{assembly}/}.
 *
 * Publishing happens in two phases. First every staged file is copied to a hidden temp file next to its
 * destination; if any copy fails all temps are removed and nothing public has changed. Then each temp is renamed
 * over its destination. A reader of any single public file therefore sees either the old or the new version.
 */
public final class AtomicPublisher {
    private static final Logger logger = LogManager.getLogger(AtomicPublisher.class);

    private final Path publishRoot;

    public AtomicPublisher(final Path publishRoot) {
        this.publishRoot = Utils.nonNull(publishRoot);
    }

    public Path getPublishRoot() {
        return publishRoot;
    }

    /**
     * @return the directory that holds the published files of {@code key}
     */
    public Path directoryFor(final GenomeKey key) {
        return key.resolveUnder(publishRoot);
    }

    /**
     * Publishes {@code staged} for {@code key}.
     *
     * @param staged a complete artifact set whose files all exist
     * @return the published artifact set, in the standard layout
     */
    public ArtifactSet publish(final GenomeKey key, final ArtifactSet staged) {
        Utils.nonNull(key);
        Utils.nonNull(staged);
        if (!staged.existsOnDisk()) {
            throw new GenomeCacheException("Refusing to publish " + key + ": staged artifacts are incomplete or missing " + staged);
        }
        final ArtifactSet destination = ArtifactSet.standardLayout(IOUtils.createDirectories(directoryFor(key)), staged.hasAnnotation());
        final List<Path> sources = staged.allPaths();
        final List<Path> targets = destination.allPaths();
        Utils.validate(sources.size() == targets.size(), "staged and published layouts differ");

        final List<Path> temps = new ArrayList<>(targets.size());
        try {
            for (int i = 0; i < sources.size(); i++) {
                final Path tmp = IOUtils.createSiblingTempPath(targets.get(i));
                temps.add(tmp);
                Files.copy(sources.get(i), tmp, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (final IOException e) {
            temps.forEach(IOUtils::deleteQuietly);
            throw new UserException.CouldNotCreateOutputFile(directoryFor(key), "cannot stage files for publishing", e);
        }

        for (int i = 0; i < temps.size(); i++) {
            IOUtils.atomicReplace(temps.get(i), targets.get(i));
        }
        logger.info(String.format("Published %s (%d files) to %s", key, targets.size(), directoryFor(key)));
        return destination;
    }
}
