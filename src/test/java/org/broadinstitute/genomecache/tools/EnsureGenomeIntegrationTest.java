package org.broadinstitute.genomecache.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.broadinstitute.genomecache.CommandLineProgramTest;
import org.broadinstitute.genomecache.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.genomecache.exceptions.EntryFailedException;
import org.broadinstitute.genomecache.exceptions.PipelineStage;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.inventory.GenomeKey;
import org.broadinstitute.genomecache.publish.AggregateIndex;
import org.broadinstitute.genomecache.publish.PublishedPaths;
import org.broadinstitute.genomecache.testutils.ArgumentsBuilder;
import org.broadinstitute.genomecache.testutils.GenomeFixtures;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public final class EnsureGenomeIntegrationTest extends CommandLineProgramTest {

    @Test
    public void testPublishesAndWritesPaths() throws IOException {
        final Path origin = createTempDirPath("origin");
        final Path cacheRoot = createTempDirPath("cache");
        final Path output = createTempPath("paths", ".json");
        final ArgumentsBuilder args = new ArgumentsBuilder()
                .addCacheRoot(cacheRoot)
                .addGenomeKey(TEST_KEY)
                .add(StandardArgumentDefinitions.SEQUENCE_URL_LONG_NAME, fileUrl(GenomeFixtures.write(
                        origin.resolve("genome.fa.bz2"), GenomeFixtures.FASTA, GenomeFixtures.Compression.BZIP2)))
                .add(StandardArgumentDefinitions.ANNOTATION_URL_LONG_NAME, fileUrl(GenomeFixtures.write(
                        origin.resolve("genes.gff3"), GenomeFixtures.GFF3, GenomeFixtures.Compression.PLAIN)))
                .addOutput(output);

        final PublishedPaths paths = (PublishedPaths) runCommandLine(args);

        Assert.assertEquals(paths.getKey(), TEST_KEY);
        Assert.assertTrue(Paths.get(paths.getSequence()).startsWith(cacheRoot.resolve("publish")), paths.getSequence());
        for (final String file : new String[]{paths.getSequence(), paths.getSequenceIndex(), paths.getSequenceBlockIndex(),
                paths.getAnnotation(), paths.getAnnotationIndex()}) {
            Assert.assertTrue(Files.isRegularFile(Paths.get(file)), file);
        }

        final JsonNode written = JsonMapper.builder().build().readTree(output.toFile());
        Assert.assertEquals(written.get("assembly").asText(), "GRCh38");
        Assert.assertEquals(written.get("sequence").asText(), paths.getSequence());
        Assert.assertEquals(written.get("annotation_index").asText(), paths.getAnnotationIndex());

        final AggregateIndex index = AggregateIndex.read(cacheRoot.resolve("publish"));
        Assert.assertEquals(index.getEntries().size(), 1);
        Assert.assertEquals(index.getEntries().get(0).getKey(), TEST_KEY);
        Assert.assertEquals(index.getEntries().get(0).getSequence(), paths.getSequence());
    }

    @Test
    public void testSequenceOnly() {
        final Path origin = createTempDirPath("origin");
        final Path cacheRoot = createTempDirPath("cache");
        final GenomeKey key = new GenomeKey("ucsc", "mus_musculus", "mm39");

        final PublishedPaths paths = publishFixtureGenome(origin, cacheRoot, key, false);

        Assert.assertNull(paths.getAnnotation());
        Assert.assertNull(paths.getAnnotationIndex());
        Assert.assertTrue(Files.isRegularFile(Paths.get(paths.getSequenceIndex())));
    }

    @Test
    public void testRerunIsStable() {
        final Path origin = createTempDirPath("origin");
        final Path cacheRoot = createTempDirPath("cache");

        final PublishedPaths first = publishFixtureGenome(origin, cacheRoot, TEST_KEY, true);
        final PublishedPaths second = publishFixtureGenome(origin, cacheRoot, TEST_KEY, true);

        Assert.assertEquals(second.getSequence(), first.getSequence());
        Assert.assertEquals(GenomeFixtures.read(Paths.get(second.getSequenceIndex())),
                GenomeFixtures.read(Paths.get(first.getSequenceIndex())));
    }

    @Test
    public void testMissingOriginNamesTheFetchStage() {
        final Path cacheRoot = createTempDirPath("cache");
        final ArgumentsBuilder args = new ArgumentsBuilder()
                .addCacheRoot(cacheRoot)
                .addGenomeKey(TEST_KEY)
                .add(StandardArgumentDefinitions.SEQUENCE_URL_LONG_NAME, fileUrl(cacheRoot.resolve("nowhere.fa.gz")));

        final EntryFailedException e = Assert.expectThrows(EntryFailedException.class, () -> runCommandLine(args));
        Assert.assertEquals(e.getStage(), PipelineStage.FETCH_SEQUENCE);
    }

    @Test
    public void testGtfAnnotationIsRejected() {
        final Path origin = createTempDirPath("origin");
        final ArgumentsBuilder args = new ArgumentsBuilder()
                .addCacheRoot(createTempDirPath("cache"))
                .addGenomeKey(TEST_KEY)
                .add(StandardArgumentDefinitions.SEQUENCE_URL_LONG_NAME, fileUrl(GenomeFixtures.write(
                        origin.resolve("genome.fa"), GenomeFixtures.FASTA, GenomeFixtures.Compression.PLAIN)))
                .add(StandardArgumentDefinitions.ANNOTATION_URL_LONG_NAME, fileUrl(GenomeFixtures.write(
                        origin.resolve("genes.gtf.gz"), GenomeFixtures.GTF, GenomeFixtures.Compression.GZIP)));

        final EntryFailedException e = Assert.expectThrows(EntryFailedException.class, () -> runCommandLine(args));
        Assert.assertEquals(e.getStage(), PipelineStage.VALIDATE);
        Assert.assertTrue(e.getCause() instanceof UserException.UnsupportedFormat, String.valueOf(e.getCause()));
    }
}
