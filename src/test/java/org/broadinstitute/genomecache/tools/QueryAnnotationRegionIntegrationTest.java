package org.broadinstitute.genomecache.tools;

import org.broadinstitute.genomecache.CommandLineProgramTest;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.inventory.GenomeKey;
import org.broadinstitute.genomecache.testutils.ArgumentsBuilder;
import org.broadinstitute.genomecache.testutils.GenomeFixtures;
import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.nio.file.Path;

public final class QueryAnnotationRegionIntegrationTest extends CommandLineProgramTest {

    private static final GenomeKey NO_ANNOTATION = new GenomeKey("ucsc", "mus_musculus", "mm39");

    private Path cacheRoot;

    @BeforeClass
    public void publish() {
        cacheRoot = createTempDirPath("cache");
        final Path origin = createTempDirPath("origin");
        publishFixtureGenome(origin, cacheRoot, TEST_KEY, true);
        publishFixtureGenome(origin, cacheRoot, NO_ANNOTATION, false);
    }

    @DataProvider(name = "regions")
    public Object[][] regions() {
        return new Object[][]{
                {"chr1:5-12", new String[]{"ID=g2"}},
                {"chr1:1-4", new String[]{"ID=g1"}},
                {"chr1", new String[]{"ID=g1", "ID=g2"}},
                {"chr2:1-28", new String[]{"ID=g3"}},
                {"chr2:10-16", new String[]{}},
                {"chrUn:1-100", new String[]{}},
        };
    }

    @Test(dataProvider = "regions")
    public void testQuery(final String interval, final String[] expectedIds) {
        final Path output = createTempPath("features", ".gff3");
        final Object count = runCommandLine(new ArgumentsBuilder()
                .addCacheRoot(cacheRoot)
                .addGenomeKey(TEST_KEY)
                .addInterval(interval)
                .addOutput(output));

        Assert.assertEquals(count, expectedIds.length);
        final String text = GenomeFixtures.read(output).trim();
        final String[] lines = text.isEmpty() ? new String[0] : text.split("\n");
        Assert.assertEquals(lines.length, expectedIds.length);
        for (int i = 0; i < lines.length; i++) {
            Assert.assertTrue(lines[i].endsWith(expectedIds[i]), lines[i]);
        }
    }

    @Test(expectedExceptions = UserException.MissingIndex.class)
    public void testGenomeWithoutAnnotation() {
        runCommandLine(new ArgumentsBuilder()
                .addCacheRoot(cacheRoot)
                .addGenomeKey(NO_ANNOTATION)
                .addInterval("chr1:1-10"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testBadInterval() {
        runCommandLine(new ArgumentsBuilder()
                .addCacheRoot(cacheRoot)
                .addGenomeKey(TEST_KEY)
                .addInterval("chr1:20-10"));
    }
}
