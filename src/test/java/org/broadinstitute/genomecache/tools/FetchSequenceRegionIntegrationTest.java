package org.broadinstitute.genomecache.tools;

import org.broadinstitute.genomecache.CommandLineProgramTest;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.testutils.ArgumentsBuilder;
import org.broadinstitute.genomecache.testutils.GenomeFixtures;
import org.broadinstitute.genomecache.utils.GenomicRegion;
import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.nio.file.Path;

public final class FetchSequenceRegionIntegrationTest extends CommandLineProgramTest {

    private Path cacheRoot;

    @BeforeClass
    public void publish() {
        cacheRoot = createTempDirPath("cache");
        publishFixtureGenome(createTempDirPath("origin"), cacheRoot, TEST_KEY, false);
    }

    @DataProvider(name = "regions")
    public Object[][] regions() {
        return new Object[][]{
                {"chr1:9-12", "ACGT"},
                {"chr1:19-22", "GTAA"},
                {"chr1:10-11", "CG"},
                {"chr2:11-16", "CCAAAA"},
                {"chr2", "TTTTGGGGCCCCAAAA"},
                {"chr2:11-100", "CCAAAA"},
        };
    }

    @Test(dataProvider = "regions")
    public void testFetch(final String interval, final String expectedBases) {
        final Path output = createTempPath("region", ".fa");
        final Object count = runCommandLine(new ArgumentsBuilder()
                .addCacheRoot(cacheRoot)
                .addGenomeKey(TEST_KEY)
                .addInterval(interval)
                .addOutput(output));

        Assert.assertEquals(count, expectedBases.length());
        Assert.assertEquals(GenomeFixtures.read(output).trim(), ">" + GenomicRegion.parse(interval).toQueryString() + "\n" + expectedBases);
    }

    @Test
    public void testLongRegionsAreWrapped() {
        final String bases = "ACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGT";
        final String fasta = FetchSequenceRegion.toFasta(new GenomicRegion("chr1", 1, bases.length()), bases);
        final String[] lines = fasta.split("\n");
        Assert.assertEquals(lines.length, 3);
        Assert.assertEquals(lines[1].length(), FetchSequenceRegion.FASTA_LINE_WIDTH);
        Assert.assertEquals(lines[1] + lines[2], bases);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testUnknownContig() {
        runCommandLine(new ArgumentsBuilder()
                .addCacheRoot(cacheRoot)
                .addGenomeKey(TEST_KEY)
                .addInterval("chrUn:1-10"));
    }
}
