package org.broadinstitute.genomecache.index;

import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.testutils.BaseTest;
import org.broadinstitute.genomecache.testutils.GenomeFixtures;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.nio.file.Path;

public final class GffSorterUnitTest extends BaseTest {

    private static final String UNSORTED =
            "##gff-version 3\n" +
            "#!genome-build test\n" +
            "chr2\tsrc\tgene\t500\t600\t.\t+\t.\tID=c\n" +
            "chr1\tsrc\tgene\t100\t200\t.\t+\t.\tID=b\n" +
            "chr1\tsrc\tgene\t50\t80\t.\t+\t.\tID=a\n";

    private static final String SORTED =
            "##gff-version 3\n" +
            "#!genome-build test\n" +
            "chr1\tsrc\tgene\t50\t80\t.\t+\t.\tID=a\n" +
            "chr1\tsrc\tgene\t100\t200\t.\t+\t.\tID=b\n" +
            "chr2\tsrc\tgene\t500\t600\t.\t+\t.\tID=c\n";

    @DataProvider(name = "recordsInRam")
    public Object[][] recordsInRam() {
        // 1 forces every record through a spill file
        return new Object[][]{{1}, {1000}};
    }

    @Test(dataProvider = "recordsInRam")
    public void testSortKeepsHeadersFirst(final int maxRecordsInRam) {
        final Path dir = createTempDirPath("gffsort");
        final Path input = GenomeFixtures.write(dir.resolve("in.gff3"), UNSORTED, GenomeFixtures.Compression.PLAIN);
        final Path output = dir.resolve("out.gff3");

        final long features = new GffSorter(maxRecordsInRam, dir.resolve("tmp")).sort(input, output);

        Assert.assertEquals(features, 3);
        Assert.assertEquals(GenomeFixtures.read(output), SORTED);
    }

    @Test
    public void testTiesKeepInputOrder() {
        final Path dir = createTempDirPath("gffties");
        final String ties =
                "chr1\tsrc\tgene\t10\t20\t.\t+\t.\tID=first\n" +
                "chr1\tsrc\tmRNA\t10\t20\t.\t+\t.\tID=second;Parent=first\n" +
                "chr1\tsrc\texon\t10\t15\t.\t+\t.\tID=third;Parent=second\n";
        final Path input = GenomeFixtures.write(dir.resolve("ties.gff3"), ties, GenomeFixtures.Compression.PLAIN);
        final Path output = dir.resolve("out.gff3");
        new GffSorter(1, dir.resolve("tmp")).sort(input, output);
        Assert.assertEquals(GenomeFixtures.read(output), ties);
    }

    @Test
    public void testEmbeddedFastaIsDropped() {
        final Path dir = createTempDirPath("gfffasta");
        final String withFasta = GenomeFixtures.GFF3 + "##FASTA\n>chr1\nACGT\n";
        final Path input = GenomeFixtures.write(dir.resolve("in.gff3"), withFasta, GenomeFixtures.Compression.PLAIN);
        final Path output = dir.resolve("out.gff3");

        Assert.assertEquals(new GffSorter(10, dir.resolve("tmp")).sort(input, output), 3);
        final String sorted = GenomeFixtures.read(output);
        Assert.assertFalse(sorted.contains("##FASTA"));
        Assert.assertFalse(sorted.contains("ACGT"));
    }

    @Test
    public void testBlankLinesAreSkipped() {
        final Path dir = createTempDirPath("gffblank");
        final Path input = GenomeFixtures.write(dir.resolve("in.gff3"),
                "\nchr1\tsrc\tgene\t5\t6\t.\t+\t.\tID=x\n\n", GenomeFixtures.Compression.PLAIN);
        Assert.assertEquals(new GffSorter(10, dir.resolve("tmp")).sort(input, dir.resolve("out.gff3")), 1);
    }

    @DataProvider(name = "badLines")
    public Object[][] badLines() {
        return new Object[][]{
                {"chr1\tsrc\tgene\tten\t20\t.\t+\t.\tID=x\n"},
                {"chr1\tsrc\tgene\t10\t2x\t.\t+\t.\tID=x\n"},
                {"chr1\tsrc\tgene\t0\t20\t.\t+\t.\tID=x\n"},
                {"chr1\tsrc\tgene\t30\t20\t.\t+\t.\tID=x\n"},
                {"chr1\tsrc\tgene\n"},
        };
    }

    @Test(dataProvider = "badLines", expectedExceptions = UserException.BadInput.class)
    public void testRejectsBadCoordinates(final String line) {
        final Path dir = createTempDirPath("gffbad");
        final Path input = GenomeFixtures.write(dir.resolve("in.gff3"), line, GenomeFixtures.Compression.PLAIN);
        new GffSorter(10, dir.resolve("tmp")).sort(input, dir.resolve("out.gff3"));
    }

    @Test(expectedExceptions = UserException.UnsupportedFormat.class)
    public void testRejectsGtfContent() {
        final Path dir = createTempDirPath("gffgtf");
        final Path input = GenomeFixtures.write(dir.resolve("named-like.gff3"), GenomeFixtures.GTF, GenomeFixtures.Compression.PLAIN);
        new GffSorter(10, dir.resolve("tmp")).sort(input, dir.resolve("out.gff3"));
    }
}
