package org.broadinstitute.genomecache.index;

import htsjdk.samtools.reference.BlockCompressedIndexedFastaSequenceFile;
import htsjdk.samtools.reference.FastaSequenceIndex;
import htsjdk.samtools.util.GZIIndex;
import htsjdk.tribble.readers.TabixReader;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.testutils.BaseTest;
import org.broadinstitute.genomecache.testutils.GenomeFixtures;
import org.broadinstitute.genomecache.transcode.FormatTranscoder;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class HtsjdkGenomeIndexerUnitTest extends BaseTest {

    private final FormatTranscoder transcoder = new FormatTranscoder();
    private final GenomeIndexer indexer = new HtsjdkGenomeIndexer(transcoder);

    @Test
    public void testIndexSequenceSupportsRandomAccess() throws IOException {
        final Path dir = createTempDirPath("htsjdkfai");
        final Path raw = GenomeFixtures.write(dir.resolve("raw.fa.xz"), GenomeFixtures.FASTA, GenomeFixtures.Compression.XZ);
        final Path bgzf = dir.resolve("genome.fa.gz");
        transcoder.toBlockCompressed(raw, bgzf);

        final Path fai = dir.resolve("genome.fa.gz.fai");
        final Path gzi = dir.resolve("genome.fa.gz.gzi");
        indexer.indexSequence(bgzf, fai, gzi);

        Assert.assertEquals(Files.readAllLines(fai), List.of("chr1\t28\t19\t10\t11", "chr2\t16\t56\t10\t11"));
        final FastaSequenceIndex index = new FastaSequenceIndex(fai);
        Assert.assertEquals(index.getIndexEntry("chr1").getSize(), GenomeFixtures.CHR1_LENGTH);
        try (final BlockCompressedIndexedFastaSequenceFile reference =
                     new BlockCompressedIndexedFastaSequenceFile(bgzf, index, GZIIndex.loadIndex(gzi))) {
            Assert.assertEquals(reference.getSubsequenceAt("chr1", 9, 12).getBaseString(), "ACGT");
            Assert.assertEquals(reference.getSubsequenceAt("chr1", 19, 22).getBaseString(), "GTAA");
            Assert.assertEquals(reference.getSubsequenceAt("chr2", 11, 16).getBaseString(), "CCAAAA");
        }
    }

    @DataProvider(name = "malformedFasta")
    public Object[][] malformedFasta() {
        return new Object[][]{
                {"line longer than the first", ">chr1\nACG\nACGTACGT\n"},
                {"empty sequence", ">empty\n>full\nACGT\n"},
        };
    }

    @Test(dataProvider = "malformedFasta")
    public void testMalformedFastaIsRejectedWithoutOutput(final String description, final String fasta) {
        final Path dir = createTempDirPath("htsjdkbad");
        final Path raw = GenomeFixtures.write(dir.resolve("raw.fa"), fasta, GenomeFixtures.Compression.PLAIN);
        final Path bgzf = dir.resolve("genome.fa.gz");
        transcoder.toBlockCompressed(raw, bgzf);
        final Path fai = dir.resolve("genome.fa.gz.fai");
        final Path gzi = dir.resolve("genome.fa.gz.gzi");

        Assert.assertThrows(UserException.BadInput.class, () -> indexer.indexSequence(bgzf, fai, gzi));
        Assert.assertFalse(Files.exists(fai), description);
        Assert.assertFalse(Files.exists(gzi), description);
    }

    @Test
    public void testCompressAndIndexAnnotation() throws IOException {
        final Path dir = createTempDirPath("htsjdktbi");
        final Path plain = GenomeFixtures.write(dir.resolve("genes.gff3"), GenomeFixtures.GFF3, GenomeFixtures.Compression.PLAIN);
        final Path sorted = dir.resolve("genes.sorted.gff3");
        new GffSorter(100, dir.resolve("tmp")).sort(plain, sorted);

        final Path annotation = dir.resolve("genes.gff3.gz");
        final Path tbi = dir.resolve("genes.gff3.gz.tbi");
        indexer.compressAndIndexAnnotation(sorted, annotation, tbi);

        Assert.assertTrue(Files.size(tbi) > 0);
        Assert.assertEquals(ids(annotation, tbi, "chr1:5-12"), List.of("ID=g2"));
        Assert.assertEquals(ids(annotation, tbi, "chr1:1-30"), List.of("ID=g1", "ID=g2"));
        Assert.assertEquals(ids(annotation, tbi, "chr2"), List.of("ID=g3"));
        Assert.assertEquals(ids(annotation, tbi, "chr2:10-16"), List.of());
    }

    private static List<String> ids(final Path annotation, final Path tbi, final String region) throws IOException {
        final List<String> ids = new ArrayList<>();
        final TabixReader reader = new TabixReader(annotation.toString(), tbi.toString());
        try {
            final TabixReader.Iterator it = reader.query(region);
            String line;
            while (it != null && (line = it.next()) != null) {
                ids.add(line.substring(line.lastIndexOf('\t') + 1));
            }
        } finally {
            reader.close();
        }
        return ids;
    }
}
