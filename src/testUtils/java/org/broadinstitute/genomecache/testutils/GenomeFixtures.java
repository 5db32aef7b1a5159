package org.broadinstitute.genomecache.testutils;

import htsjdk.samtools.util.BlockCompressedOutputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorOutputStream;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

/**
 * Small genomes and annotations for tests, written plain or compressed.
 */
public final class GenomeFixtures {

    private GenomeFixtures() {}

    /** Two contigs; chr1 spans several FASTA lines. */
    public static final String FASTA =
            ">chr1 first contig\n" +
            "ACGTACGTAC\n" +
            "GTACGTACGT\n" +
            "AACCGGTT\n" +
            ">chr2\n" +
            "TTTTGGGGCC\n" +
            "CCAAAA\n";

    public static final int CHR1_LENGTH = 28;
    public static final int CHR2_LENGTH = 16;

    /** Two headers followed by three features out of order. */
    public static final String GFF3 =
            "##gff-version 3\n" +
            "##sequence-region chr1 1 28\n" +
            "chr2\tsrc\tgene\t5\t9\t.\t+\t.\tID=g3\n" +
            "chr1\tsrc\tgene\t10\t20\t.\t+\t.\tID=g2\n" +
            "chr1\tsrc\tgene\t1\t4\t.\t-\t.\tID=g1\n";

    /** A GTF-flavoured annotation; attributes are {@code key "value";} pairs. */
    public static final String GTF =
            "chr1\tsrc\tgene\t1\t4\t.\t+\t.\tgene_id \"g1\"; transcript_id \"t1\";\n";

    public enum Compression {
        PLAIN(""),
        GZIP(".gz"),
        BGZF(".gz"),
        BZIP2(".bz2"),
        XZ(".xz");

        private final String extension;

        Compression(final String extension) {
            this.extension = extension;
        }

        public String getExtension() {
            return extension;
        }
    }

    /**
     * Writes {@code text} to {@code target} with the given compression.
     */
    public static Path write(final Path target, final String text, final Compression compression) {
        final byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            switch (compression) {
                case PLAIN:
                    Files.write(target, bytes);
                    break;
                case GZIP:
                    try (final OutputStream out = new GZIPOutputStream(Files.newOutputStream(target))) {
                        out.write(bytes);
                    }
                    break;
                case BGZF:
                    try (final OutputStream out = new BlockCompressedOutputStream(Files.newOutputStream(target), (Path) null)) {
                        out.write(bytes);
                    }
                    break;
                case BZIP2:
                    try (final OutputStream out = new BZip2CompressorOutputStream(Files.newOutputStream(target))) {
                        out.write(bytes);
                    }
                    break;
                case XZ:
                    try (final OutputStream out = new XZCompressorOutputStream(Files.newOutputStream(target))) {
                        out.write(bytes);
                    }
                    break;
                default:
                    throw new IllegalArgumentException("unknown compression " + compression);
            }
            return target;
        } catch (final IOException e) {
            throw new UncheckedIOException("cannot write fixture " + target, e);
        }
    }

    public static String read(final Path path) {
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("cannot read " + path, e);
        }
    }
}
