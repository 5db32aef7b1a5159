package org.broadinstitute.genomecache.index;

import htsjdk.samtools.util.CloseableIterator;
import htsjdk.samtools.util.SortingCollection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.io.IOUtils;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Coordinate-sorts a plain text GFF3 file.
 *
 * Lines starting with {@code #} are headers: they are moved to the top in their original order. Feature lines are
 * sorted by sequence name, then numerically by start, with ties kept in input order. Everything after a
 * {@code ##FASTA} directive (embedded sequence) is dropped, as are blank lines.
 *
 * Features are sorted with an htsjdk {@link SortingCollection}, so inputs larger than memory spill to temp files.
 */
public final class GffSorter {
    private static final Logger logger = LogManager.getLogger(GffSorter.class);

    public static final String FASTA_DIRECTIVE = "##FASTA";

    private static final int SEQNAME_COLUMN = 0;
    private static final int START_COLUMN = 3;
    private static final int END_COLUMN = 4;
    private static final int ATTRIBUTES_COLUMN = 8;

    private final int maxRecordsInRam;
    private final Path tmpDir;

    public GffSorter(final int maxRecordsInRam, final Path tmpDir) {
        Utils.validateArg(maxRecordsInRam > 0, "maxRecordsInRam must be positive");
        this.maxRecordsInRam = maxRecordsInRam;
        this.tmpDir = Utils.nonNull(tmpDir);
    }

    /**
     * Sorts {@code plainGff} into {@code output} (plain text, written via a temp file and rename).
     *
     * @return the number of feature lines written
     * @throws UserException.BadInput if a feature line has too few columns or a non-numeric start/end
     * @throws UserException.UnsupportedFormat if the feature lines turn out to be GTF
     */
    public long sort(final Path plainGff, final Path output) {
        Utils.nonNull(plainGff);
        Utils.nonNull(output);

        final List<String> headers = new ArrayList<>();
        final SortingCollection<GffLine> sorter = SortingCollection.newInstance(
                GffLine.class, new GffLineCodec(), GffLine.COORDINATE_ORDER, maxRecordsInRam, IOUtils.createDirectories(tmpDir));
        long featureCount = 0;
        try {
            try (final BufferedReader reader = Files.newBufferedReader(plainGff, StandardCharsets.UTF_8)) {
                String line;
                long lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    line = stripCarriageReturn(line);
                    if (line.trim().isEmpty()) {
                        continue;
                    }
                    if (line.startsWith(FASTA_DIRECTIVE)) {
                        logger.debug("Dropping embedded sequence after line " + lineNumber + " of " + plainGff);
                        break;
                    }
                    if (line.startsWith("#")) {
                        headers.add(line);
                        continue;
                    }
                    sorter.add(parse(line, lineNumber, featureCount, plainGff));
                    featureCount++;
                }
            } catch (final IOException e) {
                throw new UserException.CouldNotReadInputFile(plainGff, e);
            }
            sorter.doneAdding();

            final Path tmp = IOUtils.createSiblingTempPath(output);
            boolean moved = false;
            try {
                try (final BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                     final CloseableIterator<GffLine> iterator = sorter.iterator()) {
                    for (final String header : headers) {
                        writer.write(header);
                        writer.write('\n');
                    }
                    while (iterator.hasNext()) {
                        writer.write(iterator.next().getText());
                        writer.write('\n');
                    }
                } catch (final IOException e) {
                    throw new UserException.CouldNotCreateOutputFile(output, "cannot write sorted annotation", e);
                }
                IOUtils.atomicReplace(tmp, output);
                moved = true;
            } finally {
                if (!moved) {
                    IOUtils.deleteQuietly(tmp);
                }
            }
        } finally {
            sorter.cleanup();
        }
        logger.info(String.format("Sorted %d features (%d header lines) from %s", featureCount, headers.size(), plainGff));
        return featureCount;
    }

    /**
     * Parses the coordinates of one feature line.
     */
    static GffLine parse(final String line, final long lineNumber, final long ordinal, final Path source) {
        final String[] fields = line.split("\t", -1);
        if (fields.length <= END_COLUMN) {
            throw new UserException.BadInput(String.format("%s line %d has %d tab-separated columns, GFF3 requires 9: %s",
                    source, lineNumber, fields.length, abbreviate(line)));
        }
        if (fields.length > ATTRIBUTES_COLUMN && AnnotationFormat.looksLikeGtfAttributes(fields[ATTRIBUTES_COLUMN])) {
            throw new UserException.UnsupportedFormat(source.toString(),
                    String.format("line %d has GTF-style attributes; only GFF3 annotations are supported", lineNumber));
        }
        final long start = parseCoordinate(fields[START_COLUMN], "start", lineNumber, source);
        final long end = parseCoordinate(fields[END_COLUMN], "end", lineNumber, source);
        if (end < start) {
            throw new UserException.BadInput(String.format("%s line %d: end %d is before start %d", source, lineNumber, end, start));
        }
        return new GffLine(fields[SEQNAME_COLUMN], start, ordinal, line);
    }

    private static long parseCoordinate(final String value, final String what, final long lineNumber, final Path source) {
        try {
            final long coordinate = Long.parseLong(value.trim());
            if (coordinate < 1) {
                throw new UserException.BadInput(String.format("%s line %d: %s coordinate %d is not positive", source, lineNumber, what, coordinate));
            }
            return coordinate;
        } catch (final NumberFormatException e) {
            throw new UserException.BadInput(String.format("%s line %d: %s coordinate '%s' is not a number", source, lineNumber, what, value), e);
        }
    }

    private static String stripCarriageReturn(final String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static String abbreviate(final String line) {
        return line.length() > 80 ? line.substring(0, 77) + "..." : line;
    }

    /**
     * One feature line with the fields it is sorted on.
     */
    static final class GffLine {
        static final Comparator<GffLine> COORDINATE_ORDER = Comparator
                .comparing(GffLine::getSeqname)
                .thenComparingLong(GffLine::getStart)
                .thenComparingLong(GffLine::getOrdinal);

        private final String seqname;
        private final long start;
        private final long ordinal;
        private final String text;

        GffLine(final String seqname, final long start, final long ordinal, final String text) {
            this.seqname = seqname;
            this.start = start;
            this.ordinal = ordinal;
            this.text = text;
        }

        String getSeqname() {
            return seqname;
        }

        long getStart() {
            return start;
        }

        long getOrdinal() {
            return ordinal;
        }

        String getText() {
            return text;
        }
    }

    /**
     * Spills {@link GffLine}s as (ordinal, start, length-prefixed seqname, length-prefixed text).
     */
    static final class GffLineCodec implements SortingCollection.Codec<GffLine> {
        private DataOutputStream out;
        private DataInputStream in;

        @Override
        public void setOutputStream(final OutputStream os) {
            out = new DataOutputStream(os);
        }

        @Override
        public void setInputStream(final InputStream is) {
            in = new DataInputStream(is);
        }

        @Override
        public void encode(final GffLine val) {
            try {
                out.writeLong(val.getOrdinal());
                out.writeLong(val.getStart());
                writeString(val.getSeqname());
                writeString(val.getText());
            } catch (final IOException e) {
                throw new GenomeCacheException("Error spilling sorted annotation records", e);
            }
        }

        @Override
        public GffLine decode() {
            final long ordinal;
            try {
                ordinal = in.readLong();
            } catch (final EOFException e) {
                return null;
            } catch (final IOException e) {
                throw new GenomeCacheException("Error reading spilled annotation records", e);
            }
            try {
                final long start = in.readLong();
                final String seqname = readString();
                final String text = readString();
                return new GffLine(seqname, start, ordinal, text);
            } catch (final IOException e) {
                throw new GenomeCacheException("Error reading spilled annotation records", e);
            }
        }

        private void writeString(final String s) throws IOException {
            final byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
            out.writeInt(bytes.length);
            out.write(bytes);
        }

        private String readString() throws IOException {
            final byte[] bytes = new byte[in.readInt()];
            in.readFully(bytes);
            return new String(bytes, StandardCharsets.UTF_8);
        }

        @Override
        public SortingCollection.Codec<GffLine> clone() {
            return new GffLineCodec();
        }
    }
}
