package org.broadinstitute.genomecache.transcode;

import htsjdk.samtools.util.BlockCompressedOutputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.io.IOUtils;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts whatever compression a provider used into BGZF, the block gzip variant that supports random access.
 *
 * Input that is already gzip is decompressed and recompressed like everything else. Ordinary gzip and BGZF share a
 * magic number, and the indexes written downstream are only valid for BGZF produced here.
 *
 * Every output is written to a temporary sibling and renamed into place.
 */
public final class FormatTranscoder {
    private static final Logger logger = LogManager.getLogger(FormatTranscoder.class);

    public static final int DEFAULT_COMPRESSION_LEVEL = 5;

    private final int compressionLevel;

    public FormatTranscoder() {
        this(DEFAULT_COMPRESSION_LEVEL);
    }

    public FormatTranscoder(final int compressionLevel) {
        Utils.validateArg(compressionLevel >= 0 && compressionLevel <= 9, "compression level must be between 0 and 9");
        this.compressionLevel = compressionLevel;
    }

    public int getCompressionLevel() {
        return compressionLevel;
    }

    /**
     * Opens {@code file} for reading its decompressed content, whatever the compression.
     * Concatenated gzip members (including BGZF blocks), bzip2 streams and xz streams are all read through.
     */
    public static InputStream openDecompressed(final Path file) {
        final CompressionType type = CompressionType.sniff(file);
        try {
            final InputStream raw = new BufferedInputStream(Files.newInputStream(file));
            try {
                return wrap(raw, type);
            } catch (final IOException e) {
                raw.close();
                throw e;
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(file, "cannot open as " + type, e);
        }
    }

    private static InputStream wrap(final InputStream raw, final CompressionType type) throws IOException {
        switch (type) {
            case GZIP:  return new GzipCompressorInputStream(raw, true);
            case BZIP2: return new BZip2CompressorInputStream(raw, true);
            case XZ:    return new XZCompressorInputStream(raw, true);
            case PLAIN: return raw;
            default:
                throw new GenomeCacheException.ShouldNeverReachHereException("Unhandled compression type " + type);
        }
    }

    /**
     * Decompresses {@code input} and writes it as BGZF to {@code output}.
     *
     * @return what was detected and how much uncompressed data was written
     */
    public TranscodeResult toBlockCompressed(final Path input, final Path output) {
        Utils.nonNull(input);
        Utils.nonNull(output);
        final CompressionType type = CompressionType.sniff(input);
        logger.info(String.format("Transcoding %s (%s) to BGZF %s", input, type, output));
        final Path tmp = IOUtils.createSiblingTempPath(output);
        boolean moved = false;
        try {
            final long uncompressedBytes;
            try (final InputStream in = openDecompressed(input);
                 final OutputStream out = openBlockCompressed(tmp)) {
                uncompressedBytes = IOUtils.copyStream(in, out);
            } catch (final IOException e) {
                throw new UserException.CouldNotReadInputFile(input, "failed while decompressing " + type + " data", e);
            }
            IOUtils.atomicReplace(tmp, output);
            moved = true;
            return new TranscodeResult(type, uncompressedBytes);
        } finally {
            if (!moved) {
                IOUtils.deleteQuietly(tmp);
            }
        }
    }

    /**
     * Writes the decompressed content of {@code input} to {@code output} as plain bytes.
     */
    public TranscodeResult decompress(final Path input, final Path output) {
        final CompressionType type = CompressionType.sniff(input);
        final Path tmp = IOUtils.createSiblingTempPath(output);
        boolean moved = false;
        try {
            final long bytes;
            try (final InputStream in = openDecompressed(input);
                 final OutputStream out = Files.newOutputStream(tmp)) {
                bytes = IOUtils.copyStream(in, out);
            } catch (final IOException e) {
                throw new UserException.CouldNotReadInputFile(input, "failed while decompressing " + type + " data", e);
            }
            IOUtils.atomicReplace(tmp, output);
            moved = true;
            return new TranscodeResult(type, bytes);
        } finally {
            if (!moved) {
                IOUtils.deleteQuietly(tmp);
            }
        }
    }

    /**
     * @return a BGZF stream writing to {@code path} at this transcoder's compression level
     */
    public BlockCompressedOutputStream openBlockCompressed(final Path path) {
        return new BlockCompressedOutputStream(path.toFile(), compressionLevel);
    }

    /**
     * What {@link #toBlockCompressed} found and produced.
     */
    public static final class TranscodeResult {
        private final CompressionType detected;
        private final long uncompressedBytes;

        public TranscodeResult(final CompressionType detected, final long uncompressedBytes) {
            this.detected = detected;
            this.uncompressedBytes = uncompressedBytes;
        }

        public CompressionType getDetected() {
            return detected;
        }

        public long getUncompressedBytes() {
            return uncompressedBytes;
        }
    }
}
