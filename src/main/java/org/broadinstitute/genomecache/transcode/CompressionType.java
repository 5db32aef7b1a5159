package org.broadinstitute.genomecache.transcode;

import org.broadinstitute.genomecache.exceptions.UserException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Compression schemes recognized by their leading magic bytes. File names are never consulted.
 */
public enum CompressionType {
    /** gzip, including BGZF, which shares the gzip magic number. */
    GZIP(new byte[]{(byte) 0x1F, (byte) 0x8B}),
    BZIP2(new byte[]{'B', 'Z', 'h'}),
    XZ(new byte[]{(byte) 0xFD, '7', 'z', 'X', 'Z', 0x00}),
    PLAIN(new byte[0]);

    private static final byte[] ZIP_MAGIC = {'P', 'K', 0x03, 0x04};
    private static final byte[] ZSTD_MAGIC = {(byte) 0x28, (byte) 0xB5, (byte) 0x2F, (byte) 0xFD};

    static final int MAX_MAGIC_LENGTH = 6;

    private final byte[] magic;

    CompressionType(final byte[] magic) {
        this.magic = magic;
    }

    /**
     * Classifies the first bytes of a stream.
     *
     * @param header up to the first {@value #MAX_MAGIC_LENGTH} bytes
     * @param source name used in error messages
     * @throws UserException.UnsupportedFormat for containers that are recognizable but not supported (zip, zstd)
     */
    public static CompressionType sniff(final byte[] header, final String source) {
        if (startsWith(header, ZIP_MAGIC)) {
            throw new UserException.UnsupportedFormat(source, "zip archives are not supported; provide a gzip, bzip2, xz or plain file");
        }
        if (startsWith(header, ZSTD_MAGIC)) {
            throw new UserException.UnsupportedFormat(source, "zstd compression is not supported; provide a gzip, bzip2, xz or plain file");
        }
        for (final CompressionType type : values()) {
            if (type != PLAIN && startsWith(header, type.magic)) {
                return type;
            }
        }
        return PLAIN;
    }

    public static CompressionType sniff(final Path file) {
        try (final InputStream in = Files.newInputStream(file)) {
            final byte[] header = new byte[MAX_MAGIC_LENGTH];
            int read = 0;
            while (read < header.length) {
                final int n = in.read(header, read, header.length - read);
                if (n < 0) {
                    break;
                }
                read += n;
            }
            return sniff(Arrays.copyOf(header, read), file.toString());
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(file, e);
        }
    }

    private static boolean startsWith(final byte[] header, final byte[] prefix) {
        if (prefix.length == 0 || header.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (header[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
