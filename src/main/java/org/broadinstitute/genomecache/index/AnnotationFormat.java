package org.broadinstitute.genomecache.index;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.UserException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Annotation file families. Only GFF3 is accepted; GTF is rejected outright rather than converted.
 */
public enum AnnotationFormat {
    GFF3,
    GTF;

    private static final Logger logger = LogManager.getLogger(AnnotationFormat.class);

    private static final String[] COMPRESSION_SUFFIXES = {".gz", ".bgz", ".bgzf", ".bz2", ".xz"};

    /** GTF attributes look like {@code gene_id "ENSG0001"; transcript_id "ENST0001";} */
    private static final Pattern GTF_ATTRIBUTES = Pattern.compile("^\\s*[A-Za-z_][A-Za-z0-9_]*\\s+\"[^\"]*\"\\s*;.*");

    /**
     * Classifies an annotation by the file name at the end of its URL, ignoring query strings and
     * compression suffixes. Names that are neither {@code .gtf} nor {@code .gff}/{@code .gff3} are taken as GFF3.
     */
    public static AnnotationFormat fromUrl(final String url) {
        String name = url;
        final int cut = indexOfAny(name, '?', '#');
        if (cut >= 0) {
            name = name.substring(0, cut);
        }
        name = name.substring(name.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (final String suffix : COMPRESSION_SUFFIXES) {
                if (name.endsWith(suffix)) {
                    name = name.substring(0, name.length() - suffix.length());
                    stripped = true;
                }
            }
        }
        if (name.endsWith(".gtf") || name.endsWith(".gtf2")) {
            return GTF;
        }
        if (!name.endsWith(".gff") && !name.endsWith(".gff3")) {
            logger.warn("Cannot tell the annotation format of " + url + " from its name; assuming GFF3");
        }
        return GFF3;
    }

    /**
     * Rejects an annotation URL that names a GTF file. Performs no I/O.
     *
     * @throws UserException.UnsupportedFormat for GTF
     */
    public static void requireGff3(final String url) {
        if (fromUrl(url) == GTF) {
            throw new UserException.UnsupportedFormat(url, "GTF annotations are not supported; register a GFF3 file instead");
        }
    }

    /**
     * @return true if the attribute column of a feature line uses GTF syntax
     */
    public static boolean looksLikeGtfAttributes(final String attributes) {
        return attributes != null && !attributes.contains("=") && GTF_ATTRIBUTES.matcher(attributes).matches();
    }

    private static int indexOfAny(final String s, final char a, final char b) {
        final int ia = s.indexOf(a);
        final int ib = s.indexOf(b);
        if (ia < 0) return ib;
        if (ib < 0) return ia;
        return Math.min(ia, ib);
    }
}
