package org.broadinstitute.genomecache.index;

import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class AnnotationFormatUnitTest extends BaseTest {

    @DataProvider(name = "urls")
    public Object[][] urls() {
        return new Object[][]{
                {"https://example.org/genes.gff3.gz", AnnotationFormat.GFF3},
                {"https://example.org/genes.gff", AnnotationFormat.GFF3},
                {"file:///data/genes.GFF3.bz2", AnnotationFormat.GFF3},
                {"https://example.org/download?file=genes", AnnotationFormat.GFF3},
                {"https://example.org/genes.gtf.gz", AnnotationFormat.GTF},
                {"https://example.org/Homo_sapiens.GRCh38.110.gtf", AnnotationFormat.GTF},
                {"https://example.org/genes.gtf.gz?token=abc#frag", AnnotationFormat.GTF},
                {"https://example.org/genes.gtf.bgz", AnnotationFormat.GTF},
        };
    }

    @Test(dataProvider = "urls")
    public void testFromUrl(final String url, final AnnotationFormat expected) {
        Assert.assertEquals(AnnotationFormat.fromUrl(url), expected);
    }

    @Test
    public void testRequireGff3AcceptsGff3() {
        AnnotationFormat.requireGff3("https://example.org/genes.gff3.gz");
    }

    @Test(expectedExceptions = UserException.UnsupportedFormat.class)
    public void testRequireGff3RejectsGtf() {
        AnnotationFormat.requireGff3("https://example.org/genes.gtf.gz");
    }

    @Test
    public void testLooksLikeGtfAttributes() {
        Assert.assertTrue(AnnotationFormat.looksLikeGtfAttributes("gene_id \"g1\"; transcript_id \"t1\";"));
        Assert.assertFalse(AnnotationFormat.looksLikeGtfAttributes("ID=g1;Name=\"quoted\""));
        Assert.assertFalse(AnnotationFormat.looksLikeGtfAttributes("."));
        Assert.assertFalse(AnnotationFormat.looksLikeGtfAttributes(null));
    }
}
