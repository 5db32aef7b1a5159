package org.broadinstitute.genomecache.exceptions;

import org.broadinstitute.genomecache.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Paths;

public final class EntryFailedExceptionUnitTest extends BaseTest {

    @Test
    public void testMessageNamesTheStage() {
        final EntryFailedException e = new EntryFailedException(PipelineStage.FETCH_ANNOTATION,
                new GenomeCacheException.FetchFailure("https://example.org/genes.gff3.gz", 503, "Service Unavailable"));
        Assert.assertEquals(e.getStage(), PipelineStage.FETCH_ANNOTATION);
        Assert.assertTrue(e.getMessage().startsWith("FETCH_ANNOTATION: Fetching https://example.org/genes.gff3.gz failed with HTTP status 503"),
                e.getMessage());
        Assert.assertFalse(e.isUserError());
    }

    @Test
    public void testUserCause() {
        final EntryFailedException e = new EntryFailedException(PipelineStage.TRANSCODE,
                new UserException.CouldNotReadInputFile(Paths.get("/cache/raw/sequence"), "truncated"));
        Assert.assertTrue(e.isUserError());
        Assert.assertTrue(e.getCause() instanceof UserException);
    }

    @Test
    public void testCauseWithoutMessage() {
        Assert.assertEquals(EntryFailedException.describe(PipelineStage.PUBLISH, new IllegalStateException()),
                "PUBLISH: java.lang.IllegalStateException");
    }
}
