package org.broadinstitute.genomecache.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that download, prepare and publish reference genomes.
 */
public final class GenomeCacheProgramGroup implements CommandLineProgramGroup {

    @Override
    public String getName() { return "Genome Cache"; }

    @Override
    public String getDescription() { return "Tools that fetch, index and publish reference genomes"; }
}
