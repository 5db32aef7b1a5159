package org.broadinstitute.genomecache.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Read-only tools over the publish tree.
 */
public final class PublishedGenomeProgramGroup implements CommandLineProgramGroup {

    @Override
    public String getName() { return "Published Genomes"; }

    @Override
    public String getDescription() { return "Tools that look up and read published genomes"; }
}
