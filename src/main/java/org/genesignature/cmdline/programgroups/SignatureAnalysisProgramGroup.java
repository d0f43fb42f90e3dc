package org.genesignature.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that compare expression profiles against gene signatures.
 */
public final class SignatureAnalysisProgramGroup implements CommandLineProgramGroup {

    @Override
    public String getName() { return "Signature Analysis"; }

    @Override
    public String getDescription() { return "Tools that assign expression samples to gene signatures by similarity"; }
}
