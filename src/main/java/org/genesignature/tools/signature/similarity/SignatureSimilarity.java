package org.genesignature.tools.signature.similarity;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.genesignature.cmdline.CommandLineProgram;
import org.genesignature.cmdline.programgroups.SignatureAnalysisProgramGroup;
import org.genesignature.tools.signature.SignatureArgumentCollection;

import java.io.File;

/**
 * Assigns each gene signature to its most similar expression sample in a single pass over all common features.
 *
 * <h3>Examples</h3>
 *
 * <pre>
 * java -jar gene-signature-toolkit.jar SignatureSimilarity \
 *   --query expression.tsv \
 *   --signature signatures.tsv \
 *   --similarity-measure spearman \
 *   --results-directory results
 * </pre>
 *
 * The output has one row per sample and one column per signature.  Each signature column holds a single 1 at its
 * most similar sample unless {@code --binarize false} is given, in which case the raw similarities are written.
 */
@CommandLineProgramProperties(
        summary = "Computes the similarity between expression samples and gene signatures and assigns each signature to its most similar sample",
        oneLineSummary = "Assign gene signatures to expression samples by similarity",
        programGroup = SignatureAnalysisProgramGroup.class
)
@DocumentedFeature
public final class SignatureSimilarity extends CommandLineProgram {
    static final String METHOD_NAME = "similarity";
    public static final String BINARIZE_LONG_NAME = "binarize";

    @ArgumentCollection
    private SignatureArgumentCollection signatureArguments = new SignatureArgumentCollection();

    @Argument(
            doc = "Whether to write the one-hot assignment (true) or the raw similarity (false).",
            fullName = BINARIZE_LONG_NAME,
            optional = true
    )
    private boolean binarize = true;

    @Override
    protected Object doWork() {
        final SimilarityMeasure measure = signatureArguments.getSimilarityMeasure();

        logger.info(String.format("Reading query matrix (%s)...", signatureArguments.getQueryFile()));
        final LabeledMatrix query = signatureArguments.readQuery();
        logger.info(String.format("Reading signature matrix (%s)...", signatureArguments.getSignatureFile()));
        final LabeledMatrix signatures = signatureArguments.readSignature();

        logger.info(String.format("Computing %s similarity between %d samples and %d signatures...",
                measure, query.getNumColumns(), signatures.getNumColumns()));
        final RealMatrix similarity = SimilarityUtils.computeSimilarity(query, signatures, measure);
        final RealMatrix values = binarize ? SimilarityUtils.binarize(similarity, SimilarityUtils.AXIS_COLUMNS) : similarity;
        final SimilarityResult result = new SimilarityResult(query.getColumnLabels(), signatures.getColumnLabels(), values);
        result.getBestQueryLabelByReference().forEach((signature, sample) ->
                logger.info(String.format("Signature %s is most similar to sample %s.", signature, sample)));

        final File outputFile = signatureArguments.resolveOutputFile(METHOD_NAME);
        logger.info(String.format("Writing result to %s...", outputFile));
        result.write(outputFile);

        logger.info("Signature similarity complete.");

        return "SUCCESS";
    }
}
