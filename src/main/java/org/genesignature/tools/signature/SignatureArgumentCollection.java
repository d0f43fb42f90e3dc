package org.genesignature.tools.signature;

import org.broadinstitute.barclay.argparser.Argument;
import org.genesignature.cmdline.StandardArgumentDefinitions;
import org.genesignature.exceptions.UserException;
import org.genesignature.tools.signature.similarity.LabeledMatrix;
import org.genesignature.tools.signature.similarity.SimilarityMeasure;
import org.genesignature.tools.signature.similarity.SimilarityResult;

import java.io.File;
import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Files;
import java.time.LocalDateTime;

/**
 * Inputs, similarity measure and output location shared by the signature tools.
 */
public final class SignatureArgumentCollection implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String QUERY_LONG_NAME = "query";
    public static final String QUERY_SHORT_NAME = "Q";
    public static final String SIGNATURE_LONG_NAME = "signature";
    public static final String SIGNATURE_SHORT_NAME = "S";
    public static final String RESULTS_DIRECTORY_LONG_NAME = "results-directory";

    @Argument(
            doc = "Input TSV of expression values, features (e.g., genes) by samples.",
            fullName = QUERY_LONG_NAME,
            shortName = QUERY_SHORT_NAME
    )
    private File queryFile;

    @Argument(
            doc = "Input TSV of gene signatures, features (e.g., genes) by signatures.",
            fullName = SIGNATURE_LONG_NAME,
            shortName = SIGNATURE_SHORT_NAME
    )
    private File signatureFile;

    @Argument(
            doc = "Similarity measure between samples and signatures (cosine or spearman).",
            fullName = SimilarityMeasure.ARGUMENT_LONG_NAME,
            optional = true
    )
    private String similarityMeasure = SimilarityMeasure.COSINE.getName();

    @Argument(
            doc = "Directory in which a timestamped result file is written when no output file is given.",
            fullName = RESULTS_DIRECTORY_LONG_NAME,
            optional = true
    )
    private File resultsDirectory = new File(".");

    @Argument(
            doc = "Output TSV of the sample-to-signature result.  Overrides the results directory.",
            fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            optional = true
    )
    private File outputFile = null;

    /**
     * @throws org.broadinstitute.barclay.argparser.CommandLineException.BadArgumentValue if the measure is not recognized
     */
    public SimilarityMeasure getSimilarityMeasure() {
        return SimilarityMeasure.fromName(similarityMeasure);
    }

    public LabeledMatrix readQuery() {
        return LabeledMatrix.read(queryFile);
    }

    public LabeledMatrix readSignature() {
        return LabeledMatrix.read(signatureFile);
    }

    public File getQueryFile() {
        return queryFile;
    }

    public File getSignatureFile() {
        return signatureFile;
    }

    /**
     * Returns the explicit output file if one was given, otherwise a timestamped file in the results directory,
     * which is created if needed.
     */
    public File resolveOutputFile(final String method) {
        if (outputFile != null) {
            return outputFile;
        }
        try {
            Files.createDirectories(resultsDirectory.toPath());
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(resultsDirectory, "the results directory could not be created", e);
        }
        return SimilarityResult.composeOutputFile(resultsDirectory, method, getSimilarityMeasure(), LocalDateTime.now());
    }
}
