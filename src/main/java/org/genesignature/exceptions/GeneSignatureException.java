package org.genesignature.exceptions;

/**
 * <p/>
 * Class GeneSignatureException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class GeneSignatureException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public GeneSignatureException(final String msg) {
        super(msg);
    }

    public GeneSignatureException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends GeneSignatureException {
        private static final long serialVersionUID = 0L;

        public ShouldNeverReachHereException(final String s) {
            super(s);
        }

        public ShouldNeverReachHereException(final String s, final Throwable throwable) {
            super(s, throwable);
        }
    }
}
