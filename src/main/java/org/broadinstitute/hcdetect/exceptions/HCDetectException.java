package org.broadinstitute.hcdetect.exceptions;

/**
 * Failures of the library itself rather than of its input: broken internal invariants and branches that
 * cannot be reached.
 */
public class HCDetectException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public HCDetectException(final String message) {
        super(message);
    }

    /**
     * A {@code switch} or branch got a value it does not know about.
     */
    public static class ShouldNeverReachHereException extends HCDetectException {
        private static final long serialVersionUID = 0L;

        public ShouldNeverReachHereException(final String message) {
            super(message);
        }
    }

    /**
     * A count table whose derived state disagrees with its matrix.
     */
    public static class InconsistentTableState extends HCDetectException {
        private static final long serialVersionUID = 0L;

        public InconsistentTableState(final String detail) {
            super("Count table derived state is inconsistent: " + detail);
        }
    }
}
