package org.broadinstitute.hcdetect.exceptions;

/**
 * Errors the caller can fix by changing the input, such as a count table without any mass or a candidate
 * declared part of a table it does not fit in.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String message) {
        super(message);
    }

    /**
     * No statistic can be computed from the input.
     */
    public static class InvalidInput extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidInput(final String message) {
            super("Invalid input: " + message);
        }
    }

    /**
     * Every count of the table is zero.
     */
    public static class EmptyCountTable extends InvalidInput {
        private static final long serialVersionUID = 0L;

        public EmptyCountTable(final int numDocuments, final int numFeatures) {
            super(String.format("all counts are zero in the %d x %d count table; was it built from the right data?",
                    numDocuments, numFeatures));
        }
    }

    /**
     * The candidate was declared part of the table but has more counts than the table on some feature.
     */
    public static class InvalidSubsetRelation extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidSubsetRelation(final String featureName, final long referenceCount, final long candidateCount) {
            super(String.format("the candidate cannot be part of the table: feature '%s' has %d counts in the candidate " +
                    "but only %d in the table", featureName, candidateCount, referenceCount));
        }
    }
}
