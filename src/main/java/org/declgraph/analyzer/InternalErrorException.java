package org.declgraph.analyzer;

/**
 * Thrown when an assumption about the type resolution oracle, or about the graph's own
 * bookkeeping, turns out to be false. Always a defect, never an expected runtime condition.
 */
public class InternalErrorException extends RuntimeException {

    private static final String PREFIX = "Internal Error: ";
    private static final String SUFFIX = "\n\nYou have encountered a software defect.";

    private final String unformattedMessage;

    /**
     * @param message Description of the violated assumption
     */
    public InternalErrorException(String message) {
        super(PREFIX + message + SUFFIX);
        this.unformattedMessage = message;
    }

    /**
     * @return the message without the internal-error decoration.
     */
    public String getUnformattedMessage() {
        return unformattedMessage;
    }
}
