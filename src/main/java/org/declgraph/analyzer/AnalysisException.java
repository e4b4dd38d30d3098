package org.declgraph.analyzer;

/**
 * Thrown when the analyzed program uses a construct the declaration graph cannot represent.
 * <p>
 * Typical causes:
 * <ul>
 *   <li>An entry-point export that does not resolve to any supported declaration</li>
 *   <li>An export or import declaration shape that is not implemented</li>
 *   <li>A malformed {@code package.json} encountered during metadata lookup</li>
 * </ul>
 * <p>
 * This is a RuntimeException because the run cannot continue once the input has been
 * rejected; the message names the offending export or source text.
 */
public class AnalysisException extends RuntimeException {

    /**
     * Creates an AnalysisException with the specified message.
     *
     * @param message Description of the unsupported input
     */
    public AnalysisException(String message) {
        super(message);
    }

    /**
     * Creates an AnalysisException with the specified message and cause.
     *
     * @param message Description of the unsupported input
     * @param cause The underlying exception that caused the failure
     */
    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
