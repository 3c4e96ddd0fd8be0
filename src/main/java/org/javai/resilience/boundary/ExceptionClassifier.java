package org.javai.resilience.boundary;

/**
 * Classifies exceptions into the SDK error taxonomy.
 * Implementations should be deterministic: the same exception always yields the same code.
 */
@FunctionalInterface
public interface ExceptionClassifier {

    /**
     * Classifies an exception.
     *
     * @param operation The operation that was being performed
     * @param throwable The exception that occurred
     * @return A classification, never null
     */
    Classification classify(String operation, Throwable throwable);
}
