package org.javai.resilience.boundary;

import org.javai.resilience.Outcome;
import org.javai.resilience.SdkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The boundary adapter for integrating APIs that throw checked exceptions.
 * Catches exceptions, classifies them into SDK errors and returns an Outcome.
 *
 * <p>This is the single point where checked exceptions are translated into the Outcome world,
 * which makes a boundary call a natural body for a retry attempt:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.standard();
 *
 * Outcome<HttpResponse<String>> result = Retries.call(token,
 *     () -> boundary.call("HttpClient.send", () -> httpClient.send(request, ofString())));
 * }</pre>
 *
 * <p>An {@link SdkException} thrown by the work is already classified and becomes a transient
 * failure. Any other RuntimeException is a defect and propagates.</p>
 */
public final class Boundary {

    private static final Logger logger = LoggerFactory.getLogger(Boundary.class);

    private static final ExceptionClassifier DEFAULT_CLASSIFIER = new DefaultExceptionClassifier();

    private final ExceptionClassifier classifier;

    /**
     * Creates a Boundary using {@link DefaultExceptionClassifier}.
     */
    public static Boundary standard() {
        return new Boundary(DEFAULT_CLASSIFIER);
    }

    /**
     * Creates a Boundary with custom classification.
     *
     * @param classifier the classifier for translating exceptions to errors
     * @return a configured Boundary
     */
    public static Boundary of(ExceptionClassifier classifier) {
        return new Boundary(classifier);
    }

    public Boundary(ExceptionClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any exception into an Outcome.
     *
     * @param operation The operation name, used in error messages and logs
     * @param work The work to execute
     * @return Ok with the result, or Fail with a classified error
     */
    public <T> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (SdkException e) {
            return Outcome.fail(e);
        } catch (RuntimeException e) {
            // Defects propagate; they are not operational failures.
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return handleException(operation, e);
        }
    }

    private <T> Outcome<T> handleException(String operation, Exception e) {
        Classification classification = Objects.requireNonNull(
                classifier.classify(operation, e), "classifier returned null");
        logger.debug("Operation [{}] failed with {} ({}): {}",
                operation,
                classification.error().code(),
                classification.stability(),
                e.toString());
        return classification.toOutcome();
    }
}
