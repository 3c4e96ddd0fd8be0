package org.javai.resilience.boundary;

import com.fasterxml.jackson.core.JacksonException;
import org.javai.resilience.SdkErrors;
import org.javai.resilience.SdkException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Default classifier for exceptions thrown by network and data access code.
 *
 * <p>Connection problems are transient except for an unknown host, which retrying will not
 * fix. Malformed payloads are permanent. Unrecognised exceptions map to
 * {@link SdkErrors#GENERAL_FAILURE} and are assumed transient.
 */
public class DefaultExceptionClassifier implements ExceptionClassifier {

    @Override
    public Classification classify(String operation, Throwable t) {
        if (t instanceof SdkException sdkException) {
            return Classification.transientFailure(sdkException);
        }

        // Network: transient, except for hosts that do not resolve
        if (t instanceof SocketTimeoutException
                || t instanceof HttpTimeoutException
                || t instanceof ConnectException) {
            return Classification.transientFailure(wrap(SdkErrors.NET_PEER_CONNECTION, operation, t));
        }

        if (t instanceof UnknownHostException) {
            return Classification.permanentFailure(wrap(SdkErrors.NET_PEER_CONNECTION, operation, t));
        }

        // Payloads: a body that does not parse will not parse next time either
        if (t instanceof JacksonException) {
            return Classification.permanentFailure(wrap(SdkErrors.DATA_UNMARSHAL_FAILURE, operation, t));
        }

        // File system
        if (t instanceof FileNotFoundException || t instanceof NoSuchFileException) {
            return Classification.permanentFailure(wrap(SdkErrors.FS_FILE_OPEN_FAILED, operation, t));
        }

        if (t instanceof AccessDeniedException) {
            return Classification.permanentFailure(wrap(SdkErrors.ACCESS_UNAUTHORIZED, operation, t));
        }

        if (t instanceof IOException) {
            return Classification.transientFailure(wrap(SdkErrors.NET_READING_RESPONSE_BODY, operation, t));
        }

        if (t instanceof TimeoutException) {
            return Classification.transientFailure(wrap(SdkErrors.RETRY_MAX_ELAPSED_TIME_REACHED, operation, t));
        }

        if (t instanceof InterruptedException || t instanceof CancellationException) {
            return Classification.permanentFailure(wrap(SdkErrors.RETRY_CONTEXT_CANCELED, operation, t));
        }

        return Classification.transientFailure(wrap(SdkErrors.GENERAL_FAILURE, operation, t));
    }

    private static SdkException wrap(SdkException sentinel, String operation, Throwable t) {
        return sentinel.withMessage(sentinel.getMessage() + " in " + operation).wrap(t);
    }
}
