package org.javai.resilience.wire;

import org.javai.resilience.ErrorCode;

/**
 * A response body that may report a failure through an {@code err} field.
 *
 * <p>A null code means the request succeeded.
 */
public interface ResponseWithError {

    ErrorCode err();
}
