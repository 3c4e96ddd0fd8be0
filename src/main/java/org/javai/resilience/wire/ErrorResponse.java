package org.javai.resilience.wire;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.javai.resilience.ErrorCode;

/**
 * A response that carries nothing but its error code, e.g. {@code {"err":"entity_not_found"}}.
 *
 * @param err the error code, or null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(@JsonProperty("err") ErrorCode err) implements ResponseWithError {
}
