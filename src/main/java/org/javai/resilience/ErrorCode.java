package org.javai.resilience;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A stable, serializable identifier for a kind of error.
 *
 * <p>This is the only piece of error information that crosses the network: a
 * response carries the bare code string (e.g., {@code entity_not_found}) and the
 * receiving side resolves it through {@link SdkErrors#fromCode(ErrorCode)}.
 *
 * @param value The code string, conventionally lowercase words joined by underscores
 */
public record ErrorCode(String value) {

    public ErrorCode {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }

    public static ErrorCode of(String value) {
        return new ErrorCode(value);
    }

    /**
     * Reads a code from its JSON string form. An absent or empty code means "no error"
     * on the wire and reads as null.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ErrorCode fromJson(String value) {
        return value == null || value.isBlank() ? null : new ErrorCode(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
