package org.javai.resilience.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.resilience.ErrorCode;
import org.javai.resilience.Outcome;
import org.javai.resilience.SdkErrors;
import org.javai.resilience.SdkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Turns response bodies into typed responses, mapping a reported error code back to its
 * registered {@link SdkException}.
 *
 * <pre>{@code
 * Outcome<SecretResponse> secret = decoder.decode(body, SecretResponse.class);
 * }</pre>
 *
 * <ul>
 *   <li>a body that does not parse fails permanently with
 *       {@link SdkErrors#DATA_UNMARSHAL_FAILURE} wrapping the parser error</li>
 *   <li>a body with a non-empty {@code err} fails with {@link SdkErrors#fromCode(ErrorCode)},
 *       so an unknown code degrades to {@link SdkErrors#GENERAL_FAILURE}</li>
 *   <li>anything else is returned as is</li>
 * </ul>
 */
public final class ResponseDecoder {

    private static final Logger logger = LoggerFactory.getLogger(ResponseDecoder.class);

    private final ObjectMapper mapper;

    public ResponseDecoder() {
        this(defaultMapper());
    }

    public ResponseDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Returns a mapper that ignores properties the response types do not declare.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public <T extends ResponseWithError> Outcome<T> decode(byte[] body, Class<T> type) {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(type, "type must not be null");

        T response;
        try {
            response = mapper.readValue(body, type);
        } catch (IOException e) {
            logger.debug("Failed to decode {} from {} bytes: {}", type.getSimpleName(), body.length, e.getMessage());
            return Outcome.permanent(SdkErrors.DATA_UNMARSHAL_FAILURE.wrap(e));
        }

        if (response == null) {
            return Outcome.permanent(SdkErrors.DATA_UNMARSHAL_FAILURE.withMessage("response body is null"));
        }

        ErrorCode err = response.err();
        if (err != null) {
            return Outcome.fail(SdkErrors.fromCode(err));
        }
        return Outcome.ok(response);
    }

    /**
     * Encodes the error body a server sends for {@code error}: {@code {"err":"<code>"}}.
     *
     * @throws SdkException {@link SdkErrors#DATA_MARSHAL_FAILURE} if encoding fails
     */
    public byte[] encodeError(SdkException error) {
        Objects.requireNonNull(error, "error must not be null");
        try {
            return mapper.writeValueAsBytes(new ErrorResponse(error.code()));
        } catch (JsonProcessingException e) {
            throw SdkErrors.DATA_MARSHAL_FAILURE.wrap(e);
        }
    }
}
