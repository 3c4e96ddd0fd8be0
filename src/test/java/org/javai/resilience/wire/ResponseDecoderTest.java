package org.javai.resilience.wire;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JacksonException;
import org.javai.resilience.ErrorCode;
import org.javai.resilience.Outcome;
import org.javai.resilience.SdkErrors;
import org.javai.resilience.SdkException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ResponseDecoderTest {

    record SecretResponse(@JsonProperty("data") String data, @JsonProperty("err") ErrorCode err)
            implements ResponseWithError {}

    private final ResponseDecoder decoder = new ResponseDecoder();

    private static byte[] json(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void decode_success_returnsResponse() {
        Outcome<SecretResponse> result = decoder.decode(json("{\"data\":\"s3cr3t\"}"), SecretResponse.class);

        assertThat(result.getOrThrow().data()).isEqualTo("s3cr3t");
        assertThat(result.getOrThrow().err()).isNull();
    }

    @Test
    void decode_emptyErrorField_isSuccess() {
        Outcome<SecretResponse> result = decoder.decode(json("{\"data\":\"x\",\"err\":\"\"}"), SecretResponse.class);

        assertThat(result.isOk()).isTrue();
    }

    @Test
    void decode_knownErrorCode_returnsRegisteredError() {
        Outcome<SecretResponse> result = decoder.decode(json("{\"err\":\"entity_not_found\"}"), SecretResponse.class);

        assertThat(result.failure()).containsSame(SdkErrors.ENTITY_NOT_FOUND);
    }

    @Test
    void decode_unknownErrorCode_degradesToGeneralFailure() {
        Outcome<SecretResponse> result = decoder.decode(json("{\"err\":\"brand_new_code\"}"), SecretResponse.class);

        assertThat(result.failure()).containsSame(SdkErrors.GENERAL_FAILURE);
    }

    @Test
    void decode_unknownFields_areIgnored() {
        Outcome<SecretResponse> result = decoder.decode(
                json("{\"data\":\"x\",\"version\":3,\"metadata\":{\"owner\":\"ops\"}}"), SecretResponse.class);

        assertThat(result.getOrThrow().data()).isEqualTo("x");
    }

    @Test
    void decode_malformedBody_isPermanentUnmarshalFailure() {
        Outcome<SecretResponse> result = decoder.decode(json("{\"data\":"), SecretResponse.class);

        assertThat(result.isPermanent()).isTrue();
        SdkException error = result.failure().orElseThrow();
        assertThat(error.code()).isEqualTo(SdkErrors.DATA_UNMARSHAL_FAILURE.code());
        assertThat(error.getCause()).isInstanceOf(JacksonException.class);
    }

    @Test
    void decode_emptyBody_isUnmarshalFailure() {
        Outcome<ErrorResponse> result = decoder.decode(new byte[0], ErrorResponse.class);

        assertThat(result.failure().orElseThrow().code()).isEqualTo(SdkErrors.DATA_UNMARSHAL_FAILURE.code());
    }

    @Test
    void encodeError_writesBareCode() {
        byte[] body = decoder.encodeError(SdkErrors.ACCESS_UNAUTHORIZED.withMessage("token expired"));

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("{\"err\":\"access_unauthorized\"}");
    }

    @Test
    void encodeError_thenDecode_resolvesSameSentinel() {
        byte[] body = decoder.encodeError(SdkErrors.STATE_NOT_READY);

        Outcome<ErrorResponse> result = decoder.decode(body, ErrorResponse.class);

        assertThat(result.failure()).containsSame(SdkErrors.STATE_NOT_READY);
    }
}
