package com.surveygateway.security;

import com.surveygateway.api.GatewayError;
import com.surveygateway.api.GatewayException;
import com.surveygateway.config.GatewayConfigSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OriginValidatorTest {

    private static final String ALLOWED = "https://survey.example.com";

    private static OriginValidator validator(GatewayConfigSnapshot.Builder builder) {
        return new OriginValidator(builder.build());
    }

    private static GatewayConfigSnapshot.Builder allowing(String... origins) {
        return GatewayConfigSnapshot.builder().allowedOrigins(Set.of(origins));
    }

    private static MockHttpServletRequest requestFrom(String origin) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/chat");
        if (origin != null) {
            request.addHeader("Origin", origin);
        }
        return request;
    }

    @Test
    void allowedOriginPasses() {
        assertThatCode(() -> validator(allowing(ALLOWED)).verify(requestFrom(ALLOWED)))
                .doesNotThrowAnyException();
    }

    @Test
    void trailingSlashAndWhitespaceAreIgnoredOnBothSides() {
        OriginValidator validator = validator(allowing(" https://survey.example.com/ "));

        assertThat(validator.isAllowedOrigin("https://survey.example.com/")).isTrue();
        assertThat(validator.isAllowedOrigin("https://survey.example.com")).isTrue();
    }

    @Test
    void comparisonIsExactAndCaseSensitive() {
        OriginValidator validator = validator(allowing(ALLOWED));

        assertThat(validator.isAllowedOrigin("https://SURVEY.example.com")).isFalse();
        assertThat(validator.isAllowedOrigin("https://survey.example.com.evil.test")).isFalse();
        assertThat(validator.isAllowedOrigin("http://survey.example.com")).isFalse();
    }

    @Test
    void missingOriginIsUnauthorized() {
        assertThatThrownBy(() -> validator(allowing(ALLOWED)).verify(requestFrom(null)))
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).getError())
                .isEqualTo(GatewayError.UNAUTHORIZED);
    }

    @Test
    void emptyAllowListRejectsEverything() {
        assertThatThrownBy(() -> validator(GatewayConfigSnapshot.builder()).verify(requestFrom(ALLOWED)))
                .isInstanceOf(GatewayException.class);
    }

    @Test
    void refererIsUsedWhenOriginIsAbsent() {
        MockHttpServletRequest request = requestFrom(null);
        request.addHeader("Referer", "https://survey.example.com/jfe/form/SV_123?x=1");
        OriginValidator validator = validator(allowing(ALLOWED));

        assertThat(validator.resolveOrigin(request)).isEqualTo(ALLOWED);
        assertThatCode(() -> validator.verify(request)).doesNotThrowAnyException();
    }

    @Test
    void unparseableRefererYieldsNoOrigin() {
        MockHttpServletRequest request = requestFrom(null);
        request.addHeader("Referer", "not a uri with spaces");

        assertThat(validator(allowing(ALLOWED)).resolveOrigin(request)).isNull();
    }

    @Test
    void originCheckDisabledAcceptsAnyOrigin() {
        OriginValidator validator = validator(GatewayConfigSnapshot.builder().originCheckEnabled(false));

        assertThatCode(() -> validator.verify(requestFrom("https://anywhere.test"))).doesNotThrowAnyException();
        assertThatCode(() -> validator.verify(requestFrom(null))).doesNotThrowAnyException();
    }

    @Test
    void endpointKeyMustMatchWhenEnabled() {
        OriginValidator validator = validator(allowing(ALLOWED).endpointKeyEnabled(true).endpointKey("s3cret"));

        MockHttpServletRequest missing = requestFrom(ALLOWED);
        MockHttpServletRequest wrong = requestFrom(ALLOWED);
        wrong.addHeader(OriginValidator.ENDPOINT_KEY_HEADER, "guess");
        MockHttpServletRequest right = requestFrom(ALLOWED);
        right.addHeader(OriginValidator.ENDPOINT_KEY_HEADER, "s3cret");

        assertThatThrownBy(() -> validator.verify(missing)).isInstanceOf(GatewayException.class);
        assertThatThrownBy(() -> validator.verify(wrong)).isInstanceOf(GatewayException.class);
        assertThatCode(() -> validator.verify(right)).doesNotThrowAnyException();
    }

    @Test
    void enabledKeyWithoutConfiguredSecretRejectsAll() {
        OriginValidator validator = validator(allowing(ALLOWED).endpointKeyEnabled(true).endpointKey(""));
        MockHttpServletRequest request = requestFrom(ALLOWED);
        request.addHeader(OriginValidator.ENDPOINT_KEY_HEADER, "");

        assertThatThrownBy(() -> validator.verify(request)).isInstanceOf(GatewayException.class);
    }

    @Test
    void badOriginAndBadKeyLookTheSameToCaller() {
        OriginValidator validator = validator(allowing(ALLOWED).endpointKeyEnabled(true).endpointKey("s3cret"));

        GatewayException badOrigin = catchGateway(() -> validator.verify(requestFrom("https://evil.test")));
        GatewayException badKey = catchGateway(() -> validator.verify(requestFrom(ALLOWED)));

        assertThat(badOrigin.getError()).isEqualTo(badKey.getError());
        assertThat(badOrigin.getCallerMessage()).isEqualTo(badKey.getCallerMessage());
    }

    private static GatewayException catchGateway(Runnable action) {
        try {
            action.run();
        } catch (GatewayException e) {
            return e;
        }
        throw new AssertionError("Expected GatewayException");
    }
}
