package uk.gov.di.oidcop.shared.helpers;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Collections;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static uk.gov.di.oidcop.shared.helpers.RequestHeaderHelper.getHeaderValueFromHeaders;
import static uk.gov.di.oidcop.shared.helpers.RequestHeaderHelper.headersContainValidHeader;

class RequestHeaderHelperTest {

    private static final String BEARER = "Bearer token-value";

    private static Stream<Arguments> headersTestParameters() {
        return Stream.of(
                arguments(null, "Authorization", true, false, null),
                arguments(Collections.emptyMap(), "Authorization", true, false, null),
                arguments(Map.of("Authorization", BEARER), "Authorization", false, true, BEARER),
                arguments(Map.of("authorization", BEARER), "Authorization", false, false, null),
                arguments(Map.of("authorization", BEARER), "Authorization", true, true, BEARER),
                arguments(Map.of("AUTHORIZATION", BEARER), "Authorization", true, true, BEARER),
                arguments(Map.of("Accept", "*/*"), "Authorization", true, false, null));
    }

    @ParameterizedTest
    @MethodSource("headersTestParameters")
    void testHeadersContainValidHeader(
            Map<String, String> headers,
            String headerName,
            boolean matchCaseInsensitive,
            boolean expectedValidity) {
        assertEquals(
                expectedValidity,
                headersContainValidHeader(headers, headerName, matchCaseInsensitive));
    }

    @ParameterizedTest
    @MethodSource("headersTestParameters")
    void testGetHeaderValueFromHeaders(
            Map<String, String> headers,
            String headerName,
            boolean matchCaseInsensitive,
            boolean expectedValidity,
            String expectedValue) {
        assertEquals(
                expectedValue, getHeaderValueFromHeaders(headers, headerName, matchCaseInsensitive));
    }
}
