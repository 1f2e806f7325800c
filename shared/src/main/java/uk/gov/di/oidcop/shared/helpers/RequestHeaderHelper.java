package uk.gov.di.oidcop.shared.helpers;

import java.util.Map;
import java.util.Optional;

public final class RequestHeaderHelper {

    private RequestHeaderHelper() {}

    public static boolean headersContainValidHeader(
            Map<String, String> headers, String headerName, boolean matchLowerCase) {
        return getOptionalHeaderValueFromHeaders(headers, headerName, matchLowerCase).isPresent();
    }

    public static String getHeaderValueFromHeaders(
            Map<String, String> headers, String headerName, boolean matchLowerCase) {
        return getOptionalHeaderValueFromHeaders(headers, headerName, matchLowerCase).orElse(null);
    }

    /**
     * Looks a header up by its exact name. When {@code matchCaseInsensitive} is set any casing
     * of the name is accepted as well.
     */
    public static Optional<String> getOptionalHeaderValueFromHeaders(
            Map<String, String> headers, String headerName, boolean matchCaseInsensitive) {
        if (headers == null || headers.isEmpty() || headerName == null) {
            return Optional.empty();
        } else if (headers.containsKey(headerName)) {
            return Optional.ofNullable(headers.get(headerName));
        } else if (matchCaseInsensitive) {
            return headers.entrySet().stream()
                    .filter(e -> headerName.equalsIgnoreCase(e.getKey()))
                    .map(Map.Entry::getValue)
                    .findFirst();
        } else {
            return Optional.empty();
        }
    }
}
