package uk.gov.di.oidcop.shared.helpers;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import org.apache.http.HttpHeaders;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class ApiGatewayResponseHelper {

    public enum SecurityHeaders {
        XSS_PROTECTION("X-XSS-Protection", "1; mode=block"),
        CONTENT_TYPE_OPTIONS("X-Content-Type-Options", "nosniff"),
        CONTENT_SECURITY_POLICY("Content-Security-Policy", "frame-ancestors 'none'"),
        STRICT_TRANSPORT_SECURITY(
                "Strict-Transport-Security", "max-age=31536000; includeSubDomains; preload"),
        FRAME_OPTIONS("X-Frame-Options", "DENY"),
        CACHE_CONTROL(HttpHeaders.CACHE_CONTROL, "no-cache, no-store"),
        PRAGMA(HttpHeaders.PRAGMA, "no-cache");

        private final String headerName;
        private final String headerValue;

        SecurityHeaders(String headerName, String headerValue) {
            this.headerName = headerName;
            this.headerValue = headerValue;
        }

        public static Map<String, String> headers() {
            return Arrays.stream(SecurityHeaders.values())
                    .collect(Collectors.toMap(x -> x.headerName, x -> x.headerValue));
        }
    }

    public static APIGatewayProxyResponseEvent generateApiGatewayProxyResponse(
            int statusCode, String body) {
        return generateApiGatewayProxyResponse(statusCode, body, null, null);
    }

    public static APIGatewayProxyResponseEvent generateApiGatewayProxyResponse(
            int statusCode, String body, Map<String, List<String>> multiValueHeaders) {
        return generateApiGatewayProxyResponse(statusCode, body, null, multiValueHeaders);
    }

    public static APIGatewayProxyResponseEvent generateApiGatewayProxyResponse(
            int statusCode,
            String body,
            Map<String, String> headers,
            Map<String, List<String>> multiValueHeaders) {

        var allHeaders = SecurityHeaders.headers();

        Optional.ofNullable(headers).ifPresent(allHeaders::putAll);

        var response =
                new APIGatewayProxyResponseEvent()
                        .withStatusCode(statusCode)
                        .withBody(body)
                        .withHeaders(allHeaders);

        if (multiValueHeaders != null) {
            response.setMultiValueHeaders(multiValueHeaders);
        }

        return response;
    }
}
