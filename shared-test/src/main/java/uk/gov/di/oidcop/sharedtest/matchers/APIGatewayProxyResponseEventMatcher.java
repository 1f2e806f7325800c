package uk.gov.di.oidcop.sharedtest.matchers;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeDiagnosingMatcher;

import java.util.function.Function;

import static org.hamcrest.Matchers.equalTo;

public class APIGatewayProxyResponseEventMatcher<T>
        extends TypeSafeDiagnosingMatcher<APIGatewayProxyResponseEvent> {

    private final String name;
    private final Function<APIGatewayProxyResponseEvent, T> mapper;
    private final Matcher<T> matcher;

    private APIGatewayProxyResponseEventMatcher(
            String name, Function<APIGatewayProxyResponseEvent, T> mapper, Matcher<T> matcher) {
        this.name = name;
        this.mapper = mapper;
        this.matcher = matcher;
    }

    @Override
    protected boolean matchesSafely(
            APIGatewayProxyResponseEvent item, Description mismatchDescription) {
        var actual = mapper.apply(item);

        boolean matched = matcher.matches(actual);

        if (!matched) {
            mismatchDescription.appendText(
                    "an APIGatewayProxyResponseEvent with " + name + ": " + actual);
        }

        return matched;
    }

    @Override
    public void describeTo(Description description) {
        description.appendText(name + " ").appendDescriptionOf(matcher);
    }

    public static APIGatewayProxyResponseEventMatcher<Integer> hasStatus(int statusCode) {
        return new APIGatewayProxyResponseEventMatcher<>(
                "status code", APIGatewayProxyResponseEvent::getStatusCode, equalTo(statusCode));
    }

    public static APIGatewayProxyResponseEventMatcher<String> hasBody(String body) {
        return new APIGatewayProxyResponseEventMatcher<>(
                "body", APIGatewayProxyResponseEvent::getBody, equalTo(body));
    }

    public static APIGatewayProxyResponseEventMatcher<String> hasHeader(
            String headerName, String value) {
        return new APIGatewayProxyResponseEventMatcher<>(
                headerName + " header",
                r -> r.getHeaders() == null ? null : r.getHeaders().get(headerName),
                equalTo(value));
    }

    public static APIGatewayProxyResponseEventMatcher<String> hasContentType(String contentType) {
        return hasHeader("Content-Type", contentType);
    }
}
