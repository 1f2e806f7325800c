package uk.gov.di.oidcop.shared.helpers;

import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URLEncodedUtils;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

public class RequestBodyHelper {

    public static Map<String, String> parseRequestBody(String body) {
        Map<String, String> queryPairs = new HashMap<>();
        if (body == null || body.isBlank()) {
            return queryPairs;
        }

        for (NameValuePair pair : URLEncodedUtils.parse(body, StandardCharsets.UTF_8)) {
            queryPairs.put(pair.getName(), pair.getValue());
        }

        return queryPairs;
    }
}
