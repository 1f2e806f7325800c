package uk.gov.di.oidcop.shared.helpers;

import io.opentelemetry.api.trace.Span;
import org.apache.logging.log4j.ThreadContext;

import static uk.gov.di.oidcop.shared.helpers.InputSanitiser.sanitiseBase64;
import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.LogFieldName.SESSION_ID;
import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.LogFieldName.SPAN_ID;
import static uk.gov.di.oidcop.shared.helpers.LogLineHelper.LogFieldName.TRACE_ID;

public class LogLineHelper {

    public enum LogFieldName {
        SESSION_ID("sessionId", true),
        GRANT_ID("grantId", true),
        AWS_REQUEST_ID("awsRequestId", false),
        CLIENT_ID("clientId", false),
        SPAN_ID("spanId", false),
        TRACE_ID("traceId", false);

        private final String logFieldName;
        private final boolean isBase64;

        LogFieldName(String fieldName, boolean isBase64) {
            this.logFieldName = fieldName;
            this.isBase64 = isBase64;
        }

        public String getLogFieldName() {
            return logFieldName;
        }
    }

    public static void attachLogFieldToLogs(LogFieldName logFieldName, String value) {
        if (logFieldName.isBase64 && sanitiseBase64(value).isEmpty()) {
            ThreadContext.put(logFieldName.getLogFieldName(), "invalid-identifier");
        } else {
            ThreadContext.put(logFieldName.getLogFieldName(), value);
        }
    }

    public static void attachSessionIdToLogs(String sessionId) {
        attachLogFieldToLogs(SESSION_ID, sessionId);
    }

    public static void attachTraceId() {
        var spanContext = Span.current().getSpanContext();
        if (spanContext.isValid()) {
            attachLogFieldToLogs(TRACE_ID, spanContext.getTraceId());
            attachLogFieldToLogs(SPAN_ID, spanContext.getSpanId());
        }
    }
}
