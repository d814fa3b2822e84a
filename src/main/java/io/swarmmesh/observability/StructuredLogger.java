package io.swarmmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.swarmmesh.security.SensitiveDataMasker;
import io.swarmmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public final class StructuredLogger {
    private final Logger delegate;

    private StructuredLogger(Logger delegate) {
        this.delegate = delegate;
    }

    public static StructuredLogger of(Class<?> type) {
        return new StructuredLogger(LoggerFactory.getLogger(type));
    }

    public static Map<String, Object> fields(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("fields() expects key/value pairs");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            out.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return out;
    }

    public void debug(String message, Map<String, Object> context) {
        if (delegate.isDebugEnabled()) {
            delegate.debug(render(message, context));
        }
    }

    public void info(String message) {
        delegate.info(message);
    }

    public void info(String message, Map<String, Object> context) {
        if (delegate.isInfoEnabled()) {
            delegate.info(render(message, context));
        }
    }

    public void warn(String message, Map<String, Object> context) {
        if (delegate.isWarnEnabled()) {
            delegate.warn(render(message, context));
        }
    }

    public void error(String message, Map<String, Object> context) {
        delegate.error(render(message, context));
    }

    public void error(String message, Map<String, Object> context, Throwable error) {
        delegate.error(render(message, context), error);
    }

    public boolean debugEnabled() {
        return delegate.isDebugEnabled();
    }

    static String render(String message, Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return message;
        }
        JsonNode masked = SensitiveDataMasker.masked(Jsons.toTree(context));
        return message + " " + Jsons.toCompactJson(masked);
    }
}
