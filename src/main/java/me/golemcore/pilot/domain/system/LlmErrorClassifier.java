package me.golemcore.pilot.domain.system;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies model provider failures into stable machine-readable reason codes
 * carried by {@link me.golemcore.pilot.domain.model.RunFailureException}.
 */
public final class LlmErrorClassifier {

    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String PROVIDER_UNAVAILABLE = "llm.provider.unavailable";
    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";
    public static final String STRUCTURED_OUTPUT_INVALID = "llm.structured.invalid_output";
    public static final String LANGCHAIN4J_RATE_LIMIT = "llm.langchain4j.rate_limit";
    public static final String LANGCHAIN4J_TIMEOUT = "llm.langchain4j.timeout";
    public static final String LANGCHAIN4J_AUTHENTICATION = "llm.langchain4j.authentication";
    public static final String LANGCHAIN4J_INVALID_REQUEST = "llm.langchain4j.invalid_request";
    public static final String LANGCHAIN4J_MODEL_NOT_FOUND = "llm.langchain4j.model_not_found";
    public static final String LANGCHAIN4J_CONTENT_FILTERED = "llm.langchain4j.content_filtered";
    public static final String LANGCHAIN4J_INTERNAL_SERVER = "llm.langchain4j.internal_server";
    public static final String LANGCHAIN4J_UNSUPPORTED_FEATURE = "llm.langchain4j.unsupported_feature";
    public static final String LANGCHAIN4J_HTTP_ERROR = "llm.langchain4j.http_error";
    public static final String LANGCHAIN4J_ERROR = "llm.langchain4j.error";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    // Matched by name so the domain layer stays free of provider imports
    private static final Map<String, String> CODES_BY_SIMPLE_NAME = Map.of(
            "RateLimitException", LANGCHAIN4J_RATE_LIMIT,
            "TimeoutException", LANGCHAIN4J_TIMEOUT,
            "AuthenticationException", LANGCHAIN4J_AUTHENTICATION,
            "InvalidRequestException", LANGCHAIN4J_INVALID_REQUEST,
            "ModelNotFoundException", LANGCHAIN4J_MODEL_NOT_FOUND,
            "ContentFilteredException", LANGCHAIN4J_CONTENT_FILTERED,
            "InternalServerException", LANGCHAIN4J_INTERNAL_SERVER,
            "UnsupportedFeatureException", LANGCHAIN4J_UNSUPPORTED_FEATURE,
            "LangChain4jException", LANGCHAIN4J_ERROR);

    private LlmErrorClassifier() {
    }

    /**
     * Classify a provider failure by walking the cause chain: embedded code
     * markers first, then known exception types, then well-known messages.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            String embedded = extractCode(current.getMessage());
            if (embedded != null && !embedded.isBlank()) {
                return embedded;
            }

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        if (message.startsWith("[" + code + "]")) {
            return message;
        }
        return "[" + code + "] " + message;
    }

    /**
     * Extract a code from diagnostics like: "[llm.some.code] details".
     */
    public static String extractCode(String message) {
        if (message == null || message.isBlank() || message.charAt(0) != '[') {
            return null;
        }
        int end = message.indexOf(']');
        if (end <= 1) {
            return null;
        }
        return message.substring(1, end);
    }

    public static boolean isTransientCode(String code) {
        return LANGCHAIN4J_RATE_LIMIT.equals(code)
                || LANGCHAIN4J_TIMEOUT.equals(code)
                || LANGCHAIN4J_INTERNAL_SERVER.equals(code)
                || REQUEST_TIMEOUT.equals(code);
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }
        if (CLASS_HTTP_EXCEPTION.equals(className)) {
            return classifyHttpExceptionByStatus(throwable);
        }
        String simpleName = className.substring(LANGCHAIN4J_EXCEPTIONS_PREFIX.length());
        return CODES_BY_SIMPLE_NAME.getOrDefault(simpleName, LANGCHAIN4J_ERROR);
    }

    private static String classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode == null) {
            return LANGCHAIN4J_HTTP_ERROR;
        }
        if (statusCode == 429) {
            return LANGCHAIN4J_RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return LANGCHAIN4J_AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return LANGCHAIN4J_TIMEOUT;
        }
        if (statusCode >= 500) {
            return LANGCHAIN4J_INTERNAL_SERVER;
        }
        if (statusCode >= 400) {
            return LANGCHAIN4J_INVALID_REQUEST;
        }
        return LANGCHAIN4J_HTTP_ERROR;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer status) {
                return status;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("prompt is too long")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }
        if (normalized.contains("rate limit") || normalized.contains("too many requests")) {
            return LANGCHAIN4J_RATE_LIMIT;
        }
        return UNKNOWN;
    }
}
