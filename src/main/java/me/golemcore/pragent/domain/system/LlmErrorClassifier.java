package me.golemcore.pragent.domain.system;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies LLM failures into stable machine-readable reason codes.
 *
 * <p>
 * Structured signals (embedded {@code [code]} markers, langchain4j exception
 * types, HTTP status codes) are checked along the whole cause chain before any
 * message text is inspected. Message matching only recognizes the upstream
 * unavailability signatures of gateway-fronted model runners.
 */
public final class LlmErrorClassifier {

    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String UPSTREAM_UNAVAILABLE = "llm.upstream.unavailable";
    public static final String LANGCHAIN4J_RATE_LIMIT = "llm.langchain4j.rate_limit";
    public static final String LANGCHAIN4J_TIMEOUT = "llm.langchain4j.timeout";
    public static final String LANGCHAIN4J_AUTHENTICATION = "llm.langchain4j.authentication";
    public static final String LANGCHAIN4J_INVALID_REQUEST = "llm.langchain4j.invalid_request";
    public static final String LANGCHAIN4J_MODEL_NOT_FOUND = "llm.langchain4j.model_not_found";
    public static final String LANGCHAIN4J_CONTENT_FILTERED = "llm.langchain4j.content_filtered";
    public static final String LANGCHAIN4J_INTERNAL_SERVER = "llm.langchain4j.internal_server";
    public static final String LANGCHAIN4J_RETRIABLE = "llm.langchain4j.retriable";
    public static final String LANGCHAIN4J_NON_RETRIABLE = "llm.langchain4j.non_retriable";
    public static final String LANGCHAIN4J_HTTP_ERROR = "llm.langchain4j.http_error";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException";
    private static final String CLASS_NON_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "NonRetriableException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private static final String CODE_PREFIX = "llm.";

    private static final List<String> UPSTREAM_SIGNATURES = List.of(
            "502",
            "bad gateway",
            "upstream",
            "temporarily",
            "1031",
            "overloaded",
            "rate limit");

    private LlmErrorClassifier() {
    }

    /**
     * Classify an LLM failure based on its cause chain.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        List<Throwable> chain = causeChain(throwable);
        for (Throwable current : chain) {
            String embedded = extractCode(current.getMessage());
            if (embedded != null && !embedded.isBlank()) {
                return embedded;
            }
            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }
        }

        for (Throwable current : chain) {
            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }
        }
        return UNKNOWN;
    }

    /**
     * Whether a failed call is worth repeating.
     */
    public static boolean isTransient(Throwable throwable) {
        return isTransientCode(classifyFromThrowable(throwable));
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
     * Extract a code from diagnostics like: "[llm.some.code] details". Other
     * bracketed prefixes such as "[503]" are not codes.
     */
    public static String extractCode(String message) {
        if (message == null || message.isBlank() || message.charAt(0) != '[') {
            return null;
        }
        int end = message.indexOf(']');
        if (end <= 1) {
            return null;
        }
        String code = message.substring(1, end);
        return code.startsWith(CODE_PREFIX) ? code : null;
    }

    public static boolean isTransientCode(String code) {
        if (code == null || code.isBlank()) {
            return false;
        }
        return LANGCHAIN4J_RATE_LIMIT.equals(code)
                || LANGCHAIN4J_TIMEOUT.equals(code)
                || LANGCHAIN4J_INTERNAL_SERVER.equals(code)
                || REQUEST_TIMEOUT.equals(code)
                || LANGCHAIN4J_RETRIABLE.equals(code)
                || UPSTREAM_UNAVAILABLE.equals(code);
    }

    private static List<Throwable> causeChain(Throwable throwable) {
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
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

        return switch (className) {
        case CLASS_RATE_LIMIT_EXCEPTION -> LANGCHAIN4J_RATE_LIMIT;
        case CLASS_TIMEOUT_EXCEPTION -> LANGCHAIN4J_TIMEOUT;
        case CLASS_AUTHENTICATION_EXCEPTION -> LANGCHAIN4J_AUTHENTICATION;
        case CLASS_INVALID_REQUEST_EXCEPTION -> LANGCHAIN4J_INVALID_REQUEST;
        case CLASS_MODEL_NOT_FOUND_EXCEPTION -> LANGCHAIN4J_MODEL_NOT_FOUND;
        case CLASS_CONTENT_FILTERED_EXCEPTION -> LANGCHAIN4J_CONTENT_FILTERED;
        case CLASS_INTERNAL_SERVER_EXCEPTION -> LANGCHAIN4J_INTERNAL_SERVER;
        case CLASS_HTTP_EXCEPTION -> classifyHttpExceptionByStatus(throwable);
        case CLASS_RETRIABLE_EXCEPTION -> LANGCHAIN4J_RETRIABLE;
        case CLASS_NON_RETRIABLE_EXCEPTION -> LANGCHAIN4J_NON_RETRIABLE;
        // LangChain4jException itself is a generic wrapper, keep walking the chain
        default -> UNKNOWN;
        };
    }

    static String classifyHttpStatus(int statusCode) {
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

    private static String classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode == null) {
            return LANGCHAIN4J_HTTP_ERROR;
        }
        return classifyHttpStatus(statusCode);
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
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
        for (String signature : UPSTREAM_SIGNATURES) {
            if (normalized.contains(signature)) {
                return UPSTREAM_UNAVAILABLE;
            }
        }
        return UNKNOWN;
    }
}
