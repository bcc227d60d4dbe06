package me.golemcore.agent.domain.system;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies reasoning engine failures into stable machine-readable reason
 * codes and tells transient ones apart.
 */
public final class LlmErrorClassifier {

    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String CONNECTION_FAILED = "llm.connection.failed";
    public static final String RATE_LIMIT = "llm.rate_limit";
    public static final String TIMEOUT = "llm.timeout";
    public static final String AUTHENTICATION = "llm.authentication";
    public static final String INVALID_REQUEST = "llm.invalid_request";
    public static final String MODEL_NOT_FOUND = "llm.model_not_found";
    public static final String CONTENT_FILTERED = "llm.content_filtered";
    public static final String INTERNAL_SERVER = "llm.internal_server";
    public static final String RETRIABLE = "llm.retriable";
    public static final String NON_RETRIABLE = "llm.non_retriable";
    public static final String HTTP_ERROR = "llm.http_error";
    public static final String NOT_CONFIGURED = "llm.not_configured";
    public static final String MALFORMED_RESPONSE = "llm.malformed_response";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";

    private LlmErrorClassifier() {
    }

    /**
     * Classify a failure by walking its cause chain.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }
            current = current.getCause();
        }
        return UNKNOWN;
    }

    public static boolean isTransientCode(String code) {
        return RATE_LIMIT.equals(code)
                || TIMEOUT.equals(code)
                || INTERNAL_SERVER.equals(code)
                || REQUEST_TIMEOUT.equals(code)
                || CONNECTION_FAILED.equals(code)
                || MALFORMED_RESPONSE.equals(code)
                || RETRIABLE.equals(code);
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
        if (throwable instanceof ConnectException) {
            return CONNECTION_FAILED;
        }
        if (throwable instanceof IllegalStateException && throwable.getMessage() != null
                && throwable.getMessage().contains("not configured")) {
            return NOT_CONFIGURED;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }
        return switch (className.substring(LANGCHAIN4J_EXCEPTIONS_PREFIX.length())) {
        case "RateLimitException" -> RATE_LIMIT;
        case "TimeoutException" -> TIMEOUT;
        case "AuthenticationException" -> AUTHENTICATION;
        case "InvalidRequestException" -> INVALID_REQUEST;
        case "ModelNotFoundException" -> MODEL_NOT_FOUND;
        case "ContentFilteredException" -> CONTENT_FILTERED;
        case "InternalServerException" -> INTERNAL_SERVER;
        case "HttpException" -> classifyHttpExceptionByStatus(throwable);
        case "RetriableException" -> RETRIABLE;
        case "NonRetriableException" -> NON_RETRIABLE;
        default -> UNKNOWN;
        };
    }

    private static String classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode == null) {
            return HTTP_ERROR;
        }
        if (statusCode == 429) {
            return RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return TIMEOUT;
        }
        if (statusCode >= 500) {
            return INTERNAL_SERVER;
        }
        if (statusCode >= 400) {
            return INVALID_REQUEST;
        }
        return HTTP_ERROR;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer code) {
                return code;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }
}
