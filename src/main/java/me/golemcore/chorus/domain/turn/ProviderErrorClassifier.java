package me.golemcore.chorus.domain.turn;

import me.golemcore.chorus.domain.model.ProviderErrorKind;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Classifies model-call failures into retry classes by walking the cause chain.
 * Langchain4j exceptions are matched by class name so the domain does not
 * depend on the provider library.
 */
public final class ProviderErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnresolvedModelServerException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private ProviderErrorClassifier() {
    }

    public static ProviderErrorKind classify(Throwable throwable) {
        if (throwable == null) {
            return ProviderErrorKind.UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            if (current instanceof ProviderCallException providerCall) {
                return providerCall.getKind();
            }

            ProviderErrorKind byType = classifyKnownThrowable(current);
            if (byType != ProviderErrorKind.UNKNOWN) {
                return byType;
            }

            ProviderErrorKind byMessage = classifyFromMessage(current.getMessage());
            if (byMessage != ProviderErrorKind.UNKNOWN) {
                return byMessage;
            }

            current = current.getCause();
        }
        return ProviderErrorKind.UNKNOWN;
    }

    private static ProviderErrorKind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException
                || throwable instanceof ConnectException
                || throwable instanceof UnknownHostException) {
            return ProviderErrorKind.NETWORK;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return throwable instanceof IOException ? ProviderErrorKind.NETWORK : ProviderErrorKind.UNKNOWN;
        }

        return switch (className) {
        case CLASS_RATE_LIMIT_EXCEPTION -> ProviderErrorKind.RATE_LIMIT;
        case CLASS_TIMEOUT_EXCEPTION, CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION -> ProviderErrorKind.NETWORK;
        case CLASS_INVALID_REQUEST_EXCEPTION -> ProviderErrorKind.BAD_REQUEST;
        case CLASS_MODEL_NOT_FOUND_EXCEPTION -> ProviderErrorKind.MODEL_NOT_FOUND;
        case CLASS_INTERNAL_SERVER_EXCEPTION -> ProviderErrorKind.SERVER_ERROR;
        case CLASS_HTTP_EXCEPTION -> classifyHttpStatus(readHttpStatusCode(throwable));
        default -> ProviderErrorKind.UNKNOWN;
        };
    }

    static ProviderErrorKind classifyHttpStatus(Integer statusCode) {
        if (statusCode == null) {
            return ProviderErrorKind.UNKNOWN;
        }
        if (statusCode == 404) {
            return ProviderErrorKind.MODEL_NOT_FOUND;
        }
        if (statusCode == 429) {
            return ProviderErrorKind.RATE_LIMIT;
        }
        if (statusCode == 408 || statusCode == 504) {
            return ProviderErrorKind.NETWORK;
        }
        if (statusCode >= 500) {
            return ProviderErrorKind.SERVER_ERROR;
        }
        if (statusCode >= 400) {
            return ProviderErrorKind.BAD_REQUEST;
        }
        return ProviderErrorKind.UNKNOWN;
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

    private static ProviderErrorKind classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return ProviderErrorKind.UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("model_not_found") || normalized.contains("model not found")) {
            return ProviderErrorKind.MODEL_NOT_FOUND;
        }
        if (normalized.contains("rate_limit") || normalized.contains("too many requests")) {
            return ProviderErrorKind.RATE_LIMIT;
        }
        return ProviderErrorKind.UNKNOWN;
    }
}
