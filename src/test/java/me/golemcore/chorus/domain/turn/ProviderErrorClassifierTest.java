package me.golemcore.chorus.domain.turn;

import dev.langchain4j.exception.RateLimitException;
import me.golemcore.chorus.domain.model.ProviderErrorKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ProviderErrorClassifierTest {

    @Test
    void shouldReturnUnknownForNull() {
        assertEquals(ProviderErrorKind.UNKNOWN, ProviderErrorClassifier.classify(null));
    }

    @Test
    void shouldUseKindOfProviderCallException() {
        ProviderCallException error = new ProviderCallException(ProviderErrorKind.BAD_REQUEST, "bad", null);

        assertEquals(ProviderErrorKind.BAD_REQUEST, ProviderErrorClassifier.classify(error));
    }

    @Test
    void shouldClassifyLangchainRateLimit() {
        assertEquals(ProviderErrorKind.RATE_LIMIT,
                ProviderErrorClassifier.classify(new RateLimitException("429")));
    }

    @Test
    void shouldClassifyWrappedTimeoutAsNetwork() {
        RuntimeException wrapped = new CompletionException(new SocketTimeoutException("read timed out"));

        assertEquals(ProviderErrorKind.NETWORK, ProviderErrorClassifier.classify(wrapped));
    }

    @Test
    void shouldClassifyIoFailureAsNetwork() {
        assertEquals(ProviderErrorKind.NETWORK,
                ProviderErrorClassifier.classify(new IOException("connection reset")));
    }

    @Test
    void shouldClassifyFromMessage() {
        assertEquals(ProviderErrorKind.MODEL_NOT_FOUND,
                ProviderErrorClassifier.classify(new IllegalStateException("error: model_not_found")));
        assertEquals(ProviderErrorKind.RATE_LIMIT,
                ProviderErrorClassifier.classify(new IllegalStateException("Too Many Requests")));
        assertEquals(ProviderErrorKind.UNKNOWN,
                ProviderErrorClassifier.classify(new IllegalStateException("boom")));
    }

    @Test
    void shouldClassifyHttpStatus() {
        assertEquals(ProviderErrorKind.MODEL_NOT_FOUND, ProviderErrorClassifier.classifyHttpStatus(404));
        assertEquals(ProviderErrorKind.RATE_LIMIT, ProviderErrorClassifier.classifyHttpStatus(429));
        assertEquals(ProviderErrorKind.NETWORK, ProviderErrorClassifier.classifyHttpStatus(504));
        assertEquals(ProviderErrorKind.SERVER_ERROR, ProviderErrorClassifier.classifyHttpStatus(502));
        assertEquals(ProviderErrorKind.BAD_REQUEST, ProviderErrorClassifier.classifyHttpStatus(400));
        assertEquals(ProviderErrorKind.UNKNOWN, ProviderErrorClassifier.classifyHttpStatus(null));
    }
}
