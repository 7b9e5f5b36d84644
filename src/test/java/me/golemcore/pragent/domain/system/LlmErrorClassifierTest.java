package me.golemcore.pragent.domain.system;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.RateLimitException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.SocketTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmErrorClassifierTest {

    // ==================== Structured signals ====================

    @Test
    void shouldClassifyRateLimitFromCauseChain() {
        Throwable throwable = new CompletionException(
                new RuntimeException("wrapper", new RateLimitException("too many requests")));

        assertEquals(LlmErrorClassifier.LANGCHAIN4J_RATE_LIMIT, LlmErrorClassifier.classifyFromThrowable(throwable));
        assertTrue(LlmErrorClassifier.isTransient(throwable));
    }

    @ParameterizedTest
    @CsvSource({
            "429, llm.langchain4j.rate_limit",
            "401, llm.langchain4j.authentication",
            "403, llm.langchain4j.authentication",
            "504, llm.langchain4j.timeout",
            "502, llm.langchain4j.internal_server",
            "400, llm.langchain4j.invalid_request"
    })
    void shouldClassifyHttpStatuses(int statusCode, String expectedCode) {
        assertEquals(expectedCode, LlmErrorClassifier.classifyFromThrowable(new HttpException(statusCode, "status")));
    }

    @Test
    void shouldPreferEmbeddedCodeOverMessageText() {
        Throwable throwable = new IllegalStateException("[llm.langchain4j.authentication] upstream said 502");

        assertEquals(LlmErrorClassifier.LANGCHAIN4J_AUTHENTICATION,
                LlmErrorClassifier.classifyFromThrowable(throwable));
        assertFalse(LlmErrorClassifier.isTransient(throwable));
    }

    @Test
    void shouldPreferTypedCauseOverWrapperMessage() {
        Throwable throwable = new LangChain4jException("upstream connect error",
                new AuthenticationException("bad key"));

        assertEquals(LlmErrorClassifier.LANGCHAIN4J_AUTHENTICATION,
                LlmErrorClassifier.classifyFromThrowable(throwable));
    }

    @Test
    void shouldClassifyTimeoutsAndCancellation() {
        assertEquals(LlmErrorClassifier.REQUEST_TIMEOUT,
                LlmErrorClassifier.classifyFromThrowable(new SocketTimeoutException("read timed out")));
        assertEquals(LlmErrorClassifier.REQUEST_ABORTED,
                LlmErrorClassifier.classifyFromThrowable(new CancellationException()));
        assertFalse(LlmErrorClassifier.isTransient(new CancellationException()));
    }

    // ==================== Message signatures ====================

    @ParameterizedTest
    @ValueSource(strings = {
            "HTTP 502 from gateway",
            "Bad Gateway",
            "upstream connect error or disconnect/reset before headers",
            "Service temporarily unavailable",
            "error code 1031",
            "Model is overloaded",
            "Rate limit reached for requests"
    })
    void shouldTreatUpstreamSignaturesAsTransient(String message) {
        RuntimeException error = new RuntimeException(message);

        assertEquals(LlmErrorClassifier.UPSTREAM_UNAVAILABLE, LlmErrorClassifier.classifyFromThrowable(error));
        assertTrue(LlmErrorClassifier.isTransient(error));
    }

    @Test
    void shouldNotRetryUnknownFailures() {
        RuntimeException error = new RuntimeException("invalid tool schema");

        assertEquals(LlmErrorClassifier.UNKNOWN, LlmErrorClassifier.classifyFromThrowable(error));
        assertFalse(LlmErrorClassifier.isTransient(error));
    }

    @Test
    void shouldRetryInternalServerErrors() {
        assertTrue(LlmErrorClassifier.isTransient(new InternalServerException("boom")));
    }

    @Test
    void shouldFallBackToMessageWhenBracketPrefixIsNotCode() {
        RuntimeException error = new RuntimeException("[503] Service overloaded, try later");

        assertEquals(LlmErrorClassifier.UPSTREAM_UNAVAILABLE, LlmErrorClassifier.classifyFromThrowable(error));
        assertTrue(LlmErrorClassifier.isTransient(error));
    }

    @Test
    void shouldReturnUnknownForNull() {
        assertEquals(LlmErrorClassifier.UNKNOWN, LlmErrorClassifier.classifyFromThrowable(null));
    }

    // ==================== Codes ====================

    @Test
    void shouldPrefixMessageWithCodeOnce() {
        String once = LlmErrorClassifier.withCode(LlmErrorClassifier.UPSTREAM_UNAVAILABLE, "gateway down");

        assertEquals("[llm.upstream.unavailable] gateway down", once);
        assertEquals(once, LlmErrorClassifier.withCode(LlmErrorClassifier.UPSTREAM_UNAVAILABLE, once));
        assertEquals("[llm.error.unknown]", LlmErrorClassifier.withCode(LlmErrorClassifier.UNKNOWN, " "));
    }

    @Test
    void shouldExtractEmbeddedCode() {
        assertEquals("llm.request.timeout", LlmErrorClassifier.extractCode("[llm.request.timeout] slow"));
        assertNull(LlmErrorClassifier.extractCode("no code here"));
        assertNull(LlmErrorClassifier.extractCode("[] empty"));
        assertNull(LlmErrorClassifier.extractCode("[503] Service overloaded"));
    }
}
