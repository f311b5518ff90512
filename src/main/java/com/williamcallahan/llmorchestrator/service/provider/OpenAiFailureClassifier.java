package com.williamcallahan.llmorchestrator.service.provider;

import com.openai.errors.BadRequestException;
import com.openai.errors.InternalServerException;
import com.openai.errors.NotFoundException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.errors.PermissionDeniedException;
import com.openai.errors.RateLimitException;
import com.openai.errors.SseException;
import com.openai.errors.UnauthorizedException;
import com.openai.errors.UnprocessableEntityException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.Locale;

/**
 * Maps OpenAI SDK and transport failures onto {@link ProviderErrorCategory}.
 *
 * <p>Status codes win over message heuristics. A missing model (404) is treated as a server-side
 * problem because another provider may well serve the same request.</p>
 */
public final class OpenAiFailureClassifier {
    private static final int HTTP_BAD_REQUEST = 400;
    private static final int HTTP_UNAUTHORIZED = 401;
    private static final int HTTP_FORBIDDEN = 403;
    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_UNPROCESSABLE_ENTITY = 422;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_INTERNAL_SERVER_ERROR = 500;

    private OpenAiFailureClassifier() {}

    /**
     * Determines the category of a provider failure.
     *
     * @param throwable failure raised by the SDK or transport
     * @return failure category, {@link ProviderErrorCategory#SERVER_ERROR} when nothing more specific applies
     */
    public static ProviderErrorCategory classify(Throwable throwable) {
        if (throwable == null) {
            return ProviderErrorCategory.SERVER_ERROR;
        }
        if (throwable instanceof UnauthorizedException || throwable instanceof PermissionDeniedException) {
            return ProviderErrorCategory.AUTH_ERROR;
        }
        if (throwable instanceof RateLimitException) {
            return ProviderErrorCategory.RATE_LIMITED;
        }
        if (throwable instanceof BadRequestException || throwable instanceof UnprocessableEntityException) {
            return ProviderErrorCategory.INVALID_REQUEST;
        }
        if (throwable instanceof NotFoundException || throwable instanceof InternalServerException) {
            return ProviderErrorCategory.SERVER_ERROR;
        }
        if (throwable instanceof OpenAIServiceException serviceException) {
            return classifyStatus(serviceException.statusCode());
        }
        if (throwable instanceof OpenAIIoException) {
            return isTimeout(throwable) ? ProviderErrorCategory.TIMEOUT : ProviderErrorCategory.SERVER_ERROR;
        }
        if (throwable instanceof SseException) {
            return ProviderErrorCategory.SERVER_ERROR;
        }
        if (throwable instanceof IllegalArgumentException) {
            return ProviderErrorCategory.INVALID_REQUEST;
        }
        return isTimeout(throwable) ? ProviderErrorCategory.TIMEOUT : ProviderErrorCategory.SERVER_ERROR;
    }

    static ProviderErrorCategory classifyStatus(int statusCode) {
        if (statusCode == HTTP_UNAUTHORIZED || statusCode == HTTP_FORBIDDEN) {
            return ProviderErrorCategory.AUTH_ERROR;
        }
        if (statusCode == HTTP_TOO_MANY_REQUESTS) {
            return ProviderErrorCategory.RATE_LIMITED;
        }
        if (statusCode == HTTP_REQUEST_TIMEOUT) {
            return ProviderErrorCategory.TIMEOUT;
        }
        if (statusCode == HTTP_BAD_REQUEST || statusCode == HTTP_UNPROCESSABLE_ENTITY) {
            return ProviderErrorCategory.INVALID_REQUEST;
        }
        return ProviderErrorCategory.SERVER_ERROR;
    }

    private static boolean isTimeout(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof SocketTimeoutException) {
                return true;
            }
            if (current instanceof InterruptedIOException && "timeout".equals(current.getMessage())) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("timeout")) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
