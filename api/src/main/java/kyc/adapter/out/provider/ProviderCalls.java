package kyc.adapter.out.provider;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;

import io.vertx.core.VertxException;
import io.vertx.core.json.DecodeException;

import kyc.core.exception.TransientNetworkException;
import kyc.core.exception.VerificationException;

/**
 * Classification shared by the provider HTTP clients.
 */
final class ProviderCalls {

    static final String SUCCESS = "success";
    static final String TRANSIENT = "transient";
    static final String REJECTED = "rejected";

    private ProviderCalls() {}

    /**
     * Transport failures raised below the HTTP response become
     * {@link TransientNetworkException}. Errors already classified pass
     * through. Anything else is a defect on our side and is reported through
     * {@code rejected}, which is never retryable.
     */
    static Throwable classify(
            Throwable error,
            String endpoint,
            BiFunction<String, Throwable, ? extends VerificationException> rejected) {
        if (error instanceof VerificationException) {
            return error;
        }
        if (isTransport(error)) {
            return new TransientNetworkException(endpoint + " endpoint unreachable: " + error.getMessage(), error);
        }
        return rejected.apply(endpoint + " call failed unexpectedly: " + error, error);
    }

    /**
     * Connection, TLS and timeout failures. Vert.x reports most of these as
     * {@link VertxException} or an {@link IOException}; JSON decoding errors
     * share the Vert.x type but are not transport problems.
     */
    static boolean isTransport(Throwable error) {
        if (error instanceof DecodeException) {
            return false;
        }
        return error instanceof IOException
                || error instanceof TimeoutException
                || error instanceof io.smallrye.mutiny.TimeoutException
                || error instanceof VertxException;
    }

    static String outcome(Throwable error) {
        return error instanceof TransientNetworkException ? TRANSIENT : REJECTED;
    }

    static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }
}
