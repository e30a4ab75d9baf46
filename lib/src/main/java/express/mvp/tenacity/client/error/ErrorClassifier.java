package express.mvp.tenacity.client.error;

import express.mvp.tenacity.client.ConfigurationException;
import express.mvp.tenacity.client.codec.ProtocolException;
import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

/**
 * Classifies exceptions into error categories for recovery decisions.
 *
 * <h2>Classification Strategy</h2>
 *
 * <ol>
 *   <li>Unwrap {@link CompletionException} and {@link ExecutionException}
 *   <li>Library exceptions: protocol and configuration
 *   <li>Cancellation and interruption
 *   <li>JVM and security errors
 *   <li>Timeouts, then network errors by type
 *   <li>Exception message patterns
 *   <li>The cause chain, else UNKNOWN
 * </ol>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try {
 *     transport.open(timeout);
 * } catch (IOException e) {
 *     ErrorCategory category = ErrorClassifier.classify(e);
 *     if (category.isRetryable()) {
 *         // wait for the backoff delay and try again
 *     }
 * }
 * }</pre>
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies an exception into an error category.
     *
     * @param throwable the exception to classify
     * @return the error category, UNKNOWN for null
     */
    public static ErrorCategory classify(Throwable throwable) {
        if (throwable == null) {
            return ErrorCategory.UNKNOWN;
        }
        if ((throwable instanceof CompletionException || throwable instanceof ExecutionException)
                && throwable.getCause() != null) {
            return classify(throwable.getCause());
        }

        if (throwable instanceof ProtocolException) {
            return ErrorCategory.PROTOCOL;
        }
        if (throwable instanceof ConfigurationException) {
            return ErrorCategory.CONFIGURATION;
        }
        if (isCancellation(throwable)) {
            return ErrorCategory.CANCELLATION;
        }

        if (throwable instanceof VirtualMachineError
                || throwable instanceof LinkageError
                || throwable instanceof SecurityException) {
            return ErrorCategory.FATAL;
        }

        if (isTimeoutError(throwable)) {
            return ErrorCategory.TRANSIENT;
        }
        if (isNetworkError(throwable)) {
            return ErrorCategory.NETWORK;
        }

        ErrorCategory messageCategory = classifyByMessage(throwable);
        if (messageCategory != null) {
            return messageCategory;
        }

        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable) {
            ErrorCategory causeCategory = classify(cause);
            if (causeCategory != ErrorCategory.UNKNOWN) {
                return causeCategory;
            }
        }
        return ErrorCategory.UNKNOWN;
    }

    /**
     * Checks whether a throwable signals cooperative cancellation.
     *
     * @param t the throwable
     * @return true for cancellation and interruption
     */
    public static boolean isCancellation(Throwable t) {
        return t instanceof CancellationException
                || t instanceof InterruptedException
                || t instanceof ClosedByInterruptException
                || (t instanceof InterruptedIOException && !(t instanceof SocketTimeoutException));
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof TimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof HttpConnectTimeoutException
                || t instanceof HttpTimeoutException;
    }

    private static boolean isNetworkError(Throwable t) {
        if (t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof NoRouteToHostException
                || t instanceof PortUnreachableException
                || t instanceof ClosedChannelException
                || t instanceof EOFException
                || t instanceof SocketException
                || t instanceof SSLException) {
            return true;
        }
        if (t instanceof IOException) {
            String msg = t.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase(Locale.ROOT);
                return lower.contains("connection")
                        || lower.contains("socket")
                        || lower.contains("network");
            }
        }
        return false;
    }

    private static ErrorCategory classifyByMessage(Throwable t) {
        String msg = t.getMessage();
        if (msg == null || msg.isEmpty()) {
            return null;
        }
        String lower = msg.toLowerCase(Locale.ROOT);
        if (lower.contains("timed out") || lower.contains("timeout")) {
            return ErrorCategory.TRANSIENT;
        }
        if (lower.contains("connection")
                && (lower.contains("reset")
                        || lower.contains("refused")
                        || lower.contains("closed")
                        || lower.contains("lost"))) {
            return ErrorCategory.NETWORK;
        }
        if (lower.contains("busy") || lower.contains("temporarily")) {
            return ErrorCategory.TRANSIENT;
        }
        return null;
    }
}
