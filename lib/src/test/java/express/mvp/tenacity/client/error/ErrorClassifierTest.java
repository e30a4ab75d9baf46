package express.mvp.tenacity.client.error;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.tenacity.client.ConfigurationException;
import express.mvp.tenacity.client.codec.ProtocolException;
import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ErrorClassifier}. */
@DisplayName("ErrorClassifier")
class ErrorClassifierTest {

    @Nested
    @DisplayName("Network errors")
    class NetworkErrorTests {

        @Test
        @DisplayName("ConnectException is NETWORK")
        void connectException_isNetwork() {
            assertEquals(
                    ErrorCategory.NETWORK,
                    ErrorClassifier.classify(new ConnectException("Connection refused")));
        }

        @Test
        @DisplayName("UnknownHostException is NETWORK")
        void unknownHostException_isNetwork() {
            assertEquals(
                    ErrorCategory.NETWORK,
                    ErrorClassifier.classify(new UnknownHostException("host.invalid")));
        }

        @Test
        @DisplayName("Peer close is NETWORK")
        void eofException_isNetwork() {
            assertEquals(ErrorCategory.NETWORK, ErrorClassifier.classify(new EOFException()));
            assertEquals(
                    ErrorCategory.NETWORK, ErrorClassifier.classify(new ClosedChannelException()));
            assertEquals(
                    ErrorCategory.NETWORK,
                    ErrorClassifier.classify(new SocketException("Connection reset")));
        }
    }

    @Nested
    @DisplayName("Timeouts")
    class TimeoutTests {

        @Test
        @DisplayName("Timeouts are TRANSIENT")
        void timeouts_areTransient() {
            assertEquals(
                    ErrorCategory.TRANSIENT,
                    ErrorClassifier.classify(new SocketTimeoutException("connect timed out")));
            assertEquals(
                    ErrorCategory.TRANSIENT, ErrorClassifier.classify(new TimeoutException()));
        }

        @Test
        @DisplayName("Message mentioning a timeout is TRANSIENT")
        void timeoutMessage_isTransient() {
            assertEquals(
                    ErrorCategory.TRANSIENT,
                    ErrorClassifier.classify(new IllegalStateException("operation timed out")));
        }
    }

    @Nested
    @DisplayName("Non-retryable errors")
    class NonRetryableTests {

        @Test
        @DisplayName("ProtocolException is PROTOCOL")
        void protocolException_isProtocol() {
            ErrorCategory category = ErrorClassifier.classify(new ProtocolException("bad frame"));
            assertEquals(ErrorCategory.PROTOCOL, category);
            assertFalse(category.isRetryable());
            assertFalse(category.isUnrecoverable());
        }

        @Test
        @DisplayName("ConfigurationException is CONFIGURATION")
        void configurationException_isConfiguration() {
            ErrorCategory category =
                    ErrorClassifier.classify(new ConfigurationException("bad address"));
            assertEquals(ErrorCategory.CONFIGURATION, category);
            assertTrue(category.isUnrecoverable());
        }

        @Test
        @DisplayName("Errors are FATAL")
        void virtualMachineError_isFatal() {
            assertEquals(ErrorCategory.FATAL, ErrorClassifier.classify(new OutOfMemoryError()));
        }

        @Test
        @DisplayName("Cancellation is CANCELLATION")
        void cancellation() {
            assertEquals(
                    ErrorCategory.CANCELLATION,
                    ErrorClassifier.classify(new CancellationException()));
            assertEquals(
                    ErrorCategory.CANCELLATION,
                    ErrorClassifier.classify(new InterruptedException()));
            assertTrue(ErrorClassifier.isCancellation(new CancellationException()));
            assertFalse(ErrorClassifier.isCancellation(new SocketTimeoutException()));
        }
    }

    @Nested
    @DisplayName("Wrapped errors")
    class WrappedTests {

        @Test
        @DisplayName("CompletionException is unwrapped")
        void completionException_unwrapped() {
            assertEquals(
                    ErrorCategory.PROTOCOL,
                    ErrorClassifier.classify(new CompletionException(new ProtocolException("x"))));
        }

        @Test
        @DisplayName("ExecutionException is unwrapped")
        void executionException_unwrapped() {
            assertEquals(
                    ErrorCategory.NETWORK,
                    ErrorClassifier.classify(new ExecutionException(new ConnectException("refused"))));
        }

        @Test
        @DisplayName("Cause is consulted when the wrapper says nothing")
        void causeConsulted() {
            assertEquals(
                    ErrorCategory.NETWORK,
                    ErrorClassifier.classify(new RuntimeException(new ConnectException("refused"))));
        }
    }

    @Test
    @DisplayName("Null and unrecognized errors are UNKNOWN")
    void unknown() {
        assertEquals(ErrorCategory.UNKNOWN, ErrorClassifier.classify(null));
        assertEquals(ErrorCategory.UNKNOWN, ErrorClassifier.classify(new IOException("odd")));
    }
}
