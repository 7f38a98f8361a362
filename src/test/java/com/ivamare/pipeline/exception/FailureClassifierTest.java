package com.ivamare.pipeline.exception;

import com.ivamare.pipeline.model.FailureKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FailureClassifier")
class FailureClassifierTest {

    @Test
    @DisplayName("should honour pipeline exception types")
    void shouldHonourPipelineExceptionTypes() {
        assertEquals(FailureKind.PERMANENT,
            FailureClassifier.classify(new PermanentOperationException("GONE", "Video removed")));
        assertEquals(FailureKind.TRANSIENT,
            FailureClassifier.classify(new TransientOperationException("NET", "Upstream busy", Map.of("status", 503))));
    }

    @Test
    @DisplayName("should treat network exceptions as transient")
    void shouldTreatNetworkExceptionsAsTransient() {
        assertEquals(FailureKind.TRANSIENT, FailureClassifier.classify(new SocketTimeoutException("Read timed out")));
        assertEquals(FailureKind.TRANSIENT, FailureClassifier.classify(new IOException("stream closed")));
    }

    @Test
    @DisplayName("should treat invalid arguments as permanent")
    void shouldTreatInvalidArgumentsAsPermanent() {
        assertEquals(FailureKind.PERMANENT, FailureClassifier.classify(new IllegalArgumentException("bad url")));
    }

    @Test
    @DisplayName("should classify by wrapped cause")
    void shouldClassifyByCause() {
        RuntimeException wrapped = new RuntimeException("upload step failed",
            new PermanentOperationException("QUOTA", "daily limit reached"));

        assertEquals(FailureKind.PERMANENT, FailureClassifier.classify(wrapped));
    }

    @Test
    @DisplayName("should classify error text")
    void shouldClassifyErrorText() {
        assertEquals(FailureKind.PERMANENT, FailureClassifier.classify("ERROR: Private video"));
        assertEquals(FailureKind.TRANSIENT, FailureClassifier.classify("Connection reset by peer"));
        assertEquals(FailureKind.TRANSIENT, FailureClassifier.classify("something odd"));
        assertEquals(FailureKind.TRANSIENT, FailureClassifier.classify((String) null));
    }

    @Test
    @DisplayName("should default unknown exceptions to transient")
    void shouldDefaultToTransient() {
        assertEquals(FailureKind.TRANSIENT, FailureClassifier.classify(new IllegalStateException("weird")));
        assertEquals(FailureKind.TRANSIENT, FailureClassifier.classify((Throwable) null));
    }

    @Test
    @DisplayName("should describe exceptions without message by type")
    void shouldDescribeExceptions() {
        assertEquals("NullPointerException", FailureClassifier.describe(new NullPointerException()));
        assertEquals("[GONE] Video removed",
            FailureClassifier.describe(new PermanentOperationException("GONE", "Video removed")));
    }
}
