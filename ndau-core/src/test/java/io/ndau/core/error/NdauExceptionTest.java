// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class NdauExceptionTest {

    @Test
    void onlyUnusableValuesAreRetryable() {
        assertTrue(KeyException.unusableSeed().isRetryable());
        assertTrue(KeyException.invalidChild(7).isRetryable());
        assertTrue(KeyException.unusableValue("scalar out of range").isRetryable());

        assertFalse(KeyException.badChecksum("key").isRetryable());
        assertFalse(KeyException.depthExceeded().isRetryable());
        assertFalse(KeyException.parseFailure("bad").isRetryable());
        assertFalse(AddressException.badChecksum().isRetryable());
    }

    @Test
    void factoriesSetKind() {
        assertEquals(NdauException.Kind.INVALID_LENGTH, KeyException.invalidLength("seed", "16-64", 3).kind());
        assertEquals(NdauException.Kind.BAD_CHECKSUM, KeyException.badChecksum("key").kind());
        assertEquals(NdauException.Kind.PARSE_FAILURE, KeyException.parseFailure("bad").kind());
        assertEquals(NdauException.Kind.UNSUPPORTED_OPERATION, KeyException.unsupported("no").kind());
        assertEquals(NdauException.Kind.UNKNOWN_ALGORITHM, KeyException.unknownAlgorithm(200).kind());
        assertEquals(NdauException.Kind.UNKNOWN_ALGORITHM, KeyException.unknownAlgorithm("rsa").kind());
        assertEquals(NdauException.Kind.DEPTH_EXCEEDED, KeyException.depthExceeded().kind());

        assertEquals(NdauException.Kind.PARSE_FAILURE, AddressException.invalidKind("z").kind());
        assertEquals(NdauException.Kind.PARSE_FAILURE, AddressException.invalidPrefix("n").kind());
        assertEquals(NdauException.Kind.INVALID_LENGTH, AddressException.invalidLength("short").kind());
    }

    @Test
    void messagesDescribeTheFailure() {
        assertEquals("seed must be 16-64 bytes, got 3", KeyException.invalidLength("seed", "16-64", 3).getMessage());
        assertEquals("key: checksum failure", KeyException.badChecksum("key").getMessage());
        assertTrue(KeyException.invalidChild(0x80000001).getMessage().contains("2147483649"));
    }

    @Test
    void causeIsPreserved() {
        final IllegalArgumentException cause = new IllegalArgumentException("bad symbol");

        assertSame(cause, KeyException.parseFailure("bad text", cause).getCause());
        assertSame(cause, AddressException.undecodable(cause).getCause());
    }

    @Test
    void subclassesAreCaughtAsBase() {
        final NdauException ex = assertThrows(NdauException.class, () -> {
            throw AddressException.badChecksum();
        });
        assertInstanceOf(AddressException.class, ex);
    }

    @Test
    void kindIsRequired() {
        assertThrows(NullPointerException.class, () -> new KeyException(null, "message"));
    }
}
