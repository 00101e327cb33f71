package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.error.CircuitBreakerOpenException;
import com.ryuqq.resilience.core.error.DeadlineExceededException;
import com.ryuqq.resilience.core.error.TooManyRequestsException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * CircuitBreaker.isErrorPermanent 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class CircuitBreakerTest {

    @Test
    void isErrorPermanent_OpenState_ReturnsTrue() {
        assertTrue(CircuitBreaker.isErrorPermanent(new CircuitBreakerOpenException("payment")));
    }

    @Test
    void isErrorPermanent_TooManyRequests_ReturnsTrue() {
        assertTrue(CircuitBreaker.isErrorPermanent(new TooManyRequestsException("payment")));
    }

    @Test
    void isErrorPermanent_WrappedRejection_ReturnsTrue() {
        // Given
        RuntimeException wrapped = new RuntimeException("wrapper",
            new IllegalStateException("middle", new CircuitBreakerOpenException("payment")));

        // When & Then
        assertTrue(CircuitBreaker.isErrorPermanent(wrapped));
    }

    @Test
    void isErrorPermanent_OtherErrors_ReturnsFalse() {
        assertFalse(CircuitBreaker.isErrorPermanent(new IOException("boom")));
        assertFalse(CircuitBreaker.isErrorPermanent(new DeadlineExceededException()));
        assertFalse(CircuitBreaker.isErrorPermanent(new RuntimeException(new IOException("boom"))));
    }

    @Test
    void isErrorPermanent_Null_ReturnsFalse() {
        assertFalse(CircuitBreaker.isErrorPermanent(null));
    }

    @Test
    void rejectionMessages_ContainBreakerName() {
        CircuitBreakerOpenException open = new CircuitBreakerOpenException("payment");
        TooManyRequestsException tooMany = new TooManyRequestsException("payment");

        assertEquals("payment", open.getBreakerName());
        assertTrue(open.getMessage().contains("circuit breaker is open"));
        assertTrue(tooMany.getMessage().contains("too many requests"));
    }
}
