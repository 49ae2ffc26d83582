package mta.eda.generator.service.util;

import mta.eda.generator.exception.InvalidStatusTransitionException;
import org.junit.jupiter.api.Test;

import static mta.eda.generator.model.OrderStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StatusMachine to ensure strict sequential transitions
 */
class StatusMachineTest {

    @Test
    void testValidSequentialTransitions() {
        assertTrue(StatusMachine.isValidTransition(PENDING, CONFIRMED));
        assertTrue(StatusMachine.isValidTransition(CONFIRMED, PROCESSING));
        assertTrue(StatusMachine.isValidTransition(PROCESSING, SHIPPED));
    }

    @Test
    void testInvalidSkippingTransitions() {
        assertFalse(StatusMachine.isValidTransition(PENDING, PROCESSING),
                "Should NOT allow PENDING → PROCESSING (must go through CONFIRMED)");
        assertFalse(StatusMachine.isValidTransition(PENDING, SHIPPED),
                "Should NOT allow PENDING → SHIPPED");
        assertFalse(StatusMachine.isValidTransition(CONFIRMED, SHIPPED),
                "Should NOT allow CONFIRMED → SHIPPED (must go through PROCESSING)");
    }

    @Test
    void testCancelledReachableBeforeShipping() {
        assertTrue(StatusMachine.isValidTransition(PENDING, CANCELLED));
        assertTrue(StatusMachine.isValidTransition(CONFIRMED, CANCELLED));
        assertTrue(StatusMachine.isValidTransition(PROCESSING, CANCELLED));
    }

    @Test
    void testNothingLeavesTerminalStates() {
        assertFalse(StatusMachine.isValidTransition(SHIPPED, CANCELLED));
        assertFalse(StatusMachine.isValidTransition(SHIPPED, CONFIRMED));
        assertFalse(StatusMachine.isValidTransition(CANCELLED, PENDING));
        assertFalse(StatusMachine.isValidTransition(CANCELLED, CANCELLED));
    }

    @Test
    void testBackwardAndSameStatusNotAllowed() {
        assertFalse(StatusMachine.isValidTransition(PROCESSING, CONFIRMED));
        assertFalse(StatusMachine.isValidTransition(CONFIRMED, PENDING));
        assertFalse(StatusMachine.isValidTransition(PENDING, PENDING));
    }

    @Test
    void testFirstStatusMustBePending() {
        assertTrue(StatusMachine.isValidTransition(null, PENDING));
        assertFalse(StatusMachine.isValidTransition(null, CONFIRMED));
        assertFalse(StatusMachine.isValidTransition(PENDING, null));
    }

    @Test
    void testRequireValidTransitionThrows() {
        InvalidStatusTransitionException ex = assertThrows(InvalidStatusTransitionException.class,
                () -> StatusMachine.requireValidTransition("ORD-12345678", SHIPPED, CONFIRMED));
        assertEquals("ORD-12345678", ex.getOrderId());
        assertEquals(SHIPPED, ex.getCurrentStatus());
        assertEquals(CONFIRMED, ex.getRequestedStatus());
        assertDoesNotThrow(() -> StatusMachine.requireValidTransition("ORD-12345678", PENDING, CONFIRMED));
    }
}
