package mta.eda.generator.service.util;

import mta.eda.generator.exception.InvalidStatusTransitionException;
import mta.eda.generator.model.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * StatusMachine: transition rules for the order lifecycle.
 *
 * Status Progression (State Machine):
 * PENDING (0) → CONFIRMED (1) → PROCESSING (2) → SHIPPED (3)
 *                     ↓
 *               CANCELLED (4) [terminal - reachable from any non-terminal state]
 *
 * Rules:
 * 1. PENDING is the initial status (first creation)
 * 2. Status can only move forward, one step at a time
 * 3. CANCELLED can be reached from PENDING, CONFIRMED and PROCESSING
 * 4. Nothing leaves SHIPPED or CANCELLED
 * 5. Same status (no-op) is not a transition
 */
public final class StatusMachine {

    private static final Logger logger = LoggerFactory.getLogger(StatusMachine.class);

    private StatusMachine() {}

    /**
     * Validates if a status transition is allowed.
     *
     * @param currentStatus the current status (null for initial creation)
     * @param newStatus the incoming status
     * @return true if transition is valid, false otherwise
     */
    public static boolean isValidTransition(OrderStatus currentStatus, OrderStatus newStatus) {
        if (newStatus == null) {
            return false;
        }

        // First-time creation: only PENDING
        if (currentStatus == null) {
            return newStatus == OrderStatus.PENDING;
        }

        if (currentStatus.isTerminal()) {
            logger.debug("Invalid transition: {} is terminal, cannot move to {}", currentStatus, newStatus);
            return false;
        }

        if (newStatus == OrderStatus.CANCELLED) {
            return true;
        }

        // Strictly sequential: PENDING→CONFIRMED, CONFIRMED→PROCESSING, PROCESSING→SHIPPED
        return newStatus.order() == currentStatus.order() + 1;
    }

    /**
     * @throws InvalidStatusTransitionException if the transition is not allowed
     */
    public static void requireValidTransition(String orderId, OrderStatus currentStatus, OrderStatus newStatus) {
        if (!isValidTransition(currentStatus, newStatus)) {
            throw new InvalidStatusTransitionException(orderId, currentStatus, newStatus);
        }
    }

    /**
     * Get human-readable description of the allowed status progression.
     *
     * @return string describing the state machine
     */
    public static String getStateMachineDescription() {
        return "pending → confirmed → processing → shipped (cancelled reachable before shipping)";
    }
}
