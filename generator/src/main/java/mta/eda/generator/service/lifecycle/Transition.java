package mta.eda.generator.service.lifecycle;

import mta.eda.generator.model.CancellationReason;
import mta.eda.generator.model.OrderStatus;

/**
 * Outcome of one lifecycle step. reason is set only for cancellations.
 */
public record Transition(
        String orderId,
        OrderStatus from,
        OrderStatus to,
        CancellationReason reason
) {

    public boolean isCancellation() {
        return to == OrderStatus.CANCELLED;
    }

    public boolean isTerminal() {
        return to.isTerminal();
    }
}
