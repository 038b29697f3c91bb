package com.orderflow.orderservice.model;

/**
 * Refund progress as reported by gateway webhooks. Events may arrive out of
 * order, so a status only replaces one of lower rank. A later success
 * overrides an earlier failure.
 */
public enum RefundStatus {
    REFUND_INITIATED(0),
    REFUND_FAILED(1),
    REFUND_COMPLETED(2);

    private final int rank;

    RefundStatus(int rank) {
        this.rank = rank;
    }

    public boolean outranks(RefundStatus other) {
        return other == null || rank > other.rank;
    }
}
