package com.orderflow.orderservice.exception;

import com.orderflow.orderservice.model.OrderStatus;

/**
 * Exception thrown when anything tries to mutate a DELIVERED or CANCELLED order
 * HTTP Status: 422 Unprocessable Entity (errorCode ORDER_CLOSED)
 */
public class TerminalStateException extends InvalidOrderStateException {

    private final OrderStatus status;

    public TerminalStateException(String orderNumber, OrderStatus status) {
        super("Order " + orderNumber + " is " + status + " and can no longer be changed");
        this.status = status;
    }

    public OrderStatus getStatus() {
        return status;
    }
}
