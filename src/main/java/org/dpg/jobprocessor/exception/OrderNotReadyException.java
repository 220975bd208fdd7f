package org.dpg.jobprocessor.exception;

import java.io.Serial;

/**
 * An order cannot be marked as passing QA, e.g. because it is not approved or has an unpaid fee.
 */
public class OrderNotReadyException extends Exception {
    @Serial
    private static final long serialVersionUID = 6281109375543320981L;

    public OrderNotReadyException(String message) {
        super(message);
    }
}
