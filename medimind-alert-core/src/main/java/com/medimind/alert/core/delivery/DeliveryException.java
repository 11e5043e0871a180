package com.medimind.alert.core.delivery;

/** Raised by a {@link DeliveryChannel} when the external provider rejects or cannot take a delivery. */
public class DeliveryException extends Exception {
    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
