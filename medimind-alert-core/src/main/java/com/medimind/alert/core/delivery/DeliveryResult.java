package com.medimind.alert.core.delivery;

public record DeliveryResult(Status status, String method, String reason) {

    public enum Status {
        DELIVERED,
        FAILED,
        UNKNOWN_METHOD
    }

    public static DeliveryResult delivered(String method) {
        return new DeliveryResult(Status.DELIVERED, method, null);
    }

    public static DeliveryResult failed(String method, String reason) {
        return new DeliveryResult(Status.FAILED, method, reason);
    }

    public static DeliveryResult unknownMethod(String method) {
        return new DeliveryResult(Status.UNKNOWN_METHOD, method, "No delivery channel registered for " + method);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
