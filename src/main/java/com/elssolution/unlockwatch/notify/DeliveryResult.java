package com.elssolution.unlockwatch.notify;

public record DeliveryResult(boolean ok, String error) {

    public static DeliveryResult delivered() {
        return new DeliveryResult(true, null);
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(false, error);
    }
}
