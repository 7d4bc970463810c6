package io.utxoiq.pulse.infrastructure.channel;

public record DeliveryResult(boolean success, String detail) {

    public static DeliveryResult delivered(String detail) {
        return new DeliveryResult(true, detail);
    }

    public static DeliveryResult failed(String detail) {
        return new DeliveryResult(false, detail);
    }
}
