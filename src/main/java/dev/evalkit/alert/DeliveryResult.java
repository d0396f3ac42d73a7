package dev.evalkit.alert;

import java.util.Optional;

public record DeliveryResult(String channel, boolean delivered, Optional<String> error) {
    public static DeliveryResult ok(String channel) {
        return new DeliveryResult(channel, true, Optional.empty());
    }

    public static DeliveryResult failed(String channel, String error) {
        return new DeliveryResult(channel, false, Optional.of(error));
    }
}
