package dev.evalkit.alert;

import java.util.List;

/** An alert as kept in the dispatcher's history, with what happened to it. */
public record AlertRecord(Alert alert, boolean suppressed, List<DeliveryResult> deliveries) {
    public AlertRecord {
        deliveries = List.copyOf(deliveries);
    }

    public boolean deliveredAnywhere() {
        return deliveries.stream().anyMatch(DeliveryResult::delivered);
    }
}
