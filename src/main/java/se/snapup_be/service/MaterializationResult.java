package se.snapup_be.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import se.snapup_be.pojo.Order;

@Getter
@AllArgsConstructor
public class MaterializationResult {
    private final Order order;
    // the offer already had an order; nothing was created
    private final boolean alreadyMaterialized;
}
