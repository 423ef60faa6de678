package se.snapup_be.pojo.enums;

public enum OrderStatus {
    // Order is materialized from an accepted offer, awaiting payment.
    PENDING_PAYMENT,

    // Payment collaborator confirmed the funds.
    PAID,

    // The seller handed the parcel to a courier.
    SHIPPED,

    // The buyer confirmed delivery. Escrow countdown is running.
    DELIVERED,

    // Superseded by another order on the same listing, expired or cancelled by a party.
    CANCELLED,

    // Fully refunded after a dispute.
    REFUNDED
}
