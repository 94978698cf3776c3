package com.my.mailr.domain.model;

public record DeliveryReceipt(boolean accepted, String detail) {

    public static DeliveryReceipt accepted(String detail) {
        return new DeliveryReceipt(true, detail);
    }

    public static DeliveryReceipt rejected(String detail) {
        return new DeliveryReceipt(false, detail);
    }
}
