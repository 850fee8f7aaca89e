package com.delta.mailverify.verify.model;

public record DeliveryEvidence(String domain, boolean hasGoodReal, boolean hasBadInvalid) {

    public static DeliveryEvidence empty(String domain) {
        return new DeliveryEvidence(domain, false, false);
    }
}
