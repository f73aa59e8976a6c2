package com.medicaledu.backend.modules.payments.domain;

public enum PaymentProvider {
    STRIPE,
    PAYPAL,
    MANUAL
}
