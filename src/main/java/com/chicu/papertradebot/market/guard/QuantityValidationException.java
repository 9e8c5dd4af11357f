package com.chicu.papertradebot.market.guard;

import lombok.Getter;

@Getter
public class QuantityValidationException extends RuntimeException {

    private final QuantityRejectReason reason;

    public QuantityValidationException(QuantityRejectReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
