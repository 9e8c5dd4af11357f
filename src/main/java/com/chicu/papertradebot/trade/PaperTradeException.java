package com.chicu.papertradebot.trade;

import lombok.Getter;

@Getter
public class PaperTradeException extends RuntimeException {

    public enum Code {
        BAD_REQUEST,
        NO_MARKET_PRICE
    }

    private final Code code;

    public PaperTradeException(Code code, String message) {
        super(message != null ? message : code.name());
        this.code = code;
    }
}
