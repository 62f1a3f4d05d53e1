package com.amannmalik.finmoney.api.shared;

public final class MoneyErrorException extends RuntimeException {
    private final transient MoneyError error;

    public MoneyErrorException(MoneyError error) {
        super(error.message());
        this.error = error;
    }

    public MoneyError error() {
        return error;
    }
}
