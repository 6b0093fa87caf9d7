package com.stockinsight.common.model;

/**
 * Exchange family a symbol trades on. Drives symbol normalisation and the
 * market block of the AI prompt.
 */
public enum Market {
    A_SHARE("CNY", "Asia/Shanghai"),
    HK("HKD", "Asia/Hong_Kong"),
    US("USD", "America/New_York");

    private final String currency;
    private final String timezone;

    Market(String currency, String timezone) {
        this.currency = currency;
        this.timezone = timezone;
    }

    public String currency() { return currency; }

    public String timezone() { return timezone; }
}
