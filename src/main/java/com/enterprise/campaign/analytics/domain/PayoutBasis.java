package com.enterprise.campaign.analytics.domain;

/**
 * How an influencer is paid: a flat fee per post or a commission per order.
 */
public enum PayoutBasis {

    POST("post"),
    ORDER("order");

    private final String code;

    PayoutBasis(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static PayoutBasis fromCode(String value) {
        if (value != null) {
            for (PayoutBasis basis : values()) {
                if (basis.code.equalsIgnoreCase(value.trim())) {
                    return basis;
                }
            }
        }
        throw new IllegalArgumentException(
                "Invalid basis value: '" + value + "'. Valid values: [post, order]");
    }

    @Override
    public String toString() {
        return code;
    }
}
