package org.processgraph.reasoning.redistribution.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RedistributionStrategy {
    /** role match, type fallback, then flow-control propagation */
    ROLE_BASED("role-based"),
    /** role match, then everything else to the least populated lane */
    BALANCE("balance"),
    /** neighbor voting for every node */
    MINIMIZE_CROSSINGS("minimize-crossings"),
    /** caller-chosen nodes to one caller-chosen lane */
    MANUAL("manual");

    private final String code;

    RedistributionStrategy(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static RedistributionStrategy fromCode(String code) {
        for (RedistributionStrategy strategy : values()) {
            if (strategy.code.equals(code)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown strategy '" + code + "'. Expected one of: "
                + "role-based, balance, minimize-crossings, manual");
    }
}
