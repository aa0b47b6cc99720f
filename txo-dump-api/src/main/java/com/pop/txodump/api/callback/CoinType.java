package com.pop.txodump.api.callback;

import java.util.Locale;

/**
 * Chains a block stream can be read from.
 */
public enum CoinType {
    BITCOIN("Bitcoin"),
    TESTNET3("TestNet3"),
    LITECOIN("Litecoin"),
    DOGECOIN("Dogecoin"),
    NAMECOIN("Namecoin");

    private final String displayName;

    CoinType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Case-insensitive lookup by constant or display name.
     */
    public static CoinType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Coin type must not be null");
        }
        String trimmed = name.trim();
        for (CoinType type : values()) {
            if (type.name().equalsIgnoreCase(trimmed) || type.displayName.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported coin type: " + name.toUpperCase(Locale.ROOT));
    }
}
