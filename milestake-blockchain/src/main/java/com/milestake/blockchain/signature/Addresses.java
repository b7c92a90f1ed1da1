package com.milestake.blockchain.signature;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form for 20-byte account identities: lower-case, 0x-prefixed hex.
 */
public final class Addresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {}

    public static boolean isValid(String address) {
        return address != null
                && ADDRESS.matcher(address).matches()
                && !ZERO.equalsIgnoreCase(address);
    }

    /**
     * Normalizes an address to lower case.
     *
     * @throws IllegalArgumentException if the value is malformed or the zero address
     */
    public static String normalize(String address) {
        if (!isValid(address)) {
            throw new IllegalArgumentException("Invalid address: " + address);
        }
        return address.toLowerCase(Locale.ROOT);
    }

    public static boolean same(String a, String b) {
        return a != null && b != null && a.equalsIgnoreCase(b);
    }
}
