package com.logstore.common.util;

import java.util.Locale;

/**
 * Registry node addresses are hex strings; case is not significant.
 */
public final class AddressUtil {

    private AddressUtil() {
    }

    public static String normalize(String address) {
        return address == null ? null : address.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean sameAddress(String a, String b) {
        return a != null && b != null && normalize(a).equals(normalize(b));
    }
}
