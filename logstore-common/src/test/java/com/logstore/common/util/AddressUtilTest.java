package com.logstore.common.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AddressUtilTest {

    @Test
    void testAddressComparisonIgnoresCaseAndWhitespace() {
        assertTrue(AddressUtil.sameAddress("0xAAAAaaaa", " 0xaaaaAAAA "));
        assertFalse(AddressUtil.sameAddress("0xaaaa", "0xbbbb"));
        assertFalse(AddressUtil.sameAddress(null, "0xaaaa"));
        assertFalse(AddressUtil.sameAddress("0xaaaa", null));
    }
}
