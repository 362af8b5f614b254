package com.whaleradar.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Hyperliquid accounts are EVM-style addresses: 0x followed by 40 hex characters.
 */
@Component
public class AddressValidator {

    private static final Pattern ACCOUNT_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return ACCOUNT_ADDRESS.matcher(address.trim()).matches();
    }
}
