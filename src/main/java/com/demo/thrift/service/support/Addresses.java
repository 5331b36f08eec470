package com.demo.thrift.service.support;

import com.demo.thrift.exception.InvalidInputException;
import org.web3j.crypto.Keys;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/** EVM account addresses, always handled in EIP-55 checksum form. */
public final class Addresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final Pattern HEX_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {}

    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException("address is required");
        }
        String trimmed = raw.trim();
        if (!HEX_ADDRESS.matcher(trimmed).matches()) {
            throw new InvalidInputException("not a valid address: " + trimmed);
        }
        String checksummed = Keys.toChecksumAddress(trimmed.toLowerCase());
        if (ZERO.equals(checksummed)) {
            throw new InvalidInputException("zero address is not allowed");
        }
        return checksummed;
    }

    public static Set<String> normalizeAll(Collection<String> raw) {
        Set<String> out = new LinkedHashSet<>();
        for (String r : raw) {
            out.add(normalize(r));
        }
        return out;
    }
}
