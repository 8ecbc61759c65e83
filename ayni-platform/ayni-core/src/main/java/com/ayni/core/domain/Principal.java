package com.ayni.core.domain;

import com.ayni.core.error.InvalidRegistryInputException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.util.regex.Pattern;

/**
 * Account address of an identity holder, issuer or the registry owner.
 * Stored in EIP-55 checksum form so differently cased spellings compare equal.
 */
public record Principal(String address) {

    private static final Pattern HEX_ADDRESS = Pattern.compile("[0-9a-fA-F]{" + Keys.ADDRESS_LENGTH_IN_HEX + "}");

    public Principal {
        if (address == null || !HEX_ADDRESS.matcher(Numeric.cleanHexPrefix(address)).matches()) {
            throw new InvalidRegistryInputException("Invalid principal address: " + address);
        }
        address = Keys.toChecksumAddress(address);
    }

    @JsonCreator
    public static Principal of(String address) {
        return new Principal(address);
    }

    @JsonValue
    @Override
    public String toString() {
        return address;
    }
}
