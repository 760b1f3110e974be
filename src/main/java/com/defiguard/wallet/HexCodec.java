package com.defiguard.wallet;

import com.defiguard.exception.WalletException;
import java.util.HexFormat;

/**
 * 0x-prefixed hex helpers. Decoding failures never echo the rejected input.
 */
public final class HexCodec {

    private static final HexFormat HEX = HexFormat.of();

    private HexCodec() {}

    public static byte[] decode(String input) {
        if (input == null) {
            throw new WalletException("Invalid hex string: value is missing");
        }
        String trimmed = input.startsWith("0x") || input.startsWith("0X") ? input.substring(2) : input;
        try {
            return HEX.parseHex(trimmed);
        } catch (IllegalArgumentException e) {
            throw new WalletException("Invalid hex string: expected an even number of hex digits");
        }
    }

    public static String encode(byte[] bytes) {
        return "0x" + HEX.formatHex(bytes);
    }
}
