package com.defiguard.wallet;

import com.defiguard.exception.ConfigurationException;
import com.defiguard.exception.WalletException;
import java.math.BigInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

/**
 * The only place in the process where private key material exists.
 *
 * <ul>
 *   <li>The key pair is private and final; no accessor returns it or any part of it</li>
 *   <li>{@link #toString()} prints the address and a redaction marker only</li>
 *   <li>The class is not serializable and is never handed to Jackson</li>
 *   <li>Parse errors report the expected shape, never the supplied value</li>
 * </ul>
 *
 * <p>Signing is serialized through {@link #signingLock}; address reads are lock-free.
 */
public final class SecureWallet {

    static final String REDACTED = "[REDACTED]";

    private static final Pattern PRIVATE_KEY_HEX = Pattern.compile("^(0x|0X)?[0-9a-fA-F]{64}$");

    private final ECKeyPair keyPair;
    private final String address;
    private final ReentrantLock signingLock = new ReentrantLock();

    private SecureWallet(ECKeyPair keyPair) {
        this.keyPair = keyPair;
        this.address = Keys.toChecksumAddress(Keys.getAddress(keyPair));
    }

    /**
     * Builds a wallet from a hex-encoded 32-byte secp256k1 private key (0x prefix optional).
     *
     * @throws ConfigurationException if the key is missing, malformed or out of range
     */
    public static SecureWallet fromHex(String keyHex) {
        if (keyHex == null || keyHex.isBlank()) {
            throw new ConfigurationException("Wallet private key is missing");
        }
        String trimmed = keyHex.trim();
        if (!PRIVATE_KEY_HEX.matcher(trimmed).matches()) {
            throw new ConfigurationException("Invalid private key: expected 32 bytes of hex");
        }

        BigInteger secret = new BigInteger(trimmed.substring(trimmed.length() - 64), 16);
        if (secret.signum() == 0 || secret.compareTo(Sign.CURVE_PARAMS.getN()) >= 0) {
            throw new ConfigurationException("Invalid private key: outside the secp256k1 range");
        }
        return new SecureWallet(ECKeyPair.create(secret));
    }

    /**
     * Builds a wallet from the environment variable {@code variableName}.
     *
     * @param environment lookup function, e.g. {@code System::getenv}
     */
    public static SecureWallet fromEnvironment(String variableName, UnaryOperator<String> environment) {
        String value = environment.apply(variableName);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(
                    "Environment variable " + variableName + " not set. Required for wallet initialization.");
        }
        return fromHex(value);
    }

    /** Checksummed public address, safe to share. */
    public String getAddress() {
        return address;
    }

    /**
     * Signs a 32-byte digest. The digest is checked before the key is touched.
     */
    public Sign.SignatureData signHash(byte[] hash) {
        if (hash == null || hash.length != 32) {
            throw new WalletException("Hash to sign must be exactly 32 bytes");
        }
        signingLock.lock();
        try {
            return Sign.signMessage(hash, keyPair, false);
        } finally {
            signingLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "SecureWallet{address=" + address + ", key=" + REDACTED + "}";
    }
}
