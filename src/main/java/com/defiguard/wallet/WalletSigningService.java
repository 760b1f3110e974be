package com.defiguard.wallet;

import com.defiguard.exception.WalletException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;

/**
 * The signing ladder: three capability-gated operations over the {@link SecureWallet}.
 *
 * <ol>
 *   <li>{@link #deriveAddress()} -- read-only, returns the public address</li>
 *   <li>{@link #signMessage(String)} -- EIP-191 personal message signature</li>
 *   <li>{@link #signTransaction(String, String)} -- signs a transaction hash, or the
 *       Keccak-256 of raw transaction bytes</li>
 * </ol>
 *
 * <p>Which rungs a script may use is decided by policy before any of these methods run.
 * Every input is validated before the wallet is asked to sign. Results carry the
 * address, the signed digest and the 65-byte {@code r || s || v} signature, never key
 * material.
 */
@Service
public class WalletSigningService {

    private static final Logger log = LoggerFactory.getLogger(WalletSigningService.class);

    private static final int HASH_LENGTH = 32;

    private final SecureWallet secureWallet;

    public WalletSigningService(SecureWallet secureWallet) {
        this.secureWallet = secureWallet;
    }

    public String deriveAddress() {
        return secureWallet.getAddress();
    }

    public MessageSignature signMessage(String message) {
        if (message == null) {
            throw new WalletException("message is required");
        }
        byte[] messageHash = Sign.getEthereumMessageHash(message.getBytes(StandardCharsets.UTF_8));
        Sign.SignatureData signature = secureWallet.signHash(messageHash);

        String hashHex = HexCodec.encode(messageHash);
        log.info("Signed personal message [address={}, messageHash={}]", secureWallet.getAddress(), hashHex);
        return MessageSignature.builder()
                .address(secureWallet.getAddress())
                .messageHash(hashHex)
                .signature(encodeSignature(signature))
                .build();
    }

    /**
     * Signs exactly one of a precomputed 32-byte hash or raw transaction bytes.
     *
     * @param txHashHex  0x-prefixed 32-byte hash, or null
     * @param txBytesHex 0x-prefixed raw transaction bytes, or null
     */
    public TransactionSignature signTransaction(String txHashHex, String txBytesHex) {
        if ((txHashHex == null) == (txBytesHex == null)) {
            throw new WalletException("Exactly one of tx_hash or tx_bytes is required");
        }

        byte[] hash;
        HashSource source;
        if (txHashHex != null) {
            hash = HexCodec.decode(txHashHex);
            if (hash.length != HASH_LENGTH) {
                throw new WalletException("tx_hash must be 32 bytes");
            }
            source = HashSource.TX_HASH;
        } else {
            byte[] txBytes = HexCodec.decode(txBytesHex);
            if (txBytes.length == 0) {
                throw new WalletException("tx_bytes must not be empty");
            }
            hash = Hash.sha3(txBytes);
            source = HashSource.TX_BYTES;
        }

        Sign.SignatureData signature = secureWallet.signHash(hash);
        String hashHex = HexCodec.encode(hash);
        log.info(
                "Signed transaction hash [address={}, hash={}, source={}]",
                secureWallet.getAddress(),
                hashHex,
                source.getWireValue());
        return TransactionSignature.builder()
                .address(secureWallet.getAddress())
                .hash(hashHex)
                .hashSource(source)
                .signature(encodeSignature(signature))
                .build();
    }

    static String encodeSignature(Sign.SignatureData signature) {
        byte[] r = signature.getR();
        byte[] s = signature.getS();
        byte[] v = signature.getV();
        byte[] encoded = new byte[r.length + s.length + v.length];
        System.arraycopy(r, 0, encoded, 0, r.length);
        System.arraycopy(s, 0, encoded, r.length, s.length);
        System.arraycopy(v, 0, encoded, r.length + s.length, v.length);
        return HexCodec.encode(encoded);
    }
}
