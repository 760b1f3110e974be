package com.defiguard.unit.wallet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.defiguard.exception.WalletException;
import com.defiguard.support.GovernanceHarness;
import com.defiguard.wallet.HashSource;
import com.defiguard.wallet.HexCodec;
import com.defiguard.wallet.MessageSignature;
import com.defiguard.wallet.SecureWallet;
import com.defiguard.wallet.TransactionSignature;
import com.defiguard.wallet.WalletSigningService;
import java.math.BigInteger;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

/**
 * Unit tests for the signing ladder, using a well-known development key so signatures
 * can be checked by public-key recovery.
 */
class WalletSigningServiceTest {

    private WalletSigningService service;

    @BeforeEach
    void setUp() {
        service = new WalletSigningService(SecureWallet.fromHex(GovernanceHarness.TEST_KEY));
    }

    /** Recovers the signer address from a 0x r||s||v signature over {@code hashHex}. */
    private static String recoverAddress(String hashHex, String signatureHex) throws Exception {
        byte[] signature = HexCodec.decode(signatureHex);
        Sign.SignatureData data = new Sign.SignatureData(
                signature[64], Arrays.copyOfRange(signature, 0, 32), Arrays.copyOfRange(signature, 32, 64));
        BigInteger publicKey = Sign.signedMessageHashToKey(HexCodec.decode(hashHex), data);
        return "0x" + Keys.getAddress(publicKey);
    }

    @Test
    @DisplayName("deriveAddress returns the wallet's public address")
    void deriveAddress() {
        assertThat(service.deriveAddress()).isEqualToIgnoringCase(GovernanceHarness.TEST_ADDRESS);
    }

    // ==============================
    // MESSAGE SIGNING
    // ==============================

    @Nested
    @DisplayName("Message Signing")
    class MessageSigning {

        @Test
        @DisplayName("Messages are hashed with the EIP-191 personal-message prefix")
        void eip191Hash() {
            MessageSignature signature = service.signMessage("Hello World");

            assertThat(signature.getMessageHash())
                    .isEqualTo("0xa1de988600a42c4b4ab089b619297c17d53cffae5d5120d82d8a92d0bb3b78f2");
        }

        @Test
        @DisplayName("The signature is 65 bytes and recovers to the wallet address")
        void signatureRecoversToWallet() throws Exception {
            MessageSignature signature = service.signMessage("approve swap #42");

            assertThat(HexCodec.decode(signature.getSignature())).hasSize(65);
            assertThat(recoverAddress(signature.getMessageHash(), signature.getSignature()))
                    .isEqualToIgnoringCase(GovernanceHarness.TEST_ADDRESS);
        }

        @Test
        @DisplayName("Signing is deterministic for the same message")
        void deterministic() {
            assertThat(service.signMessage("same").getSignature())
                    .isEqualTo(service.signMessage("same").getSignature());
        }

        @Test
        @DisplayName("A null message is rejected")
        void nullMessage_rejected() {
            assertThatThrownBy(() -> service.signMessage(null)).isInstanceOf(WalletException.class);
        }
    }

    // ==============================
    // TRANSACTION SIGNING
    // ==============================

    @Nested
    @DisplayName("Transaction Signing")
    class TransactionSigning {

        private final String txBytes = "0x02ef0180843b9aca00850ba43b7400825208940000000000000000000000000000000000000000"
                + "0180c0";

        @Test
        @DisplayName("Raw bytes are signed over their Keccak-256 hash")
        void bytesAreHashed() throws Exception {
            TransactionSignature signature = service.signTransaction(null, txBytes);

            assertThat(signature.getHashSource()).isEqualTo(HashSource.TX_BYTES);
            assertThat(signature.getHash()).isEqualTo(HexCodec.encode(Hash.sha3(HexCodec.decode(txBytes))));
            assertThat(recoverAddress(signature.getHash(), signature.getSignature()))
                    .isEqualToIgnoringCase(GovernanceHarness.TEST_ADDRESS);
        }

        @Test
        @DisplayName("Signing the hash directly gives the same signature as signing the bytes")
        void hashAndBytesAgree() {
            TransactionSignature fromBytes = service.signTransaction(null, txBytes);
            TransactionSignature fromHash = service.signTransaction(fromBytes.getHash(), null);

            assertThat(fromHash.getHashSource()).isEqualTo(HashSource.TX_HASH);
            assertThat(fromHash.getSignature()).isEqualTo(fromBytes.getSignature());
        }

        @Test
        @DisplayName("Exactly one of hash or bytes must be given")
        void exactlyOneInput() {
            assertThatThrownBy(() -> service.signTransaction(null, null))
                    .hasMessage("Exactly one of tx_hash or tx_bytes is required");
            assertThatThrownBy(() -> service.signTransaction("0x" + "11".repeat(32), txBytes))
                    .hasMessage("Exactly one of tx_hash or tx_bytes is required");
        }

        @Test
        @DisplayName("Malformed hashes and bytes are rejected before signing")
        void malformedInput_rejected() {
            assertThatThrownBy(() -> service.signTransaction("0x1234", null)).hasMessage("tx_hash must be 32 bytes");
            assertThatThrownBy(() -> service.signTransaction(null, "0x")).hasMessage("tx_bytes must not be empty");
            assertThatThrownBy(() -> service.signTransaction(null, "0xabc"))
                    .isInstanceOf(WalletException.class)
                    .hasMessageStartingWith("Invalid hex string");
        }
    }

    // ==============================
    // KEY HYGIENE
    // ==============================

    @Test
    @DisplayName("No log line emitted while signing contains the private key")
    void logsNeverContainKey() {
        Logger logger = (Logger) LoggerFactory.getLogger("com.defiguard");
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            service.deriveAddress();
            service.signMessage("hello");
            service.signTransaction("0x" + "ab".repeat(32), null);
            try {
                SecureWallet.fromHex(GovernanceHarness.TEST_KEY.substring(0, 40));
            } catch (RuntimeException expected) {
                assertThat(expected.getMessage()).doesNotContain(GovernanceHarness.TEST_KEY.substring(2, 40));
            }
        } finally {
            logger.detachAppender(appender);
        }

        String keyDigits = GovernanceHarness.TEST_KEY.substring(2);
        assertThat(appender.list).isNotEmpty();
        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .allSatisfy(line -> assertThat(line.toLowerCase()).doesNotContain(keyDigits));
    }
}
