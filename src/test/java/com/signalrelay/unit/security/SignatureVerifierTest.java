package com.signalrelay.unit.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.signalrelay.security.SignatureVerifier;
import com.signalrelay.support.TestSignals;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SignatureVerifierTest {

    private SignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new SignatureVerifier();
    }

    @Nested
    @DisplayName("Signing")
    class Signing {

        @Test
        @DisplayName("Matches the RFC 4231 HMAC-SHA256 test vector")
        void matchesRfc4231Vector() {
            byte[] body = "what do ya want for nothing?".getBytes(StandardCharsets.UTF_8);

            assertThat(verifier.sign(body, "Jefe"))
                    .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
        }

        @Test
        @DisplayName("Produces 64 lower-case hex characters")
        void lowerCaseHex() {
            assertThat(verifier.sign(TestSignals.btcBuyBody(), TestSignals.SECRET)).matches("[0-9a-f]{64}");
        }

        @Test
        @DisplayName("Refuses an empty secret")
        void emptySecret() {
            assertThatThrownBy(() -> verifier.sign(TestSignals.btcBuyBody(), ""))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Verification")
    class Verification {

        @Test
        @DisplayName("Accepts the signature it produced")
        void roundTrip() {
            byte[] body = TestSignals.btcBuyBody();
            String signature = verifier.sign(body, TestSignals.SECRET);

            assertThat(verifier.verify(body, TestSignals.SECRET, signature)).isTrue();
        }

        @Test
        @DisplayName("Rejects after flipping any single body byte")
        void bodyByteFlip() {
            byte[] body = TestSignals.btcBuyBody();
            String signature = verifier.sign(body, TestSignals.SECRET);

            for (int i = 0; i < body.length; i++) {
                byte[] tampered = body.clone();
                tampered[i] ^= 0x01;
                assertThat(verifier.verify(tampered, TestSignals.SECRET, signature))
                        .as("flip at offset %d", i)
                        .isFalse();
            }
        }

        @Test
        @DisplayName("Rejects after changing any single signature character")
        void signatureCharFlip() {
            byte[] body = TestSignals.btcBuyBody();
            String signature = verifier.sign(body, TestSignals.SECRET);

            for (int i = 0; i < signature.length(); i++) {
                char[] chars = signature.toCharArray();
                chars[i] = chars[i] == '0' ? '1' : '0';
                assertThat(verifier.verify(body, TestSignals.SECRET, new String(chars)))
                        .as("change at index %d", i)
                        .isFalse();
            }
        }

        @Test
        @DisplayName("Rejects a signature made with another secret")
        void wrongSecret() {
            byte[] body = TestSignals.btcBuyBody();

            assertThat(verifier.verify(body, TestSignals.SECRET, verifier.sign(body, "other-secret")))
                    .isFalse();
        }

        @Test
        @DisplayName("Upper-case hex does not match")
        void upperCaseRejected() {
            byte[] body = TestSignals.btcBuyBody();
            String signature = verifier.sign(body, TestSignals.SECRET).toUpperCase();

            assertThat(verifier.verify(body, TestSignals.SECRET, signature)).isFalse();
        }

        @Test
        @DisplayName("Missing or empty signature is rejected")
        void missingSignature() {
            byte[] body = TestSignals.btcBuyBody();

            assertThat(verifier.verify(body, TestSignals.SECRET, null)).isFalse();
            assertThat(verifier.verify(body, TestSignals.SECRET, "")).isFalse();
        }

        @Test
        @DisplayName("Unconfigured secret rejects everything")
        void blankSecret() {
            byte[] body = TestSignals.btcBuyBody();
            String signature = verifier.sign(body, TestSignals.SECRET);

            assertThat(verifier.verify(body, null, signature)).isFalse();
            assertThat(verifier.verify(body, "", signature)).isFalse();
        }
    }
}
