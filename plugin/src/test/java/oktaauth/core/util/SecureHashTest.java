package oktaauth.core.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HexFormat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SecureHash")
class SecureHashTest {

    @Nested
    @DisplayName("sha256")
    class Sha256Tests {

        @Test
        @DisplayName("should match the known digest of a UTF-8 string")
        void shouldMatchKnownDigest() {
            final var expected =
                    HexFormat.of().parseHex("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");

            assertArrayEquals(expected, SecureHash.sha256("abc"));
        }

        @Test
        @DisplayName("should produce a 32-byte digest")
        void shouldProduce32Bytes() {
            assertEquals(32, SecureHash.sha256("").length);
            assertEquals(32, SecureHash.sha256("a much longer client secret value").length);
        }
    }

    @Nested
    @DisplayName("fingerprint")
    class FingerprintTests {

        @Test
        @DisplayName("should be the first 12 hex characters of the digest")
        void shouldTruncateDigest() {
            assertEquals("ba7816bf8f01", SecureHash.fingerprint("abc"));
        }

        @Test
        @DisplayName("should produce deterministic output for same input")
        void shouldBeDeterministic() {
            assertEquals(SecureHash.fingerprint("client-secret"), SecureHash.fingerprint("client-secret"));
        }

        @Test
        @DisplayName("should produce different output for different inputs")
        void shouldDifferForDifferentSecrets() {
            assertNotEquals(SecureHash.fingerprint("secret-a"), SecureHash.fingerprint("secret-b"));
        }

        @Test
        @DisplayName("should not contain the secret")
        void shouldNotContainSecret() {
            final var fingerprint = SecureHash.fingerprint("abcdef");

            assertFalse(fingerprint.contains("abcdef"));
            assertTrue(fingerprint.matches("[0-9a-f]{12}"));
        }
    }
}
