package oktaauth.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RedirectStateCodec")
class RedirectStateCodecTest {

    private RedirectStateCodec codec;

    @BeforeEach
    void setUp() {
        codec = new RedirectStateCodec("client-secret");
    }

    @Test
    @DisplayName("should carry the destination through encode and decode unchanged")
    void shouldRoundTripDestination() {
        final var destination = "https://example.org/dashboard?tab=1&x=%2F";

        assertEquals(Optional.of(destination), codec.decode(codec.encode(destination)));
    }

    @Test
    @DisplayName("should reject a state signed with another secret")
    void shouldRejectForeignSignature() {
        final var state = new RedirectStateCodec("other-secret").encode("https://evil.example.com");

        assertTrue(codec.decode(state).isEmpty());
    }

    @Test
    @DisplayName("should reject a tampered state")
    void shouldRejectTamperedState() {
        final var state = codec.encode("https://example.org/a");
        final var parts = state.split("\\.");
        final var forged = parts[0] + "." + new RedirectStateCodec("x").encode("https://evil.example.com").split("\\.")[1]
                + "." + parts[2];

        assertTrue(codec.decode(forged).isEmpty());
    }

    @Test
    @DisplayName("should reject missing and malformed states")
    void shouldRejectMissingOrMalformed() {
        assertTrue(codec.decode(null).isEmpty());
        assertTrue(codec.decode("").isEmpty());
        assertTrue(codec.decode("not-a-jws").isEmpty());
    }

    @Test
    @DisplayName("should produce different states for different destinations")
    void shouldDifferPerDestination() {
        assertNotEquals(codec.encode("https://example.org/a"), codec.encode("https://example.org/b"));
    }
}
