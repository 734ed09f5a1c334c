package crosspost.core.model.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("KeyPath")
class KeyPathTest {

    @Nested
    @DisplayName("construction")
    class ConstructionTests {

        @Test
        @DisplayName("should reject empty segments")
        void shouldRejectEmptySegments() {
            assertThrows(IllegalArgumentException.class, () -> KeyPath.of("token", ""));
        }

        @Test
        @DisplayName("should reject null segments")
        void shouldRejectNullSegments() {
            assertThrows(IllegalArgumentException.class, () -> KeyPath.of("token", null));
        }

        @Test
        @DisplayName("should treat root as having no segments")
        void shouldTreatRootAsEmpty() {
            assertTrue(KeyPath.root().isRoot());
            assertEquals("", KeyPath.root().encoded());
            assertEquals("", KeyPath.root().encodedPrefix());
        }
    }

    @Nested
    @DisplayName("encoding")
    class EncodingTests {

        @Test
        @DisplayName("should join segments with slash")
        void shouldJoinSegments() {
            assertEquals("token/twitter/123", KeyPath.of("token", "twitter", "123").encoded());
        }

        @Test
        @DisplayName("should escape separators inside segments")
        void shouldEscapeSeparators() {
            final var key = KeyPath.of("wallet-index", "a/b", "50%");

            assertEquals("wallet-index/a%2Fb/50%25", key.encoded());
            assertEquals(key, KeyPath.decode(key.encoded()));
        }

        @Test
        @DisplayName("should decode escaped percent without touching following text")
        void shouldDecodeEscapedPercent() {
            final var key = KeyPath.of("%2F");

            assertEquals("%252F", key.encoded());
            assertEquals("%2F", KeyPath.decode(key.encoded()).last());
        }

        @Test
        @DisplayName("should end non-root prefixes with the separator")
        void shouldEndPrefixWithSeparator() {
            assertEquals("token/a/", KeyPath.of("token", "a").encodedPrefix());
            assertFalse("token/ab".startsWith(KeyPath.of("token", "a").encodedPrefix()));
        }
    }

    @Nested
    @DisplayName("navigation")
    class NavigationTests {

        @Test
        @DisplayName("should append segments and keys")
        void shouldAppend() {
            final var base = KeyPath.of("token");

            assertEquals(KeyPath.of("token", "twitter", "1"), base.append("twitter", "1"));
            assertEquals(KeyPath.of("token", "twitter"), base.append(KeyPath.of("twitter")));
        }

        @Test
        @DisplayName("should match whole segments only")
        void shouldMatchWholeSegments() {
            final var key = KeyPath.of("token", "ab");

            assertTrue(key.startsWith(KeyPath.of("token")));
            assertTrue(key.startsWith(KeyPath.root()));
            assertFalse(key.startsWith(KeyPath.of("token", "a")));
        }

        @Test
        @DisplayName("should strip a prefix")
        void shouldStripPrefix() {
            assertEquals(
                    KeyPath.of("twitter", "1"),
                    KeyPath.of("token", "twitter", "1").relativeTo(KeyPath.of("token")));
        }

        @Test
        @DisplayName("should reject stripping a prefix the key is not under")
        void shouldRejectForeignPrefix() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> KeyPath.of("token", "1").relativeTo(KeyPath.of("auth")));
        }
    }

    @Test
    @DisplayName("should order keys by their encoded form")
    void shouldOrderByEncodedForm() {
        final var keys = new ArrayList<>(List.of(
                KeyPath.of("audit", "0000000000002-000000"),
                KeyPath.of("audit", "0000000000001-000001"),
                KeyPath.of("audit", "0000000000001-000000")));

        Collections.sort(keys);

        assertEquals("0000000000001-000000", keys.get(0).last());
        assertEquals("0000000000001-000001", keys.get(1).last());
        assertEquals("0000000000002-000000", keys.get(2).last());
    }
}
