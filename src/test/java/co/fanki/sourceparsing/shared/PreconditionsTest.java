package co.fanki.sourceparsing.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNonNullValue_shouldReturnValue() {
        final String value = "import os";

        assertEquals(value, Preconditions.requireNonNull(value, "message"));
    }

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowWithMessage() {
        final IllegalArgumentException exception = assertThrows(
                IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Source is required"));

        assertEquals("Source is required", exception.getMessage());
    }

    @Test
    void whenRequireNonBlank_givenBlankString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "Name is blank"));
    }

    @Test
    void whenRequireNonBlank_givenNullString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank(null, "Name is null"));
    }

    @Test
    void whenRequirePositive_givenOneBasedLine_shouldReturnIt() {
        assertEquals(1, Preconditions.requirePositive(1, "message"));
    }

    @Test
    void whenRequirePositive_givenZero_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requirePositive(0, "Line must be 1-based"));
    }

}
