package infrastructure.util;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationUtilsTest {

    @Test
    void finite() {
        assertDoesNotThrow(() -> ValidationUtils.validateFinite(-3.5, "x"));
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.validateFinite(Double.NaN, "x"));
        assertThrows(IllegalArgumentException.class,
            () -> ValidationUtils.validateFinite(Double.POSITIVE_INFINITY, "x"));
    }

    @Test
    void integral() {
        assertDoesNotThrow(() -> ValidationUtils.validateIntegral(-42, "seed"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ValidationUtils.validateIntegral(2.5, "seed"));
        assertTrue(e.getMessage().startsWith("seed"));
    }

    @Test
    void nonNegativeAndAtLeast() {
        assertDoesNotThrow(() -> ValidationUtils.validateNonNegative(0, "min"));
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.validateNonNegative(-1e-9, "min"));
        assertDoesNotThrow(() -> ValidationUtils.validateAtLeast(2, 2, "bound"));
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.validateAtLeast(1, 2, "bound"));
    }

    @Test
    void notEmpty() {
        assertDoesNotThrow(() -> ValidationUtils.validateNotEmpty(List.of(1), "seeds"));
        assertThrows(IllegalArgumentException.class,
            () -> ValidationUtils.validateNotEmpty(Collections.emptyList(), "seeds"));
        assertThrows(IllegalArgumentException.class, () -> ValidationUtils.validateNotEmpty(null, "seeds"));
    }
}
