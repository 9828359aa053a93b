package io.kwinctl.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class BindingsTest {
    @Test
    void extendingLeavesTheBaseUntouched() {
        var base = Bindings.of(Map.of("marker", "kwinctl-1.js"));
        var step = base.with("step_name", "search");

        assertFalse(base.contains("step_name"));
        assertEquals("search", step.get("step_name"));
        assertEquals("kwinctl-1.js", step.get("marker"));
    }

    @Test
    void laterValuesOverrideEarlierOnes() {
        var bindings = Bindings.empty().with("n", 1).withAll(Map.of("n", 2));
        assertEquals(2, bindings.get("n"));
    }

    @Test
    void nullValuesCountAsBound() {
        var bindings = Bindings.empty().with("n", null);
        assertTrue(bindings.contains("n"));
        assertNull(bindings.get("n"));
    }

    @Test
    void exposedMapIsReadOnly() {
        var bindings = Bindings.empty().with("a", 1);
        assertThrows(UnsupportedOperationException.class, () -> bindings.asMap().put("b", 2));
    }
}
