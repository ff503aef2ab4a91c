package com.callplane.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApplicationTest {

    @Test
    void testValidNames() {
        assertTrue(Application.isValid("myapp"));
        assertTrue(Application.isValid("my-app_2.0"));
        assertTrue(Application.isValid("A"));
        assertTrue(Application.isValid("a".repeat(128)));
    }

    @Test
    void testInvalidNames() {
        assertFalse(Application.isValid(null));
        assertFalse(Application.isValid(""));
        assertFalse(Application.isValid("-leading-dash"));
        assertFalse(Application.isValid("with space"));
        assertFalse(Application.isValid("slash/inside"));
        assertFalse(Application.isValid("a".repeat(129)));
    }

    @Test
    void testFromName_DeterministicUuid() {
        Application first = Application.fromName("myapp");
        Application second = Application.fromName("myapp");

        assertEquals("myapp", first.getName());
        assertEquals(first.getUuid(), second.getUuid());
        assertEquals(first, second);
        assertNotEquals(first.getUuid(), Application.fromName("otherapp").getUuid());
    }

    @Test
    void testFromName_RejectsInvalidName() {
        assertThrows(IllegalArgumentException.class, () -> Application.fromName("bad name"));
    }
}
