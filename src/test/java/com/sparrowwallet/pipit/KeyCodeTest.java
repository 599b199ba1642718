package com.sparrowwallet.pipit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class KeyCodeTest {
    @Test
    public void testParse() {
        assertEquals(23, KeyCode.parse("23"));
        assertEquals(23, KeyCode.parse("DPAD_CENTER"));
        assertEquals(23, KeyCode.parse("keycode_dpad_center"));
        assertEquals(3, KeyCode.parse(" HOME "));
        assertEquals(999, KeyCode.parse("999"));
    }

    @Test
    public void testParseInvalid() {
        assertThrows(IllegalArgumentException.class, () -> KeyCode.parse("TELEPORT"));
        assertThrows(IllegalArgumentException.class, () -> KeyCode.parse(""));
    }
}
