package com.connectpro.policy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FooterTest {

    private final Footer footer = new Footer("This Bot was made using @Connectsprobot");

    @Test
    void appendsAttribution() {
        var text = footer.add("Hello");
        assertTrue(text.startsWith("Hello\n\n"));
        assertTrue(text.endsWith("This Bot was made using @Connectsprobot"));
    }

    @Test
    void removeUndoesAdd() {
        assertEquals("Hello", footer.remove(footer.add("Hello")));
        assertEquals("plain", footer.remove("plain"));
    }
}
