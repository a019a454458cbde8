package com.ciro.jsonui.mapping;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClassListTest {

    @Test
    void keepsInsertionOrderWithoutDuplicates() {
        ClassList list = new ClassList();
        list.add("flex flex-col");
        list.add("flex");
        list.add("  p-4 ");
        assertEquals("flex flex-col p-4", list.toString());
        assertEquals(List.of("flex", "flex-col", "p-4"), list.tokens());
    }

    @Test
    void removeByPrefix() {
        ClassList list = new ClassList();
        list.add("opacity-50 pointer-events-none opacity-[0.3]");
        list.removeIf("opacity-");
        assertEquals("pointer-events-none", list.toString());
        assertTrue(list.contains("pointer-events-none"));
    }
}
