package com.delta.adsync.sync.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GraphIdsTest {

    @Test
    void stripsAccountPrefix() {
        assertEquals("12345", GraphIds.normalizeAccountId("act_12345"));
        assertEquals("12345", GraphIds.normalizeAccountId(" 12345 "));
        assertNull(GraphIds.normalizeAccountId("act_"));
        assertNull(GraphIds.normalizeAccountId(null));
    }

    @Test
    void accountNodeRequiresAnId() {
        assertEquals("act_12345", GraphIds.accountNode("12345"));
        assertEquals("act_12345", GraphIds.accountNode("act_12345"));
        assertThrows(IllegalArgumentException.class, () -> GraphIds.accountNode(" "));
    }
}
