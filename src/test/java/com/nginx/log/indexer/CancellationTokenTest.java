package com.nginx.log.indexer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class CancellationTokenTest {

    @Test
    public void testCancel() {
        CancellationToken token = new CancellationToken();
        assertFalse(token.isCancelled());
        assertNull(token.getReason());

        token.cancel("timed out");
        token.cancel("second reason");

        assertTrue(token.isCancelled());
        assertEquals("timed out", token.getReason());
    }

    @Test
    public void testChildFollowsParent() {
        CancellationToken parent = new CancellationToken();
        CancellationToken child = parent.child();
        CancellationToken sibling = parent.child();

        child.cancel();
        assertTrue(child.isCancelled());
        assertFalse(parent.isCancelled());
        assertFalse(sibling.isCancelled());

        parent.cancel("shutdown");
        assertTrue(sibling.isCancelled());
        assertEquals("shutdown", sibling.getReason());
        assertEquals("cancelled", child.getReason());
    }
}
