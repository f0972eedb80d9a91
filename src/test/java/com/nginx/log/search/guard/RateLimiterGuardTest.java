package com.nginx.log.search.guard;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.nginx.log.error.QueryException;

public class RateLimiterGuardTest {

    @Test
    public void testDisabled() throws Exception {
        RateLimiterGuard guard = new RateLimiterGuard(0);

        assertFalse(guard.isEnabled());
        for (int i = 0; i < 100; i++) {
            guard.acquire();
        }
    }

    @Test
    public void testRejectsBurst() throws Exception {
        RateLimiterGuard guard = new RateLimiterGuard(0.01);

        assertTrue(guard.isEnabled());
        guard.acquire();
        QueryException e = assertThrows(QueryException.class, guard::acquire);
        assertEquals(QueryException.Reason.RATE_LIMITED, e.getReason());
        assertEquals("RATE_LIMITED", e.getReasonName());
    }
}
