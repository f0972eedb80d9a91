package com.nginx.log.files;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LogPathWhitelistTest {

    @TempDir
    Path dir;

    @Test
    public void testEmptyWhitelistAllowsEverything() {
        LogPathWhitelist whitelist = LogPathWhitelist.allowAll();
        assertTrue(whitelist.isEmpty());
        assertTrue(whitelist.isAllowed("/etc/passwd"));
    }

    @Test
    public void testPrefixMatch() {
        LogPathWhitelist whitelist = new LogPathWhitelist(List.of(dir.toString(), " "));

        assertFalse(whitelist.isEmpty());
        assertTrue(whitelist.isAllowed(dir.resolve("access.log")));
        assertTrue(whitelist.isAllowed(dir.resolve("sub/access.log").toString()));
        assertFalse(whitelist.isAllowed("/etc/passwd"));
        assertFalse(whitelist.isAllowed(dir.resolve("../outside.log")));
    }

    @Test
    public void testSiblingDirectoryWithSamePrefixIsRejected() {
        LogPathWhitelist whitelist = new LogPathWhitelist(List.of(dir.resolve("nginx").toString()));

        assertFalse(whitelist.isAllowed(dir.resolve("nginx-other/access.log")));
        assertTrue(whitelist.isAllowed(dir.resolve("nginx/access.log")));
    }
}
