package com.nginx.log.files;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directory prefixes log files may be read from. An empty whitelist allows every path.
 */
public class LogPathWhitelist {

    static final Logger logger = LoggerFactory.getLogger(LogPathWhitelist.class);

    private final List<Path> dirs = new ArrayList<>();

    public LogPathWhitelist(Collection<String> dirs) {
        for (String dir : dirs) {
            if (dir != null && !dir.trim().isEmpty()) {
                Path path = Paths.get(dir.trim()).toAbsolutePath().normalize();
                this.dirs.add(path);
                try {
                    Path real = path.toRealPath();
                    if (!real.equals(path)) {
                        this.dirs.add(real);
                    }
                } catch (IOException e) {
                    // directory may be created later, keep the configured form only
                    logger.debug("Whitelist dir {} not resolvable: {}", path, e.getMessage());
                }
            }
        }
    }

    public static LogPathWhitelist allowAll() {
        return new LogPathWhitelist(List.of());
    }

    public boolean isEmpty() {
        return dirs.isEmpty();
    }

    public boolean isAllowed(Path path) {
        if (dirs.isEmpty()) {
            return true;
        }
        Path normalized = path.toAbsolutePath().normalize();
        for (Path dir : dirs) {
            if (normalized.startsWith(dir)) {
                return true;
            }
        }
        return false;
    }

    public boolean isAllowed(String path) {
        return isAllowed(Paths.get(path));
    }
}
