package com.nginx.log.files;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps rotated and compressed log files onto the main log path of their group and
 * enumerates the members of a group.
 */
public final class LogFileGroups {

    static final Logger logger = LoggerFactory.getLogger(LogFileGroups.class);

    private static final Pattern ROTATION_SUFFIX = Pattern.compile("^(.+)\\.(\\d{1,3})$");
    private static final Pattern DATE_SUFFIX = Pattern.compile(
            "^(.+?)[.\\-_](\\d{8}|\\d{4}-\\d{2}-\\d{2}|\\d{4}\\.\\d{2}\\.\\d{2}|\\d{4}_\\d{2}_\\d{2})$");

    private LogFileGroups() {
    }

    /**
     * Strips a compression suffix, then a numeric rotation suffix or else a trailing
     * date stamp. Paths without either are returned unchanged.
     */
    public static String getMainLogPath(String filePath) {
        if (filePath == null || filePath.isEmpty()) {
            return filePath;
        }
        String path = filePath;
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".gz")) {
            path = path.substring(0, path.length() - 3);
        } else if (lower.endsWith(".bz2")) {
            path = path.substring(0, path.length() - 4);
        }

        Matcher rotation = ROTATION_SUFFIX.matcher(path);
        if (rotation.matches()) {
            return rotation.group(1);
        }
        Matcher date = DATE_SUFFIX.matcher(path);
        if (date.matches()) {
            return date.group(1);
        }
        return path;
    }

    public static boolean isCompressed(String filePath) {
        String lower = filePath.toLowerCase(Locale.ROOT);
        return lower.endsWith(".gz") || lower.endsWith(".bz2");
    }

    /**
     * Only gzip has a decompressor.
     */
    public static boolean isGzip(String filePath) {
        return filePath.toLowerCase(Locale.ROOT).endsWith(".gz");
    }

    /**
     * All regular files named {@code <main>*} in the main log's directory, sorted and
     * de-duplicated. The main log itself is included whenever it exists.
     */
    public static List<String> findRelatedFiles(String mainLogPath) {
        TreeSet<String> files = new TreeSet<>();
        Path main = Paths.get(mainLogPath).toAbsolutePath().normalize();
        Path dir = main.getParent();
        String base = main.getFileName().toString();

        if (dir != null && Files.isDirectory(dir)) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir,
                    p -> p.getFileName().toString().startsWith(base))) {
                for (Path candidate : stream) {
                    if (Files.isRegularFile(candidate)) {
                        files.add(candidate.toString());
                    }
                }
            } catch (IOException e) {
                logger.warn("Unable to list {}: {}", dir, e.getMessage());
            }
        }

        if (Files.isRegularFile(main)) {
            files.add(main.toString());
        }
        return new ArrayList<>(files);
    }
}
