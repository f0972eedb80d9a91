package com.nginx.log.parser;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Supported nginx access log formats, declared in matching priority order
 * (widest pattern first).
 */
public enum LogFormat {

    /** combined plus request_time, upstream_time, x_forwarded_for and connection */
    DETAILED("detailed",
            "^(\\S+) - (\\S+) \\[([^\\]]+)\\] \"([^\"]*)\" (\\d+) (\\d+|-) \"([^\"]*)\" \"([^\"]*)\" (\\S+) (\\S+) \"([^\"]*)\" (\\S+)",
            "ip", "remote_user", "timestamp", "request", "status", "bytes_sent", "referer", "user_agent",
            "request_time", "upstream_time", "x_forwarded_for", "connection"),

    COMBINED("combined",
            "^(\\S+) - (\\S+) \\[([^\\]]+)\\] \"([^\"]*)\" (\\d+) (\\d+|-) \"([^\"]*)\" \"([^\"]*)\"(?:\\s+(\\S+))?(?:\\s+(\\S+))?",
            "ip", "remote_user", "timestamp", "request", "status", "bytes_sent", "referer", "user_agent",
            "request_time", "upstream_time"),

    /** common log format; referer and user agent are optional */
    MAIN("main",
            "^(\\S+) - (\\S+) \\[([^\\]]+)\\] \"([^\"]*)\" (\\d+) (\\d+|-)(?: \"([^\"]*)\" \"([^\"]*)\")?",
            "ip", "remote_user", "timestamp", "request", "status", "bytes_sent", "referer", "user_agent");

    private final String formatName;
    private final Pattern pattern;
    private final List<String> fields;

    LogFormat(String formatName, String regex, String... fields) {
        this.formatName = formatName;
        this.pattern = Pattern.compile(regex);
        this.fields = List.of(fields);
    }

    public String getFormatName() {
        return formatName;
    }

    public Pattern getPattern() {
        return pattern;
    }

    /**
     * Field names in capture group order (group 1 is the first field).
     */
    public List<String> getFields() {
        return fields;
    }

    public boolean matches(String line) {
        return pattern.matcher(line).find();
    }

    public static LogFormat forName(String name) {
        for (LogFormat format : values()) {
            if (format.formatName.equalsIgnoreCase(name)) {
                return format;
            }
        }
        return null;
    }

    /**
     * Returns the highest priority format matching more than half of the non-blank
     * sample lines, or null when none does.
     */
    public static LogFormat detect(List<String> sampleLines) {
        if (sampleLines == null || sampleLines.isEmpty()) {
            return null;
        }
        int nonBlank = 0;
        int[] scores = new int[values().length];
        for (String line : sampleLines) {
            if (line == null || line.trim().isEmpty()) {
                continue;
            }
            String trimmed = line.trim();
            nonBlank++;
            for (LogFormat format : values()) {
                if (format.matches(trimmed)) {
                    scores[format.ordinal()]++;
                }
            }
        }
        if (nonBlank == 0) {
            return null;
        }
        for (LogFormat format : values()) {
            if (scores[format.ordinal()] * 2 > nonBlank) {
                return format;
            }
        }
        return null;
    }
}
