package com.nginx.log.parser;

import com.nginx.log.parser.model.UserAgentInfo;

/**
 * Classifies a raw user agent string.
 */
@FunctionalInterface
public interface UserAgentParser {

    UserAgentInfo parse(String userAgent);
}
