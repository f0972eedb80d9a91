package com.nginx.log.parser;

import com.nginx.log.parser.model.GeoLocation;

/**
 * Resolves a client IP to a region/province/city triple. Loading of the backing
 * database is up to the implementation.
 */
@FunctionalInterface
public interface GeoIpLookup {

    GeoLocation lookup(String ip);
}
