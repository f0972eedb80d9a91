package com.nginx.log.parser.model;

import java.util.Objects;

/**
 * Classification of a user agent string. Fields are empty when not recognised.
 */
public class UserAgentInfo {

    public static final UserAgentInfo EMPTY = new UserAgentInfo("", "", "", "", "");

    private final String browser;
    private final String browserVersion;
    private final String os;
    private final String osVersion;
    private final String deviceType;

    public UserAgentInfo(String browser, String browserVersion, String os, String osVersion, String deviceType) {
        this.browser = browser;
        this.browserVersion = browserVersion;
        this.os = os;
        this.osVersion = osVersion;
        this.deviceType = deviceType;
    }

    public String getBrowser() {
        return browser;
    }

    public String getBrowserVersion() {
        return browserVersion;
    }

    public String getOs() {
        return os;
    }

    public String getOsVersion() {
        return osVersion;
    }

    public String getDeviceType() {
        return deviceType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UserAgentInfo that = (UserAgentInfo) o;
        return Objects.equals(browser, that.browser) && Objects.equals(browserVersion, that.browserVersion)
                && Objects.equals(os, that.os) && Objects.equals(osVersion, that.osVersion)
                && Objects.equals(deviceType, that.deviceType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(browser, browserVersion, os, osVersion, deviceType);
    }

    @Override
    public String toString() {
        return browser + " " + browserVersion + " / " + os + " " + osVersion + " / " + deviceType;
    }
}
