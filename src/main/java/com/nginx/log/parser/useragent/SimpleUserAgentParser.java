package com.nginx.log.parser.useragent;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.nginx.log.parser.UserAgentParser;
import com.nginx.log.parser.model.UserAgentInfo;

/**
 * Regex based user agent classifier. Pattern lists are ordered: the first match wins,
 * so more specific browsers and operating systems come before the generic ones they
 * embed (Edge before Chrome, Chrome before Safari, iOS before macOS, Android before Linux).
 */
public class SimpleUserAgentParser implements UserAgentParser {

    public static final String DEVICE_DESKTOP = "Desktop";
    public static final String DEVICE_MOBILE = "Mobile";
    public static final String DEVICE_TABLET = "Tablet";
    public static final String DEVICE_IPHONE = "iPhone";
    public static final String DEVICE_IPAD = "iPad";
    public static final String DEVICE_IPOD = "iPod";
    public static final String DEVICE_BOT = "Bot";
    public static final String DEVICE_TV = "TV";
    public static final String DEVICE_GAME_CONSOLE = "Game Console";
    public static final String DEVICE_SMART_SPEAKER = "Smart Speaker";
    public static final String DEVICE_WEARABLE = "Wearable";

    private static final Pattern BOT = Pattern.compile(
            "bot|crawler|spider|crawl|slurp|sohu-search|lycos|robozilla|facebookexternalhit|whatsapp|pinterest|bytespider|scraper|headlesschrome",
            Pattern.CASE_INSENSITIVE);

    private static final List<NamedPattern> BROWSERS = List.of(
            new NamedPattern("Bot", BOT, null),
            browser("WeChat", "micromessenger", "micromessenger/(\\d+)\\.(\\d+)"),
            browser("QQ", "\\bqq/\\d", "\\bqq/(\\d+)\\.(\\d+)"),
            browser("DingTalk", "dingtalk", "dingtalk/(\\d+)\\.(\\d+)"),
            browser("Alipay", "alipayclient", "alipayclient/(\\d+)\\.(\\d+)"),
            browser("TikTok", "musical_ly|musically_|trill_", "(?:musical_ly|musically|trill)_(\\d+)\\.(\\d+)"),
            browser("360 Browser", "360se|qihoobrowser|qhbrowser", "(?:360se|qihoobrowser|qhbrowser)/(\\d+)\\.(\\d+)"),
            browser("QQ Browser", "qqbrowser", "qqbrowser/(\\d+)\\.(\\d+)"),
            browser("UC Browser", "ucbrowser|ucweb", "ucbrowser/(\\d+)\\.(\\d+)"),
            browser("Sogou Explorer", "metasr|\\bse \\d", "(?:metasr|se) (\\d+)\\.(\\d+)"),
            browser("Baidu Browser", "baidubrowser|bidubrowser", "(?:baidubrowser|bidubrowser)/(\\d+)\\.(\\d+)"),
            browser("Maxthon", "maxthon", "maxthon/(\\d+)\\.(\\d+)"),
            browser("Samsung Browser", "samsungbrowser", "samsungbrowser/(\\d+)\\.(\\d+)"),
            browser("Huawei Browser", "huaweibrowser", "huaweibrowser/(\\d+)\\.(\\d+)"),
            browser("Xiaomi Browser", "miuibrowser|xiaomi/miuibrowser", "miuibrowser/(\\d+)\\.(\\d+)"),
            browser("Oppo Browser", "oppobrowser|heytapbrowser", "(?:oppobrowser|heytapbrowser)/(\\d+)\\.(\\d+)"),
            browser("Vivo Browser", "vivobrowser", "vivobrowser/(\\d+)\\.(\\d+)"),
            browser("Yandex", "yabrowser", "yabrowser/(\\d+)\\.(\\d+)"),
            browser("Brave", "brave", "brave/(\\d+)\\.(\\d+)"),
            browser("Vivaldi", "vivaldi", "vivaldi/(\\d+)\\.(\\d+)"),
            browser("Edge", "edg/|edge/|edga/|edgios/", "edg(?:e|a|ios)?/(\\d+)\\.(\\d+)"),
            browser("Internet Explorer", "msie |trident/.*rv:", "(?:msie |rv:)(\\d+)\\.(\\d+)"),
            browser("Opera", "opr/|opera/|opera mini", "(?:opr|opera)/(\\d+)\\.(\\d+)"),
            browser("Chrome", "chrome/|crios/", "(?:chrome|crios)/(\\d+)\\.(\\d+)"),
            browser("Firefox", "firefox/|fxios/", "(?:firefox|fxios)/(\\d+)\\.(\\d+)"),
            browser("Safari", "safari/", "version/(\\d+)\\.(\\d+)"),
            browser("NetFront", "netfront", "netfront/(\\d+)\\.(\\d+)"),
            browser("Konqueror", "konqueror", "konqueror/(\\d+)\\.(\\d+)"));

    private static final List<NamedPattern> OPERATING_SYSTEMS = List.of(
            os("iOS", "iphone|ipad|ipod", "os (\\d+)[_.](\\d+)"),
            os("Android", "android", "android (\\d+)(?:\\.(\\d+))?"),
            os("Windows Phone", "windows phone", "windows phone(?: os)? (\\d+)\\.(\\d+)"),
            os("Windows", "windows", "windows nt (\\d+)\\.(\\d+)"),
            os("Chrome OS", "\\bcros\\b", "cros \\S+ (\\d+)\\.(\\d+)"),
            os("macOS", "mac os x|macintosh", "mac os x (\\d+)[_.](\\d+)"),
            os("Ubuntu", "ubuntu", "ubuntu[/ ](\\d+)\\.(\\d+)"),
            os("CentOS", "centos", "centos[/ ](\\d+)(?:\\.(\\d+))?"),
            os("Red Hat", "red ?hat|rhel", "(?:red ?hat|rhel)[/ ](\\d+)(?:\\.(\\d+))?"),
            os("Debian", "debian", "debian[/ ](\\d+)(?:\\.(\\d+))?"),
            os("Fedora", "fedora", "fedora[/ ](\\d+)(?:\\.(\\d+))?"),
            os("SUSE", "suse", "suse[/ ](\\d+)(?:\\.(\\d+))?"),
            os("FreeBSD", "freebsd", "freebsd (\\d+)(?:\\.(\\d+))?"),
            os("OpenBSD", "openbsd", "openbsd (\\d+)(?:\\.(\\d+))?"),
            os("NetBSD", "netbsd", "netbsd (\\d+)(?:\\.(\\d+))?"),
            os("Linux", "linux|x11", null),
            os("BlackBerry", "blackberry|bb10", "(?:blackberry\\w*|bb10)[/ ](\\d+)\\.(\\d+)"),
            os("Symbian", "symbian|series60|s60", "symbianos/(\\d+)\\.(\\d+)"));

    private static final Map<String, String> WINDOWS_NAMES = Map.of(
            "10.0", "Windows 10",
            "6.3", "Windows 8.1",
            "6.2", "Windows 8",
            "6.1", "Windows 7",
            "6.0", "Windows Vista",
            "5.2", "Windows XP",
            "5.1", "Windows XP");

    private static final Pattern MOBILE = Pattern.compile(
            "\\bmobile\\b|mobi|windows phone|iemobile|blackberry|bb10|symbian|opera mini|palm|webos.*mobile|phone",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLET = Pattern.compile("tablet|kindle|silk/|playbook|nexus (7|9|10)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TV = Pattern.compile(
            "smart-?tv|hbbtv|netcast|roku|apple ?tv|googletv|android tv|\\bcrkey\\b|bravia|aft[a-z]\\b|tizen.*tv|web0s.*tv",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern GAME_CONSOLE = Pattern.compile("playstation|xbox|nintendo",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SMART_SPEAKER = Pattern.compile("alexa|echo dot|aeo[a-z]{2}|googlehome|google home|homepod",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WEARABLE = Pattern.compile("watch os|watchos|wearable|fitbit|wear os|galaxy watch",
            Pattern.CASE_INSENSITIVE);

    @Override
    public UserAgentInfo parse(String userAgent) {
        if (userAgent == null) {
            return UserAgentInfo.EMPTY;
        }
        String ua = userAgent.trim();
        if (ua.isEmpty() || "-".equals(ua)) {
            return UserAgentInfo.EMPTY;
        }

        String browser = "";
        String browserVersion = "";
        for (NamedPattern candidate : BROWSERS) {
            if (candidate.pattern.matcher(ua).find()) {
                browser = candidate.name;
                browserVersion = candidate.version(ua);
                break;
            }
        }

        String os = "";
        String osVersion = "";
        for (NamedPattern candidate : OPERATING_SYSTEMS) {
            if (candidate.pattern.matcher(ua).find()) {
                os = candidate.name;
                osVersion = candidate.version(ua);
                break;
            }
        }
        if ("Windows".equals(os)) {
            os = WINDOWS_NAMES.getOrDefault(osVersion, "Windows");
        }

        return new UserAgentInfo(browser, browserVersion, os, osVersion, classifyDevice(ua));
    }

    /**
     * Device priority: bot, Apple handhelds, Android phone, Android tablet,
     * other classes, desktop.
     */
    String classifyDevice(String ua) {
        String lower = ua.toLowerCase(Locale.ROOT);
        if (BOT.matcher(ua).find()) {
            return DEVICE_BOT;
        }
        if (lower.contains("iphone")) {
            return DEVICE_IPHONE;
        }
        if (lower.contains("ipad")) {
            return DEVICE_IPAD;
        }
        if (lower.contains("ipod")) {
            return DEVICE_IPOD;
        }
        boolean android = lower.contains("android");
        boolean tv = TV.matcher(ua).find();
        if (android && lower.contains("mobile")) {
            return DEVICE_MOBILE;
        }
        if (android && !tv) {
            return DEVICE_TABLET;
        }
        if (!tv && TABLET.matcher(ua).find()) {
            return DEVICE_TABLET;
        }
        if (!tv && MOBILE.matcher(ua).find()) {
            return DEVICE_MOBILE;
        }
        if (tv) {
            return DEVICE_TV;
        }
        if (GAME_CONSOLE.matcher(ua).find()) {
            return DEVICE_GAME_CONSOLE;
        }
        if (SMART_SPEAKER.matcher(ua).find()) {
            return DEVICE_SMART_SPEAKER;
        }
        if (WEARABLE.matcher(ua).find()) {
            return DEVICE_WEARABLE;
        }
        return DEVICE_DESKTOP;
    }

    private static NamedPattern browser(String name, String pattern, String version) {
        return new NamedPattern(name, Pattern.compile(pattern, Pattern.CASE_INSENSITIVE),
                version == null ? null : Pattern.compile(version, Pattern.CASE_INSENSITIVE));
    }

    private static NamedPattern os(String name, String pattern, String version) {
        return browser(name, pattern, version);
    }

    private static class NamedPattern {
        private final String name;
        private final Pattern pattern;
        private final Pattern versionPattern;

        NamedPattern(String name, Pattern pattern, Pattern versionPattern) {
            this.name = name;
            this.pattern = pattern;
            this.versionPattern = versionPattern;
        }

        /**
         * major.minor from the first two groups, or major alone.
         */
        String version(String ua) {
            if (versionPattern == null) {
                return "";
            }
            Matcher m = versionPattern.matcher(ua);
            if (!m.find()) {
                return "";
            }
            String major = m.group(1);
            String minor = m.groupCount() >= 2 ? m.group(2) : null;
            return minor == null ? major : major + "." + minor;
        }
    }
}
