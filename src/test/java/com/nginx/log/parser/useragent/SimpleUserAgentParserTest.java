package com.nginx.log.parser.useragent;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.nginx.log.parser.model.UserAgentInfo;

public class SimpleUserAgentParserTest {

    private final SimpleUserAgentParser parser = new SimpleUserAgentParser();

    @Test
    public void testChromeOnWindows() {
        UserAgentInfo info = parser.parse("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36");
        assertEquals("Chrome", info.getBrowser());
        assertEquals("120.0", info.getBrowserVersion());
        assertEquals("Windows 10", info.getOs());
        assertEquals("10.0", info.getOsVersion());
        assertEquals("Desktop", info.getDeviceType());
    }

    @Test
    public void testEdgeIsNotReportedAsChrome() {
        UserAgentInfo info = parser.parse("Mozilla/5.0 (Windows NT 6.1; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36 Edg/120.0.2210.91");
        assertEquals("Edge", info.getBrowser());
        assertEquals("120.0", info.getBrowserVersion());
        assertEquals("Windows 7", info.getOs());
    }

    @Test
    public void testSafariOnIphone() {
        UserAgentInfo info = parser.parse("Mozilla/5.0 (iPhone; CPU iPhone OS 14_6 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/14.1.1 Mobile/15E148 Safari/604.1");
        assertEquals("Safari", info.getBrowser());
        assertEquals("14.1", info.getBrowserVersion());
        assertEquals("iOS", info.getOs());
        assertEquals("14.6", info.getOsVersion());
        assertEquals("iPhone", info.getDeviceType());
    }

    @Test
    public void testIpad() {
        UserAgentInfo info = parser.parse("Mozilla/5.0 (iPad; CPU OS 13_2 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/13.0.3 Mobile/15E148 Safari/604.1");
        assertEquals("iOS", info.getOs());
        assertEquals("iPad", info.getDeviceType());
    }

    @Test
    public void testAndroidPhoneAndTablet() {
        UserAgentInfo phone = parser.parse("Mozilla/5.0 (Linux; Android 10; SM-G973F) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/83.0.4103.106 Mobile Safari/537.36");
        assertEquals("Android", phone.getOs());
        assertEquals("10", phone.getOsVersion());
        assertEquals("Mobile", phone.getDeviceType());

        UserAgentInfo tablet = parser.parse("Mozilla/5.0 (Linux; Android 9; SM-T720) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/83.0.4103.106 Safari/537.36");
        assertEquals("Android", tablet.getOs());
        assertEquals("Tablet", tablet.getDeviceType());
    }

    @Test
    public void testFirefoxOnMac() {
        UserAgentInfo info = parser.parse("Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:109.0) Gecko/20100101 Firefox/115.0");
        assertEquals("Firefox", info.getBrowser());
        assertEquals("115.0", info.getBrowserVersion());
        assertEquals("macOS", info.getOs());
        assertEquals("10.15", info.getOsVersion());
        assertEquals("Desktop", info.getDeviceType());
    }

    @Test
    public void testLinuxDesktop() {
        UserAgentInfo info = parser.parse("Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0.0.0 Safari/537.36");
        assertEquals("Linux", info.getOs());
        assertEquals("Desktop", info.getDeviceType());
    }

    @Test
    public void testBot() {
        UserAgentInfo info = parser.parse("Mozilla/5.0 (compatible; Googlebot/2.1; +http://www.google.com/bot.html)");
        assertEquals("Bot", info.getBrowser());
        assertEquals("Bot", info.getDeviceType());
    }

    @Test
    public void testWeChat() {
        UserAgentInfo info = parser.parse("Mozilla/5.0 (iPhone; CPU iPhone OS 16_0 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Mobile/15E148 MicroMessenger/8.0.40(0x18002831) NetType/WIFI Language/zh_CN");
        assertEquals("WeChat", info.getBrowser());
        assertEquals("8.0", info.getBrowserVersion());
        assertEquals("iPhone", info.getDeviceType());
    }

    @Test
    public void testOtherDeviceClasses() {
        assertEquals("Game Console", parser.parse("Mozilla/5.0 (PlayStation 5 3.11) AppleWebKit/605.1.15 (KHTML, like Gecko)").getDeviceType());
        assertEquals("TV", parser.parse("Mozilla/5.0 (SMART-TV; Linux; Tizen 6.0) AppleWebKit/538.1 (KHTML, like Gecko) Version/6.0 TV Safari/538.1").getDeviceType());
        assertEquals("Smart Speaker", parser.parse("Alexa/2.2 (Echo Dot)").getDeviceType());
        assertEquals("Wearable", parser.parse("Fitbit/1.0").getDeviceType());
    }

    @Test
    public void testBlankAgentLeavesFieldsEmpty() {
        assertEquals(UserAgentInfo.EMPTY, parser.parse(""));
        assertEquals(UserAgentInfo.EMPTY, parser.parse("-"));
        assertEquals(UserAgentInfo.EMPTY, parser.parse(null));
    }

    @Test
    public void testUnrecognisedAgentIsNotFabricated() {
        UserAgentInfo info = parser.parse("curl/8.4.0");
        assertEquals("", info.getBrowser());
        assertEquals("", info.getOs());
        assertEquals("Desktop", info.getDeviceType());
    }
}
