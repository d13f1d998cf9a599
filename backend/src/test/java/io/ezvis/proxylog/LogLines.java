package io.ezvis.proxylog;

/**
 * Access-log lines for tests.
 */
public final class LogLines {

    public static final String EXAMPLE = "10.50.3.252 - sCyGAlJG8RoCLDry3ziUL4lk7NXPtMH [15/Feb/2026:00:00:04 +0000] "
            + "\"GET https://www.jstor.org:443/stable/12345 HTTP/1.1\" 200 251752 \"US\" \"Mozilla/5.0 ...\"";

    public static final String FIREFOX = "Mozilla/5.0 (X11; Linux x86_64; rv:120.0) Gecko/20100101 Firefox/120.0";

    private LogLines() {
    }

    public static String line(String timestamp, String url, int status) {
        return line(timestamp, url, status, "100", "US", FIREFOX);
    }

    public static String line(String timestamp, String url, int status, String bytes, String country, String userAgent) {
        return "10.0.0.1 - session-1 [" + timestamp + "] \"GET " + url + " HTTP/1.1\" "
                + status + " " + bytes + " \"" + country + "\" \"" + userAgent + "\"";
    }
}
