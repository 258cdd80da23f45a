package com.delta.adsync.sync.util;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for ad-platform CDN URLs: dimension hints, low-resolution detection and token
 * redaction for logs.
 */
public final class MediaUrls {
    private static final Pattern SIZE_SEGMENT = Pattern.compile("(?:^|[/_\\-.])[ps](\\d{2,5})x(\\d{2,5})(?=$|[/_\\-.&])");
    private static final Pattern LOW_RES_SEGMENT = Pattern.compile("p(64|128)x\\1");
    private static final Pattern ACCESS_TOKEN = Pattern.compile("(access_token=)[^&\\s\"]+");
    private static final String UPGRADED_SEGMENT = "p720x720";

    private MediaUrls() {
    }

    public record Dimensions(Integer width, Integer height) {
        static final Dimensions NONE = new Dimensions(null, null);

        public boolean known() {
            return width != null && height != null && width > 0 && height > 0;
        }
    }

    /**
     * Reads width/height hints from the query ({@code w}/{@code h}, {@code width}/{@code height},
     * or an {@code stp} transform such as {@code dst-jpg_s1080x1080}) and then from size segments
     * in the path ({@code /p720x720/}, {@code /s1280x720/}).
     */
    public static Dimensions dimensionsFromUrl(String url) {
        if (url == null || url.isBlank()) {
            return Dimensions.NONE;
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return Dimensions.NONE;
        }
        Map<String, String> query = parseQuery(uri.getRawQuery());
        Integer width = parsePositive(firstNonNull(query.get("w"), query.get("width")));
        Integer height = parsePositive(firstNonNull(query.get("h"), query.get("height")));
        if (width != null && height != null) {
            return new Dimensions(width, height);
        }
        Dimensions fromStp = fromSegment(query.get("stp"));
        if (fromStp.known()) {
            return fromStp;
        }
        return fromSegment(uri.getPath());
    }

    /** True when the URL path (not the query) carries a 64 or 128 pixel size segment. */
    public static boolean isLowQualityUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        String path;
        try {
            path = URI.create(url.trim()).getPath();
        } catch (IllegalArgumentException e) {
            int queryStart = url.indexOf('?');
            path = queryStart >= 0 ? url.substring(0, queryStart) : url;
        }
        return path != null && LOW_RES_SEGMENT.matcher(path).find();
    }

    public static String upgradeResolution(String url) {
        if (!isLowQualityUrl(url)) {
            return url;
        }
        return LOW_RES_SEGMENT.matcher(url).replaceAll(UPGRADED_SEGMENT);
    }

    public static String redactToken(String url) {
        if (url == null) {
            return null;
        }
        return ACCESS_TOKEN.matcher(url).replaceAll("$1***");
    }

    private static Dimensions fromSegment(String value) {
        if (value == null || value.isBlank()) {
            return Dimensions.NONE;
        }
        Matcher matcher = SIZE_SEGMENT.matcher(value.toLowerCase(Locale.ROOT));
        Dimensions best = Dimensions.NONE;
        while (matcher.find()) {
            Integer width = parsePositive(matcher.group(1));
            Integer height = parsePositive(matcher.group(2));
            if (width != null && height != null) {
                best = new Dimensions(width, height);
            }
        }
        return best;
    }

    private static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> out = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isBlank()) {
            return out;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
            String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            out.putIfAbsent(key, value);
        }
        return out;
    }

    private static Integer parsePositive(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
