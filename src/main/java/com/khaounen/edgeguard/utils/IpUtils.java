package com.khaounen.edgeguard.utils;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

public class IpUtils {

    public static final String UNKNOWN = "unknown";

    private static final String[] FORWARDED_HEADERS = {
            "X-Real-IP",
            "X-Forwarded-For",
            "CF-Connecting-IP",
            "True-Client-IP"
    };

    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$"
    );
    private static final Pattern IPV4_WITH_PORT = Pattern.compile("^(\\d{1,3}(\\.\\d{1,3}){3}):\\d{1,5}$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-f:.]+$");
    private static final Pattern HEX_GROUP = Pattern.compile("^[0-9a-f]{1,4}$");

    private IpUtils() {
    }

    public static String resolveIp(HttpServletRequest request, boolean trustForwardedHeaders) {
        if (trustForwardedHeaders) {
            for (String header : FORWARDED_HEADERS) {
                String value = request.getHeader(header);
                if (StringUtils.hasText(value)) {
                    return normalize(value.split(",")[0]);
                }
            }
        }
        return normalize(request.getRemoteAddr());
    }

    public static String normalize(String address) {
        if (!StringUtils.hasText(address)) {
            return UNKNOWN;
        }
        String value = address.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            value = close > 0 ? value.substring(1, close) : value.substring(1);
        }
        var withPort = IPV4_WITH_PORT.matcher(value);
        if (withPort.matches()) {
            value = withPort.group(1);
        }
        int zone = value.indexOf('%');
        if (zone >= 0) {
            value = value.substring(0, zone);
        }
        if (value.startsWith("::ffff:") && IPV4.matcher(value.substring(7)).matches()) {
            value = value.substring(7);
        }
        return value;
    }

    public static boolean isIpLiteral(String address) {
        if (address == null || address.isEmpty()) {
            return false;
        }
        return IPV4.matcher(address).matches() || isIpv6Literal(address.toLowerCase(Locale.ROOT));
    }

    private static boolean isIpv6Literal(String value) {
        if (!IPV6_CHARS.matcher(value).matches() || value.indexOf(':') < 0) {
            return false;
        }
        int gap = value.indexOf("::");
        if (gap >= 0 && value.indexOf("::", gap + 1) >= 0) {
            return false;
        }
        String head = gap >= 0 ? value.substring(0, gap) : value;
        String tail = gap >= 0 ? value.substring(gap + 2) : "";
        int headGroups = countGroups(head, tail.isEmpty());
        int tailGroups = countGroups(tail, true);
        if (headGroups < 0 || tailGroups < 0) {
            return false;
        }
        int groups = headGroups + tailGroups;
        return gap >= 0 ? groups <= 7 : groups == 8;
    }

    // -1 when malformed; an embedded IPv4 tail counts as two groups
    private static int countGroups(String part, boolean mayEndWithIpv4) {
        if (part.isEmpty()) {
            return 0;
        }
        String[] groups = part.split(":", -1);
        int count = 0;
        for (int i = 0; i < groups.length; i++) {
            String group = groups[i];
            if (i == groups.length - 1 && mayEndWithIpv4 && group.indexOf('.') >= 0) {
                if (!IPV4.matcher(group).matches()) {
                    return -1;
                }
                count += 2;
            } else if (HEX_GROUP.matcher(group).matches()) {
                count++;
            } else {
                return -1;
            }
        }
        return count;
    }
}
