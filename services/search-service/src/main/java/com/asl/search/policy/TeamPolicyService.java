package com.asl.search.policy;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Team flags and the domain blocklist, both read from {@code search.policy}.
 */
@Component
public class TeamPolicyService implements UrlBlocklist {
    private static final Logger log = LoggerFactory.getLogger(TeamPolicyService.class);

    private static final Pattern AUTHORITY = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://([^/?#\\\\\\s]*)");
    private static final Pattern HOST = Pattern.compile("[a-z0-9_.:-]+");

    private final BlocklistProperties properties;

    public TeamPolicyService(BlocklistProperties properties) {
        this.properties = properties;
    }

    public TeamFlags flagsFor(String teamId) {
        if (teamId == null) {
            return TeamFlags.none();
        }
        TeamFlags flags = properties.getTeams().get(teamId);
        return flags == null ? TeamFlags.none() : flags;
    }

    /**
     * A URL whose host cannot be read is treated as blocked: it can be neither checked nor fetched.
     */
    @Override
    public boolean isBlocked(String url, TeamFlags flags) {
        String host = hostOf(url);
        if (host == null) {
            log.info("blocking url without readable host url={}", url);
            return true;
        }
        if (flags != null && matchesAny(host, flags.getUnblockedDomains())) {
            return false;
        }
        return matchesAny(host, properties.getBlockedDomains());
    }

    static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim();
        String host = null;
        try {
            host = new URI(trimmed).getHost();
        } catch (URISyntaxException e) {
            log.debug("url not RFC 3986 compliant, reading host leniently url={}", url);
        }
        if (host == null) {
            host = lenientHost(trimmed);
        }
        if (host == null) {
            return null;
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        host = host.startsWith("www.") ? host.substring(4) : host;
        return HOST.matcher(host).matches() ? host : null;
    }

    // scheme://[userinfo@]host[:port] without any escaping rules
    private static String lenientHost(String url) {
        Matcher matcher = AUTHORITY.matcher(url);
        if (!matcher.find()) {
            return null;
        }
        String authority = matcher.group(1);
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            return close > 0 ? authority.substring(1, close) : null;
        }
        int colon = authority.indexOf(':');
        return colon >= 0 ? authority.substring(0, colon) : authority;
    }

    private static boolean matchesAny(String host, List<String> domains) {
        if (domains == null) {
            return false;
        }
        for (String domain : domains) {
            if (domain == null || domain.isBlank()) {
                continue;
            }
            String normalized = domain.trim().toLowerCase(Locale.ROOT);
            if (host.equals(normalized) || host.endsWith("." + normalized)) {
                return true;
            }
        }
        return false;
    }
}
