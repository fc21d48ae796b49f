package com.github.dimitryivaniuta.keyguard.lifecycle;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.web.util.matcher.IpAddressMatcher;

import java.util.Collection;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Matches client addresses against allow-list entries (single IPv4/IPv6 addresses or CIDR blocks).
 *
 * <p>Parsed matchers are cached per entry. Malformed entries never match.
 */
@Slf4j
public class IpAllowListMatcher {

    /** Address literals only; anything else would make the JDK attempt a DNS lookup. */
    private static final Pattern ADDRESS_LITERAL = Pattern.compile("[0-9A-Fa-f:.]+");
    private static final Pattern ENTRY_LITERAL = Pattern.compile("[0-9A-Fa-f:.]+(/\\d{1,3})?");

    private final Cache<String, Optional<IpAddressMatcher>> matchers = Caffeine.newBuilder()
            .maximumSize(10_000)
            .build();

    public boolean isAllowed(Collection<String> allowList, String clientIp) {
        if (allowList == null || allowList.isEmpty()) {
            return true;
        }
        if (clientIp == null || clientIp.isBlank()) {
            return false;
        }
        String ip = clientIp.trim();
        for (String entry : allowList) {
            Optional<IpAddressMatcher> matcher = matcher(entry);
            if (matcher.isPresent() && matches(matcher.get(), ip)) {
                return true;
            }
        }
        return false;
    }

    public boolean isValidEntry(String entry) {
        return entry != null && matcher(entry).isPresent();
    }

    private Optional<IpAddressMatcher> matcher(String entry) {
        return matchers.get(entry.trim(), IpAllowListMatcher::parse);
    }

    private static Optional<IpAddressMatcher> parse(String entry) {
        if (!ENTRY_LITERAL.matcher(entry).matches()) {
            log.warn("Ignoring IP allow-list entry '{}': not an address or CIDR block", entry);
            return Optional.empty();
        }
        try {
            return Optional.of(new IpAddressMatcher(entry));
        } catch (IllegalArgumentException ex) {
            log.warn("Ignoring malformed IP allow-list entry '{}': {}", entry, ex.getMessage());
            return Optional.empty();
        }
    }

    private static boolean matches(IpAddressMatcher matcher, String ip) {
        if (!ADDRESS_LITERAL.matcher(ip).matches()) {
            return false;
        }
        try {
            return matcher.matches(ip);
        } catch (IllegalArgumentException ex) {
            // unparseable client address
            return false;
        }
    }
}
