package com.github.dimitryivaniuta.keyguard.lifecycle;

import java.time.Duration;
import java.util.Set;

/**
 * @param validity lifetime from now; {@code null} for a key that never expires
 */
public record IssueKeyCommand(
        String name,
        String ownerId,
        Set<String> scopes,
        Integer rateLimitOverride,
        Duration validity,
        Set<String> ipAllowList
) {

    public IssueKeyCommand {
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        ipAllowList = ipAllowList == null ? Set.of() : Set.copyOf(ipAllowList);
    }
}
