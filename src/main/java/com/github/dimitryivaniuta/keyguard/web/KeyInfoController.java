package com.github.dimitryivaniuta.keyguard.web;

import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Set;

/**
 * Lets a client inspect the key it is calling with. Sits behind {@link ApiKeyDecisionFilter}.
 */
@RestController
@RequestMapping("/api/key")
public class KeyInfoController {

    public record KeyInfoResponse(String keyId, String name, Set<String> scopes, Instant expiresAt, String replacedBy) {}

    @GetMapping
    public KeyInfoResponse current(
            @RequestAttribute(name = RequestContextKeys.API_KEY_RECORD_ATTRIBUTE, required = false) ApiKeyRecord key) {
        if (key == null) {
            // fail-open pass-through without a loaded record
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "key details unavailable");
        }
        return new KeyInfoResponse(key.getKeyId(), key.getName(), key.getScopes(), key.getExpiresAt(),
                key.getReplacedBy());
    }
}
