package com.github.dimitryivaniuta.keyguard.web;

import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;
import com.github.dimitryivaniuta.keyguard.key.KeyStatus;
import com.github.dimitryivaniuta.keyguard.lifecycle.IssueKeyCommand;
import com.github.dimitryivaniuta.keyguard.lifecycle.IssuedKey;
import com.github.dimitryivaniuta.keyguard.lifecycle.KeyLifecycleReport;
import com.github.dimitryivaniuta.keyguard.lifecycle.KeyLifecycleService;
import com.github.dimitryivaniuta.keyguard.lifecycle.RotationResult;
import com.github.dimitryivaniuta.keyguard.lifecycle.RotationTrigger;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/keys")
public class ApiKeyAdminController {

    private final KeyLifecycleService keys;

    // ---------- DTOs ----------
    public record IssueKeyRequest(
            @NotBlank @Size(max = 255) String name,
            @NotBlank @Size(max = 255) String ownerId,
            Set<@NotBlank String> scopes,
            @Positive Integer rateLimitOverride,
            @Positive @Max(3650) Integer validityDays,
            Set<@NotBlank String> ipAllowList
    ) {}

    public record IssuedKeyResponse(
            KeyResponse key,
            String secret,  // returned ONCE
            String apiKey   // "keyId.secret", the X-API-Key value
    ) {}

    public record RotateKeyRequest(
            RotationTrigger trigger,
            @PositiveOrZero Integer gracePeriodDays
    ) {}

    public record RotateKeyResponse(
            KeyResponse key,
            String secret,
            String apiKey,
            String oldKeyId,
            Instant oldValidUntil,
            RotationTrigger trigger
    ) {}

    public record ExtendExpirationRequest(
            @Positive int additionalDays
    ) {}

    public record KeyResponse(
            String keyId,
            String name,
            String ownerId,
            KeyStatus status,
            Set<String> scopes,
            Integer rateLimitOverride,
            Set<String> ipAllowList,
            Instant createdAt,
            Instant expiresAt,
            Instant lastUsedAt,
            String replacedBy,
            String replaces
    ) {
        static KeyResponse from(ApiKeyRecord r) {
            return new KeyResponse(r.getKeyId(), r.getName(), r.getOwnerId(), r.getStatus(), r.getScopes(),
                    r.getRateLimitOverride(), r.getIpAllowList(), r.getCreatedAt(), r.getExpiresAt(),
                    r.getLastUsedAt(), r.getReplacedBy(), r.getReplaces());
        }
    }

    // ---------- endpoints ----------

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public IssuedKeyResponse issue(@Valid @RequestBody IssueKeyRequest req) {
        IssuedKey issued = keys.issue(new IssueKeyCommand(
                req.name(),
                req.ownerId(),
                req.scopes(),
                req.rateLimitOverride(),
                req.validityDays() == null ? null : Duration.ofDays(req.validityDays()),
                req.ipAllowList()));
        return new IssuedKeyResponse(KeyResponse.from(issued.record()), issued.secret(), issued.credential());
    }

    @GetMapping
    public List<KeyResponse> list() {
        return keys.list().stream().map(KeyResponse::from).toList();
    }

    @GetMapping("/{keyId}")
    public KeyLifecycleReport status(@PathVariable String keyId) {
        return keys.report(keyId);
    }

    @PostMapping("/{keyId}/rotate")
    public RotateKeyResponse rotate(@PathVariable String keyId,
                                    @Valid @RequestBody(required = false) RotateKeyRequest req) {
        RotationTrigger trigger = (req == null || req.trigger() == null) ? RotationTrigger.MANUAL : req.trigger();
        Duration grace = (req == null || req.gracePeriodDays() == null) ? null : Duration.ofDays(req.gracePeriodDays());
        RotationResult r = keys.rotate(keyId, trigger, grace);
        return new RotateKeyResponse(
                KeyResponse.from(r.newRecord()),
                r.newSecret(),
                r.newRecord().getKeyId() + "." + r.newSecret(),
                r.oldKeyId(),
                r.oldValidUntil(),
                r.trigger());
    }

    @PostMapping("/{keyId}/revoke")
    public KeyResponse revoke(@PathVariable String keyId) {
        return KeyResponse.from(keys.revoke(keyId));
    }

    @PostMapping("/{keyId}/enable")
    public KeyResponse enable(@PathVariable String keyId) {
        return KeyResponse.from(keys.setEnabled(keyId, true));
    }

    @PostMapping("/{keyId}/disable")
    public KeyResponse disable(@PathVariable String keyId) {
        return KeyResponse.from(keys.setEnabled(keyId, false));
    }

    @PostMapping("/{keyId}/extend")
    public KeyResponse extend(@PathVariable String keyId, @Valid @RequestBody ExtendExpirationRequest req) {
        return KeyResponse.from(keys.extendExpiration(keyId, req.additionalDays()));
    }
}
