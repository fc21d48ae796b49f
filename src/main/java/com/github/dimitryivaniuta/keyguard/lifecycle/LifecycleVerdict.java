package com.github.dimitryivaniuta.keyguard.lifecycle;

import java.util.Objects;

public record LifecycleVerdict(boolean allowed, LifecycleDenial denial) {

    private static final LifecycleVerdict ALLOWED = new LifecycleVerdict(true, null);

    public static LifecycleVerdict allow() {
        return ALLOWED;
    }

    public static LifecycleVerdict denied(LifecycleDenial denial) {
        return new LifecycleVerdict(false, Objects.requireNonNull(denial, "denial must not be null"));
    }
}
