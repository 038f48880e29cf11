package com.assetsync.reconciler.model.domain;

import java.util.Optional;

/**
 * Identity key plus the static override that produced it, if any.
 */
public record ResolvedIdentity(IdentityKey key, StaticOverride staticOverride) {

    public boolean isStaticOverride() {
        return staticOverride != null;
    }

    public Optional<StaticOverride> override() {
        return Optional.ofNullable(staticOverride);
    }
}
