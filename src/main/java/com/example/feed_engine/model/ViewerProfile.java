package com.example.feed_engine.model;

import java.util.Set;

/**
 * Per-viewer capabilities and preferences applied to a ranking pass.
 *
 * @param id                      viewer profile id, may be {@code null} for anonymous viewers.
 * @param sensitiveContentAllowed whether sensitive clips may be shown.
 * @param city                    viewer city, may be {@code null}.
 * @param blockedCreatorIds       creators the viewer blocked.
 */
public record ViewerProfile(String id,
                            boolean sensitiveContentAllowed,
                            String city,
                            Set<String> blockedCreatorIds) {
    public ViewerProfile {
        blockedCreatorIds = blockedCreatorIds == null ? Set.of() : Set.copyOf(blockedCreatorIds);
    }

    public static ViewerProfile anonymous() {
        return new ViewerProfile(null, false, null, Set.of());
    }

    public boolean hasCity() {
        return city != null && !city.isBlank();
    }
}
