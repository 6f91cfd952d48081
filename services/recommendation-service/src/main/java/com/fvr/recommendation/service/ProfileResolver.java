package com.fvr.recommendation.service;

import com.fvr.recommendation.config.RecommendationProperties.Profile;
import java.util.Map;

/**
 * Picks the profile for a request. Users without likes get a guest profile when
 * one is configured; otherwise the requested mode, the configured default,
 * {@code home}, and finally the first configured profile are tried in order.
 */
public final class ProfileResolver {
    static final String DEFAULT_NAME = "default";

    private ProfileResolver() {
    }

    public static ResolvedProfile resolve(
        Map<String, Profile> profiles,
        String defaultProfile,
        String mode,
        boolean hasLikes
    ) {
        if (profiles == null || profiles.isEmpty()) {
            return new ResolvedProfile(DEFAULT_NAME, new Profile());
        }
        if (!hasLikes) {
            String guest = null;
            if ("upnext".equals(mode) && profiles.containsKey("guest_upnext")) {
                guest = "guest_upnext";
            } else if ((mode == null || "home".equals(mode)) && profiles.containsKey("guest_home")) {
                guest = "guest_home";
            } else if (profiles.containsKey("guest")) {
                guest = "guest";
            }
            if (guest != null) {
                return new ResolvedProfile(guest, profiles.get(guest));
            }
        }
        if (mode != null && profiles.containsKey(mode)) {
            return new ResolvedProfile(mode, profiles.get(mode));
        }
        if (defaultProfile != null && profiles.containsKey(defaultProfile)) {
            return new ResolvedProfile(defaultProfile, profiles.get(defaultProfile));
        }
        if (profiles.containsKey("home")) {
            return new ResolvedProfile("home", profiles.get("home"));
        }
        Map.Entry<String, Profile> first = profiles.entrySet().iterator().next();
        return new ResolvedProfile(first.getKey(), first.getValue());
    }
}
