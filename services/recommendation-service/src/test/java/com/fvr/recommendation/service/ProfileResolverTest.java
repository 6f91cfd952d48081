package com.fvr.recommendation.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fvr.recommendation.config.RecommendationProperties.Profile;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProfileResolverTest {

    @Test
    void guestProfileForUsersWithoutLikes() {
        Map<String, Profile> profiles = profiles("home", "upnext", "guest_home", "guest_upnext");

        assertThat(ProfileResolver.resolve(profiles, "home", "home", false).getName()).isEqualTo("guest_home");
        assertThat(ProfileResolver.resolve(profiles, "home", null, false).getName()).isEqualTo("guest_home");
        assertThat(ProfileResolver.resolve(profiles, "home", "upnext", false).getName()).isEqualTo("guest_upnext");
        assertThat(ProfileResolver.resolve(profiles, "home", "upnext", true).getName()).isEqualTo("upnext");
    }

    @Test
    void genericGuestProfileWhenModeSpecificOneIsMissing() {
        Map<String, Profile> profiles = profiles("home", "guest");

        assertThat(ProfileResolver.resolve(profiles, "home", "upnext", false).getName()).isEqualTo("guest");
    }

    @Test
    void fallsBackThroughDefaultAndHome() {
        Map<String, Profile> profiles = profiles("first", "home", "featured");

        assertThat(ProfileResolver.resolve(profiles, "featured", "unknown", true).getName()).isEqualTo("featured");
        assertThat(ProfileResolver.resolve(profiles, "missing", "unknown", true).getName()).isEqualTo("home");
        assertThat(ProfileResolver.resolve(profiles("first", "second"), null, "unknown", true).getName())
            .isEqualTo("first");
    }

    @Test
    void builtInDefaultWhenNothingConfigured() {
        ResolvedProfile resolved = ProfileResolver.resolve(Map.of(), "home", "home", false);

        assertThat(resolved.getName()).isEqualTo("default");
        assertThat(resolved.getProfile()).isNotNull();
        assertThat(resolved.getProfile().getMaxPerAuthor()).isZero();
    }

    private static Map<String, Profile> profiles(String... names) {
        Map<String, Profile> profiles = new LinkedHashMap<>();
        for (String name : names) {
            profiles.put(name, new Profile());
        }
        return profiles;
    }
}
