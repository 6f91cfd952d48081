package com.fvr.recommendation.service;

import com.fvr.recommendation.config.RecommendationProperties.Profile;

public class ResolvedProfile {
    private final String name;
    private final Profile profile;

    public ResolvedProfile(String name, Profile profile) {
        this.name = name;
        this.profile = profile;
    }

    public String getName() {
        return name;
    }

    public Profile getProfile() {
        return profile;
    }
}
