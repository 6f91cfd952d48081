package com.fvr.recommendation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "moderation")
public class ModerationProperties {
    private boolean instanceDenylistEnabled = true;
    private boolean channelBlocklistEnabled = true;

    public boolean isInstanceDenylistEnabled() {
        return instanceDenylistEnabled;
    }

    public void setInstanceDenylistEnabled(boolean instanceDenylistEnabled) {
        this.instanceDenylistEnabled = instanceDenylistEnabled;
    }

    public boolean isChannelBlocklistEnabled() {
        return channelBlocklistEnabled;
    }

    public void setChannelBlocklistEnabled(boolean channelBlocklistEnabled) {
        this.channelBlocklistEnabled = channelBlocklistEnabled;
    }
}
