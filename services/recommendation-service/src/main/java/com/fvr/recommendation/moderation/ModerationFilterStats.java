package com.fvr.recommendation.moderation;

public class ModerationFilterStats {
    private final int filteredByDenylist;
    private final int filteredByBlockedChannel;

    public ModerationFilterStats(int filteredByDenylist, int filteredByBlockedChannel) {
        this.filteredByDenylist = filteredByDenylist;
        this.filteredByBlockedChannel = filteredByBlockedChannel;
    }

    public static ModerationFilterStats none() {
        return new ModerationFilterStats(0, 0);
    }

    public int getFilteredByDenylist() {
        return filteredByDenylist;
    }

    public int getFilteredByBlockedChannel() {
        return filteredByBlockedChannel;
    }

    public int totalFiltered() {
        return filteredByDenylist + filteredByBlockedChannel;
    }
}
