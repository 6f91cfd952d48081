package com.fvr.recommendation.events;

/**
 * Supported interaction events and the change each one applies to the
 * aggregated signals of its video.
 */
public enum InteractionEventType {
    LIKE("Like", 1, 0, 0, 1.0),
    UNDO_LIKE("UndoLike", -1, 1, 0, -1.0),
    COMMENT("Comment", 0, 0, 1, 0.25);

    private final String wireName;
    private final int likesDelta;
    private final int undoLikesDelta;
    private final int commentsDelta;
    private final double signalDelta;

    InteractionEventType(String wireName, int likesDelta, int undoLikesDelta, int commentsDelta, double signalDelta) {
        this.wireName = wireName;
        this.likesDelta = likesDelta;
        this.undoLikesDelta = undoLikesDelta;
        this.commentsDelta = commentsDelta;
        this.signalDelta = signalDelta;
    }

    public static InteractionEventType fromWireName(String value) {
        for (InteractionEventType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        return null;
    }

    public String getWireName() {
        return wireName;
    }

    public int getLikesDelta() {
        return likesDelta;
    }

    public int getUndoLikesDelta() {
        return undoLikesDelta;
    }

    public int getCommentsDelta() {
        return commentsDelta;
    }

    public double getSignalDelta() {
        return signalDelta;
    }
}
