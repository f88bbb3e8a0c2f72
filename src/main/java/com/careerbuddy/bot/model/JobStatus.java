package com.careerbuddy.bot.model;

public enum JobStatus {

    COLLECTING,

    DRAFT_READY,

    PREVIEW_READY,

    AWAITING_PAYMENT,

    PAID,

    RENDERING,

    DELIVERED,

    CLOSED;

    /** Statuses recomputed from the collected answers on every step transition. */
    public boolean isCollectionPhase() {
        return this == COLLECTING || this == DRAFT_READY || this == PREVIEW_READY;
    }
}
