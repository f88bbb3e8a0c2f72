package com.careerbuddy.bot.model;

public enum Tier {

    FREE("Free"),

    PRO("Premium");

    private final String displayName;

    Tier(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
