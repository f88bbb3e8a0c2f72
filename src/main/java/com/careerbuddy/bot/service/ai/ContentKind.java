package com.careerbuddy.bot.service.ai;

public enum ContentKind {
    SKILLS,
    SUMMARY,
    REVAMP
}
