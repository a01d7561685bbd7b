package com.practiceacademy.tournament.model;

public enum RewardKind {
    CREDIT,
    XP,
    SKILL,
    BADGE
}
