package com.practiceacademy.tournament.model;

public enum MatchStatus {
    SCHEDULED,
    COMPLETED
}
