package com.practiceacademy.tournament.model;

public enum RoundAggregation {
    SUM,
    BEST
}
