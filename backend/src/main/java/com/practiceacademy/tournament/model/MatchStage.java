package com.practiceacademy.tournament.model;

public enum MatchStage {
    GROUP,
    KNOCKOUT,
    SINGLE
}
