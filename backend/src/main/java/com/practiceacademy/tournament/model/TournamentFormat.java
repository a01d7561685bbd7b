package com.practiceacademy.tournament.model;

public enum TournamentFormat {
    HEAD_TO_HEAD,
    INDIVIDUAL_RANKING
}
