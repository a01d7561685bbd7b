package com.practiceacademy.tournament.model;

public enum HeadToHeadType {
    LEAGUE,
    KNOCKOUT,
    GROUP_KNOCKOUT
}
