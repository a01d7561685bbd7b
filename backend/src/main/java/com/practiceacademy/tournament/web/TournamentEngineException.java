package com.practiceacademy.tournament.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class TournamentEngineException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public TournamentEngineException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static TournamentEngineException validation(String detail) {
        return new TournamentEngineException(
                HttpStatus.BAD_REQUEST,
                "validation_failed",
                detail
        );
    }

    public static TournamentEngineException notFound(String resource, Object id) {
        return new TournamentEngineException(
                HttpStatus.NOT_FOUND,
                resource + "_not_found",
                "Not found: " + resource + " " + id
        );
    }

    public static TournamentEngineException invalidState(String detail) {
        return new TournamentEngineException(
                HttpStatus.CONFLICT,
                "invalid_state",
                detail
        );
    }

    public static TournamentEngineException conflict(String code, String detail) {
        return new TournamentEngineException(
                HttpStatus.CONFLICT,
                code,
                detail
        );
    }
}
