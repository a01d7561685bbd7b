package com.practiceacademy.tournament.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class TournamentEngineExceptionHandler {

    @ExceptionHandler(TournamentEngineException.class)
    public ResponseEntity<TournamentEngineErrorResponse> handle(TournamentEngineException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new TournamentEngineErrorResponse(ex.getCode(), ex.getMessage()));
    }

    public record TournamentEngineErrorResponse(
            String code,
            String message
    ) {
    }
}
