package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.dto.RewardConfig;
import com.practiceacademy.tournament.web.TournamentEngineException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration-time checks for a reward policy. A policy that passes here never fails distribution on shape.
 */
@Component
@RequiredArgsConstructor
public class RewardConfigValidator {

    private final Validator validator;

    public RewardConfig validate(RewardConfig config) {
        if (config == null) {
            throw TournamentEngineException.validation("Reward configuration is required");
        }
        Set<ConstraintViolation<RewardConfig>> violations = validator.validate(config);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw TournamentEngineException.validation("Invalid reward configuration: " + detail);
        }
        return config;
    }
}
