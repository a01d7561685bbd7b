package com.practiceacademy.tournament.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.practiceacademy.tournament.dto.RewardConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RewardConfigCodec {

    private final ObjectMapper objectMapper;

    public JsonNode toJson(RewardConfig config) {
        return objectMapper.valueToTree(config);
    }

    public RewardConfig fromJson(JsonNode json) {
        if (json == null || json.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(json, RewardConfig.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored reward configuration is unreadable", ex);
        }
    }
}
