package com.practiceacademy.tournament.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MatchOutcomeJsonCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void headToHeadOutcomeStoresScoresResultAndDecider() {
        UUID decider = UUID.fromString("00000000-0000-0000-0000-000000000c01");

        ObjectNode json = MatchOutcomeJsonCodec.toJson(new MatchOutcome.HeadToHead(1, 1, decider));

        assertEquals("HEAD_TO_HEAD", json.get("type").asText());
        assertEquals(1, json.get("participant1_score").asInt());
        assertEquals("DRAW", json.get("result").asText());
        assertEquals(decider.toString(), json.get("decider_winner_id").asText());

        MatchOutcome.HeadToHead parsed = assertInstanceOf(MatchOutcome.HeadToHead.class, MatchOutcomeJsonCodec.fromJson(json));
        assertEquals(decider, parsed.deciderWinnerId());
    }

    @Test
    void individualOutcomeKeepsDecimalPrecisionAsText() throws Exception {
        ObjectNode json = MatchOutcomeJsonCodec.toJson(new MatchOutcome.IndividualRanking(new BigDecimal("9.580"), " s "));

        assertEquals("9.580", json.get("value").asText());
        assertEquals("s", json.get("unit").asText());

        MatchOutcome parsed = MatchOutcomeJsonCodec.fromJson(objectMapper.readTree("""
                {"type": "INDIVIDUAL_RANKING", "value": 12.25}
                """));
        MatchOutcome.IndividualRanking individual = assertInstanceOf(MatchOutcome.IndividualRanking.class, parsed);
        assertEquals(0, new BigDecimal("12.25").compareTo(individual.value()));
        assertNull(individual.unit());
    }

    @Test
    void decodingRejectsFieldsOfTheOtherFormat() throws Exception {
        IllegalArgumentException ex = assertThrows(
                IllegalArgumentException.class,
                () -> MatchOutcomeJsonCodec.fromJson(objectMapper.readTree("""
                        {"type": "HEAD_TO_HEAD", "participant1_score": 1, "participant2_score": 0, "value": 3}
                        """))
        );

        assertEquals("Unexpected match outcome field: value", ex.getMessage());
    }

    @Test
    void decodingRejectsMissingTypeAndFractionalScores() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> MatchOutcomeJsonCodec.fromJson(objectMapper.readTree("{\"value\": 3}")));
        assertThrows(IllegalArgumentException.class,
                () -> MatchOutcomeJsonCodec.fromJson(objectMapper.readTree("""
                        {"type": "HEAD_TO_HEAD", "participant1_score": 1.5, "participant2_score": 0}
                        """)));
        assertThrows(IllegalArgumentException.class,
                () -> MatchOutcomeJsonCodec.fromJson(objectMapper.readTree("{\"type\": \"RELAY\"}")));
    }

    @Test
    void negativeScoresAreRejectedAtConstruction() {
        assertThrows(IllegalArgumentException.class, () -> MatchOutcome.HeadToHead.of(-1, 0));
        assertEquals(MatchOutcome.HeadToHeadResult.PARTICIPANT2_WIN, MatchOutcome.HeadToHead.of(0, 3).result());
    }
}
