package com.practiceacademy.tournament.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.Set;
import java.util.UUID;

/**
 * Reads and writes the persisted {@code outcome_json} payload of a match.
 */
public final class MatchOutcomeJsonCodec {

    private static final String FIELD_TYPE = "type";
    private static final String FIELD_PARTICIPANT1_SCORE = "participant1_score";
    private static final String FIELD_PARTICIPANT2_SCORE = "participant2_score";
    private static final String FIELD_DECIDER_WINNER_ID = "decider_winner_id";
    private static final String FIELD_RESULT = "result";
    private static final String FIELD_VALUE = "value";
    private static final String FIELD_UNIT = "unit";

    private static final Set<String> HEAD_TO_HEAD_FIELDS = Set.of(
            FIELD_TYPE,
            FIELD_PARTICIPANT1_SCORE,
            FIELD_PARTICIPANT2_SCORE,
            FIELD_DECIDER_WINNER_ID,
            FIELD_RESULT
    );

    private static final Set<String> INDIVIDUAL_RANKING_FIELDS = Set.of(
            FIELD_TYPE,
            FIELD_VALUE,
            FIELD_UNIT
    );

    private MatchOutcomeJsonCodec() {
    }

    public static ObjectNode toJson(MatchOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("Match outcome is required");
        }
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put(FIELD_TYPE, outcome.format().name());
        if (outcome instanceof MatchOutcome.HeadToHead headToHead) {
            root.put(FIELD_PARTICIPANT1_SCORE, headToHead.participant1Score());
            root.put(FIELD_PARTICIPANT2_SCORE, headToHead.participant2Score());
            if (headToHead.deciderWinnerId() != null) {
                root.put(FIELD_DECIDER_WINNER_ID, headToHead.deciderWinnerId().toString());
            }
            root.put(FIELD_RESULT, headToHead.result().name());
            return root;
        }
        MatchOutcome.IndividualRanking individual = (MatchOutcome.IndividualRanking) outcome;
        root.put(FIELD_VALUE, individual.value().toPlainString());
        if (individual.unit() != null) {
            root.put(FIELD_UNIT, individual.unit());
        }
        return root;
    }

    public static MatchOutcome fromJson(JsonNode json) {
        if (json == null || json.isNull() || !json.isObject()) {
            throw new IllegalArgumentException("Match outcome JSON must be an object");
        }
        JsonNode typeNode = json.get(FIELD_TYPE);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new IllegalArgumentException("Match outcome JSON is missing type");
        }

        TournamentFormat format;
        try {
            format = TournamentFormat.valueOf(typeNode.asText());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown match outcome type: " + typeNode.asText(), ex);
        }

        if (format == TournamentFormat.HEAD_TO_HEAD) {
            rejectUnexpectedFields(json, HEAD_TO_HEAD_FIELDS);
            return new MatchOutcome.HeadToHead(
                    requireInt(json, FIELD_PARTICIPANT1_SCORE),
                    requireInt(json, FIELD_PARTICIPANT2_SCORE),
                    optionalUuid(json, FIELD_DECIDER_WINNER_ID)
            );
        }

        rejectUnexpectedFields(json, INDIVIDUAL_RANKING_FIELDS);
        JsonNode valueNode = json.get(FIELD_VALUE);
        if (valueNode == null || valueNode.isNull()) {
            throw new IllegalArgumentException("Match outcome JSON is missing value");
        }
        BigDecimal value;
        try {
            value = valueNode.isNumber() ? valueNode.decimalValue() : new BigDecimal(valueNode.asText());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Match outcome value is not numeric: " + valueNode.asText(), ex);
        }
        JsonNode unitNode = json.get(FIELD_UNIT);
        return new MatchOutcome.IndividualRanking(value, unitNode == null || unitNode.isNull() ? null : unitNode.asText());
    }

    private static int requireInt(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || !node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException("Match outcome field must be an integer: " + field);
        }
        return node.intValue();
    }

    private static UUID optionalUuid(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return UUID.fromString(node.asText());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Match outcome field must be a UUID: " + field, ex);
        }
    }

    private static void rejectUnexpectedFields(JsonNode json, Set<String> allowed) {
        json.fieldNames().forEachRemaining(name -> {
            if (!allowed.contains(name)) {
                throw new IllegalArgumentException("Unexpected match outcome field: " + name);
            }
        });
    }
}
