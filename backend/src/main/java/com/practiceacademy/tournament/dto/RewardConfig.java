package com.practiceacademy.tournament.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.practiceacademy.tournament.model.PlacementTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Placement and skill reward policy of a tournament.
 */
public record RewardConfig(
        @NotNull(message = "skillMappings is required")
        @Valid
        List<SkillMapping> skillMappings,

        @Valid
        Tiers tiers,

        @Size(max = 120, message = "templateName must be at most 120 characters")
        String templateName
) {

    @JsonIgnore
    @AssertTrue(message = "at least one skill mapping must be enabled")
    public boolean isAnySkillEnabled() {
        return !enabledSkills().isEmpty();
    }

    /**
     * Skill rows are keyed by {@link SkillMapping#skillKey()}, so two enabled names with one key would share a row.
     */
    @JsonIgnore
    @AssertTrue(message = "enabled skill names must stay distinct ignoring case and punctuation")
    public boolean isSkillKeysDistinct() {
        Set<String> seen = new HashSet<>();
        for (SkillMapping mapping : enabledSkills()) {
            if (mapping.skill() != null && !mapping.skill().isBlank() && !seen.add(mapping.skillKey())) {
                return false;
            }
        }
        return true;
    }

    public List<SkillMapping> enabledSkills() {
        if (skillMappings == null) {
            return List.of();
        }
        return skillMappings.stream()
                .filter(mapping -> mapping != null && mapping.enabled())
                .toList();
    }

    public TierReward tierReward(PlacementTier tier) {
        return tiers == null ? null : tiers.forTier(tier);
    }

    public record SkillMapping(
            @NotBlank(message = "skill is required")
            @Size(max = 40, message = "skill must be at most 40 characters")
            String skill,

            @NotNull(message = "weight is required")
            @DecimalMin(value = "0.1", message = "weight must be at least 0.1")
            @DecimalMax(value = "5.0", message = "weight must be at most 5.0")
            BigDecimal weight,

            @NotBlank(message = "category is required")
            String category,

            boolean enabled
    ) {

        @JsonIgnore
        public String skillKey() {
            return skill.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        }
    }

    public record Tiers(
            @Valid TierReward firstPlace,
            @Valid TierReward secondPlace,
            @Valid TierReward thirdPlace,
            @Valid TierReward top25Percent,
            @Valid TierReward participation
    ) {

        public TierReward forTier(PlacementTier tier) {
            return switch (tier) {
                case FIRST_PLACE -> firstPlace;
                case SECOND_PLACE -> secondPlace;
                case THIRD_PLACE -> thirdPlace;
                case TOP_25_PERCENT -> top25Percent;
                case PARTICIPATION -> participation;
            };
        }
    }

    public record TierReward(
            @Min(value = 0, message = "credits must be non-negative")
            Integer credits,

            @DecimalMin(value = "0.0", message = "xpMultiplier must be non-negative")
            @DecimalMax(value = "5.0", message = "xpMultiplier must be at most 5.0")
            BigDecimal xpMultiplier,

            @Valid
            List<BadgeReward> badges
    ) {
    }

    public record BadgeReward(
            @NotBlank(message = "badgeType is required")
            @Size(max = 40, message = "badgeType must be at most 40 characters")
            String badgeType,

            String title,

            String rarity,

            boolean enabled
    ) {
    }
}
