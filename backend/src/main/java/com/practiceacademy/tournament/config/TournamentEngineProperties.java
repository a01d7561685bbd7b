package com.practiceacademy.tournament.config;

import com.practiceacademy.tournament.model.PlacementTier;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Tournament engine runtime settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "tournament")
public class TournamentEngineProperties {

    private Generation generation = new Generation();
    private Worker worker = new Worker();
    private Groups groups = new Groups();
    private Rewards rewards = new Rewards();

    @Getter
    @Setter
    public static class Generation {
        /**
         * Enrollment count at which generation moves to the background queue.
         */
        private int asyncThreshold = 256;
        private int maxRetries = 2;
        private long retryBackoffMs = 500;
    }

    @Getter
    @Setter
    public static class Worker {
        private String queueMode = "in_memory";
        private String redisQueueKey = "tournament:generation:queue";
        private long redisPopTimeoutSeconds = 1;
        /**
         * Lifetime of the marker that keeps a second job for the same tournament stage off the Redis list. Bounds how
         * long a marker survives a worker that died between pop and delete.
         */
        private long pendingMarkerTtlSeconds = 600;
        private int poolSize = 4;
    }

    @Getter
    @Setter
    public static class Groups {
        private int preferredGroupSize = 4;
        private int defaultQualifiersPerGroup = 2;
    }

    @Getter
    @Setter
    public static class Rewards {
        private Map<PlacementTier, Integer> baseXp = defaults(500, 300, 200, 100, 50);
        private Map<PlacementTier, Integer> defaultCredits = defaults(100, 50, 25, 0, 0);
        private Map<PlacementTier, Integer> baseSkillPoints = defaults(10, 7, 5, 3, 1);

        /**
         * XP granted per skill point, keyed by skill category (case-insensitive).
         */
        private Map<String, Integer> xpPerSkillPoint = new HashMap<>(Map.of(
                "PHYSICAL", 10,
                "TECHNICAL", 12,
                "MENTAL", 15
        ));
        private int defaultXpPerSkillPoint = 10;

        private static Map<PlacementTier, Integer> defaults(
                int first,
                int second,
                int third,
                int topQuarter,
                int participation
        ) {
            Map<PlacementTier, Integer> values = new EnumMap<>(PlacementTier.class);
            values.put(PlacementTier.FIRST_PLACE, first);
            values.put(PlacementTier.SECOND_PLACE, second);
            values.put(PlacementTier.THIRD_PLACE, third);
            values.put(PlacementTier.TOP_25_PERCENT, topQuarter);
            values.put(PlacementTier.PARTICIPATION, participation);
            return values;
        }

        public int baseXpFor(PlacementTier tier) {
            return baseXp.getOrDefault(tier, 0);
        }

        public int defaultCreditsFor(PlacementTier tier) {
            return defaultCredits.getOrDefault(tier, 0);
        }

        public int baseSkillPointsFor(PlacementTier tier) {
            return baseSkillPoints.getOrDefault(tier, 0);
        }

        public int xpPerSkillPointFor(String category) {
            if (category == null || category.isBlank()) {
                return defaultXpPerSkillPoint;
            }
            String normalized = category.trim().toUpperCase(Locale.ROOT);
            for (Map.Entry<String, Integer> entry : xpPerSkillPoint.entrySet()) {
                if (entry.getKey().trim().toUpperCase(Locale.ROOT).equals(normalized)) {
                    return entry.getValue();
                }
            }
            return defaultXpPerSkillPoint;
        }
    }
}
