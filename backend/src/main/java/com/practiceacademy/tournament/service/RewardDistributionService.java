package com.practiceacademy.tournament.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.practiceacademy.tournament.config.TournamentEngineProperties;
import com.practiceacademy.tournament.dto.RewardConfig;
import com.practiceacademy.tournament.model.PlacementTier;
import com.practiceacademy.tournament.model.RewardKind;
import com.practiceacademy.tournament.model.RewardLedgerEntry;
import com.practiceacademy.tournament.model.Tournament;
import com.practiceacademy.tournament.model.TournamentEnrollment;
import com.practiceacademy.tournament.model.TournamentRanking;
import com.practiceacademy.tournament.model.TournamentStatus;
import com.practiceacademy.tournament.repository.RewardLedgerEntryRepository;
import com.practiceacademy.tournament.repository.TournamentEnrollmentRepository;
import com.practiceacademy.tournament.repository.TournamentRankingRepository;
import com.practiceacademy.tournament.repository.TournamentRepository;
import com.practiceacademy.tournament.web.TournamentEngineException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Pays out placement, skill and badge rewards for a completed tournament. Every ledger row carries a deterministic
 * idempotency key so a repeated or concurrent run reuses rows instead of paying twice.
 */
@Service
@RequiredArgsConstructor
public class RewardDistributionService {

    private static final Logger log = LoggerFactory.getLogger(RewardDistributionService.class);

    static final String REASON_PLACEMENT = "placement";
    static final String REASON_SKILL_BONUS = "skill_bonus";
    static final String BADGE_CHAMPION = "CHAMPION";
    static final String BADGE_RUNNER_UP = "RUNNER_UP";
    static final String BADGE_THIRD_PLACE = "THIRD_PLACE";
    static final String BADGE_PODIUM_FINISH = "PODIUM_FINISH";
    static final String BADGE_PARTICIPANT = "TOURNAMENT_PARTICIPANT";
    static final String BADGE_VETERAN = "TOURNAMENT_VETERAN";
    static final String BADGE_LEGEND = "TOURNAMENT_LEGEND";
    static final String BADGE_TRIPLE_CROWN = "TRIPLE_CROWN";
    static final String METADATA_PLACEMENT = "placement";
    static final int VETERAN_TOURNAMENTS = 5;
    static final int LEGEND_TOURNAMENTS = 10;
    static final int TRIPLE_CROWN_TITLES = 3;
    private static final List<String> RARITY_ORDER = List.of("LEGENDARY", "EPIC", "RARE", "UNCOMMON", "COMMON");

    private final TournamentRepository tournamentRepository;
    private final TournamentEnrollmentRepository tournamentEnrollmentRepository;
    private final TournamentRankingRepository tournamentRankingRepository;
    private final RewardLedgerEntryRepository rewardLedgerEntryRepository;
    private final IdempotentLedgerWriter idempotentLedgerWriter;
    private final RewardConfigValidator rewardConfigValidator;
    private final RewardConfigCodec rewardConfigCodec;
    private final TournamentStateMachine tournamentStateMachine;
    private final TournamentEngineProperties properties;

    /**
     * @param suppliedConfig policy to apply; when null the tournament's saved policy is used, and without one the
     *                       configured default credits, XP and badges apply
     */
    @Transactional
    public DistributionSummary distributeRewards(UUID tournamentId, RewardConfig suppliedConfig) {
        if (suppliedConfig != null) {
            rewardConfigValidator.validate(suppliedConfig);
        }
        Tournament tournament = tournamentRepository.findByTournamentIdForUpdate(tournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("tournament", tournamentId));

        if (tournament.getStatus() == TournamentStatus.REWARDS_DISTRIBUTED) {
            log.debug("Rewards for tournament {} already distributed at {}", tournamentId, tournament.getRewardsDistributedAt());
            return summarizeExisting(tournament);
        }
        if (tournament.getStatus() == TournamentStatus.CANCELLED) {
            throw TournamentEngineException.invalidState("Tournament " + tournamentId + " was cancelled; rewards are not paid");
        }
        if (tournament.getStatus() != TournamentStatus.COMPLETED) {
            throw TournamentEngineException.invalidState(
                    "Tournament " + tournamentId + " must be COMPLETED to distribute rewards, is " + tournament.getStatus()
            );
        }

        RewardConfig config = suppliedConfig != null
                ? suppliedConfig
                : rewardConfigCodec.fromJson(tournament.getRewardConfigJson());

        Map<UUID, TournamentRanking> rankings = new LinkedHashMap<>();
        for (TournamentRanking ranking : tournamentRankingRepository.findByTournamentIdOrderByRankAsc(tournamentId)) {
            rankings.put(ranking.getParticipantId(), ranking);
        }
        Map<UUID, TournamentEnrollment> enrollments = new LinkedHashMap<>();
        for (TournamentEnrollment enrollment
                : tournamentEnrollmentRepository.findByTournamentIdOrderByEnrolledAtAscParticipantIdAsc(tournamentId)) {
            enrollments.put(enrollment.getParticipantId(), enrollment);
        }
        Set<UUID> participants = new LinkedHashSet<>(rankings.keySet());
        participants.addAll(enrollments.keySet());

        OffsetDateTime now = OffsetDateTime.now();
        Tally tally = new Tally();
        for (UUID participantId : participants) {
            ResolvedRank resolved = resolveRank(tournamentId, participantId, rankings, enrollments);
            if (resolved == null) {
                tally.skipped++;
                log.warn(
                        "Skipping rank-dependent rewards for participant {} in tournament {}: no ranking, placement or badge record",
                        participantId,
                        tournamentId
                );
                continue;
            }
            rewardParticipant(tournament, participantId, resolved, participants.size(), config, now, tally);
            tally.rewarded++;
        }

        tournamentStateMachine.transition(tournament, TournamentStatus.REWARDS_DISTRIBUTED, now);
        tournamentRepository.save(tournament);

        DistributionSummary summary = new DistributionSummary(
                tournamentId,
                false,
                tally.rewarded,
                tally.skipped,
                tally.created,
                tally.matched,
                tally.credits,
                tally.xp,
                tally.skillPoints,
                tally.badges,
                List.copyOf(tally.alerts),
                now
        );
        log.info(
                "Distributed rewards for tournament {}: {} participants, {} skipped, {} new ledger entries, {} reused, {} drift alerts",
                tournamentId,
                summary.participantsRewarded(),
                summary.participantsSkipped(),
                summary.newEntriesCreated(),
                summary.existingEntriesMatched(),
                summary.dataDriftAlerts().size()
        );
        return summary;
    }

    /**
     * Ranking row first, then the enrollment's recorded placement, then a placement stored on an earlier badge.
     */
    ResolvedRank resolveRank(
            UUID tournamentId,
            UUID participantId,
            Map<UUID, TournamentRanking> rankings,
            Map<UUID, TournamentEnrollment> enrollments
    ) {
        TournamentRanking ranking = rankings.get(participantId);
        if (ranking != null && ranking.getRank() != null && ranking.getRank() > 0) {
            return new ResolvedRank(ranking.getRank(), "ranking");
        }
        TournamentEnrollment enrollment = enrollments.get(participantId);
        if (enrollment != null && enrollment.getFinalPlacement() != null && enrollment.getFinalPlacement() > 0) {
            return new ResolvedRank(enrollment.getFinalPlacement(), "enrollment");
        }
        for (RewardLedgerEntry badge : priorBadges(tournamentId, participantId)) {
            JsonNode metadata = badge.getMetadataJson();
            JsonNode placement = metadata == null ? null : metadata.get(METADATA_PLACEMENT);
            if (placement != null && placement.canConvertToInt() && placement.intValue() > 0) {
                return new ResolvedRank(placement.intValue(), "badge");
            }
        }
        return null;
    }

    private void rewardParticipant(
            Tournament tournament,
            UUID participantId,
            ResolvedRank resolved,
            int totalParticipants,
            RewardConfig config,
            OffsetDateTime now,
            Tally tally
    ) {
        UUID tournamentId = tournament.getTournamentId();
        int rank = resolved.rank();
        PlacementTier tier = PlacementTier.forRank(rank, totalParticipants);
        RewardConfig.TierReward tierReward = config == null ? null : config.tierReward(tier);
        TournamentEngineProperties.Rewards defaults = properties.getRewards();

        int credits = tierReward != null && tierReward.credits() != null
                ? tierReward.credits()
                : defaults.defaultCreditsFor(tier);
        if (credits > 0 && write(tally, entry(tournamentId, participantId, RewardKind.CREDIT, REASON_PLACEMENT,
                BigDecimal.valueOf(credits), rank, tier, null, now))) {
            tally.credits += credits;
        }

        BigDecimal multiplier = tierReward != null && tierReward.xpMultiplier() != null
                ? tierReward.xpMultiplier()
                : BigDecimal.ONE;
        long placementXp = BigDecimal.valueOf(defaults.baseXpFor(tier))
                .multiply(multiplier)
                .setScale(0, RoundingMode.FLOOR)
                .longValue();
        if (placementXp > 0 && write(tally, entry(tournamentId, participantId, RewardKind.XP, REASON_PLACEMENT,
                BigDecimal.valueOf(placementXp), rank, tier, null, now))) {
            tally.xp += placementXp;
        }

        if (config != null) {
            rewardSkills(tournamentId, participantId, rank, tier, config, now, tally);
        }

        List<BadgeGrant> badges = resolveBadges(rank, tierReward);
        checkChampionDrift(tournamentId, participantId, resolved, badges, tally);
        for (BadgeGrant badge : badges) {
            ObjectNode metadata = JsonNodeFactory.instance.objectNode();
            metadata.put("badge_type", badge.badgeType());
            metadata.put("title", badge.title());
            if (badge.rarity() != null) {
                metadata.put("rarity", badge.rarity());
            }
            metadata.put(METADATA_PLACEMENT, rank);
            metadata.put("placement_tier", tier.name());
            if (write(tally, entry(tournamentId, participantId, RewardKind.BADGE, "badge:" + badge.badgeType(),
                    BigDecimal.ONE, rank, tier, metadata, now))) {
                tally.badges++;
            }
        }

        awardMilestones(tournamentId, participantId, rank, tier, now, tally);
    }

    /**
     * Career badges, granted once per participant across all tournaments. The triggering tournament is recorded on
     * the row but not in its key.
     */
    private void awardMilestones(
            UUID tournamentId,
            UUID participantId,
            int rank,
            PlacementTier tier,
            OffsetDateTime now,
            Tally tally
    ) {
        long tournamentsRewarded = rewardLedgerEntryRepository.countDistinctTournamentsByParticipantId(participantId);
        long championships = rewardLedgerEntryRepository.countByParticipantIdAndRewardKindAndReason(
                participantId,
                RewardKind.BADGE,
                "badge:" + BADGE_CHAMPION
        );
        List<Milestone> reached = new ArrayList<>();
        if (tournamentsRewarded >= VETERAN_TOURNAMENTS) {
            reached.add(new Milestone(BADGE_VETERAN, "Tournament veteran", "EPIC", tournamentsRewarded));
        }
        if (tournamentsRewarded >= LEGEND_TOURNAMENTS) {
            reached.add(new Milestone(BADGE_LEGEND, "Tournament legend", "LEGENDARY", tournamentsRewarded));
        }
        if (championships >= TRIPLE_CROWN_TITLES) {
            reached.add(new Milestone(BADGE_TRIPLE_CROWN, "Triple crown", "LEGENDARY", championships));
        }
        for (Milestone milestone : reached) {
            ObjectNode metadata = JsonNodeFactory.instance.objectNode();
            metadata.put("badge_type", milestone.badgeType());
            metadata.put("title", milestone.title());
            metadata.put("rarity", milestone.rarity());
            metadata.put("count", milestone.count());
            metadata.put("milestone", true);
            RewardLedgerEntry entry = entry(tournamentId, participantId, RewardKind.BADGE,
                    "milestone:" + milestone.badgeType(), BigDecimal.ONE, rank, tier, metadata, now);
            entry.setIdempotencyKey(milestoneKey(participantId, milestone.badgeType()));
            if (write(tally, entry)) {
                tally.badges++;
                log.info("Participant {} reached milestone {} in tournament {}",
                        participantId, milestone.badgeType(), tournamentId);
            }
        }
    }

    private void rewardSkills(
            UUID tournamentId,
            UUID participantId,
            int rank,
            PlacementTier tier,
            RewardConfig config,
            OffsetDateTime now,
            Tally tally
    ) {
        List<RewardConfig.SkillMapping> skills = config.enabledSkills();
        if (skills.isEmpty()) {
            return;
        }
        BigDecimal totalWeight = skills.stream()
                .map(RewardConfig.SkillMapping::weight)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal basePoints = BigDecimal.valueOf(properties.getRewards().baseSkillPointsFor(tier));

        long bonusXp = 0;
        for (RewardConfig.SkillMapping skill : skills) {
            BigDecimal points = splitSkillPoints(basePoints, skill.weight(), totalWeight);
            if (points.signum() <= 0) {
                continue;
            }
            ObjectNode metadata = JsonNodeFactory.instance.objectNode();
            metadata.put("skill", skill.skill());
            metadata.put("category", skill.category());
            metadata.put("weight", skill.weight());
            if (!write(tally, entry(tournamentId, participantId, RewardKind.SKILL, "skill:" + skill.skillKey(),
                    points, rank, tier, metadata, now))) {
                continue;
            }
            tally.skillPoints = tally.skillPoints.add(points);
            bonusXp += points.multiply(BigDecimal.valueOf(properties.getRewards().xpPerSkillPointFor(skill.category())))
                    .setScale(0, RoundingMode.FLOOR)
                    .longValue();
        }
        if (bonusXp > 0 && write(tally, entry(tournamentId, participantId, RewardKind.XP, REASON_SKILL_BONUS,
                BigDecimal.valueOf(bonusXp), rank, tier, null, now))) {
            tally.xp += bonusXp;
        }
    }

    static BigDecimal splitSkillPoints(BigDecimal basePoints, BigDecimal weight, BigDecimal totalWeight) {
        if (totalWeight.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return basePoints.multiply(weight).divide(totalWeight, 1, RoundingMode.HALF_UP);
    }

    static List<BadgeGrant> resolveBadges(int rank, RewardConfig.TierReward tierReward) {
        if (tierReward != null && tierReward.badges() != null) {
            return tierReward.badges().stream()
                    .filter(badge -> badge != null && badge.enabled())
                    .map(badge -> new BadgeGrant(
                            normalizeBadgeType(badge.badgeType()),
                            badge.title() == null || badge.title().isBlank() ? badge.badgeType() : badge.title(),
                            badge.rarity()
                    ))
                    .distinct()
                    .toList();
        }
        List<BadgeGrant> badges = new ArrayList<>();
        if (rank == 1) {
            badges.add(new BadgeGrant(BADGE_CHAMPION, "Champion", "LEGENDARY"));
        } else if (rank == 2) {
            badges.add(new BadgeGrant(BADGE_RUNNER_UP, "Runner-up", "EPIC"));
        } else if (rank == 3) {
            badges.add(new BadgeGrant(BADGE_THIRD_PLACE, "Third place", "RARE"));
        }
        if (rank <= 3) {
            badges.add(new BadgeGrant(BADGE_PODIUM_FINISH, "Podium finish", "RARE"));
        }
        badges.add(new BadgeGrant(BADGE_PARTICIPANT, "Tournament participant", "COMMON"));
        return badges;
    }

    private void checkChampionDrift(
            UUID tournamentId,
            UUID participantId,
            ResolvedRank resolved,
            List<BadgeGrant> badges,
            Tally tally
    ) {
        if (resolved.rank() == 1) {
            return;
        }
        boolean championAwarded = badges.stream().anyMatch(badge -> BADGE_CHAMPION.equals(badge.badgeType()));
        boolean championOnRecord = priorBadges(tournamentId, participantId).stream()
                .anyMatch(entry -> entry.getReason().equals("badge:" + BADGE_CHAMPION));
        if (!championAwarded && !championOnRecord) {
            return;
        }
        DataDriftAlert alert = new DataDriftAlert(
                tournamentId,
                participantId,
                BADGE_CHAMPION,
                resolved.rank(),
                resolved.source()
        );
        tally.alerts.add(alert);
        log.error(
                "DATA_DRIFT champion badge for participant {} in tournament {} contradicts resolved rank {} (source {})",
                participantId,
                tournamentId,
                resolved.rank(),
                resolved.source()
        );
    }

    private List<RewardLedgerEntry> priorBadges(UUID tournamentId, UUID participantId) {
        return rewardLedgerEntryRepository.findByTournamentIdAndParticipantIdAndRewardKind(
                tournamentId,
                participantId,
                RewardKind.BADGE
        );
    }

    /**
     * @return true only when this call inserted the row; totals are counted on that basis
     */
    private boolean write(Tally tally, RewardLedgerEntry entry) {
        IdempotentLedgerWriter.WriteResult result = idempotentLedgerWriter.insertOrRead(entry);
        if (result.created()) {
            tally.created++;
        } else {
            tally.matched++;
        }
        return result.created();
    }

    static String idempotencyKey(UUID tournamentId, UUID participantId, RewardKind kind, String reason) {
        return "reward:" + tournamentId + ":" + participantId + ":" + kind.name() + ":" + reason;
    }

    static String milestoneKey(UUID participantId, String badgeType) {
        return "reward:career:" + participantId + ":" + RewardKind.BADGE.name() + ":milestone:" + badgeType;
    }

    private static RewardLedgerEntry entry(
            UUID tournamentId,
            UUID participantId,
            RewardKind kind,
            String reason,
            BigDecimal amount,
            int rank,
            PlacementTier tier,
            JsonNode metadata,
            OffsetDateTime now
    ) {
        RewardLedgerEntry entry = new RewardLedgerEntry();
        entry.setEntryId(UUID.randomUUID());
        entry.setTournamentId(tournamentId);
        entry.setParticipantId(participantId);
        entry.setRewardKind(kind);
        entry.setReason(reason);
        entry.setIdempotencyKey(idempotencyKey(tournamentId, participantId, kind, reason));
        entry.setAmount(amount);
        entry.setResolvedRank(rank);
        entry.setPlacementTier(tier);
        entry.setMetadataJson(metadata == null ? JsonNodeFactory.instance.objectNode() : metadata);
        entry.setCreatedAt(now);
        return entry;
    }

    private DistributionSummary summarizeExisting(Tournament tournament) {
        List<RewardLedgerEntry> ledger =
                rewardLedgerEntryRepository.findByTournamentIdOrderByCreatedAtAsc(tournament.getTournamentId());
        long credits = 0;
        long xp = 0;
        BigDecimal skillPoints = BigDecimal.ZERO;
        int badges = 0;
        Set<UUID> participants = new LinkedHashSet<>();
        for (RewardLedgerEntry entry : ledger) {
            participants.add(entry.getParticipantId());
            switch (entry.getRewardKind()) {
                case CREDIT -> credits += entry.getAmount().longValue();
                case XP -> xp += entry.getAmount().longValue();
                case SKILL -> skillPoints = skillPoints.add(entry.getAmount());
                case BADGE -> badges++;
            }
        }
        return new DistributionSummary(
                tournament.getTournamentId(),
                true,
                participants.size(),
                0,
                0,
                ledger.size(),
                credits,
                xp,
                skillPoints,
                badges,
                List.of(),
                tournament.getRewardsDistributedAt()
        );
    }

    /**
     * What one participant received from one tournament, read back from the ledger. Milestone badges earned at this
     * tournament are included.
     */
    @Transactional(readOnly = true)
    public ParticipantRewardSummary participantRewardSummary(UUID tournamentId, UUID participantId) {
        Tournament tournament = tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("tournament", tournamentId));
        List<RewardLedgerEntry> entries = rewardLedgerEntryRepository
                .findByTournamentIdAndParticipantIdOrderByCreatedAtAsc(tournamentId, participantId);
        Optional<TournamentEnrollment> enrollment =
                tournamentEnrollmentRepository.findByTournamentIdAndParticipantId(tournamentId, participantId);
        if (entries.isEmpty() && enrollment.isEmpty()) {
            throw TournamentEngineException.notFound("participant", participantId);
        }

        Integer placement = enrollment.map(TournamentEnrollment::getFinalPlacement).orElse(null);
        PlacementTier tier = null;
        long credits = 0;
        long placementXp = 0;
        long skillBonusXp = 0;
        Map<String, BigDecimal> skillPoints = new LinkedHashMap<>();
        List<ParticipantRewardSummary.Badge> badges = new ArrayList<>();
        for (RewardLedgerEntry entry : entries) {
            if (placement == null && entry.getResolvedRank() != null) {
                placement = entry.getResolvedRank();
            }
            if (tier == null) {
                tier = entry.getPlacementTier();
            }
            switch (entry.getRewardKind()) {
                case CREDIT -> credits += entry.getAmount().longValue();
                case XP -> {
                    if (REASON_SKILL_BONUS.equals(entry.getReason())) {
                        skillBonusXp += entry.getAmount().longValue();
                    } else {
                        placementXp += entry.getAmount().longValue();
                    }
                }
                case SKILL -> skillPoints.merge(skillName(entry), entry.getAmount(), BigDecimal::add);
                case BADGE -> badges.add(toBadge(entry));
            }
        }
        String rarest = badges.stream()
                .map(ParticipantRewardSummary.Badge::rarity)
                .filter(RARITY_ORDER::contains)
                .min(Comparator.comparingInt(RARITY_ORDER::indexOf))
                .orElse(null);
        return new ParticipantRewardSummary(
                tournamentId,
                participantId,
                placement,
                tier,
                credits,
                placementXp,
                skillBonusXp,
                placementXp + skillBonusXp,
                skillPoints,
                badges,
                rarest,
                tournament.getRewardsDistributedAt()
        );
    }

    private static String skillName(RewardLedgerEntry entry) {
        JsonNode metadata = entry.getMetadataJson();
        JsonNode skill = metadata == null ? null : metadata.get("skill");
        if (skill != null && skill.isTextual()) {
            return skill.asText();
        }
        return entry.getReason().startsWith("skill:") ? entry.getReason().substring("skill:".length()) : entry.getReason();
    }

    private static ParticipantRewardSummary.Badge toBadge(RewardLedgerEntry entry) {
        JsonNode metadata = entry.getMetadataJson();
        return new ParticipantRewardSummary.Badge(
                text(metadata, "badge_type", entry.getReason()),
                text(metadata, "title", null),
                text(metadata, "rarity", null),
                metadata != null && metadata.path("milestone").asBoolean(false),
                entry.getCreatedAt()
        );
    }

    private static String text(JsonNode metadata, String field, String fallback) {
        JsonNode value = metadata == null ? null : metadata.get(field);
        return value != null && value.isTextual() ? value.asText() : fallback;
    }

    private static String normalizeBadgeType(String badgeType) {
        return badgeType.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_");
    }

    record ResolvedRank(
            int rank,
            String source
    ) {
    }

    private record Milestone(
            String badgeType,
            String title,
            String rarity,
            long count
    ) {
    }

    record BadgeGrant(
            String badgeType,
            String title,
            String rarity
    ) {
    }

    private static final class Tally {
        private int rewarded;
        private int skipped;
        private int created;
        private int matched;
        private long credits;
        private long xp;
        private BigDecimal skillPoints = BigDecimal.ZERO;
        private int badges;
        private final List<DataDriftAlert> alerts = new ArrayList<>();
    }
}
