package com.seedling.service;

import com.seedling.dto.CompetitionRequests;
import com.seedling.dto.CompetitionResponses;
import com.seedling.mapper.SeedlingResponseMapper;
import com.seedling.model.Competition;
import com.seedling.model.CompetitionStatus;
import com.seedling.model.CompetitionTermsJsonCodec;
import com.seedling.model.SubmissionStatus;
import com.seedling.model.User;
import com.seedling.repository.CompetitionRepository;
import com.seedling.repository.SubmissionRepository;
import com.seedling.web.SettlementException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Forward-only competition lifecycle. Completion is gated on the selected winners.
 */
@Service
@RequiredArgsConstructor
public class CompetitionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(CompetitionLifecycleService.class);
    private static final int DEFAULT_JUDGING_SLA_DAYS = 14;

    private final CompetitionRepository competitionRepository;
    private final SubmissionRepository submissionRepository;
    private final ActorAccessService actorAccessService;
    private final ParticipantNotifier participantNotifier;
    private final SeedlingResponseMapper seedlingResponseMapper;

    @Transactional
    public CompetitionResponses.CompetitionDetail createCompetition(
            CompetitionRequests.CreateCompetitionRequest request,
            UUID actorId
    ) {
        User admin = actorAccessService.requireAdmin(actorId);
        try {
            CompetitionTermsJsonCodec.prizeStructure(request.prizeStructure());
        } catch (IllegalArgumentException ex) {
            throw SettlementException.validationFailed(ex.getMessage());
        }

        Competition competition = new Competition();
        competition.setCompetitionId(UUID.randomUUID());
        competition.setTitle(request.title().trim());
        competition.setDescription(request.description());
        competition.setDomain(request.domain());
        competition.setStatus(CompetitionStatus.DRAFT);
        competition.setEntryFee(MoneyAmounts.scale(request.entryFee()));
        competition.setPlatformFeePercentage(MoneyAmounts.scale(request.platformFeePercentage()));
        competition.setPrizePool(MoneyAmounts.scale(BigDecimal.ZERO));
        competition.setMaxEntries(request.maxEntries());
        competition.setCurrentEntries(0);
        competition.setOpenDate(request.openDate());
        competition.setDeadline(request.deadline());
        competition.setJudgingSlaDays(request.judgingSlaDays() == null ? DEFAULT_JUDGING_SLA_DAYS : request.judgingSlaDays());
        competition.setPrizeStructure(request.prizeStructure());
        competition.setRubric(request.rubric());
        competition.setCreatedBy(admin.getUserId());

        Competition saved = competitionRepository.save(competition);
        log.info("Competition created: competitionId={}, title={}, createdBy={}", saved.getCompetitionId(), saved.getTitle(), admin.getUserId());
        return seedlingResponseMapper.toCompetitionDetail(saved);
    }

    @Transactional(readOnly = true)
    public CompetitionResponses.CompetitionDetail getCompetition(UUID competitionId) {
        return seedlingResponseMapper.toCompetitionDetail(requireCompetition(competitionId));
    }

    /**
     * Moves a competition one step forward. COMPLETE additionally requires one WINNER per prize place.
     */
    @Transactional
    public CompetitionResponses.CompetitionDetail transition(UUID competitionId, CompetitionStatus target, UUID actorId) {
        User admin = actorAccessService.requireAdmin(actorId);
        Competition competition = competitionRepository.findByCompetitionIdForUpdate(competitionId)
                .orElseThrow(() -> SettlementException.notFound("Competition not found: " + competitionId));
        CompetitionStatus current = competition.getStatus();

        if (target == CompetitionStatus.COMPLETE) {
            verifyCompletable(competition);
        } else if (!current.isImmediatePredecessorOf(target)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("currentStatus", current);
            details.put("targetStatus", target);
            CompetitionStatus required = requiredPredecessor(target);
            details.put("requiredStatus", required);
            throw SettlementException.preconditionFailed(
                    "Cannot transition competition from " + current + " to " + target
                            + "; required current status: " + (required == null ? "none" : required),
                    details
            );
        }

        competition.setStatus(target);
        competition.setUpdatedAt(OffsetDateTime.now());
        Competition saved = competitionRepository.save(competition);
        log.info("Competition transitioned: competitionId={}, from={}, to={}, adminId={}", competitionId, current, target, admin.getUserId());

        if (target == CompetitionStatus.UPCOMING) {
            try {
                participantNotifier.competitionAnnounced(saved);
            } catch (RuntimeException ex) {
                log.warn("Competition announcement failed: competitionId={}", competitionId, ex);
            }
        }
        return seedlingResponseMapper.toCompetitionDetail(saved);
    }

    @Transactional
    public void deleteCompetition(UUID competitionId, UUID actorId) {
        User actor = actorAccessService.requireUser(actorId);
        Competition competition = competitionRepository.findByCompetitionIdForUpdate(competitionId)
                .orElseThrow(() -> SettlementException.notFound("Competition not found: " + competitionId));
        actorAccessService.requireOwnerOrAdmin(actor, competition.getCreatedBy(), "Only an admin or the creator can delete a competition");
        if (competition.getStatus() != CompetitionStatus.DRAFT) {
            throw SettlementException.preconditionFailed(
                    "Only DRAFT competitions can be deleted. Current status: " + competition.getStatus()
            );
        }
        competitionRepository.delete(competition);
        log.info("Competition deleted: competitionId={}, actorId={}", competitionId, actor.getUserId());
    }

    private void verifyCompletable(Competition competition) {
        if (competition.getStatus() != CompetitionStatus.JUDGING) {
            throw SettlementException.preconditionFailed(
                    "Competition must be in JUDGING status to complete. Current status: " + competition.getStatus(),
                    Map.of("currentStatus", competition.getStatus(), "requiredStatus", CompetitionStatus.JUDGING)
            );
        }
        long winners = submissionRepository.countByCompetitionIdAndStatus(competition.getCompetitionId(), SubmissionStatus.WINNER);
        int places = CompetitionTermsJsonCodec.prizeStructure(competition.getPrizeStructure()).size();
        if (winners == 0) {
            throw SettlementException.preconditionFailed(
                    "Cannot complete competition without selected winners",
                    Map.of("winnerCount", winners, "expectedWinners", places)
            );
        }
        if (winners != places) {
            throw SettlementException.preconditionFailed(
                    "Winner count (" + winners + ") does not match prize structure (" + places + " places)",
                    Map.of("winnerCount", winners, "expectedWinners", places)
            );
        }
    }

    private static CompetitionStatus requiredPredecessor(CompetitionStatus target) {
        for (CompetitionStatus status : CompetitionStatus.values()) {
            if (status.isImmediatePredecessorOf(target)) {
                return status;
            }
        }
        return null;
    }

    private Competition requireCompetition(UUID competitionId) {
        return competitionRepository.findById(competitionId)
                .orElseThrow(() -> SettlementException.notFound("Competition not found: " + competitionId));
    }
}
