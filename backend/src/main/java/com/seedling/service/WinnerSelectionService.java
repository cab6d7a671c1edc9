package com.seedling.service;

import com.seedling.dto.AdminRequests;
import com.seedling.dto.SettlementResponses;
import com.seedling.model.Competition;
import com.seedling.model.CompetitionStatus;
import com.seedling.model.CompetitionTermsJsonCodec;
import com.seedling.model.Submission;
import com.seedling.model.SubmissionStatus;
import com.seedling.model.User;
import com.seedling.repository.CompetitionRepository;
import com.seedling.repository.SubmissionRepository;
import com.seedling.repository.UserRepository;
import com.seedling.web.SettlementException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Validates an admin's winner picks against the prize structure and records the outcome.
 * Checks run in a fixed order and the first failure is reported.
 */
@Service
@RequiredArgsConstructor
public class WinnerSelectionService {

    private static final Logger log = LoggerFactory.getLogger(WinnerSelectionService.class);

    private final CompetitionRepository competitionRepository;
    private final SubmissionRepository submissionRepository;
    private final UserRepository userRepository;
    private final JudgeAssignmentService judgeAssignmentService;
    private final LeaderboardRanker leaderboardRanker;
    private final ActorAccessService actorAccessService;
    private final ParticipantNotifier participantNotifier;

    @Transactional
    public SettlementResponses.WinnerSelectionResult selectWinners(
            UUID competitionId,
            List<AdminRequests.WinnerPick> picks,
            UUID actorId
    ) {
        User admin = actorAccessService.requireAdmin(actorId);
        Competition competition = competitionRepository.findByCompetitionIdForUpdate(competitionId)
                .orElseThrow(() -> SettlementException.notFound("Competition not found: " + competitionId));

        if (competition.getStatus() != CompetitionStatus.JUDGING) {
            throw SettlementException.preconditionFailed(
                    "Competition must be in JUDGING status to select winners. Current status: " + competition.getStatus(),
                    Map.of("currentStatus", competition.getStatus(), "requiredStatus", CompetitionStatus.JUDGING)
            );
        }

        List<Submission> eligible = submissionRepository.findByCompetitionIdAndStatusIn(
                competitionId,
                SubmissionStatus.IN_CONTENTION
        );
        Map<UUID, LeaderboardRanker.RankingCandidate> candidates = judgeAssignmentService.rankingCandidates(eligible);
        long pendingJudging = candidates.values().stream().filter(candidate -> !candidate.judgingComplete()).count();
        if (pendingJudging > 0) {
            throw SettlementException.preconditionFailed(
                    "Cannot select winners. " + pendingJudging + " submissions still need judging.",
                    Map.of("pendingJudging", pendingJudging)
            );
        }

        Map<String, Double> prizeStructure = CompetitionTermsJsonCodec.prizeStructure(competition.getPrizeStructure());
        validatePicks(picks, prizeStructure);

        Map<UUID, Submission> eligibleById = eligible.stream()
                .collect(Collectors.toMap(Submission::getSubmissionId, Function.identity()));
        for (AdminRequests.WinnerPick pick : picks) {
            if (!eligibleById.containsKey(pick.submissionId())) {
                throw SettlementException.validationFailed(
                        "Submission " + pick.submissionId() + " is not eligible to win this competition",
                        Map.of("submissionId", pick.submissionId())
                );
            }
        }

        OffsetDateTime now = OffsetDateTime.now();
        Map<UUID, String> placeBySubmission = new LinkedHashMap<>();
        for (AdminRequests.WinnerPick pick : picks) {
            placeBySubmission.put(pick.submissionId(), pick.place());
        }

        List<SettlementResponses.SelectedWinner> winners = new ArrayList<>(picks.size());
        int notSelected = 0;
        for (Submission submission : eligible) {
            String place = placeBySubmission.get(submission.getSubmissionId());
            if (place != null) {
                submission.setStatus(SubmissionStatus.WINNER);
                submission.setPlacement(place);
            } else {
                submission.setStatus(SubmissionStatus.NOT_SELECTED);
                notSelected++;
            }
            submission.setUpdatedAt(now);
        }
        submissionRepository.saveAll(eligible);

        for (AdminRequests.WinnerPick pick : picks) {
            Submission submission = eligibleById.get(pick.submissionId());
            winners.add(new SettlementResponses.SelectedWinner(
                    submission.getSubmissionId(),
                    submission.getTitle(),
                    submission.getUserId(),
                    pick.place(),
                    MoneyAmounts.prizeFor(competition.getPrizePool(), prizeStructure.get(pick.place()))
            ));
        }

        log.info(
                "Winners selected: competitionId={}, winners={}, notSelected={}, adminId={}",
                competitionId,
                winners.size(),
                notSelected,
                admin.getUserId()
        );

        List<ParticipantNotifier.WinnerNotice> winnerNotices = winnerNotices(competition, winners);
        List<ParticipantNotifier.ParticipantNotice> participantNotices =
                participantNotices(competition, eligible, candidates, placeBySubmission.keySet());
        notifyAfterCommit(winnerNotices, participantNotices);

        return new SettlementResponses.WinnerSelectionResult(competitionId, winners, notSelected);
    }

    private static void validatePicks(List<AdminRequests.WinnerPick> picks, Map<String, Double> prizeStructure) {
        if (picks.size() != prizeStructure.size()) {
            throw SettlementException.validationFailed(
                    "Expected " + prizeStructure.size() + " winners to match the prize structure, got " + picks.size(),
                    Map.of("expected", prizeStructure.size(), "actual", picks.size())
            );
        }

        Set<UUID> seenSubmissions = new HashSet<>();
        for (AdminRequests.WinnerPick pick : picks) {
            if (!seenSubmissions.add(pick.submissionId())) {
                throw SettlementException.validationFailed(
                        "Duplicate submission " + pick.submissionId(),
                        Map.of("submissionId", pick.submissionId())
                );
            }
        }

        Set<String> seenPlaces = new HashSet<>();
        for (AdminRequests.WinnerPick pick : picks) {
            if (!seenPlaces.add(pick.place())) {
                throw SettlementException.validationFailed(
                        "Duplicate place '" + pick.place() + "'",
                        Map.of("place", pick.place())
                );
            }
        }

        for (AdminRequests.WinnerPick pick : picks) {
            if (!prizeStructure.containsKey(pick.place())) {
                throw SettlementException.validationFailed(
                        "Invalid place '" + pick.place() + "'. Must be one of: " + String.join(", ", prizeStructure.keySet()),
                        Map.of("place", pick.place(), "validPlaces", List.copyOf(prizeStructure.keySet()))
                );
            }
        }
    }

    private List<ParticipantNotifier.WinnerNotice> winnerNotices(
            Competition competition,
            List<SettlementResponses.SelectedWinner> winners
    ) {
        Map<UUID, User> users = userRepository.findAllById(
                        winners.stream().map(SettlementResponses.SelectedWinner::userId).toList()
                ).stream()
                .collect(Collectors.toMap(User::getUserId, Function.identity()));
        List<ParticipantNotifier.WinnerNotice> notices = new ArrayList<>(winners.size());
        for (SettlementResponses.SelectedWinner winner : winners) {
            User user = users.get(winner.userId());
            if (user == null) {
                continue;
            }
            notices.add(new ParticipantNotifier.WinnerNotice(
                    user.getUserId(),
                    user.getUsername(),
                    user.getEmail(),
                    competition.getCompetitionId(),
                    competition.getTitle(),
                    winner.place(),
                    winner.prizeAmount(),
                    user.isPayoutReady()
            ));
        }
        return notices;
    }

    private List<ParticipantNotifier.ParticipantNotice> participantNotices(
            Competition competition,
            List<Submission> eligible,
            Map<UUID, LeaderboardRanker.RankingCandidate> candidates,
            Set<UUID> winnerIds
    ) {
        Map<UUID, Submission> byId = eligible.stream()
                .collect(Collectors.toMap(Submission::getSubmissionId, Function.identity()));
        Map<UUID, User> users = userRepository.findAllById(
                        eligible.stream().map(Submission::getUserId).collect(Collectors.toSet())
                ).stream()
                .collect(Collectors.toMap(User::getUserId, Function.identity()));

        List<ParticipantNotifier.ParticipantNotice> notices = new ArrayList<>();
        for (LeaderboardRanker.RankedEntry entry : leaderboardRanker.rank(candidates.values())) {
            UUID submissionId = entry.candidate().submissionId();
            if (winnerIds.contains(submissionId)) {
                continue;
            }
            User user = users.get(byId.get(submissionId).getUserId());
            if (user == null) {
                continue;
            }
            notices.add(new ParticipantNotifier.ParticipantNotice(
                    user.getUserId(),
                    user.getUsername(),
                    user.getEmail(),
                    competition.getCompetitionId(),
                    competition.getTitle(),
                    entry.rank(),
                    eligible.size()
            ));
        }
        return notices;
    }

    private void notifyAfterCommit(
            List<ParticipantNotifier.WinnerNotice> winnerNotices,
            List<ParticipantNotifier.ParticipantNotice> participantNotices
    ) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    sendNotices(winnerNotices, participantNotices);
                }
            });
            return;
        }
        sendNotices(winnerNotices, participantNotices);
    }

    private void sendNotices(
            List<ParticipantNotifier.WinnerNotice> winnerNotices,
            List<ParticipantNotifier.ParticipantNotice> participantNotices
    ) {
        for (ParticipantNotifier.WinnerNotice notice : winnerNotices) {
            try {
                participantNotifier.winnerSelected(notice);
            } catch (RuntimeException ex) {
                log.warn("Winner notification failed: userId={}, competitionId={}", notice.userId(), notice.competitionId(), ex);
            }
        }
        for (ParticipantNotifier.ParticipantNotice notice : participantNotices) {
            try {
                participantNotifier.participantResult(notice);
            } catch (RuntimeException ex) {
                log.warn("Participant notification failed: userId={}, competitionId={}", notice.userId(), notice.competitionId(), ex);
            }
        }
    }
}
