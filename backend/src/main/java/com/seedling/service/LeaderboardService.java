package com.seedling.service;

import com.seedling.dto.LeaderboardResponses;
import com.seedling.model.Competition;
import com.seedling.model.CompetitionStatus;
import com.seedling.model.CompetitionTermsJsonCodec;
import com.seedling.model.JudgeScoresJsonCodec;
import com.seedling.model.Submission;
import com.seedling.model.SubmissionStatus;
import com.seedling.model.User;
import com.seedling.repository.CompetitionRepository;
import com.seedling.repository.SubmissionRepository;
import com.seedling.repository.UserRepository;
import com.seedling.web.SettlementException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class LeaderboardService {

    private final CompetitionRepository competitionRepository;
    private final SubmissionRepository submissionRepository;
    private final UserRepository userRepository;
    private final JudgeAssignmentService judgeAssignmentService;
    private final LeaderboardRanker leaderboardRanker;
    private final ActorAccessService actorAccessService;

    @Transactional(readOnly = true)
    public LeaderboardResponses.Leaderboard adminLeaderboard(UUID competitionId, UUID actorId) {
        actorAccessService.requireAdmin(actorId);
        Competition competition = requireCompetition(competitionId);

        List<Submission> eligible = submissionRepository.findByCompetitionIdAndStatusIn(competitionId, SubmissionStatus.RANKABLE);
        Map<UUID, Submission> byId = eligible.stream()
                .collect(Collectors.toMap(Submission::getSubmissionId, Function.identity()));
        Map<UUID, User> users = usersOf(eligible);
        List<LeaderboardRanker.RankedEntry> ranked = leaderboardRanker.rank(
                judgeAssignmentService.rankingCandidates(eligible).values()
        );

        List<LeaderboardResponses.LeaderboardEntry> entries = new ArrayList<>(ranked.size());
        int fullyJudged = 0;
        for (LeaderboardRanker.RankedEntry entry : ranked) {
            LeaderboardRanker.RankingCandidate candidate = entry.candidate();
            Submission submission = byId.get(candidate.submissionId());
            User user = users.get(submission.getUserId());
            if (candidate.judgingComplete()) {
                fullyJudged++;
            }
            entries.add(new LeaderboardResponses.LeaderboardEntry(
                    entry.rank(),
                    submission.getSubmissionId(),
                    submission.getTitle(),
                    submission.getUserId(),
                    user == null ? null : user.getUsername(),
                    submission.getStatus(),
                    submission.getPlacement(),
                    submission.getFinalScore(),
                    JudgeScoresJsonCodec.aggregateFromJson(submission.getHumanScores()).average(),
                    candidate.judgesAssigned(),
                    candidate.judgesCompleted(),
                    candidate.judgingComplete(),
                    entry.hasTie()
            ));
        }

        return new LeaderboardResponses.Leaderboard(
                competition.getCompetitionId(),
                competition.getTitle(),
                competition.getStatus(),
                competition.getPrizePool(),
                CompetitionTermsJsonCodec.prizeStructure(competition.getPrizeStructure()),
                entries,
                submissionRepository.countByCompetitionId(competitionId),
                eligible.size(),
                fullyJudged
        );
    }

    /**
     * Results of a completed competition. Only winners are shown with their username.
     */
    @Transactional(readOnly = true)
    public LeaderboardResponses.PublicResults publicResults(UUID competitionId) {
        Competition competition = requireCompetition(competitionId);
        if (competition.getStatus() != CompetitionStatus.COMPLETE) {
            throw SettlementException.preconditionFailed(
                    "Results are only available once the competition is COMPLETE. Current status: " + competition.getStatus()
            );
        }

        List<Submission> eligible = submissionRepository.findByCompetitionIdAndStatusIn(competitionId, SubmissionStatus.RANKABLE);
        Map<UUID, Submission> byId = eligible.stream()
                .collect(Collectors.toMap(Submission::getSubmissionId, Function.identity()));
        Map<UUID, User> users = usersOf(eligible);

        List<LeaderboardResponses.PublicResultEntry> entries = new ArrayList<>();
        for (LeaderboardRanker.RankedEntry entry : leaderboardRanker.rank(judgeAssignmentService.rankingCandidates(eligible).values())) {
            Submission submission = byId.get(entry.candidate().submissionId());
            User user = users.get(submission.getUserId());
            boolean winner = submission.getStatus() == SubmissionStatus.WINNER;
            entries.add(new LeaderboardResponses.PublicResultEntry(
                    entry.rank(),
                    submission.getSubmissionId(),
                    submission.getTitle(),
                    winner && user != null ? user.getUsername() : null,
                    submission.getPlacement(),
                    submission.getFinalScore(),
                    entry.hasTie()
            ));
        }
        return new LeaderboardResponses.PublicResults(
                competition.getCompetitionId(),
                competition.getTitle(),
                competition.getPrizePool(),
                entries
        );
    }

    private Map<UUID, User> usersOf(List<Submission> submissions) {
        return userRepository.findAllById(submissions.stream().map(Submission::getUserId).collect(Collectors.toSet())).stream()
                .collect(Collectors.toMap(User::getUserId, Function.identity()));
    }

    private Competition requireCompetition(UUID competitionId) {
        return competitionRepository.findById(competitionId)
                .orElseThrow(() -> SettlementException.notFound("Competition not found: " + competitionId));
    }
}
