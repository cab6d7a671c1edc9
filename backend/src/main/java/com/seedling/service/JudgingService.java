package com.seedling.service;

import com.seedling.dto.JudgingResponses;
import com.seedling.mapper.SeedlingResponseMapper;
import com.seedling.model.Competition;
import com.seedling.model.CompetitionStatus;
import com.seedling.model.CompetitionTermsJsonCodec;
import com.seedling.model.JudgeAssignment;
import com.seedling.model.JudgeFeedback;
import com.seedling.model.JudgeScore;
import com.seedling.model.JudgeScoresJsonCodec;
import com.seedling.model.ScoreAggregate;
import com.seedling.model.Submission;
import com.seedling.model.SubmissionStatus;
import com.seedling.model.User;
import com.seedling.repository.CompetitionRepository;
import com.seedling.repository.JudgeAssignmentRepository;
import com.seedling.repository.SubmissionRepository;
import com.seedling.web.SettlementException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class JudgingService {

    private static final Logger log = LoggerFactory.getLogger(JudgingService.class);
    private static final Set<CompetitionStatus> SCORING_STATUSES = EnumSet.of(CompetitionStatus.CLOSED, CompetitionStatus.JUDGING);
    private static final Set<SubmissionStatus> JUDGEABLE_STATUSES = EnumSet.of(
            SubmissionStatus.SUBMITTED,
            SubmissionStatus.UNDER_REVIEW,
            SubmissionStatus.WINNER
    );

    private final SubmissionRepository submissionRepository;
    private final CompetitionRepository competitionRepository;
    private final JudgeAssignmentRepository judgeAssignmentRepository;
    private final ScoringEngine scoringEngine;
    private final ActorAccessService actorAccessService;
    private final SeedlingResponseMapper seedlingResponseMapper;

    /**
     * Records or replaces the acting judge's rubric scores and re-derives the submission's final score.
     */
    @Transactional
    public JudgingResponses.ScoredSubmission submitScore(
            UUID submissionId,
            Map<String, Double> criteriaScores,
            String feedback,
            UUID actorId
    ) {
        User judge = actorAccessService.requireJudgeOrAdmin(actorId);
        Submission submission = submissionRepository.findBySubmissionIdForUpdate(submissionId)
                .orElseThrow(() -> SettlementException.notFound("Submission not found: " + submissionId));
        JudgeAssignment assignment = judgeAssignmentRepository
                .findByJudgeIdAndSubmissionId(judge.getUserId(), submissionId)
                .orElse(null);
        if (assignment == null && !judge.isAdmin()) {
            throw SettlementException.forbidden("You are not assigned to judge this submission");
        }

        Competition competition = competitionRepository.findById(submission.getCompetitionId())
                .orElseThrow(() -> SettlementException.notFound("Competition not found: " + submission.getCompetitionId()));
        if (!SCORING_STATUSES.contains(competition.getStatus())) {
            throw SettlementException.preconditionFailed(
                    "Scores can only be submitted while the competition is CLOSED or JUDGING. Current status: "
                            + competition.getStatus()
            );
        }
        Map<String, Double> rubricWeights = CompetitionTermsJsonCodec.rubricWeights(competition.getRubric());
        if (rubricWeights == null || rubricWeights.isEmpty()) {
            throw SettlementException.validationFailed("Competition rubric is invalid or missing");
        }

        OffsetDateTime now = OffsetDateTime.now();
        JudgeScore score = scoringEngine.score(
                judge.getUserId(),
                judge.getUsername(),
                rubricWeights,
                criteriaScores,
                feedback,
                now
        );

        ScoreAggregate humanScores = JudgeScoresJsonCodec.aggregateFromJson(submission.getHumanScores()).upsert(score);
        submission.setHumanScores(JudgeScoresJsonCodec.toJson(humanScores));
        List<JudgeFeedback> feedbackList = JudgeScoresJsonCodec.upsertFeedback(
                JudgeScoresJsonCodec.feedbackFromJson(submission.getJudgeFeedback()),
                new JudgeFeedback(judge.getUserId(), judge.getUsername(), feedback, now)
        );
        submission.setJudgeFeedback(JudgeScoresJsonCodec.feedbackToJson(feedbackList));
        submission.recalculateFinalScore();
        submission.setUpdatedAt(now);
        Submission saved = submissionRepository.save(submission);

        if (assignment != null && !assignment.isCompleted()) {
            assignment.setCompletedAt(now);
            judgeAssignmentRepository.save(assignment);
        }

        log.info(
                "Score recorded: submissionId={}, judgeId={}, overall={}, finalScore={}, judges={}",
                submissionId,
                judge.getUserId(),
                score.overall(),
                saved.getFinalScore(),
                humanScores.judges().size()
        );
        return seedlingResponseMapper.toScoredSubmission(saved, judge.getUserId());
    }

    /**
     * The acting judge's assignments grouped by competition, with completion counts.
     */
    @Transactional(readOnly = true)
    public List<JudgingResponses.AssignmentSummary> getJudgeAssignments(UUID actorId) {
        User judge = actorAccessService.requireJudgeOrAdmin(actorId);
        List<JudgeAssignment> assignments = judgeAssignmentRepository.findByJudgeIdOrderByAssignedAtAsc(judge.getUserId());
        if (assignments.isEmpty()) {
            return List.of();
        }

        Map<UUID, Submission> submissions = submissionRepository
                .findBySubmissionIdIn(assignments.stream().map(JudgeAssignment::getSubmissionId).toList()).stream()
                .collect(Collectors.toMap(Submission::getSubmissionId, Function.identity()));
        Map<UUID, List<JudgeAssignment>> byCompetition = new LinkedHashMap<>();
        for (JudgeAssignment assignment : assignments) {
            byCompetition.computeIfAbsent(assignment.getCompetitionId(), id -> new ArrayList<>()).add(assignment);
        }
        Map<UUID, Competition> competitions = competitionRepository.findAllById(byCompetition.keySet()).stream()
                .collect(Collectors.toMap(Competition::getCompetitionId, Function.identity()));

        List<JudgingResponses.AssignmentSummary> summaries = new ArrayList<>(byCompetition.size());
        for (Map.Entry<UUID, List<JudgeAssignment>> entry : byCompetition.entrySet()) {
            Competition competition = competitions.get(entry.getKey());
            if (competition == null) {
                continue;
            }
            List<JudgingResponses.AssignedSubmission> assigned = new ArrayList<>();
            int completed = 0;
            for (JudgeAssignment assignment : entry.getValue()) {
                Submission submission = submissions.get(assignment.getSubmissionId());
                if (assignment.isCompleted()) {
                    completed++;
                }
                assigned.add(new JudgingResponses.AssignedSubmission(
                        assignment.getAssignmentId(),
                        assignment.getSubmissionId(),
                        submission == null ? null : submission.getTitle(),
                        submission == null ? null : submission.getStatus(),
                        assignment.getAssignedAt(),
                        assignment.getCompletedAt()
                ));
            }
            summaries.add(new JudgingResponses.AssignmentSummary(
                    competition.getCompetitionId(),
                    competition.getTitle(),
                    competition.getStatus(),
                    competition.getRubric(),
                    assigned.size(),
                    completed,
                    assigned
            ));
        }
        return summaries;
    }

    /**
     * Admins see every judgeable submission; judges only the ones assigned to them.
     */
    @Transactional(readOnly = true)
    public List<JudgingResponses.ScoredSubmission> listSubmissionsForJudging(UUID competitionId, UUID actorId) {
        User judge = actorAccessService.requireJudgeOrAdmin(actorId);
        Competition competition = competitionRepository.findById(competitionId)
                .orElseThrow(() -> SettlementException.notFound("Competition not found: " + competitionId));
        Set<SubmissionStatus> visible = competition.getStatus() == CompetitionStatus.COMPLETE
                ? SubmissionStatus.RANKABLE
                : JUDGEABLE_STATUSES;

        List<Submission> submissions = submissionRepository.findByCompetitionIdAndStatusIn(competitionId, visible);
        if (!judge.isAdmin()) {
            Set<UUID> assigned = judgeAssignmentRepository.findByJudgeIdAndCompetitionId(judge.getUserId(), competitionId).stream()
                    .map(JudgeAssignment::getSubmissionId)
                    .collect(Collectors.toSet());
            submissions = submissions.stream()
                    .filter(submission -> assigned.contains(submission.getSubmissionId()))
                    .toList();
        }
        return submissions.stream()
                .sorted(Comparator.comparing(Submission::getCreatedAt))
                .map(submission -> seedlingResponseMapper.toScoredSubmission(submission, judge.getUserId()))
                .toList();
    }

    @Transactional(readOnly = true)
    public JudgingResponses.ScoredSubmission getSubmissionForJudging(UUID submissionId, UUID actorId) {
        User judge = actorAccessService.requireJudgeOrAdmin(actorId);
        Submission submission = submissionRepository.findById(submissionId)
                .orElseThrow(() -> SettlementException.notFound("Submission not found: " + submissionId));
        if (!judge.isAdmin() && !judgeAssignmentRepository.existsByJudgeIdAndSubmissionId(judge.getUserId(), submissionId)) {
            throw SettlementException.forbidden("You are not assigned to judge this submission");
        }
        return seedlingResponseMapper.toScoredSubmission(submission, judge.getUserId());
    }
}
