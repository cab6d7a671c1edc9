package com.seedling.service;

import com.seedling.dto.AdminRequests;
import com.seedling.dto.SettlementResponses;
import com.seedling.mapper.SeedlingResponseMapper;
import com.seedling.model.Competition;
import com.seedling.model.CompetitionStatus;
import com.seedling.model.JudgeAssignment;
import com.seedling.model.Submission;
import com.seedling.model.SubmissionStatus;
import com.seedling.model.User;
import com.seedling.repository.CompetitionRepository;
import com.seedling.repository.JudgeAssignmentRepository;
import com.seedling.repository.SubmissionRepository;
import com.seedling.repository.UserRepository;
import com.seedling.web.SettlementException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class JudgeAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(JudgeAssignmentService.class);
    private static final Set<CompetitionStatus> ASSIGNABLE_COMPETITION_STATUSES =
            EnumSet.of(CompetitionStatus.CLOSED, CompetitionStatus.JUDGING);

    private final JudgeAssignmentRepository judgeAssignmentRepository;
    private final CompetitionRepository competitionRepository;
    private final SubmissionRepository submissionRepository;
    private final UserRepository userRepository;
    private final ActorAccessService actorAccessService;
    private final SeedlingResponseMapper seedlingResponseMapper;

    @Transactional
    public List<SettlementResponses.JudgeAssignmentView> assignJudges(
            UUID competitionId,
            AdminRequests.AssignJudgesRequest request,
            boolean replaceExisting,
            UUID actorId
    ) {
        User admin = actorAccessService.requireAdmin(actorId);
        Competition competition = competitionRepository.findById(competitionId)
                .orElseThrow(() -> SettlementException.notFound("Competition not found: " + competitionId));
        if (!ASSIGNABLE_COMPETITION_STATUSES.contains(competition.getStatus())) {
            throw SettlementException.preconditionFailed(
                    "Judges can only be assigned while the competition is CLOSED or JUDGING. Current status: "
                            + competition.getStatus(),
                    Map.of("currentStatus", competition.getStatus(), "requiredStatus", ASSIGNABLE_COMPETITION_STATUSES)
            );
        }

        Set<UUID> judgeIds = new LinkedHashSet<>();
        Set<UUID> submissionIds = new LinkedHashSet<>();
        for (AdminRequests.JudgeAssignmentSpec spec : request.assignments()) {
            judgeIds.add(spec.judgeId());
            submissionIds.addAll(spec.submissionIds());
        }

        Map<UUID, User> judges = userRepository.findAllById(judgeIds).stream()
                .collect(Collectors.toMap(User::getUserId, Function.identity()));
        for (UUID judgeId : judgeIds) {
            User judge = judges.get(judgeId);
            if (judge == null) {
                throw SettlementException.notFound("Judge not found: " + judgeId);
            }
            if (!judge.canJudge()) {
                throw SettlementException.validationFailed("User " + judgeId + " is not a judge or admin");
            }
        }

        Map<UUID, Submission> submissions = submissionRepository.findBySubmissionIdIn(submissionIds).stream()
                .collect(Collectors.toMap(Submission::getSubmissionId, Function.identity()));
        for (UUID submissionId : submissionIds) {
            Submission submission = submissions.get(submissionId);
            if (submission == null) {
                throw SettlementException.notFound("Submission not found: " + submissionId);
            }
            if (!submission.getCompetitionId().equals(competitionId)) {
                throw SettlementException.validationFailed(
                        "Submission " + submissionId + " does not belong to competition " + competitionId
                );
            }
            if (!SubmissionStatus.IN_CONTENTION.contains(submission.getStatus())) {
                throw SettlementException.validationFailed(
                        "Submission " + submissionId + " is not eligible for judging (status: " + submission.getStatus() + ")"
                );
            }
        }

        if (replaceExisting) {
            int removed = judgeAssignmentRepository.deleteByCompetitionId(competitionId);
            log.info("Replaced judge assignments: competitionId={}, removed={}", competitionId, removed);
        }

        OffsetDateTime now = OffsetDateTime.now();
        int created = 0;
        int skipped = 0;
        for (AdminRequests.JudgeAssignmentSpec spec : request.assignments()) {
            for (UUID submissionId : new LinkedHashSet<>(spec.submissionIds())) {
                if (judgeAssignmentRepository.existsByJudgeIdAndSubmissionId(spec.judgeId(), submissionId)) {
                    skipped++;
                    continue;
                }
                JudgeAssignment assignment = new JudgeAssignment();
                assignment.setAssignmentId(UUID.randomUUID());
                assignment.setCompetitionId(competitionId);
                assignment.setSubmissionId(submissionId);
                assignment.setJudgeId(spec.judgeId());
                assignment.setAssignedBy(admin.getUserId());
                assignment.setAssignedAt(now);
                judgeAssignmentRepository.save(assignment);
                created++;

                Submission submission = submissions.get(submissionId);
                if (submission.getStatus() == SubmissionStatus.SUBMITTED) {
                    submission.setStatus(SubmissionStatus.UNDER_REVIEW);
                    submission.setUpdatedAt(now);
                    submissionRepository.save(submission);
                }
            }
        }

        log.info(
                "Judge assignments updated: competitionId={}, created={}, skippedExisting={}, replace={}",
                competitionId,
                created,
                skipped,
                replaceExisting
        );
        return toViews(judgeAssignmentRepository.findByCompetitionIdOrderByAssignedAtAsc(competitionId));
    }

    @Transactional(readOnly = true)
    public List<SettlementResponses.JudgeAssignmentView> listAssignments(UUID competitionId, UUID actorId) {
        actorAccessService.requireAdmin(actorId);
        if (!competitionRepository.existsById(competitionId)) {
            throw SettlementException.notFound("Competition not found: " + competitionId);
        }
        return toViews(judgeAssignmentRepository.findByCompetitionIdOrderByAssignedAtAsc(competitionId));
    }

    /**
     * Moves one assignment to a different judge. The new assignment starts uncompleted.
     */
    @Transactional
    public SettlementResponses.JudgeAssignmentView reassign(UUID assignmentId, UUID newJudgeId, UUID actorId) {
        User admin = actorAccessService.requireAdmin(actorId);
        JudgeAssignment current = judgeAssignmentRepository.findById(assignmentId)
                .orElseThrow(() -> SettlementException.notFound("Assignment not found: " + assignmentId));
        User newJudge = userRepository.findById(newJudgeId)
                .orElseThrow(() -> SettlementException.notFound("Judge not found: " + newJudgeId));
        if (!newJudge.canJudge()) {
            throw SettlementException.validationFailed("User " + newJudgeId + " is not a judge or admin");
        }
        if (current.getJudgeId().equals(newJudgeId)) {
            throw SettlementException.validationFailed("New judge is the same as the current judge");
        }
        if (judgeAssignmentRepository.existsByJudgeIdAndSubmissionId(newJudgeId, current.getSubmissionId())) {
            throw SettlementException.conflict("Judge " + newJudgeId + " is already assigned to this submission");
        }

        JudgeAssignment replacement = new JudgeAssignment();
        replacement.setAssignmentId(UUID.randomUUID());
        replacement.setCompetitionId(current.getCompetitionId());
        replacement.setSubmissionId(current.getSubmissionId());
        replacement.setJudgeId(newJudgeId);
        replacement.setAssignedBy(admin.getUserId());
        replacement.setAssignedAt(OffsetDateTime.now());

        judgeAssignmentRepository.delete(current);
        JudgeAssignment saved = judgeAssignmentRepository.save(replacement);
        log.info(
                "Judge reassigned: submissionId={}, fromJudgeId={}, toJudgeId={}",
                current.getSubmissionId(),
                current.getJudgeId(),
                newJudgeId
        );
        return seedlingResponseMapper.toJudgeAssignmentView(saved, newJudge.getUsername());
    }

    /**
     * Judging progress of each submission, keyed by submission id.
     */
    @Transactional(readOnly = true)
    public Map<UUID, LeaderboardRanker.RankingCandidate> rankingCandidates(Collection<Submission> submissions) {
        Map<UUID, int[]> counts = new HashMap<>();
        List<UUID> submissionIds = submissions.stream().map(Submission::getSubmissionId).toList();
        if (!submissionIds.isEmpty()) {
            for (JudgeAssignment assignment : judgeAssignmentRepository.findBySubmissionIdIn(submissionIds)) {
                int[] tally = counts.computeIfAbsent(assignment.getSubmissionId(), id -> new int[2]);
                tally[0]++;
                if (assignment.isCompleted()) {
                    tally[1]++;
                }
            }
        }

        Map<UUID, LeaderboardRanker.RankingCandidate> candidates = new LinkedHashMap<>();
        for (Submission submission : submissions) {
            int[] tally = counts.getOrDefault(submission.getSubmissionId(), new int[2]);
            candidates.put(
                    submission.getSubmissionId(),
                    new LeaderboardRanker.RankingCandidate(
                            submission.getSubmissionId(),
                            submission.getFinalScore(),
                            tally[0],
                            tally[1]
                    )
            );
        }
        return candidates;
    }

    private List<SettlementResponses.JudgeAssignmentView> toViews(List<JudgeAssignment> assignments) {
        Set<UUID> judgeIds = assignments.stream().map(JudgeAssignment::getJudgeId).collect(Collectors.toSet());
        Map<UUID, String> usernames = userRepository.findAllById(judgeIds).stream()
                .collect(Collectors.toMap(User::getUserId, User::getUsername));
        return assignments.stream()
                .map(assignment -> seedlingResponseMapper.toJudgeAssignmentView(
                        assignment,
                        usernames.get(assignment.getJudgeId())
                ))
                .toList();
    }
}
