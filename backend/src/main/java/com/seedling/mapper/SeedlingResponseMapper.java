package com.seedling.mapper;

import com.seedling.dto.CompetitionResponses;
import com.seedling.dto.JudgingResponses;
import com.seedling.dto.SettlementResponses;
import com.seedling.dto.SubmissionResponses;
import com.seedling.model.Competition;
import com.seedling.model.JudgeAssignment;
import com.seedling.model.JudgeScore;
import com.seedling.model.JudgeScoresJsonCodec;
import com.seedling.model.Payment;
import com.seedling.model.ScoreAggregate;
import com.seedling.model.Submission;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class SeedlingResponseMapper {

    public CompetitionResponses.CompetitionDetail toCompetitionDetail(Competition competition) {
        return new CompetitionResponses.CompetitionDetail(
                competition.getCompetitionId(),
                competition.getTitle(),
                competition.getDescription(),
                competition.getDomain(),
                competition.getStatus(),
                competition.getEntryFee(),
                competition.getPlatformFeePercentage(),
                competition.getPrizePool(),
                competition.getMaxEntries(),
                competition.getCurrentEntries(),
                competition.getOpenDate(),
                competition.getDeadline(),
                competition.getJudgingSlaDays(),
                competition.getPrizeStructure(),
                competition.getRubric(),
                competition.getCreatedBy(),
                competition.getCreatedAt(),
                competition.getUpdatedAt()
        );
    }

    public SubmissionResponses.SubmissionDetail toSubmissionDetail(Submission submission) {
        return toSubmissionDetail(submission, null);
    }

    public SubmissionResponses.SubmissionDetail toSubmissionDetail(Submission submission, String paymentClientSecret) {
        return new SubmissionResponses.SubmissionDetail(
                submission.getSubmissionId(),
                submission.getCompetitionId(),
                submission.getUserId(),
                submission.getTitle(),
                submission.getDescription(),
                submission.getStatus(),
                submission.getAttachments(),
                submission.getFinalScore(),
                submission.getPlacement(),
                submission.getSubmittedAt(),
                submission.getCreatedAt(),
                submission.getUpdatedAt(),
                paymentClientSecret
        );
    }

    public JudgingResponses.ScoredSubmission toScoredSubmission(Submission submission, UUID viewerJudgeId) {
        ScoreAggregate human = JudgeScoresJsonCodec.aggregateFromJson(submission.getHumanScores());
        JudgingResponses.JudgeScoreView myScore = human.judges().stream()
                .filter(score -> score.judgeId().equals(viewerJudgeId))
                .findFirst()
                .map(this::toJudgeScoreView)
                .orElse(null);

        return new JudgingResponses.ScoredSubmission(
                submission.getSubmissionId(),
                submission.getCompetitionId(),
                submission.getTitle(),
                submission.getDescription(),
                submission.getStatus(),
                submission.getAttachments(),
                submission.getFinalScore(),
                human.average(),
                human.judges().size(),
                myScore
        );
    }

    public JudgingResponses.JudgeScoreView toJudgeScoreView(JudgeScore judgeScore) {
        return new JudgingResponses.JudgeScoreView(
                judgeScore.judgeId(),
                judgeScore.judgeName(),
                judgeScore.criteriaScores(),
                judgeScore.overall(),
                judgeScore.feedback(),
                judgeScore.submittedAt()
        );
    }

    public SettlementResponses.JudgeAssignmentView toJudgeAssignmentView(JudgeAssignment assignment, String judgeUsername) {
        return new SettlementResponses.JudgeAssignmentView(
                assignment.getAssignmentId(),
                assignment.getCompetitionId(),
                assignment.getSubmissionId(),
                assignment.getJudgeId(),
                judgeUsername,
                assignment.getAssignedBy(),
                assignment.getAssignedAt(),
                assignment.getCompletedAt()
        );
    }

    public SettlementResponses.PaymentView toPaymentView(Payment payment) {
        return new SettlementResponses.PaymentView(
                payment.getPaymentId(),
                payment.getUserId(),
                payment.getCompetitionId(),
                payment.getSubmissionId(),
                payment.getType(),
                payment.getStatus(),
                payment.getAmount(),
                payment.getProcessorChargeId(),
                payment.getProcessorTransferId(),
                payment.getFailureReason(),
                payment.getProcessedAt(),
                payment.getCreatedAt()
        );
    }
}
