package com.seedling.service;

import com.seedling.dto.SubmissionRequests;
import com.seedling.dto.SubmissionResponses;
import com.seedling.mapper.SeedlingResponseMapper;
import com.seedling.model.Competition;
import com.seedling.model.CompetitionStatus;
import com.seedling.model.Submission;
import com.seedling.model.SubmissionStatus;
import com.seedling.model.User;
import com.seedling.repository.CompetitionRepository;
import com.seedling.repository.PaymentRepository;
import com.seedling.repository.SubmissionRepository;
import com.seedling.web.SettlementException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);
    private static final Set<SubmissionStatus> ENTERED_STATUSES = EnumSet.of(
            SubmissionStatus.SUBMITTED,
            SubmissionStatus.UNDER_REVIEW,
            SubmissionStatus.WINNER,
            SubmissionStatus.NOT_SELECTED
    );
    private static final Set<SubmissionStatus> OPEN_STATUSES = EnumSet.of(
            SubmissionStatus.DRAFT,
            SubmissionStatus.PENDING_PAYMENT
    );
    private static final Set<SubmissionStatus> ADMIN_OVERRIDE_STATUSES = EnumSet.of(
            SubmissionStatus.UNDER_REVIEW,
            SubmissionStatus.REJECTED
    );

    private final SubmissionRepository submissionRepository;
    private final CompetitionRepository competitionRepository;
    private final PaymentRepository paymentRepository;
    private final EntryFeeSettlementService entryFeeSettlementService;
    private final ActorAccessService actorAccessService;
    private final SeedlingResponseMapper seedlingResponseMapper;

    @Transactional
    public SubmissionResponses.SubmissionDetail createSubmission(
            UUID competitionId,
            SubmissionRequests.CreateSubmissionRequest request,
            UUID actorId
    ) {
        User actor = actorAccessService.requireUser(actorId);
        Competition competition = competitionRepository.findById(competitionId)
                .orElseThrow(() -> SettlementException.notFound("Competition not found: " + competitionId));
        if (competition.getStatus() != CompetitionStatus.ACTIVE) {
            throw SettlementException.preconditionFailed(
                    "Competition is not active. Current status: " + competition.getStatus()
            );
        }

        if (!submissionRepository.findByCompetitionIdAndUserIdAndStatusIn(competitionId, actor.getUserId(), ENTERED_STATUSES).isEmpty()) {
            throw SettlementException.conflict("You have already submitted an entry for this competition");
        }
        List<Submission> open = submissionRepository.findByCompetitionIdAndUserIdAndStatusIn(
                competitionId,
                actor.getUserId(),
                OPEN_STATUSES
        );
        if (!open.isEmpty()) {
            throw SettlementException.conflict(
                    "You already have a submission (ID: " + open.get(0).getSubmissionId() + ") for this competition"
            );
        }

        SubmissionStatus requested = request.status() == null ? SubmissionStatus.DRAFT : request.status();
        if (requested != SubmissionStatus.DRAFT && requested != SubmissionStatus.SUBMITTED) {
            throw SettlementException.validationFailed("New submissions may only be created as DRAFT or SUBMITTED");
        }

        Submission submission = new Submission();
        submission.setSubmissionId(UUID.randomUUID());
        submission.setCompetitionId(competitionId);
        submission.setUserId(actor.getUserId());
        submission.setTitle(request.title());
        submission.setDescription(request.description());
        submission.setAttachments(request.attachments());
        submission.setStatus(SubmissionStatus.DRAFT);
        Submission saved = submissionRepository.save(submission);
        log.info("Submission created: submissionId={}, competitionId={}, userId={}", saved.getSubmissionId(), competitionId, actor.getUserId());

        if (requested == SubmissionStatus.SUBMITTED) {
            EntryFeeSettlementService.EntryRequestOutcome outcome = entryFeeSettlementService.requestEntry(saved, competition);
            return seedlingResponseMapper.toSubmissionDetail(reload(saved), outcome.clientSecret());
        }
        return seedlingResponseMapper.toSubmissionDetail(saved);
    }

    @Transactional
    public SubmissionResponses.SubmissionDetail updateSubmission(
            UUID submissionId,
            SubmissionRequests.UpdateSubmissionRequest request,
            UUID actorId
    ) {
        User actor = actorAccessService.requireUser(actorId);
        Submission submission = submissionRepository.findBySubmissionIdForUpdate(submissionId)
                .orElseThrow(() -> SettlementException.notFound("Submission not found: " + submissionId));
        actorAccessService.requireOwnerOrAdmin(actor, submission.getUserId(), "You can only edit your own submissions");

        if (!actor.isAdmin() && !submission.getStatus().isOwnerEditable()) {
            throw SettlementException.preconditionFailed("Cannot edit submission after it has been submitted");
        }

        boolean contentChange = request.title() != null || request.description() != null || request.attachments() != null;
        if (contentChange && !submission.getStatus().isOwnerEditable()) {
            throw SettlementException.preconditionFailed("Cannot edit submission after it has been submitted");
        }
        if (request.title() != null) {
            submission.setTitle(request.title());
        }
        if (request.description() != null) {
            submission.setDescription(request.description());
        }
        if (request.attachments() != null) {
            submission.setAttachments(request.attachments());
        }
        submission.setUpdatedAt(OffsetDateTime.now());
        Submission saved = submissionRepository.save(submission);

        SubmissionStatus requested = request.status();
        if (requested == null || requested == saved.getStatus()) {
            return seedlingResponseMapper.toSubmissionDetail(saved);
        }

        if (requested == SubmissionStatus.SUBMITTED) {
            if (!saved.getStatus().isOwnerEditable()) {
                throw SettlementException.preconditionFailed(
                        "Submission cannot be submitted from status " + saved.getStatus()
                );
            }
            Competition competition = competitionRepository.findById(saved.getCompetitionId())
                    .orElseThrow(() -> SettlementException.notFound("Competition not found: " + saved.getCompetitionId()));
            EntryFeeSettlementService.EntryRequestOutcome outcome = entryFeeSettlementService.requestEntry(saved, competition);
            return seedlingResponseMapper.toSubmissionDetail(reload(saved), outcome.clientSecret());
        }

        if (actor.isAdmin() && ADMIN_OVERRIDE_STATUSES.contains(requested)
                && SubmissionStatus.IN_CONTENTION.contains(saved.getStatus())) {
            SubmissionStatus previous = saved.getStatus();
            saved.setStatus(requested);
            saved.setUpdatedAt(OffsetDateTime.now());
            Submission overridden = submissionRepository.save(saved);
            log.info(
                    "Submission status overridden: submissionId={}, from={}, to={}, adminId={}",
                    submissionId,
                    previous,
                    requested,
                    actor.getUserId()
            );
            return seedlingResponseMapper.toSubmissionDetail(overridden);
        }

        throw SettlementException.validationFailed(
                "Cannot change submission status from " + saved.getStatus() + " to " + requested
        );
    }

    /**
     * Explicitly requests a new entry-fee charge for a draft submission.
     */
    @Transactional
    public SubmissionResponses.SubmissionDetail createPaymentIntent(UUID submissionId, UUID actorId) {
        User actor = actorAccessService.requireUser(actorId);
        Submission submission = submissionRepository.findBySubmissionIdForUpdate(submissionId)
                .orElseThrow(() -> SettlementException.notFound("Submission not found: " + submissionId));
        actorAccessService.requireOwnerOrAdmin(actor, submission.getUserId(), "You can only pay for your own submissions");
        if (submission.getStatus() != SubmissionStatus.DRAFT) {
            throw SettlementException.preconditionFailed(
                    "Payment can only be started for a DRAFT submission. Current status: " + submission.getStatus()
            );
        }
        Competition competition = competitionRepository.findById(submission.getCompetitionId())
                .orElseThrow(() -> SettlementException.notFound("Competition not found: " + submission.getCompetitionId()));
        EntryFeeSettlementService.EntryRequestOutcome outcome = entryFeeSettlementService.requestEntry(submission, competition);
        return seedlingResponseMapper.toSubmissionDetail(reload(submission), outcome.clientSecret());
    }

    @Transactional
    public SubmissionResponses.PaymentStatusCheck checkPaymentStatus(UUID submissionId, UUID actorId) {
        User actor = actorAccessService.requireUser(actorId);
        Submission submission = submissionRepository.findById(submissionId)
                .orElseThrow(() -> SettlementException.notFound("Submission not found: " + submissionId));
        actorAccessService.requireOwnerOrAdmin(actor, submission.getUserId(), "You can only check your own submissions");
        return entryFeeSettlementService.pollEntryFee(submission);
    }

    @Transactional
    public void deleteSubmission(UUID submissionId, UUID actorId) {
        User actor = actorAccessService.requireUser(actorId);
        Submission submission = submissionRepository.findBySubmissionIdForUpdate(submissionId)
                .orElseThrow(() -> SettlementException.notFound("Submission not found: " + submissionId));
        actorAccessService.requireOwnerOrAdmin(actor, submission.getUserId(), "You can only delete your own submissions");
        if (submission.getStatus() != SubmissionStatus.DRAFT) {
            throw SettlementException.preconditionFailed("Only DRAFT submissions can be deleted");
        }
        if (paymentRepository.existsBySubmissionId(submissionId)) {
            throw SettlementException.preconditionFailed("Submissions with payment history cannot be deleted");
        }
        submissionRepository.delete(submission);
        log.info("Submission deleted: submissionId={}, actorId={}", submissionId, actor.getUserId());
    }

    private Submission reload(Submission submission) {
        return submissionRepository.findById(submission.getSubmissionId()).orElse(submission);
    }
}
