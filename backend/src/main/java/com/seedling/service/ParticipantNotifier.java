package com.seedling.service;

import com.seedling.model.Competition;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outbound participant notifications. Callers treat every call as best-effort.
 */
public interface ParticipantNotifier {

    void competitionAnnounced(Competition competition);

    void winnerSelected(WinnerNotice notice);

    void participantResult(ParticipantNotice notice);

    record WinnerNotice(
            UUID userId,
            String username,
            String email,
            UUID competitionId,
            String competitionTitle,
            String place,
            BigDecimal prizeAmount,
            boolean payoutReady
    ) {
    }

    record ParticipantNotice(
            UUID userId,
            String username,
            String email,
            UUID competitionId,
            String competitionTitle,
            int rank,
            int totalParticipants
    ) {
    }
}
