package com.seedling.service;

import com.seedling.model.Competition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingParticipantNotifier implements ParticipantNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingParticipantNotifier.class);

    @Override
    public void competitionAnnounced(Competition competition) {
        log.info(
                "Competition announced: competitionId={}, title={}, openDate={}",
                competition.getCompetitionId(),
                competition.getTitle(),
                competition.getOpenDate()
        );
    }

    @Override
    public void winnerSelected(WinnerNotice notice) {
        log.info(
                "Winner notification: userId={}, competitionId={}, place={}, prizeAmount={}, payoutReady={}",
                notice.userId(),
                notice.competitionId(),
                notice.place(),
                notice.prizeAmount(),
                notice.payoutReady()
        );
    }

    @Override
    public void participantResult(ParticipantNotice notice) {
        log.info(
                "Participant notification: userId={}, competitionId={}, rank={}/{}",
                notice.userId(),
                notice.competitionId(),
                notice.rank(),
                notice.totalParticipants()
        );
    }
}
