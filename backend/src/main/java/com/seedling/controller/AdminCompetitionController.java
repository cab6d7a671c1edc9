package com.seedling.controller;

import com.seedling.dto.AdminRequests;
import com.seedling.dto.LeaderboardResponses;
import com.seedling.dto.SettlementResponses;
import com.seedling.service.JudgeAssignmentService;
import com.seedling.service.LeaderboardService;
import com.seedling.service.PrizeDistributionService;
import com.seedling.service.WinnerSelectionService;
import com.seedling.web.ActorHeaders;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin")
public class AdminCompetitionController {

    private final JudgeAssignmentService judgeAssignmentService;
    private final LeaderboardService leaderboardService;
    private final WinnerSelectionService winnerSelectionService;
    private final PrizeDistributionService prizeDistributionService;

    public AdminCompetitionController(
            JudgeAssignmentService judgeAssignmentService,
            LeaderboardService leaderboardService,
            WinnerSelectionService winnerSelectionService,
            PrizeDistributionService prizeDistributionService
    ) {
        this.judgeAssignmentService = judgeAssignmentService;
        this.leaderboardService = leaderboardService;
        this.winnerSelectionService = winnerSelectionService;
        this.prizeDistributionService = prizeDistributionService;
    }

    @PostMapping("/competitions/{competitionId}/judge-assignments")
    public ResponseEntity<List<SettlementResponses.JudgeAssignmentView>> assignJudges(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID competitionId,
            @RequestParam(name = "replace", defaultValue = "false") boolean replace,
            @Valid @RequestBody AdminRequests.AssignJudgesRequest request
    ) {
        List<SettlementResponses.JudgeAssignmentView> assignments =
                judgeAssignmentService.assignJudges(competitionId, request, replace, actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(assignments);
    }

    @GetMapping("/competitions/{competitionId}/judge-assignments")
    public ResponseEntity<List<SettlementResponses.JudgeAssignmentView>> listAssignments(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID competitionId
    ) {
        return ResponseEntity.ok(judgeAssignmentService.listAssignments(competitionId, actorId));
    }

    @PatchMapping("/judge-assignments/{assignmentId}")
    public ResponseEntity<SettlementResponses.JudgeAssignmentView> reassignJudge(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID assignmentId,
            @Valid @RequestBody AdminRequests.ReassignJudgeRequest request
    ) {
        return ResponseEntity.ok(judgeAssignmentService.reassign(assignmentId, request.judgeId(), actorId));
    }

    @GetMapping("/competitions/{competitionId}/leaderboard")
    public ResponseEntity<LeaderboardResponses.Leaderboard> getLeaderboard(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID competitionId
    ) {
        return ResponseEntity.ok(leaderboardService.adminLeaderboard(competitionId, actorId));
    }

    @PostMapping("/competitions/{competitionId}/winners")
    public ResponseEntity<SettlementResponses.WinnerSelectionResult> selectWinners(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID competitionId,
            @Valid @RequestBody AdminRequests.SelectWinnersRequest request
    ) {
        return ResponseEntity.ok(winnerSelectionService.selectWinners(competitionId, request.winners(), actorId));
    }

    @PostMapping("/competitions/{competitionId}/distribute-prizes")
    public ResponseEntity<SettlementResponses.PrizeDistributionResult> distributePrizes(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID competitionId
    ) {
        return ResponseEntity.ok(prizeDistributionService.distributePrizes(competitionId, actorId));
    }

    @GetMapping("/competitions/{competitionId}/payments")
    public ResponseEntity<List<SettlementResponses.PaymentView>> listPayouts(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID competitionId
    ) {
        return ResponseEntity.ok(prizeDistributionService.listCompetitionPayouts(competitionId, actorId));
    }
}
