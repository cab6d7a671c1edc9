package com.seedling.controller;

import com.seedling.dto.SettlementResponses;
import com.seedling.service.PrizeDistributionService;
import com.seedling.web.ActorHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/payments")
public class PaymentController {

    private final PrizeDistributionService prizeDistributionService;

    public PaymentController(PrizeDistributionService prizeDistributionService) {
        this.prizeDistributionService = prizeDistributionService;
    }

    @GetMapping("/my-winnings")
    public ResponseEntity<List<SettlementResponses.WinningView>> myWinnings(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId
    ) {
        return ResponseEntity.ok(prizeDistributionService.myWinnings(actorId));
    }
}
