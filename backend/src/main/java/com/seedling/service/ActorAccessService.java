package com.seedling.service;

import com.seedling.model.User;
import com.seedling.repository.UserRepository;
import com.seedling.web.SettlementException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Resolves the acting user of a request and enforces role checks.
 */
@Service
@RequiredArgsConstructor
public class ActorAccessService {

    private final UserRepository userRepository;

    public User requireUser(UUID userId) {
        if (userId == null) {
            throw SettlementException.forbidden("An acting user is required");
        }
        return userRepository.findById(userId)
                .orElseThrow(() -> SettlementException.forbidden("Unknown user: " + userId));
    }

    public User requireAdmin(UUID userId) {
        User user = requireUser(userId);
        if (!user.isAdmin()) {
            throw SettlementException.forbidden("Admin role required");
        }
        return user;
    }

    public User requireJudgeOrAdmin(UUID userId) {
        User user = requireUser(userId);
        if (!user.canJudge()) {
            throw SettlementException.forbidden("Judge or admin role required");
        }
        return user;
    }

    public void requireOwnerOrAdmin(User actor, UUID ownerId, String detail) {
        if (!actor.isAdmin() && !actor.getUserId().equals(ownerId)) {
            throw SettlementException.forbidden(detail);
        }
    }
}
