package com.unievents.event.domain.service;

import com.unievents.common.exception.ForbiddenException;
import com.unievents.event.domain.model.Actor;
import com.unievents.event.domain.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Turns the caller id from the request header into an {@link Actor} with its current role and status.
 */
@Component
@RequiredArgsConstructor
public class ActorResolver {

    private final UserAccountRepository userAccountRepository;

    @Transactional(readOnly = true)
    public Actor resolve(UUID actorId) {
        if (actorId == null) {
            throw new ForbiddenException("Caller identity is required");
        }
        return userAccountRepository.findById(actorId)
                .map(Actor::of)
                .orElseThrow(() -> new ForbiddenException("Unknown caller " + actorId));
    }
}
