package com.unievents.event.domain.access;

import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.model.UserAccount;
import com.unievents.event.domain.repository.WhitelistEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides whether a user may see and register for an event.
 *
 * Order of checks:
 * 1. Inactive users (BLOCKED, PENDING_VERIFICATION) are denied, whitelist or not.
 * 2. Events without role restriction are open to every active user.
 * 3. Restricted events admit the listed roles, plus whitelisted users and whitelisted roles.
 *
 * Reads current state only; safe to call repeatedly and concurrently.
 */
@Component
@RequiredArgsConstructor
public class AccessControlResolver {

    private final WhitelistEntryRepository whitelistEntryRepository;

    public boolean canAccess(Event event, UserAccount user) {
        return evaluate(event, user).granted();
    }

    public AccessDecision evaluate(Event event, UserAccount user) {
        if (user == null || !user.isActive()) {
            return AccessDecision.DENIED_INACTIVE_USER;
        }
        if (!event.isRestricted()) {
            return AccessDecision.GRANTED_UNRESTRICTED;
        }
        if (event.getRestrictedTo().contains(user.getRole())) {
            return AccessDecision.GRANTED_BY_ROLE;
        }
        if (whitelistEntryRepository.existsByEventIdAndUserId(event.getId(), user.getId())) {
            return AccessDecision.GRANTED_BY_USER_WHITELIST;
        }
        if (whitelistEntryRepository.existsByEventIdAndRole(event.getId(), user.getRole())) {
            return AccessDecision.GRANTED_BY_ROLE_WHITELIST;
        }
        return AccessDecision.DENIED_RESTRICTED;
    }
}
