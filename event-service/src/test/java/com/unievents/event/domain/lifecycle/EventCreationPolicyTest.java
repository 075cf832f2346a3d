package com.unievents.event.domain.lifecycle;

import com.unievents.event.domain.model.Actor;
import com.unievents.event.domain.model.EventType;
import com.unievents.event.domain.model.UserRole;
import com.unievents.event.domain.model.UserStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class EventCreationPolicyTest {

    private static Actor as(UserRole role) {
        return Actor.user(UUID.randomUUID(), role);
    }

    @Test
    @DisplayName("workshops are created by professors and the office, booths by vendors and the office")
    void creatorRoles() {
        assertThat(EventCreationPolicy.mayCreate(as(UserRole.PROFESSOR), EventType.WORKSHOP)).isTrue();
        assertThat(EventCreationPolicy.mayCreate(as(UserRole.PROFESSOR), EventType.TRIP)).isFalse();
        assertThat(EventCreationPolicy.mayCreate(as(UserRole.VENDOR), EventType.BOOTH)).isTrue();
        assertThat(EventCreationPolicy.mayCreate(as(UserRole.VENDOR), EventType.BAZAAR)).isFalse();
        assertThat(EventCreationPolicy.mayCreate(as(UserRole.STUDENT), EventType.GYM_SESSION)).isFalse();

        for (EventType type : EventType.values()) {
            assertThat(EventCreationPolicy.mayCreate(as(UserRole.EVENT_OFFICE), type)).as(type.name()).isTrue();
            assertThat(EventCreationPolicy.mayCreate(as(UserRole.ADMIN), type)).as(type.name()).isTrue();
        }
    }

    @Test
    @DisplayName("inactive users and the system actor create nothing")
    void inactiveAndSystem() {
        Actor blocked = new Actor(UUID.randomUUID(), UserRole.ADMIN, UserStatus.BLOCKED, false);

        assertThat(EventCreationPolicy.mayCreate(blocked, EventType.TRIP)).isFalse();
        assertThat(EventCreationPolicy.mayCreate(Actor.systemActor(), EventType.TRIP)).isFalse();
    }
}
