package com.unievents.event.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ActorTest {

    @Test
    @DisplayName("the system actor is active but owns nothing and holds no Event Office rights")
    void systemActor() {
        Actor actor = Actor.systemActor();

        assertThat(actor.system()).isTrue();
        assertThat(actor.isActive()).isTrue();
        assertThat(actor.isEventOffice()).isFalse();
        assertThat(actor.is(null)).isFalse();
        assertThat(Actor.systemActor()).isSameAs(actor);
    }

    @Test
    @DisplayName("a suspended Event Office account loses its Event Office rights")
    void inactiveEventOffice() {
        UserAccount account = UserAccount.builder()
                .id(UUID.randomUUID())
                .email("office@uni.example")
                .role(UserRole.EVENT_OFFICE)
                .status(UserStatus.BLOCKED)
                .build();

        Actor actor = Actor.of(account);

        assertThat(actor.system()).isFalse();
        assertThat(actor.isActive()).isFalse();
        assertThat(actor.isEventOffice()).isFalse();
        assertThat(actor.is(account.getId())).isTrue();
    }

    @Test
    @DisplayName("Admin counts as Event Office")
    void adminIsEventOffice() {
        assertThat(Actor.user(UUID.randomUUID(), UserRole.ADMIN).isEventOffice()).isTrue();
        assertThat(Actor.user(UUID.randomUUID(), UserRole.STUDENT).isEventOffice()).isFalse();
    }
}
