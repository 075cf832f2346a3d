package com.unievents.event.api.controller;

import com.unievents.common.exception.ConflictException;
import com.unievents.common.exception.ForbiddenException;
import com.unievents.common.exception.ResourceNotFoundException;
import com.unievents.event.api.dto.TransitionRequest;
import com.unievents.event.domain.exception.EventErrorCodes;
import com.unievents.event.domain.model.Actor;
import com.unievents.event.domain.model.EventStatus;
import com.unievents.event.domain.model.UserRole;
import com.unievents.event.domain.service.ActorResolver;
import com.unievents.event.domain.service.EventLifecycleService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EventController.class)
class EventControllerTest {

    private static final UUID EVENT_ID = UUID.fromString("aaaaaaaa-0000-0000-0000-000000000002");
    private static final UUID PROFESSOR_ID = UUID.fromString("cccccccc-0000-0000-0000-000000000001");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EventLifecycleService eventLifecycleService;

    @MockBean
    private ActorResolver actorResolver;

    @Test
    @DisplayName("creator publishing a workshop gets 403 FORBIDDEN_TRANSITION")
    void transition_forbidden() throws Exception {
        Actor professor = Actor.user(PROFESSOR_ID, UserRole.PROFESSOR);
        given(actorResolver.resolve(PROFESSOR_ID)).willReturn(professor);
        given(eventLifecycleService.transitionEvent(eq(EVENT_ID), any(TransitionRequest.class), eq(professor)))
                .willThrow(new ForbiddenException("Actor may not move WORKSHOP event from APPROVED to PUBLISHED",
                        EventErrorCodes.FORBIDDEN_TRANSITION));

        mockMvc.perform(post("/api/v1/events/{id}/transitions", EVENT_ID)
                        .header("X-Actor-Id", PROFESSOR_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetStatus\":\"PUBLISHED\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value(EventErrorCodes.FORBIDDEN_TRANSITION));
    }

    @Test
    @DisplayName("edge outside the table gets 409 INVALID_TRANSITION")
    void transition_invalid() throws Exception {
        given(actorResolver.resolve(PROFESSOR_ID)).willReturn(Actor.user(PROFESSOR_ID, UserRole.PROFESSOR));
        given(eventLifecycleService.transitionEvent(eq(EVENT_ID), any(TransitionRequest.class), any(Actor.class)))
                .willThrow(new ConflictException("Transition DRAFT -> PUBLISHED is not allowed",
                        EventErrorCodes.INVALID_TRANSITION));

        mockMvc.perform(post("/api/v1/events/{id}/transitions", EVENT_ID)
                        .header("X-Actor-Id", PROFESSOR_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetStatus\":\"PUBLISHED\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value(EventErrorCodes.INVALID_TRANSITION));
    }

    @Test
    @DisplayName("unknown target status in the body is a 400 VALIDATION_ERROR")
    void transition_unknownStatus() throws Exception {
        mockMvc.perform(post("/api/v1/events/{id}/transitions", EVENT_ID)
                        .header("X-Actor-Id", PROFESSOR_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetStatus\":\"LAUNCHED\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("unknown event is a 404 RESOURCE_NOT_FOUND")
    void getEvent_notFound() throws Exception {
        given(eventLifecycleService.getEvent(EVENT_ID)).willThrow(new ResourceNotFoundException("Event", EVENT_ID));

        mockMvc.perform(get("/api/v1/events/{id}", EVENT_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("RESOURCE_NOT_FOUND"));
    }

    @Test
    @DisplayName("status values are accepted by name")
    void transitionRequest_statusByName() throws Exception {
        given(actorResolver.resolve(PROFESSOR_ID)).willReturn(Actor.user(PROFESSOR_ID, UserRole.PROFESSOR));
        given(eventLifecycleService.transitionEvent(eq(EVENT_ID),
                eq(new TransitionRequest(EventStatus.PENDING_APPROVAL, null)), any(Actor.class)))
                .willReturn(null);

        mockMvc.perform(post("/api/v1/events/{id}/transitions", EVENT_ID)
                        .header("X-Actor-Id", PROFESSOR_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetStatus\":\"PENDING_APPROVAL\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }
}
