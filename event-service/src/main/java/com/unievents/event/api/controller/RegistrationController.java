package com.unievents.event.api.controller;

import com.unievents.common.dto.BaseResponse;
import com.unievents.common.exception.ForbiddenException;
import com.unievents.common.util.Constants;
import com.unievents.event.api.dto.RegisterRequest;
import com.unievents.event.api.dto.RegistrationResponse;
import com.unievents.event.domain.model.Actor;
import com.unievents.event.domain.service.ActorResolver;
import com.unievents.event.domain.service.RegistrationEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/registrations")
@RequiredArgsConstructor
public class RegistrationController {

    private final RegistrationEngine registrationEngine;
    private final ActorResolver actorResolver;

    /**
     * Users register themselves; Event Office may register on someone's behalf.
     */
    @PostMapping
    public ResponseEntity<BaseResponse<RegistrationResponse>> register(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @Valid @RequestBody RegisterRequest request) {
        Actor actor = actorResolver.resolve(actorId);
        if (!actor.is(request.userId()) && !actor.isEventOffice()) {
            throw new ForbiddenException("Cannot register another user");
        }
        RegistrationResponse response = registrationEngine.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Registration created successfully", response));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<RegistrationResponse>> cancel(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @PathVariable UUID id) {
        RegistrationResponse response = registrationEngine.cancel(id, actorResolver.resolve(actorId));
        return ResponseEntity.ok(BaseResponse.success("Registration cancelled", response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<RegistrationResponse>> getRegistration(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @PathVariable UUID id) {
        return ResponseEntity.ok(BaseResponse.success(
                registrationEngine.getRegistration(id, actorResolver.resolve(actorId))));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<BaseResponse<List<RegistrationResponse>>> getRegistrationsByUser(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @PathVariable UUID userId) {
        return ResponseEntity.ok(BaseResponse.success(
                registrationEngine.getRegistrationsByUser(userId, actorResolver.resolve(actorId))));
    }

    @GetMapping("/event/{eventId}")
    public ResponseEntity<BaseResponse<List<RegistrationResponse>>> getRegistrationsByEvent(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @PathVariable UUID eventId) {
        return ResponseEntity.ok(BaseResponse.success(
                registrationEngine.getRegistrationsByEvent(eventId, actorResolver.resolve(actorId))));
    }
}
