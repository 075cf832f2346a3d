package com.unievents.event.api.controller;

import com.unievents.common.dto.BaseResponse;
import com.unievents.common.util.Constants;
import com.unievents.event.api.dto.EventRequest;
import com.unievents.event.api.dto.EventResponse;
import com.unievents.event.api.dto.TransitionRequest;
import com.unievents.event.domain.service.ActorResolver;
import com.unievents.event.domain.service.EventLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST controller for event authoring and lifecycle transitions.
 */
@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
public class EventController {

    private final EventLifecycleService eventLifecycleService;
    private final ActorResolver actorResolver;

    @PostMapping
    public ResponseEntity<BaseResponse<EventResponse>> submitEvent(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @Valid @RequestBody EventRequest request) {
        EventResponse response = eventLifecycleService.submitEvent(request, actorResolver.resolve(actorId));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Event created successfully", response));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<EventResponse>> updateEvent(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @PathVariable UUID id,
            @Valid @RequestBody EventRequest request) {
        EventResponse response = eventLifecycleService.updateEvent(id, request, actorResolver.resolve(actorId));
        return ResponseEntity.ok(BaseResponse.success("Event updated successfully", response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<EventResponse>> getEvent(@PathVariable UUID id) {
        return ResponseEntity.ok(BaseResponse.success(eventLifecycleService.getEvent(id)));
    }

    @PostMapping("/{id}/transitions")
    public ResponseEntity<BaseResponse<EventResponse>> transitionEvent(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @PathVariable UUID id,
            @Valid @RequestBody TransitionRequest request) {
        EventResponse response = eventLifecycleService.transitionEvent(id, request, actorResolver.resolve(actorId));
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{id}/unarchive")
    public ResponseEntity<BaseResponse<EventResponse>> unarchiveEvent(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @PathVariable UUID id) {
        EventResponse response = eventLifecycleService.unarchiveEvent(id, actorResolver.resolve(actorId));
        return ResponseEntity.ok(BaseResponse.success(response));
    }
}
