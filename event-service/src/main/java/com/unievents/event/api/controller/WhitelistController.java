package com.unievents.event.api.controller;

import com.unievents.common.dto.BaseResponse;
import com.unievents.common.util.Constants;
import com.unievents.event.api.dto.AccessCheckResponse;
import com.unievents.event.api.dto.WhitelistEntryResponse;
import com.unievents.event.domain.model.UserRole;
import com.unievents.event.domain.service.ActorResolver;
import com.unievents.event.domain.service.WhitelistService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/events/{eventId}")
@RequiredArgsConstructor
public class WhitelistController {

    private final WhitelistService whitelistService;
    private final ActorResolver actorResolver;

    @PostMapping("/whitelist/users/{userId}")
    public ResponseEntity<BaseResponse<WhitelistEntryResponse>> whitelistUser(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @PathVariable UUID eventId,
            @PathVariable UUID userId) {
        return ResponseEntity.ok(BaseResponse.success(
                whitelistService.whitelistUser(eventId, userId, actorResolver.resolve(actorId))));
    }

    @DeleteMapping("/whitelist/users/{userId}")
    public ResponseEntity<BaseResponse<Void>> removeWhitelistUser(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @PathVariable UUID eventId,
            @PathVariable UUID userId) {
        whitelistService.removeWhitelistUser(eventId, userId, actorResolver.resolve(actorId));
        return ResponseEntity.ok(BaseResponse.success("User removed from whitelist", null));
    }

    @PostMapping("/whitelist/roles/{role}")
    public ResponseEntity<BaseResponse<WhitelistEntryResponse>> whitelistRole(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @PathVariable UUID eventId,
            @PathVariable UserRole role) {
        return ResponseEntity.ok(BaseResponse.success(
                whitelistService.whitelistRole(eventId, role, actorResolver.resolve(actorId))));
    }

    @DeleteMapping("/whitelist/roles/{role}")
    public ResponseEntity<BaseResponse<Void>> removeWhitelistRole(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @PathVariable UUID eventId,
            @PathVariable UserRole role) {
        whitelistService.removeWhitelistRole(eventId, role, actorResolver.resolve(actorId));
        return ResponseEntity.ok(BaseResponse.success("Role removed from whitelist", null));
    }

    @GetMapping("/whitelist")
    public ResponseEntity<BaseResponse<List<WhitelistEntryResponse>>> listWhitelist(
            @RequestHeader(Constants.ACTOR_HEADER) UUID actorId,
            @PathVariable UUID eventId) {
        return ResponseEntity.ok(BaseResponse.success(
                whitelistService.listWhitelist(eventId, actorResolver.resolve(actorId))));
    }

    @GetMapping("/access/{userId}")
    public ResponseEntity<BaseResponse<AccessCheckResponse>> checkAccess(
            @PathVariable UUID eventId,
            @PathVariable UUID userId) {
        return ResponseEntity.ok(BaseResponse.success(whitelistService.checkAccess(eventId, userId)));
    }
}
