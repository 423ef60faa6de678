package se.snapup_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import se.snapup_be.dto.response.ApiResponse;
import se.snapup_be.dto.response.SyncSnapshotResponse;
import se.snapup_be.pojo.User;
import se.snapup_be.service.SyncSnapshotService;
import se.snapup_be.service.UserService;

import java.security.Principal;

/**
 * Full snapshots for clients that (re)connect. Pushed changes are only deltas; after a
 * reconnect the client replaces its view with one of these.
 */
@Controller
@RequiredArgsConstructor
@Tag(name = "Sync", description = "State snapshots for reconnecting clients")
public class SyncController {

    private final SyncSnapshotService syncSnapshotService;
    private final UserService userService;

    @Operation(summary = "Snapshot of everything the user is party to",
            description = "Pass listingId and counterpartyId to narrow offers to one negotiation thread.")
    @SecurityRequirement(name = "basicAuth")
    @GetMapping("/api/sync/snapshot")
    @ResponseBody
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<SyncSnapshotResponse>> getSnapshot(
            @RequestParam(required = false) Long listingId,
            @RequestParam(required = false) Long counterpartyId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(
                syncSnapshotService.snapshot(user.getUserId(), listingId, counterpartyId)));
    }

    @MessageMapping("/sync.resync")
    @SendToUser(destinations = "/queue/snapshot", broadcast = false)
    public SyncSnapshotResponse resync(Principal principal) {
        User user = userService.findByUsername(principal.getName());
        return syncSnapshotService.snapshot(user.getUserId(), null, null);
    }
}
