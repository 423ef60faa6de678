package se.snapup_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;
import se.snapup_be.dto.request.CounterOfferRequest;
import se.snapup_be.dto.request.ProposeOfferRequest;
import se.snapup_be.dto.request.RespondOfferRequest;
import se.snapup_be.dto.request.WithdrawOfferRequest;
import se.snapup_be.dto.response.ApiResponse;
import se.snapup_be.dto.response.OfferResponse;
import se.snapup_be.dto.response.RespondOfferResponse;
import se.snapup_be.pojo.User;
import se.snapup_be.service.OfferService;
import se.snapup_be.service.UserService;

import java.util.List;

@RestController
@RequestMapping("/api/offers")
@Tag(name = "Offer Negotiation",
     description = "Propose, counter, accept, decline and withdraw offers on a listing. " +
                   "Commands may carry the status the client last saw; a mismatch returns 409 with the current offer.")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "basicAuth")
public class OfferController {

    private final OfferService offerService;
    private final UserService userService;

    @Operation(summary = "Make an offer",
            description = "Creates a PENDING offer below the listing price. Only one active offer per buyer, seller and listing.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Offer created",
                    content = @Content(schema = @Schema(implementation = OfferResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Amount not below the listing price"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "An active offer already exists"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "422", description = "Message blocked or warned by the content check")
    })
    @PostMapping
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<OfferResponse>> proposeOffer(
            @Valid @RequestBody ProposeOfferRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User buyer = userService.findByUsername(userDetails.getUsername());
        OfferResponse offer = offerService.proposeOffer(request.getListingId(), buyer.getUserId(),
                request.getSellerId(), request.getAmount(), request.getMessage(), request.isOverrideWarning());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Offer sent", offer));
    }

    @Operation(summary = "Counter an offer", description = "Seller only. The counter must lie above the offer and not above the listing price.")
    @PostMapping("/{offerId}/counter")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<OfferResponse>> counterOffer(
            @PathVariable Long offerId,
            @Valid @RequestBody CounterOfferRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User seller = userService.findByUsername(userDetails.getUsername());
        OfferResponse offer = offerService.counterOffer(offerId, seller.getUserId(),
                request.getCounterAmount(), request.getExpectedStatus());
        return ResponseEntity.ok(ApiResponse.success("Counter offer sent", offer));
    }

    @Operation(summary = "Accept or decline an offer",
            description = "The seller answers a PENDING offer, the buyer answers a COUNTERED one. " +
                          "Accepting creates the order exactly once; repeating an accept returns the same order.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Offer answered",
                    content = @Content(schema = @Schema(implementation = RespondOfferResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Not your turn to respond"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Offer changed in the meantime")
    })
    @PostMapping("/{offerId}/respond")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<RespondOfferResponse>> respondToOffer(
            @PathVariable Long offerId,
            @Valid @RequestBody RespondOfferRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        RespondOfferResponse result = offerService.respondToOffer(offerId, user.getUserId(),
                request.getDecision(), request.getExpectedStatus());
        String message = result.isAlreadyMaterialized()
                ? "Offer was already accepted"
                : "Offer " + result.getOffer().getStatus().name().toLowerCase();
        return ResponseEntity.ok(ApiResponse.success(message, result));
    }

    @PostMapping("/{offerId}/withdraw")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<OfferResponse>> withdrawOffer(
            @PathVariable Long offerId,
            @RequestBody(required = false) WithdrawOfferRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User buyer = userService.findByUsername(userDetails.getUsername());
        OfferResponse offer = offerService.withdrawOffer(offerId, buyer.getUserId(),
                request != null ? request.getExpectedStatus() : null);
        return ResponseEntity.ok(ApiResponse.success("Offer withdrawn", offer));
    }

    @GetMapping("/{offerId}")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<OfferResponse>> getOffer(
            @PathVariable Long offerId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(offerService.getOffer(offerId, user.getUserId())));
    }

    @Operation(summary = "Offers on a listing", description = "The seller sees every offer; a buyer sees their own.")
    @GetMapping("/listing/{listingId}")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<List<OfferResponse>>> getOffersForListing(
            @PathVariable Long listingId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(offerService.getOffersForListing(listingId, user.getUserId())));
    }
}
