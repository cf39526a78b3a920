package io.shopfront.fulfillment.controller;

import org.springframework.hateoas.MediaTypes;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.dto.DeliveryChargeQuoteRequestDTO;
import io.shopfront.fulfillment.dto.DeliveryChargeQuoteResponseDTO;
import io.shopfront.fulfillment.dto.OrderSettingsDTO;
import io.shopfront.fulfillment.exception.ActionNotPermittedException;
import io.shopfront.fulfillment.mapper.OrderMapper;
import io.shopfront.fulfillment.service.DeliveryChargeService;
import io.shopfront.fulfillment.util.ApiHeaders;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.*;

/**
 * REST controller for the delivery-charge rule sets and delivery quotes.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Delivery Charges API", description = "Endpoints for delivery-charge settings and quotes")
@Slf4j
public class OrderSettingsController {
    private final DeliveryChargeService deliveryChargeService;
    private final OrderMapper orderMapper;

    public OrderSettingsController(DeliveryChargeService deliveryChargeService, OrderMapper orderMapper) {
        this.deliveryChargeService = deliveryChargeService;
        this.orderMapper = orderMapper;
    }

    @GetMapping(value = "/order-settings", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get Order Settings", description = "Retrieves the delivery-charge rule sets.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Settings retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderSettingsDTO.class)))
    })
    public ResponseEntity<OrderSettingsDTO> getOrderSettings() {
        OrderSettingsDTO settings = orderMapper.toSettingsDto(deliveryChargeService.getOrderSettings());
        settings.add(linkTo(methodOn(OrderSettingsController.class).getOrderSettings()).withSelfRel());

        return ResponseEntity.ok(settings);
    }

    /**
     * Replaces both rule sets. Only administrators may change them.
     */
    @PutMapping(value = "/order-settings", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Update Order Settings", description = "Replaces the delivery-charge rule sets.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Settings updated", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderSettingsDTO.class))),
            @ApiResponse(responseCode = "400", description = "Malformed rule", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Not an administrator", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderSettingsDTO> updateOrderSettings(@RequestHeader(ApiHeaders.ACTOR_ROLE) ActorRole role,
            @Valid @RequestBody OrderSettingsDTO request) {
        if (role != ActorRole.ADMIN) {
            throw new ActionNotPermittedException("UPDATE_ORDER_SETTINGS", role);
        }

        OrderSettingsDTO settings = orderMapper.toSettingsDto(
                deliveryChargeService.updateOrderSettings(orderMapper.toSettings(request)));
        settings.add(linkTo(methodOn(OrderSettingsController.class).getOrderSettings()).withSelfRel());

        return ResponseEntity.ok(settings);
    }

    @PostMapping(value = "/delivery-charges/quote", produces = { MediaType.APPLICATION_JSON_VALUE })
    @Operation(summary = "Quote a Delivery Charge", description = "Computes the delivery charge for a subtotal and the next cheaper tier.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Quote computed", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = DeliveryChargeQuoteResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid subtotal or tier set", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<DeliveryChargeQuoteResponseDTO> quote(
            @Valid @RequestBody DeliveryChargeQuoteRequestDTO request) {
        return ResponseEntity.ok(orderMapper.toQuoteResponseDto(
                deliveryChargeService.quote(request.getTierSet(), request.getSubtotal())));
    }
}
