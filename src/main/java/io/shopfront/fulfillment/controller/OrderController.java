package io.shopfront.fulfillment.controller;

import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.data.web.PagedResourcesAssembler;
import org.springframework.hateoas.EntityModel;
import org.springframework.hateoas.MediaTypes;
import org.springframework.hateoas.PagedModel;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.dto.BelievedStatusRequestDTO;
import io.shopfront.fulfillment.dto.ExpectedDeliveryRequestDTO;
import io.shopfront.fulfillment.dto.OrderResponseDTO;
import io.shopfront.fulfillment.dto.ReasonRequestDTO;
import io.shopfront.fulfillment.dto.ReturnRequestDTO;
import io.shopfront.fulfillment.mapper.OrderMapper;
import io.shopfront.fulfillment.service.OrderService;
import io.shopfront.fulfillment.service.OrderWorkflowService;
import io.shopfront.fulfillment.service.ReturnWorkflowService;
import io.shopfront.fulfillment.util.ApiHeaders;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.*;

/**
 * REST controller for single orders: retrieval and every status change an
 * actor can request. The acting role is taken from the
 * {@value ApiHeaders#ACTOR_ROLE} header.
 */
@RestController
@RequestMapping("/api/v1/orders")
@Tag(name = "Orders API", description = "Endpoints for retrieving orders and moving them through their lifecycle")
@Slf4j
public class OrderController {
    private final OrderService orderService;
    private final OrderWorkflowService orderWorkflowService;
    private final ReturnWorkflowService returnWorkflowService;

    private final PagedResourcesAssembler<OrderResponseDTO> pagedResourcesAssembler;

    private final OrderMapper orderMapper;

    /**
     * Constructs an instance of {@code OrderController}.
     *
     * @param orderService            Service for order retrieval.
     * @param orderWorkflowService    Service for forward-path status changes.
     * @param returnWorkflowService   Service for return and replacement
     *                                requests.
     * @param orderMapper             Mapper for converting between entities and
     *                                DTOs.
     * @param pagedResourcesAssembler Assembler for creating HATEOAS PagedModel.
     */
    public OrderController(OrderService orderService, OrderWorkflowService orderWorkflowService,
            ReturnWorkflowService returnWorkflowService, OrderMapper orderMapper,
            PagedResourcesAssembler<OrderResponseDTO> pagedResourcesAssembler) {
        this.orderService = orderService;
        this.orderWorkflowService = orderWorkflowService;
        this.returnWorkflowService = returnWorkflowService;
        this.orderMapper = orderMapper;
        this.pagedResourcesAssembler = pagedResourcesAssembler;
    }

    /**
     * Retrieves a paginated list of all orders, newest first.
     *
     * @param pageable Pagination and sorting information.
     * @return A {@link PagedModel} of {@link OrderResponseDTO}s with HATEOAS links.
     */
    @GetMapping(produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get All Orders", description = "Retrieves a paginated list of all orders.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Orders retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = PagedModel.class)))
    })
    public ResponseEntity<PagedModel<EntityModel<OrderResponseDTO>>> findAllOrders(
            @Parameter(hidden = true) @PageableDefault(size = 10, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable) {
        Page<Order> orders = orderService.findAll(pageable);

        Page<OrderResponseDTO> orderResponseDTOs = orders.map(orderMapper::toOrderResponseDto);
        orderResponseDTOs.forEach(dto -> dto.add(
                linkTo(methodOn(OrderController.class).findByOrderId(dto.getId())).withSelfRel()));

        return ResponseEntity.ok(pagedResourcesAssembler.toModel(orderResponseDTOs));
    }

    /**
     * Retrieves an order by its unique ID.
     *
     * @param orderId The UUID of the order to retrieve.
     * @return The {@link OrderResponseDTO} with links to itself and its group.
     */
    @GetMapping(value = "/{orderId}", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get an Order by ID", description = "Retrieves an order by its unique ID.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid UUID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> findByOrderId(@PathVariable UUID orderId) {
        return ResponseEntity.ok(toResponse(orderService.findByOrderId(orderId)));
    }

    @PostMapping(value = "/{orderId}/confirmation", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Confirm an Order", description = "Seller accepts a new order. Pending Confirmation -> Processing.")
    @TransitionResponses
    public ResponseEntity<OrderResponseDTO> confirmOrder(@PathVariable UUID orderId,
            @RequestHeader(ApiHeaders.ACTOR_ROLE) ActorRole role) {
        return ResponseEntity.ok(toResponse(orderWorkflowService.confirmOrder(orderId, role)));
    }

    @PostMapping(value = "/{orderId}/rejection", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Reject an Order", description = "Seller turns down a new order. A reason is required.")
    @TransitionResponses
    public ResponseEntity<OrderResponseDTO> rejectOrder(@PathVariable UUID orderId,
            @RequestHeader(ApiHeaders.ACTOR_ROLE) ActorRole role, @RequestBody ReasonRequestDTO body) {
        return ResponseEntity.ok(toResponse(orderWorkflowService.rejectOrder(orderId, body.getReason(), role)));
    }

    @PostMapping(value = "/{orderId}/cancellation", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Cancel an Order", description = "Customer withdraws an order not yet confirmed. A reason is required.")
    @TransitionResponses
    public ResponseEntity<OrderResponseDTO> cancelOrder(@PathVariable UUID orderId,
            @RequestHeader(ApiHeaders.ACTOR_ROLE) ActorRole role, @RequestBody ReasonRequestDTO body) {
        return ResponseEntity.ok(toResponse(orderWorkflowService.cancelOrder(orderId, body.getReason(), role)));
    }

    @PostMapping(value = "/{orderId}/status-advance", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Advance an Order", description = "Moves the order one step along its fulfillment or pickup path, provided it is still in the status the caller saw.")
    @TransitionResponses
    public ResponseEntity<OrderResponseDTO> advanceStatus(@PathVariable UUID orderId,
            @RequestHeader(ApiHeaders.ACTOR_ROLE) ActorRole role, @Valid @RequestBody BelievedStatusRequestDTO body) {
        return ResponseEntity.ok(
                toResponse(orderWorkflowService.advanceStatus(orderId, body.getBelievedStatus(), role)));
    }

    @PostMapping(value = "/{orderId}/receipt-confirmation", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Confirm Receipt", description = "Customer confirms a delivery, a return pickup or a replacement.")
    @TransitionResponses
    public ResponseEntity<OrderResponseDTO> confirmReceipt(@PathVariable UUID orderId,
            @RequestHeader(ApiHeaders.ACTOR_ROLE) ActorRole role, @Valid @RequestBody BelievedStatusRequestDTO body) {
        return ResponseEntity.ok(
                toResponse(orderWorkflowService.confirmReceipt(orderId, body.getBelievedStatus(), role)));
    }

    @PutMapping(value = "/{orderId}/expected-delivery", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Schedule Expected Delivery", description = "Records the expected delivery date. The first date recorded is kept.")
    @TransitionResponses
    public ResponseEntity<OrderResponseDTO> scheduleExpectedDelivery(@PathVariable UUID orderId,
            @RequestHeader(ApiHeaders.ACTOR_ROLE) ActorRole role,
            @Valid @RequestBody ExpectedDeliveryRequestDTO body) {
        return ResponseEntity.ok(toResponse(
                orderWorkflowService.scheduleExpectedDelivery(orderId, body.getExpectedDelivery(), role)));
    }

    @PostMapping(value = "/{orderId}/return-request", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Request a Return", description = "Customer asks to return a delivered item for a refund or a replacement.")
    @TransitionResponses
    public ResponseEntity<OrderResponseDTO> requestReturn(@PathVariable UUID orderId,
            @RequestHeader(ApiHeaders.ACTOR_ROLE) ActorRole role, @Valid @RequestBody ReturnRequestDTO body) {
        return ResponseEntity.ok(toResponse(
                returnWorkflowService.requestReturn(orderId, body.getType(), body.getReason(), role)));
    }

    @PostMapping(value = "/{orderId}/return-approval", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Approve a Return", description = "Approves a refund request.")
    @TransitionResponses
    public ResponseEntity<OrderResponseDTO> approveReturn(@PathVariable UUID orderId,
            @RequestHeader(ApiHeaders.ACTOR_ROLE) ActorRole role) {
        return ResponseEntity.ok(toResponse(returnWorkflowService.approveReturn(orderId, role)));
    }

    @PostMapping(value = "/{orderId}/replacement-approval", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Approve a Replacement", description = "Approves a replacement request.")
    @TransitionResponses
    public ResponseEntity<OrderResponseDTO> approveReplacement(@PathVariable UUID orderId,
            @RequestHeader(ApiHeaders.ACTOR_ROLE) ActorRole role) {
        return ResponseEntity.ok(toResponse(returnWorkflowService.approveReplacement(orderId, role)));
    }

    @PostMapping(value = "/{orderId}/return-rejection", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Reject a Return", description = "Turns down a return or replacement request. A reason is required.")
    @TransitionResponses
    public ResponseEntity<OrderResponseDTO> rejectReturn(@PathVariable UUID orderId,
            @RequestHeader(ApiHeaders.ACTOR_ROLE) ActorRole role, @RequestBody ReasonRequestDTO body) {
        return ResponseEntity.ok(toResponse(returnWorkflowService.rejectReturn(orderId, body.getReason(), role)));
    }

    private OrderResponseDTO toResponse(Order order) {
        OrderResponseDTO responseDTO = orderMapper.toOrderResponseDto(order);

        responseDTO.add(linkTo(methodOn(OrderController.class).findByOrderId(order.getId())).withSelfRel());
        responseDTO.add(linkTo(methodOn(OrderGroupController.class).getGroup(order.getGroupId())).withRel("group"));

        return responseDTO;
    }
}
