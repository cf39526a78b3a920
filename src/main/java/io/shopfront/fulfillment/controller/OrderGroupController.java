package io.shopfront.fulfillment.controller;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.hateoas.CollectionModel;
import org.springframework.hateoas.MediaTypes;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.shopfront.fulfillment.aggregation.DashboardBucket;
import io.shopfront.fulfillment.aggregation.OrderGroupView;
import io.shopfront.fulfillment.domain.ActorRole;
import io.shopfront.fulfillment.dto.CheckoutRequestDTO;
import io.shopfront.fulfillment.dto.CheckoutResponseDTO;
import io.shopfront.fulfillment.dto.GroupSettlementResultDTO;
import io.shopfront.fulfillment.dto.OrderGroupResponseDTO;
import io.shopfront.fulfillment.dto.OrderResponseDTO;
import io.shopfront.fulfillment.dto.SellerOrderStatsDTO;
import io.shopfront.fulfillment.mapper.OrderMapper;
import io.shopfront.fulfillment.service.GroupSettlementResult;
import io.shopfront.fulfillment.service.OrderGroupQueryService;
import io.shopfront.fulfillment.service.OrderService;
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
 * REST controller for order groups: checkout, aggregated group views,
 * dashboards and delivery-fee settlement.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Order Groups API", description = "Endpoints for checkouts, order groups and dashboards")
@Slf4j
public class OrderGroupController {
    private final OrderService orderService;
    private final OrderGroupQueryService orderGroupQueryService;
    private final OrderMapper orderMapper;

    public OrderGroupController(OrderService orderService, OrderGroupQueryService orderGroupQueryService,
            OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderGroupQueryService = orderGroupQueryService;
        this.orderMapper = orderMapper;
    }

    /**
     * Turns a checkout into an order group. Repeating a request with the same
     * idempotency key returns the group created the first time.
     *
     * @param idempotencyKey Optional idempotency key of the checkout.
     * @param request        The checkout.
     * @return 201 with the group ID and a link to the group.
     */
    @PostMapping(value = "/order-groups", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Check Out", description = "Creates one order per checkout line, all sharing a new group ID.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Order group created", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = CheckoutResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid checkout", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CheckoutResponseDTO> checkout(
            @RequestHeader(name = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody CheckoutRequestDTO request) {
        UUID groupId = orderService.createOrderGroup(request, idempotencyKey);

        CheckoutResponseDTO response = new CheckoutResponseDTO(groupId);
        response.add(linkTo(methodOn(OrderGroupController.class).getGroup(groupId)).withRel("group"));

        return ResponseEntity
                .created(linkTo(methodOn(OrderGroupController.class).getGroup(groupId)).toUri())
                .body(response);
    }

    @GetMapping(value = "/order-groups/{groupId}", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get an Order Group", description = "Retrieves the aggregated view of one checkout.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Group retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderGroupResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid UUID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "No orders found for the group", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderGroupResponseDTO> getGroup(@PathVariable UUID groupId) {
        return ResponseEntity.ok(toResponse(orderGroupQueryService.getGroup(groupId)));
    }

    @GetMapping(value = "/order-groups/{groupId}/orders", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get the Orders of a Group", description = "Retrieves the group's orders, oldest first.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Orders retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = CollectionModel.class))),
            @ApiResponse(responseCode = "404", description = "No orders found for the group", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CollectionModel<OrderResponseDTO>> getGroupOrders(@PathVariable UUID groupId) {
        List<OrderResponseDTO> orders = orderMapper.toOrderResponseDtoList(orderService.getOrdersByGroup(groupId));
        orders.forEach(dto -> dto.add(
                linkTo(methodOn(OrderController.class).findByOrderId(dto.getId())).withSelfRel()));

        CollectionModel<OrderResponseDTO> collectionModel = CollectionModel.of(orders);
        collectionModel.add(linkTo(methodOn(OrderGroupController.class).getGroupOrders(groupId)).withSelfRel());
        collectionModel.add(linkTo(methodOn(OrderGroupController.class).getGroup(groupId)).withRel("group"));

        return ResponseEntity.ok(collectionModel);
    }

    /**
     * Marks the group's delivery fee as paid. If some orders cannot be updated
     * the response is a 500 problem listing them; repeating the request finishes
     * the rest.
     */
    @PostMapping(value = "/order-groups/{groupId}/delivery-fee/settlement", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Settle the Delivery Fee", description = "Marks every order of the group as having its delivery-fee share paid.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Delivery fee settled", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = GroupSettlementResultDTO.class))),
            @ApiResponse(responseCode = "403", description = "The acting role may not settle fees", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "No orders found for the group", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Some orders could not be updated", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<GroupSettlementResultDTO> settleDeliveryFee(@PathVariable UUID groupId,
            @RequestHeader(ApiHeaders.ACTOR_ROLE) ActorRole role) {
        GroupSettlementResult result = orderService.markGroupDeliveryFeePaid(groupId, role);

        GroupSettlementResultDTO response = GroupSettlementResultDTO.builder()
                .groupId(result.getGroupId())
                .paidOrderIds(result.getPaidOrderIds())
                .alreadyPaidOrderIds(result.getAlreadyPaidOrderIds())
                .deliveryFeePaid(true)
                .build();
        response.add(linkTo(methodOn(OrderGroupController.class).getGroup(groupId)).withRel("group"));

        return ResponseEntity.ok(response);
    }

    @GetMapping(value = "/sellers/{sellerId}/order-groups", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Seller Dashboard", description = "Order groups containing the seller's orders, newest first, optionally limited to one dashboard bucket.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Groups retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = CollectionModel.class))),
            @ApiResponse(responseCode = "400", description = "Unknown bucket", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CollectionModel<OrderGroupResponseDTO>> getSellerGroups(@PathVariable String sellerId,
            @RequestParam(required = false) DashboardBucket bucket) {
        CollectionModel<OrderGroupResponseDTO> collectionModel = toCollection(
                orderGroupQueryService.getGroupsForSeller(sellerId, bucket));
        collectionModel.add(
                linkTo(methodOn(OrderGroupController.class).getSellerGroups(sellerId, bucket)).withSelfRel());

        return ResponseEntity.ok(collectionModel);
    }

    @GetMapping(value = "/sellers/{sellerId}/order-stats", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Seller Dashboard Counts", description = "Counts of the seller's orders that are active, in a return or replacement, completed, rejected by the seller and cancelled by the customer.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Counts retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = SellerOrderStatsDTO.class)))
    })
    public ResponseEntity<SellerOrderStatsDTO> getSellerStats(@PathVariable String sellerId) {
        SellerOrderStatsDTO response = orderMapper.toSellerStatsDto(orderGroupQueryService.getSellerStats(sellerId));
        response.add(linkTo(methodOn(OrderGroupController.class).getSellerStats(sellerId)).withSelfRel());
        response.add(linkTo(methodOn(OrderGroupController.class).getSellerGroups(sellerId, null))
                .withRel("orderGroups"));

        return ResponseEntity.ok(response);
    }

    @GetMapping(value = "/customers/{userId}/order-groups", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Customer Order History", description = "The customer's order groups, newest first.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Groups retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = CollectionModel.class)))
    })
    public ResponseEntity<CollectionModel<OrderGroupResponseDTO>> getCustomerGroups(@PathVariable String userId) {
        CollectionModel<OrderGroupResponseDTO> collectionModel = toCollection(
                orderGroupQueryService.getGroupsForCustomer(userId));
        collectionModel.add(linkTo(methodOn(OrderGroupController.class).getCustomerGroups(userId)).withSelfRel());

        return ResponseEntity.ok(collectionModel);
    }

    private CollectionModel<OrderGroupResponseDTO> toCollection(List<OrderGroupView> views) {
        return CollectionModel.of(views.stream().map(this::toResponse).collect(Collectors.toList()));
    }

    private OrderGroupResponseDTO toResponse(OrderGroupView view) {
        OrderGroupResponseDTO responseDTO = orderMapper.toGroupResponseDto(view);

        responseDTO.add(linkTo(methodOn(OrderGroupController.class).getGroup(view.getGroupId())).withSelfRel());
        responseDTO.add(
                linkTo(methodOn(OrderGroupController.class).getGroupOrders(view.getGroupId())).withRel("orders"));
        responseDTO.getSellers().forEach(seller -> seller.getOrders().forEach(order -> order.add(
                linkTo(methodOn(OrderController.class).findByOrderId(order.getId())).withSelfRel())));

        return responseDTO;
    }
}
