package io.shopfront.fulfillment.mapper;

import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Mappings;

import io.shopfront.fulfillment.aggregation.OrderGroupView;
import io.shopfront.fulfillment.aggregation.SellerOrderStats;
import io.shopfront.fulfillment.aggregation.SellerOrders;
import io.shopfront.fulfillment.delivery.DeliveryChargeQuote;
import io.shopfront.fulfillment.delivery.OrderSettings;
import io.shopfront.fulfillment.domain.DeliveryChargeRule;
import io.shopfront.fulfillment.domain.Order;
import io.shopfront.fulfillment.domain.OrderTracking;
import io.shopfront.fulfillment.dto.CheckoutItemRequestDTO;
import io.shopfront.fulfillment.dto.DeliveryChargeQuoteResponseDTO;
import io.shopfront.fulfillment.dto.DeliveryChargeRuleDTO;
import io.shopfront.fulfillment.dto.OrderGroupResponseDTO;
import io.shopfront.fulfillment.dto.OrderResponseDTO;
import io.shopfront.fulfillment.dto.OrderSettingsDTO;
import io.shopfront.fulfillment.dto.OrderTrackingDTO;
import io.shopfront.fulfillment.dto.SellerOrderStatsDTO;
import io.shopfront.fulfillment.dto.SellerOrdersDTO;

/**
 * Mapper interface for converting between order DTOs and domain objects using
 * MapStruct.
 */
@Mapper(componentModel = "spring")
public interface OrderMapper {

    /**
     * Maps one checkout line to a new {@link Order}. Everything shared by the
     * group (user, address, contact, group ID, fee share) is filled in by the
     * caller; lifecycle fields are not part of the builder and keep their initial
     * values.
     *
     * @param dto The checkout line.
     * @return The unsaved order.
     */
    @Mappings({
            @Mapping(target = "id", ignore = true),
            @Mapping(target = "groupId", ignore = true),
            @Mapping(target = "checkoutKey", ignore = true),
            @Mapping(target = "userId", ignore = true),
            @Mapping(target = "deliveryCharge", ignore = true),
            @Mapping(target = "shippingAddress", ignore = true),
            @Mapping(target = "mobile", ignore = true),
            @Mapping(target = "altMobiles", ignore = true)
    })
    Order toEntity(CheckoutItemRequestDTO dto);

    OrderResponseDTO toOrderResponseDto(Order entity);

    List<OrderResponseDTO> toOrderResponseDtoList(List<Order> entityList);

    OrderTrackingDTO toTrackingDto(OrderTracking tracking);

    SellerOrdersDTO toSellerOrdersDto(SellerOrders sellerOrders);

    OrderGroupResponseDTO toGroupResponseDto(OrderGroupView view);

    SellerOrderStatsDTO toSellerStatsDto(SellerOrderStats stats);

    List<OrderGroupResponseDTO> toGroupResponseDtoList(List<OrderGroupView> views);

    DeliveryChargeRuleDTO toRuleDto(DeliveryChargeRule rule);

    List<DeliveryChargeRuleDTO> toRuleDtoList(List<DeliveryChargeRule> rules);

    /**
     * The tier set is taken from the list the rule arrives in, so it is not
     * mapped here.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "tierSet", ignore = true)
    DeliveryChargeRule toRuleEntity(DeliveryChargeRuleDTO dto);

    List<DeliveryChargeRule> toRuleEntityList(List<DeliveryChargeRuleDTO> dtos);

    @Mappings({
            @Mapping(source = "nextTier.threshold", target = "nextTierThreshold"),
            @Mapping(source = "nextTier.amountNeeded", target = "amountNeeded"),
            @Mapping(source = "nextTier.charge", target = "nextTierCharge")
    })
    DeliveryChargeQuoteResponseDTO toQuoteResponseDto(DeliveryChargeQuote quote);

    default OrderSettingsDTO toSettingsDto(OrderSettings settings) {
        return new OrderSettingsDTO(toRuleDtoList(settings.getItemDeliveryRules()),
                toRuleDtoList(settings.getPrintJobDeliveryRules()));
    }

    default OrderSettings toSettings(OrderSettingsDTO dto) {
        return OrderSettings.builder()
                .itemDeliveryRules(toRuleEntityList(dto.getItemDeliveryRules()))
                .printJobDeliveryRules(toRuleEntityList(dto.getPrintJobDeliveryRules()))
                .build();
    }
}
