package io.shopfront.fulfillment.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import io.shopfront.fulfillment.delivery.DeliveryChargeQuote;
import io.shopfront.fulfillment.delivery.OrderSettings;
import io.shopfront.fulfillment.domain.DeliveryTierSet;
import io.shopfront.fulfillment.dto.DeliveryChargeQuoteResponseDTO;
import io.shopfront.fulfillment.dto.DeliveryChargeRuleDTO;
import io.shopfront.fulfillment.dto.OrderSettingsDTO;
import io.shopfront.fulfillment.mapper.OrderMapper;
import io.shopfront.fulfillment.service.DeliveryChargeService;
import io.shopfront.fulfillment.util.ApiHeaders;

@WebMvcTest(OrderSettingsController.class)
public class OrderSettingsControllerTest {
    private static final String SETTINGS_BODY = "{\"itemDeliveryRules\":["
            + "{\"from\":0,\"to\":499.99,\"charge\":50},"
            + "{\"from\":500,\"to\":999.99,\"charge\":20},"
            + "{\"from\":1000,\"charge\":0}],"
            + "\"printJobDeliveryRules\":[{\"from\":0,\"charge\":15}]}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DeliveryChargeService deliveryChargeService;

    @MockitoBean
    private OrderMapper orderMapper;

    @Test
    void getOrderSettings() throws Exception {
        OrderSettings settings = OrderSettings.builder().build();
        given(deliveryChargeService.getOrderSettings()).willReturn(settings);
        given(orderMapper.toSettingsDto(settings)).willReturn(new OrderSettingsDTO(
                List.of(DeliveryChargeRuleDTO.builder().from(BigDecimal.ZERO).charge(new BigDecimal("50")).build()),
                List.of()));

        mockMvc.perform(get("/api/v1/order-settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.itemDeliveryRules[0].charge").value(50))
                .andExpect(jsonPath("$._links.self.href").exists());
    }

    @Test
    void updateOrderSettings_admin() throws Exception {
        OrderSettings settings = OrderSettings.builder().build();
        given(orderMapper.toSettings(any(OrderSettingsDTO.class))).willReturn(settings);
        given(deliveryChargeService.updateOrderSettings(settings)).willReturn(settings);
        given(orderMapper.toSettingsDto(settings)).willReturn(new OrderSettingsDTO(List.of(), List.of()));

        mockMvc.perform(put("/api/v1/order-settings")
                .header(ApiHeaders.ACTOR_ROLE, "ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .content(SETTINGS_BODY))
                .andExpect(status().isOk());
    }

    @Test
    void updateOrderSettings_sellerForbidden() throws Exception {
        mockMvc.perform(put("/api/v1/order-settings")
                .header(ApiHeaders.ACTOR_ROLE, "SELLER")
                .contentType(MediaType.APPLICATION_JSON)
                .content(SETTINGS_BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.title").value("Action Not Permitted"));

        verifyNoInteractions(deliveryChargeService);
    }

    @Test
    void updateOrderSettings_negativeCharge() throws Exception {
        mockMvc.perform(put("/api/v1/order-settings")
                .header(ApiHeaders.ACTOR_ROLE, "ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"itemDeliveryRules\":[{\"from\":0,\"charge\":-5}],\"printJobDeliveryRules\":[]}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(deliveryChargeService);
    }

    @Test
    void quote() throws Exception {
        DeliveryChargeQuote quote = DeliveryChargeQuote.builder().charge(new BigDecimal("50")).build();
        given(deliveryChargeService.quote(DeliveryTierSet.ITEM, new BigDecimal("250.00"))).willReturn(quote);
        DeliveryChargeQuoteResponseDTO response = new DeliveryChargeQuoteResponseDTO();
        response.setCharge(new BigDecimal("50"));
        response.setNextTierInfo("Add items worth Rs 250.00 more for a delivery charge of Rs 20.00.");
        given(orderMapper.toQuoteResponseDto(quote)).willReturn(response);

        mockMvc.perform(post("/api/v1/delivery-charges/quote")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tierSet\":\"ITEM\",\"subtotal\":250.00}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.charge").value(50))
                .andExpect(jsonPath("$.nextTierInfo")
                        .value("Add items worth Rs 250.00 more for a delivery charge of Rs 20.00."))
                .andExpect(jsonPath("$.amountNeeded").doesNotExist());
    }
}
