package io.shopfront.fulfillment.service.impl;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import io.shopfront.fulfillment.delivery.DeliveryChargeCalculator;
import io.shopfront.fulfillment.delivery.DeliveryChargeQuote;
import io.shopfront.fulfillment.delivery.OrderSettings;
import io.shopfront.fulfillment.domain.DeliveryChargeRule;
import io.shopfront.fulfillment.domain.DeliveryTierSet;
import io.shopfront.fulfillment.repository.DeliveryChargeRuleRepository;
import io.shopfront.fulfillment.service.DeliveryChargeService;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link DeliveryChargeService} interface.
 * Stores the item and print-job rule sets and evaluates them with
 * {@link DeliveryChargeCalculator}.
 */
@Service
@Slf4j
public class DeliveryChargeServiceImpl implements DeliveryChargeService {

    private final DeliveryChargeRuleRepository ruleRepository;

    public DeliveryChargeServiceImpl(DeliveryChargeRuleRepository ruleRepository) {
        this.ruleRepository = ruleRepository;
    }

    @Override
    public DeliveryChargeQuote computeDeliveryCharge(List<DeliveryChargeRule> rules, BigDecimal subtotal) {
        return DeliveryChargeCalculator.calculate(rules, subtotal);
    }

    @Override
    @Transactional(readOnly = true)
    public DeliveryChargeQuote quote(DeliveryTierSet tierSet, BigDecimal subtotal) {
        List<DeliveryChargeRule> rules = ruleRepository.findByTierSet(tierSet);
        log.debug("Quoting {} delivery charge for subtotal {} against {} rules", tierSet, subtotal, rules.size());

        return DeliveryChargeCalculator.calculate(rules, subtotal);
    }

    @Override
    @Transactional(readOnly = true)
    public OrderSettings getOrderSettings() {
        return OrderSettings.builder()
                .itemDeliveryRules(ruleRepository.findByTierSet(DeliveryTierSet.ITEM))
                .printJobDeliveryRules(ruleRepository.findByTierSet(DeliveryTierSet.PRINT_JOB))
                .build();
    }

    /**
     * Validates and replaces both rule sets in one transaction. Gaps and
     * overlaps between rules are accepted; the calculator resolves them by
     * lower bound.
     */
    @Override
    @Transactional
    public OrderSettings updateOrderSettings(OrderSettings settings) {
        settings.getItemDeliveryRules().forEach(DeliveryChargeCalculator::validateRule);
        settings.getPrintJobDeliveryRules().forEach(DeliveryChargeCalculator::validateRule);

        List<DeliveryChargeRule> itemRules = replaceRules(DeliveryTierSet.ITEM, settings.getItemDeliveryRules());
        List<DeliveryChargeRule> printJobRules = replaceRules(DeliveryTierSet.PRINT_JOB,
                settings.getPrintJobDeliveryRules());

        log.info("Order settings updated: {} item rules, {} print-job rules", itemRules.size(), printJobRules.size());

        return OrderSettings.builder()
                .itemDeliveryRules(itemRules)
                .printJobDeliveryRules(printJobRules)
                .build();
    }

    private List<DeliveryChargeRule> replaceRules(DeliveryTierSet tierSet, List<DeliveryChargeRule> rules) {
        ruleRepository.deleteByTierSet(tierSet);
        ruleRepository.flush();

        List<DeliveryChargeRule> fresh = rules.stream()
                .map(rule -> DeliveryChargeRule.builder()
                        .tierSet(tierSet)
                        .from(rule.getFrom())
                        .to(rule.getTo())
                        .charge(rule.getCharge())
                        .build())
                .collect(Collectors.toList());

        return ruleRepository.saveAll(fresh);
    }
}
