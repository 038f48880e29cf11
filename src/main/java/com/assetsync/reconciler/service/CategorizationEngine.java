package com.assetsync.reconciler.service;

import org.springframework.stereotype.Service;

import com.assetsync.reconciler.model.domain.Classification;
import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.model.domain.ResolvedIdentity;
import com.assetsync.reconciler.rules.CategorizationRules;
import com.assetsync.reconciler.rules.ClassificationRule;
import com.assetsync.reconciler.rules.DeviceFacts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Assigns a device category to a raw record.
 *
 * A static override decides immediately. Otherwise the rule table is walked
 * in order and the first matching row wins; nothing matching yields
 * {@code OTHER}. Classification never fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategorizationEngine {

    private final CategorizationRules rules;

    public Classification classify(RawDeviceRecord record, ResolvedIdentity identity) {
        if (identity.isStaticOverride()) {
            return Classification.staticOverride(identity.staticOverride().getCategory());
        }

        DeviceFacts facts = DeviceFacts.of(record);
        Classification classification = classify(facts);

        if (classification.ruleName().equals("fallback")) {
            log.debug("No rule matched {} (vendor='{}', model='{}', os='{}'), using {}",
                    identity.key(), facts.vendor(), facts.model(), facts.os(),
                    classification.category().getDeviceType());
        } else {
            log.debug("Classified {} as {} by rule {}", identity.key(),
                    classification.category().getDeviceType(), classification.ruleName());
        }
        return classification;
    }

    public Classification classify(DeviceFacts facts) {
        for (ClassificationRule rule : rules.getRules()) {
            if (rule.matches(facts)) {
                return Classification.rule(rule.category(), rule.group() + "/" + rule.name());
            }
        }
        return Classification.fallback();
    }
}
