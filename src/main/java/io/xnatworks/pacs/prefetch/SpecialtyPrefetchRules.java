/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.prefetch;

import io.xnatworks.pacs.config.AppConfig;
import io.xnatworks.pacs.model.MedicalSpecialty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds prefetch rule sets, adding the extra rules some specialties use.
 */
public final class SpecialtyPrefetchRules {
    private static final Logger log = LoggerFactory.getLogger(SpecialtyPrefetchRules.class);

    public static final String RADIOLOGY_PRIORITY = "radiology_priority";
    public static final String CARDIOLOGY_PRIORITY = "cardiology_priority";

    private SpecialtyPrefetchRules() {
    }

    /**
     * recent_studies and urgent_radiology.
     */
    public static List<PrefetchRule> defaultRules(Clock clock) {
        List<PrefetchRule> rules = new ArrayList<>();
        for (AppConfig.PrefetchRuleConfig config : AppConfig.PrefetchConfig.defaultRules()) {
            rules.add(PrefetchRule.fromConfig(config, clock));
        }
        return rules;
    }

    /**
     * The base rules followed by the specialty's own rules. Specialties without extra rules,
     * and a null specialty, get the base rules unchanged.
     */
    public static List<PrefetchRule> forSpecialty(MedicalSpecialty specialty, List<PrefetchRule> baseRules) {
        List<PrefetchRule> rules = new ArrayList<>(baseRules);
        if (specialty == null) {
            return rules;
        }
        switch (specialty) {
            case RADIOLOGY:
                rules.add(new PrefetchRule(RADIOLOGY_PRIORITY,
                        PrefetchCondition.modalityIn("CT", "MR", "CR", "DX"), 1, 100, true));
                break;
            case CARDIOLOGY:
                rules.add(new PrefetchRule(CARDIOLOGY_PRIORITY,
                        PrefetchCondition.modalityIn("ECG", "US", "XA"), 1, 30, true));
                break;
            default:
                break;
        }
        return rules;
    }

    /**
     * Rules from the prefetch configuration, with the configured specialty's rules added.
     */
    public static List<PrefetchRule> fromConfig(AppConfig.PrefetchConfig config, Clock clock) {
        List<PrefetchRule> rules = new ArrayList<>();
        for (AppConfig.PrefetchRuleConfig ruleConfig : config.getRules()) {
            rules.add(PrefetchRule.fromConfig(ruleConfig, clock));
        }

        MedicalSpecialty specialty = null;
        if (config.getSpecialty() != null) {
            specialty = MedicalSpecialty.fromCode(config.getSpecialty());
            if (specialty == null) {
                log.warn("Unknown prefetch specialty '{}', using configured rules only", config.getSpecialty());
            }
        }
        return forSpecialty(specialty, rules);
    }
}
