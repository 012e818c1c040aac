/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.metrics;

import com.intuitivedesigns.routerkernel.config.KernelConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsSettingsTest {

    @Test
    void testDefaultsWhenNothingConfigured() {
        MetricsSettings s = MetricsSettings.from(KernelConfig.empty());

        assertEquals("NONE", s.providerId);
        assertEquals(Duration.ofSeconds(10), s.step);
        assertEquals(9404, s.prometheusPort);
        assertTrue(s.commonTags.isEmpty());
    }

    @Test
    void testProviderIsUpperCasedAndTagsCollected() {
        MetricsSettings s = MetricsSettings.from(KernelConfig.of(Map.of(
                "metrics.provider", " simple ",
                "metrics.tag.env", "staging",
                "metrics.tag.blank", "  ",
                "metrics.step.seconds", "99999")));

        assertEquals("SIMPLE", s.providerId);
        assertEquals(Map.of("env", "staging"), s.commonTags);
        assertEquals(Duration.ofSeconds(3_600), s.step);
    }

    @Test
    void testToTagsSkipsBlankEntries() {
        assertEquals(1, MetricsUtil.toTags(Map.of("a", "1", " ", "x")).stream().count());
        assertFalse(MetricsUtil.toTags(null).iterator().hasNext());
    }
}
