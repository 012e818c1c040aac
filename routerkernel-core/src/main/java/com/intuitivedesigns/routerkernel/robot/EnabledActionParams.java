/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Parameter block of an action that has nothing to configure besides being switched on.
 */
public record EnabledActionParams(boolean enabled) {

    public static final EnabledActionParams DISABLED = new EnabledActionParams(false);
    public static final EnabledActionParams ENABLED = new EnabledActionParams(true);

    @JsonCreator
    public EnabledActionParams(@JsonProperty("enabled") boolean enabled) {
        this.enabled = enabled;
    }
}
