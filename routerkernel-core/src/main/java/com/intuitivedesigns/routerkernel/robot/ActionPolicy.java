/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.Decision;

/**
 * Gate for one robot action: enabled flag first, then the action's own argument rules.
 */
public interface ActionPolicy {

    RobotAction action();

    boolean enabled();

    Decision validate(ApiCall call);
}
