/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.core;

import java.util.Locale;

/**
 * Why a call was refused. Every denial carries exactly one of these.
 */
public enum DenyReason {
    ACTION_DISABLED,
    GLOBS_NOT_ALLOWED,
    INTERPOLATIONS_NOT_ALLOWED,
    ARTIFACT_NOT_WHITELISTED,
    FILE_TOO_LARGE,
    DAILY_QUOTA_EXCEEDED,
    DUPLICATE_TOO_SOON,
    PATH_BLACKLISTED,
    PATH_NOT_WHITELISTED,
    NO_MATCHING_ROUTER,
    INVALID_ARGUMENTS,
    CLIENT_NOT_ACCESSIBLE,
    INTERNAL_ERROR;

    /** Lower-case token used in metric names and wire output. */
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }
}
