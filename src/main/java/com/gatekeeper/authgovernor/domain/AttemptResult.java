package com.gatekeeper.authgovernor.domain;

public enum AttemptResult {
    SUCCESS,
    FAILED,
    BLOCKED
}
