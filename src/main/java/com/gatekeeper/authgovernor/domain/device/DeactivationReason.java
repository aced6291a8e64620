package com.gatekeeper.authgovernor.domain.device;

/**
 * Why a device session stopped being active.
 */
public enum DeactivationReason {
    /** Least-recently-used session pushed out by a new login at the cap. */
    EVICTED,
    /** Operator revoked it. */
    REVOKED,
    /** Operator lowered the cap below the active count. */
    CAP_REDUCED,
    LOGOUT
}
