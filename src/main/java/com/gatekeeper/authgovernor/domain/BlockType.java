package com.gatekeeper.authgovernor.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Scope of a block. A COMBINED block restricts both login and password reset.
 */
public enum BlockType {
    LOGIN,
    PASSWORD_RESET,
    COMBINED;

    public static BlockType of(AttemptType attemptType) {
        return attemptType == AttemptType.LOGIN ? LOGIN : PASSWORD_RESET;
    }

    /** Block types that restrict the given attempt type. */
    public static Set<BlockType> covering(AttemptType attemptType) {
        return EnumSet.of(of(attemptType), COMBINED);
    }

    public boolean covers(AttemptType attemptType) {
        return this == COMBINED || this == of(attemptType);
    }
}
