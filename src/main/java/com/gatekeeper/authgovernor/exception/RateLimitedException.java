package com.gatekeeper.authgovernor.exception;

import com.gatekeeper.authgovernor.domain.BlockInfo;

/**
 * Thrown when an active block rejects an authentication attempt.
 */
public class RateLimitedException extends RuntimeException {

    private final BlockInfo blockInfo;

    public RateLimitedException(BlockInfo blockInfo) {
        super(blockInfo.messageEn());
        this.blockInfo = blockInfo;
    }

    public BlockInfo getBlockInfo() {
        return blockInfo;
    }
}
