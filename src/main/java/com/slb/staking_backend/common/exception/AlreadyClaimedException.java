package com.slb.staking_backend.common.exception;

public class AlreadyClaimedException extends StateViolationException {

    public static final String ALREADY_CLAIMED = "ALREADY_CLAIMED";

    public AlreadyClaimedException(Long requestId) {
        super(ALREADY_CLAIMED, "claim.once", "CLAIMABLE", "CLAIMED (request " + requestId + ")");
    }
}
