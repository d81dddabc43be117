package com.slb.staking_backend.support;

public interface Rollbackable {

    Object snapshot();

    void restore(Object snapshot);
}
