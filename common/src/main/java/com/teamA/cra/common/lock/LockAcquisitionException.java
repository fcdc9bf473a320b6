package com.teamA.cra.common.lock;

public class LockAcquisitionException extends RuntimeException {

    private final String lockKey;

    public LockAcquisitionException(String lockKey, long waitedMillis) {
        super("Could not acquire lock " + lockKey + " within " + waitedMillis + "ms");
        this.lockKey = lockKey;
    }

    public String getLockKey() {
        return lockKey;
    }
}
