package com.teamA.cra.common.lock;

import java.util.function.Supplier;

/**
 * (key1, key2) 단위 advisory lock
 *
 * - work 실행 동안만 잡고, 성공/실패와 상관없이 반드시 푼다
 * - 대기 시간 초과 시 LockAcquisitionException
 */
public interface AdvisoryLockManager {

    <T> T withLock(String key1, String key2, Supplier<T> work);
}
