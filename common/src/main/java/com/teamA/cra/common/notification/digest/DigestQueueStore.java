package com.teamA.cra.common.notification.digest;

/**
 * digest 큐 적재. 꺼내서 묶어 보내는 쪽은 외부 발송기
 */
public interface DigestQueueStore {

    void enqueue(DigestQueueEntry entry);
}
