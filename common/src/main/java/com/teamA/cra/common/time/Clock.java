package com.teamA.cra.common.time;

import java.time.Instant;

/**
 * 시간 획득을 추상화하기 위한 인터페이스.
 * - 테스트에서 시간 고정을 쉽게 하기 위함
 * - history timestamp, digestDate, request id 날짜 모두 여기서 나온다
 */
public interface Clock {

    /** 현재 시각을 epoch milliseconds로 반환 */
    long nowMillis();

    default Instant now() {
        return Instant.ofEpochMilli(nowMillis());
    }
}
