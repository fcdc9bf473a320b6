package com.teamA.cra.common.id;

/**
 * Request id 발급: <prefix><yyMMdd><seq>, seq는 일자별 원자 카운터 (최소 2자리 zero-pad)
 */
public interface RequestIdGenerator {

    String nextId();
}
