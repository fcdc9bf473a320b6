package com.teamA.cra.common.marker;

/**
 * "하루 한 번" 작업용 마커
 */
public interface DailyMarkerStore {

    /** 처음 찍었으면 true, 이미 있으면 false */
    boolean tryMark(String name, String date);

    /** 표시 해제 (마커 찍은 뒤 작업이 실패했을 때 다음 실행에서 재시도하도록) */
    void clear(String name, String date);
}
