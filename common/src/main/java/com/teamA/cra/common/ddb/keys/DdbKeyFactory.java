package com.teamA.cra.common.ddb.keys;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * DynamoDB PK/SK 문자열 규칙을 단일 진실로 관리한다. (single-table)
 *
 * ❗주의
 * - 절대 다른 곳에서 문자열을 직접 조합하지 말 것
 * - 모든 PK/SK는 이 Factory를 통해 생성한다
 */
public final class DdbKeyFactory {

    public static final String ATTR_PK = "PK";
    public static final String ATTR_SK = "SK";
    public static final String ATTR_GSI1_PK = "GSI1PK";
    public static final String ATTR_GSI1_SK = "GSI1SK";
    public static final String ATTR_GSI2_PK = "GSI2PK";
    public static final String ATTR_GSI2_SK = "GSI2SK";

    public static final String GSI1 = "GSI1";
    public static final String GSI2 = "GSI2";

    // PK
    private static final String REQ_PREFIX = "REQ#";
    private static final String DRAFT_PREFIX = "DRAFT#";
    private static final String LOCK_PREFIX = "LOCK#";
    private static final String COUNTER_PREFIX = "COUNTER#";
    private static final String USER_PREFIX = "USER#";
    private static final String ROLE_PREFIX = "ROLE#";
    private static final String EMAIL_PREFIX = "EMAIL#";
    private static final String DIGEST_PREFIX = "DIGEST#";
    private static final String SETTINGS_PK = "SETTINGS#NOTIFICATION";
    private static final String MARKER_PREFIX = "MARKER#";

    // SK
    private static final String META_SK = "META";         // RequestItem / Settings
    private static final String POINTER_SK = "POINTER";   // draft 세션 -> requestId
    private static final String LOCK_SK = "LOCK";         // advisory lock lease
    private static final String COUNTER_SK = "COUNTER";   // 일자별 시퀀스
    private static final String PROFILE_SK = "PROFILE";   // 사용자
    private static final String NOTI_PREFIX = "NOTI#";    // in-app 알림
    private static final String EVT_PREFIX = "EVT#";      // digest 이벤트
    private static final String CAT_PREFIX = "CAT#";      // 생성 시각 정렬

    private DdbKeyFactory() {
        // util class
    }

    /** RequestItem PK: REQ#<requestId> */
    public static String requestPk(String requestId) {
        return REQ_PREFIX + requestId;
    }

    public static String requestPkPrefix() {
        return REQ_PREFIX;
    }

    /**
     * Draft 세션 PK (pointer item / GSI1): DRAFT#<creatorId>#<sessionKey>
     * ❗두 값 모두 사용자 입력이라 인코딩 ('#'이 구분자와 섞이지 않게)
     */
    public static String draftSessionPk(String creatorId, String draftSessionKey) {
        return DRAFT_PREFIX + component(creatorId) + "#" + component(draftSessionKey);
    }

    /** Advisory lock PK: LOCK#<key1>#<key2> (각 부분 인코딩) */
    public static String lockPk(String key1, String key2) {
        return LOCK_PREFIX + component(key1) + "#" + component(key2);
    }

    /** 키 조각 인코딩: '#' -> %23 */
    static String component(String raw) {
        return URLEncoder.encode(raw == null ? "" : raw, StandardCharsets.UTF_8);
    }

    /** 일자별 request 카운터 PK: COUNTER#request_<yymmdd> */
    public static String requestCounterPk(String dateStamp) {
        return COUNTER_PREFIX + "request_" + dateStamp;
    }

    /** 사용자 PK: USER#<userId> (in-app 알림도 같은 파티션) */
    public static String userPk(String userId) {
        return USER_PREFIX + userId;
    }

    /** GSI1 PK (역할별 사용자): ROLE#<role> */
    public static String rolePk(String role) {
        return ROLE_PREFIX + role;
    }

    /** GSI2 PK (이메일 -> 사용자): EMAIL#<lowercase email> */
    public static String emailPk(String email) {
        return EMAIL_PREFIX + email.trim().toLowerCase();
    }

    /** Digest 큐 PK: DIGEST#<yyyy-MM-dd>#<lang> */
    public static String digestPk(String digestDate, String lang) {
        return DIGEST_PREFIX + digestDate + "#" + lang;
    }

    public static String settingsPk() {
        return SETTINGS_PK;
    }

    /** 하루 한 번짜리 작업 마커: MARKER#<name>#<yyyy-MM-dd> */
    public static String dailyMarkerPk(String name, String date) {
        return MARKER_PREFIX + name + "#" + date;
    }

    public static String metaSk() { return META_SK; }

    public static String pointerSk() { return POINTER_SK; }

    public static String lockSk() { return LOCK_SK; }

    public static String counterSk() { return COUNTER_SK; }

    public static String profileSk() { return PROFILE_SK; }

    /** in-app 알림 SK: NOTI#<notificationId> (id 자체가 시간순 정렬됨) */
    public static String notificationSk(String notificationId) {
        return NOTI_PREFIX + notificationId;
    }

    public static String notificationSkPrefix() {
        return NOTI_PREFIX;
    }

    /** Digest 이벤트 SK: EVT#<eventAt>#<id> */
    public static String digestEventSk(long eventAt, String id) {
        return EVT_PREFIX + eventAt + "#" + id;
    }

    /** 마커 SK: 하루 한 번 단위 안의 대상 (예: admin userId), 대상 없으면 "ONCE" */
    public static String markerSk(String scope) {
        return scope == null || scope.isEmpty() ? "ONCE" : scope;
    }

    /** GSI1 SK (draft 세션 내 정렬): CAT#<createdAt>#REQ#<requestId> */
    public static String draftSessionSk(long createdAt, String requestId) {
        return CAT_PREFIX + createdAt + "#" + REQ_PREFIX + requestId;
    }

    /** GSI1 SK (역할별 사용자): USER#<userId> */
    public static String roleMemberSk(String userId) {
        return USER_PREFIX + userId;
    }
}
