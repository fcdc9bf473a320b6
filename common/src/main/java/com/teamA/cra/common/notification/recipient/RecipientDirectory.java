package com.teamA.cra.common.notification.recipient;

import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.domain.enums.Role;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 사용자 디렉터리 조회
 *
 * 조회 실패는 RecipientLookupException (호출 쪽에서 fail-open 처리)
 */
public interface RecipientDirectory {

    List<DirectoryUser> findActiveUsersByRole(Role role);

    /** key = 소문자 이메일, 활성 사용자만. 선호 언어가 없으면 결과에 없음 */
    Map<String, NotificationLanguage> preferredLanguages(Collection<String> emails);

    Optional<DirectoryUser> findById(String userId);

    Optional<DirectoryUser> findByEmail(String email);
}
