package com.teamA.cra.common.notification.recipient;

import com.teamA.cra.common.ddb.keys.DdbKeyFactory;
import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.domain.enums.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * 사용자 프로필 item (enhanced client bean)
 *
 * PK = USER#{userId}, SK = PROFILE
 * GSI1: ROLE#{role} / USER#{userId}  (역할별 사용자)
 * GSI2: EMAIL#{lower email} / PROFILE (이메일 -> 사용자)
 */
@DynamoDbBean
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserItem {

    // 1. pk, sk
    private String pk;
    private String sk;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("PK")
    public String getPk() { return pk; }

    @DynamoDbSortKey
    @DynamoDbAttribute("SK")
    public String getSk() { return sk; }

    // 2. GSI
    private String gsi1Pk;
    private String gsi1Sk;

    @DynamoDbSecondaryPartitionKey(indexNames = DdbKeyFactory.GSI1)
    @DynamoDbAttribute("GSI1PK")
    public String getGsi1Pk() { return gsi1Pk; }

    @DynamoDbSecondarySortKey(indexNames = DdbKeyFactory.GSI1)
    @DynamoDbAttribute("GSI1SK")
    public String getGsi1Sk() { return gsi1Sk; }

    private String gsi2Pk;
    private String gsi2Sk;

    @DynamoDbSecondaryPartitionKey(indexNames = DdbKeyFactory.GSI2)
    @DynamoDbAttribute("GSI2PK")
    public String getGsi2Pk() { return gsi2Pk; }

    @DynamoDbSecondarySortKey(indexNames = DdbKeyFactory.GSI2)
    @DynamoDbAttribute("GSI2SK")
    public String getGsi2Sk() { return gsi2Sk; }

    // Domain Attributes
    private String userId;
    private String email;
    private String name;
    private String role;               // 소문자 code
    private String preferredLanguage;  // en / fr / zh (없으면 null)
    private Boolean active;

    public void generateKeys() {
        if (userId == null || email == null || role == null) {
            throw new IllegalStateException("키 생성 오류: userId, email, role must not be null");
        }
        this.pk = DdbKeyFactory.userPk(userId);
        this.sk = DdbKeyFactory.profileSk();
        this.gsi1Pk = DdbKeyFactory.rolePk(role);
        this.gsi1Sk = DdbKeyFactory.roleMemberSk(userId);
        this.gsi2Pk = DdbKeyFactory.emailPk(email);
        this.gsi2Sk = DdbKeyFactory.profileSk();
    }

    @DynamoDbIgnore
    public boolean isActiveUser() {
        return Boolean.TRUE.equals(active);
    }

    @DynamoDbIgnore
    public DirectoryUser toDirectoryUser() {
        return new DirectoryUser(
                userId,
                email,
                name,
                Role.fromCode(role).orElse(null),
                NotificationLanguage.fromCode(preferredLanguage).orElse(null),
                isActiveUser()
        );
    }
}
