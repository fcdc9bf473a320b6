package com.teamA.cra.common.notification.recipient;

import com.teamA.cra.common.ddb.keys.DdbKeyFactory;
import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.domain.enums.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.Page;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * UserItem 기반 디렉터리 (enhanced client)
 *
 * - 역할별: GSI1 (ROLE#role)
 * - 이메일: GSI2 (EMAIL#lower)
 */
@Slf4j
@RequiredArgsConstructor
public class DynamoRecipientDirectory implements RecipientDirectory {

    private static final TableSchema<UserItem> USER_SCHEMA = TableSchema.fromBean(UserItem.class);

    private final DynamoDbEnhancedClient enhancedClient;
    private final String tableName;

    private DynamoDbTable<UserItem> table() {
        return enhancedClient.table(tableName, USER_SCHEMA);
    }

    @Override
    public List<DirectoryUser> findActiveUsersByRole(Role role) {
        Key gsiKey = Key.builder()
                .partitionValue(DdbKeyFactory.rolePk(role.code()))
                .build();

        try {
            List<DirectoryUser> result = new ArrayList<>();
            Iterator<Page<UserItem>> it = table()
                    .index(DdbKeyFactory.GSI1)
                    .query(q -> q.queryConditional(QueryConditional.keyEqualTo(gsiKey)))
                    .iterator();

            while (it.hasNext()) {
                for (UserItem item : it.next().items()) {
                    if (item.isActiveUser()) result.add(item.toDirectoryUser());
                }
            }
            return result;
        } catch (SdkException e) {
            throw new RecipientLookupException("Failed to query users of role " + role.code(), e);
        }
    }

    @Override
    public Map<String, NotificationLanguage> preferredLanguages(Collection<String> emails) {
        Map<String, NotificationLanguage> out = new HashMap<>();
        for (String email : emails) {
            if (email == null || email.isBlank()) continue;
            String lower = email.trim().toLowerCase();
            if (out.containsKey(lower)) continue;

            findByEmail(lower)
                    .filter(DirectoryUser::active)
                    .filter(u -> u.preferredLanguage() != null)
                    .ifPresent(u -> out.put(lower, u.preferredLanguage()));
        }
        return out;
    }

    @Override
    public Optional<DirectoryUser> findById(String userId) {
        Key key = Key.builder()
                .partitionValue(DdbKeyFactory.userPk(userId))
                .sortValue(DdbKeyFactory.profileSk())
                .build();

        try {
            UserItem item = table().getItem(r -> r.key(key).consistentRead(true));
            return Optional.ofNullable(item).map(UserItem::toDirectoryUser);
        } catch (SdkException e) {
            throw new RecipientLookupException("Failed to load user " + userId, e);
        }
    }

    @Override
    public Optional<DirectoryUser> findByEmail(String email) {
        Key gsiKey = Key.builder()
                .partitionValue(DdbKeyFactory.emailPk(email))
                .build();

        try {
            Iterator<Page<UserItem>> it = table()
                    .index(DdbKeyFactory.GSI2)
                    .query(q -> q.queryConditional(QueryConditional.keyEqualTo(gsiKey)).limit(1))
                    .iterator();

            while (it.hasNext()) {
                List<UserItem> items = it.next().items();
                if (!items.isEmpty()) return Optional.of(items.get(0).toDirectoryUser());
            }
            return Optional.empty();
        } catch (SdkException e) {
            throw new RecipientLookupException("Failed to look up user by email", e);
        }
    }
}
