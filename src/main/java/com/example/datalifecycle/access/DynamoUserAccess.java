package com.example.datalifecycle.access;

import com.example.datalifecycle.models.User;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoUserAccess implements UserAccess {

    private final DynamoDbTable<User> table;

    public DynamoUserAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("users", TableSchema.fromBean(User.class));
    }

    @Override
    public Optional<User> findById(String userId) {
        return Optional.ofNullable(table.getItem(r -> r.key(buildKey(userId))
                .consistentRead(true)));
    }

    @Override
    public User save(User user) {
        table.putItem(user);
        return user;
    }

    @Override
    public User update(User user) {
        // ignoreNulls=false turns null fields into REMOVE actions so scrubbed values disappear
        return table.updateItem(r -> r.item(user).ignoreNulls(false));
    }

    @Override
    public void delete(String userId) {
        table.deleteItem(buildKey(userId));
    }

    private Key buildKey(String userId) {
        return Key.builder().partitionValue(userId).build();
    }
}
