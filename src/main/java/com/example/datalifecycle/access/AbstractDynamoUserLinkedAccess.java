package com.example.datalifecycle.access;

import com.example.datalifecycle.models.UserLinked;
import java.util.List;
import java.util.stream.Collectors;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

abstract class AbstractDynamoUserLinkedAccess<T extends UserLinked> implements UserLinkedDataAccess<T> {

    protected final DynamoDbTable<T> table;

    protected AbstractDynamoUserLinkedAccess(DynamoDbEnhancedClient enhancedClient,
                                             String tableName,
                                             Class<T> beanClass) {
        this.table = enhancedClient.table(tableName, TableSchema.fromBean(beanClass));
    }

    @Override
    public T save(T item) {
        table.putItem(item);
        return item;
    }

    @Override
    public List<T> findByUserId(String userId) {
        return table.index(UserLinked.BY_USER_ID_INDEX)
                .query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(userId).build())))
                .stream()
                .flatMap(page -> page.items().stream())
                .collect(Collectors.toList());
    }

    @Override
    public int deleteByUserId(String userId) {
        List<T> linked = findByUserId(userId);
        for (T item : linked) {
            deleteById(item.getId());
        }
        return linked.size();
    }

    protected void deleteById(String id) {
        table.deleteItem(Key.builder().partitionValue(id).build());
    }
}
