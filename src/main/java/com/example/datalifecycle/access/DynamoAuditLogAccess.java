package com.example.datalifecycle.access;

import com.example.datalifecycle.models.AuditLogEntry;
import com.example.datalifecycle.models.UserLinked;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

@Component
public class DynamoAuditLogAccess implements AuditLogAccess {

    private final DynamoDbTable<AuditLogEntry> table;

    public DynamoAuditLogAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("audit_logs", TableSchema.fromBean(AuditLogEntry.class));
    }

    @Override
    public void save(AuditLogEntry entry) {
        table.putItem(entry);
    }

    @Override
    public Optional<AuditLogEntry> findById(String id) {
        return Optional.ofNullable(table.getItem(r -> r.key(buildKey(id)).consistentRead(true)));
    }

    @Override
    public int clearIdentifiersOlderThan(long cutoffTimestamp) {
        Expression filter = olderThan(cutoffTimestamp,
                "(attribute_exists(user_id) OR attribute_exists(ip_address) OR attribute_exists(user_agent))");

        // DynamoDB has no set-based update; the scan and the writes form one logical bulk step
        int updated = 0;
        for (AuditLogEntry entry : scan(filter)) {
            table.updateItem(r -> r.item(entry.clearIdentifiers()).ignoreNulls(false));
            updated++;
        }
        return updated;
    }

    @Override
    public List<AuditLogEntry> findWithMetadataOlderThan(long cutoffTimestamp) {
        return scan(olderThan(cutoffTimestamp, "attribute_exists(metadata)"));
    }

    @Override
    public void update(AuditLogEntry entry) {
        table.updateItem(r -> r.item(entry).ignoreNulls(false));
    }

    @Override
    public int detachUser(String userId) {
        List<AuditLogEntry> owned = table.index(UserLinked.BY_USER_ID_INDEX)
                .query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(userId))))
                .stream()
                .flatMap(page -> page.items().stream())
                .collect(Collectors.toList());

        int detached = 0;
        for (AuditLogEntry entry : owned) {
            // The GSI projection may be partial; re-read so the write does not drop attributes
            AuditLogEntry current = table.getItem(r -> r.key(buildKey(entry.getId())).consistentRead(true));
            if (current == null || !userId.equals(current.getUserId())) {
                continue;
            }
            current.setUserId(null);
            table.updateItem(r -> r.item(current).ignoreNulls(false));
            detached++;
        }
        return detached;
    }

    @Override
    public int deleteOlderThan(long cutoffTimestamp) {
        List<AuditLogEntry> expired = scan(olderThan(cutoffTimestamp, null));
        for (AuditLogEntry entry : expired) {
            table.deleteItem(buildKey(entry.getId()));
        }
        return expired.size();
    }

    private List<AuditLogEntry> scan(Expression filterExpression) {
        ScanEnhancedRequest scanRequest = ScanEnhancedRequest.builder()
                .filterExpression(filterExpression)
                .consistentRead(true)
                .build();

        return table.scan(scanRequest)
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    private static Expression olderThan(long cutoffTimestamp, String extraCondition) {
        String expression = "#created_at < :cutoff";
        if (extraCondition != null) {
            expression = expression + " AND " + extraCondition;
        }
        return Expression.builder()
                .expression(expression)
                .putExpressionName("#created_at", "created_at")
                .putExpressionValue(":cutoff", AttributeValue.builder().n(String.valueOf(cutoffTimestamp)).build())
                .build();
    }

    private Key buildKey(String partitionValue) {
        return Key.builder().partitionValue(partitionValue).build();
    }
}
