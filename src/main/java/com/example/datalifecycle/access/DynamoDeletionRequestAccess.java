package com.example.datalifecycle.access;

import com.example.datalifecycle.models.DeletionRequest;
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
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

@Component
public class DynamoDeletionRequestAccess implements DeletionRequestAccess {

    private final DynamoDbTable<DeletionRequest> table;

    public DynamoDeletionRequestAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table("deletion_requests", TableSchema.fromBean(DeletionRequest.class));
    }

    @Override
    public Optional<DeletionRequest> findById(String requestId) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder()
                        .partitionValue(requestId)
                        .build())
                .consistentRead(true)));
    }

    @Override
    public List<DeletionRequest> findPendingRequestedAtOrBefore(long cutoffTimestamp) {
        return table.index(DeletionRequest.STATUS_INDEX)
                .query(r -> r.queryConditional(
                                QueryConditional.sortLessThanOrEqualTo(
                                        Key.builder()
                                                .partitionValue(DeletionRequest.Status.PENDING.name())
                                                .sortValue(cutoffTimestamp)
                                                .build()))
                        .scanIndexForward(true))
                .stream()
                .flatMap(page -> page.items().stream())
                // Index reads are eventually consistent and may be projected; re-read the base row
                .map(indexed -> findById(indexed.getId()))
                .flatMap(Optional::stream)
                .filter(request -> request.getStatus() == DeletionRequest.Status.PENDING)
                .collect(Collectors.toList());
    }

    @Override
    public DeletionRequest save(DeletionRequest request) {
        table.putItem(request);
        return request;
    }

    @Override
    public boolean completeIfPending(DeletionRequest completed) {
        try {
            table.updateItem(r -> r.item(completed)
                    .conditionExpression(Expression.builder()
                            .expression("#status = :pending")
                            .putExpressionName("#status", "status")
                            .putExpressionValue(":pending",
                                    AttributeValue.fromS(DeletionRequest.Status.PENDING.name()))
                            .build()));
            return true;
        } catch (ConditionalCheckFailedException ex) {
            return false;
        }
    }
}
