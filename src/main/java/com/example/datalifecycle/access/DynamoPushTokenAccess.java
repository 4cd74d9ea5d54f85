package com.example.datalifecycle.access;

import com.example.datalifecycle.models.PushToken;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

@Component
public class DynamoPushTokenAccess extends AbstractDynamoUserLinkedAccess<PushToken> implements PushTokenAccess {

    public DynamoPushTokenAccess(DynamoDbEnhancedClient enhancedClient) {
        super(enhancedClient, "push_tokens", PushToken.class);
    }

    @Override
    public int deleteLastUsedBefore(long cutoffTimestamp) {
        Expression filterExpression = Expression.builder()
                .expression("#last_used_at < :cutoff")
                .putExpressionName("#last_used_at", "last_used_at")
                .putExpressionValue(":cutoff", AttributeValue.builder().n(String.valueOf(cutoffTimestamp)).build())
                .build();

        List<PushToken> inactive = table.scan(ScanEnhancedRequest.builder()
                        .filterExpression(filterExpression)
                        .build())
                .items()
                .stream()
                .collect(Collectors.toList());

        for (PushToken token : inactive) {
            deleteById(token.getId());
        }
        return inactive.size();
    }
}
