package com.example.datalifecycle.access;

import com.example.datalifecycle.models.RefreshToken;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;

@Component
public class DynamoRefreshTokenAccess extends AbstractDynamoUserLinkedAccess<RefreshToken> implements RefreshTokenAccess {

    public DynamoRefreshTokenAccess(DynamoDbEnhancedClient enhancedClient) {
        super(enhancedClient, "refresh_tokens", RefreshToken.class);
    }
}
