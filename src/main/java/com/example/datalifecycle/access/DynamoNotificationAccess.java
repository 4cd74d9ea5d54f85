package com.example.datalifecycle.access;

import com.example.datalifecycle.models.Notification;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;

@Component
public class DynamoNotificationAccess extends AbstractDynamoUserLinkedAccess<Notification> implements NotificationAccess {

    public DynamoNotificationAccess(DynamoDbEnhancedClient enhancedClient) {
        super(enhancedClient, "notifications", Notification.class);
    }
}
