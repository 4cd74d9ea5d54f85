package com.example.datalifecycle.access;

import com.example.datalifecycle.models.ConsentRecord;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;

@Component
public class DynamoConsentRecordAccess extends AbstractDynamoUserLinkedAccess<ConsentRecord> implements ConsentRecordAccess {

    public DynamoConsentRecordAccess(DynamoDbEnhancedClient enhancedClient) {
        super(enhancedClient, "consent_records", ConsentRecord.class);
    }
}
