package com.example.datalifecycle.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class ConsentRecord implements UserLinked {

    @NonNull private String id;
    @NonNull private String userId;
    @NonNull private String consentType;

    private Boolean granted;
    private Long recordedAt;

    @Override
    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public String getId() { return id; }

    @Override
    @DynamoDbSecondaryPartitionKey(indexNames = BY_USER_ID_INDEX)
    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbAttribute("consent_type")
    public String getConsentType() { return consentType; }

    @DynamoDbAttribute("granted")
    public Boolean getGranted() { return granted; }

    @DynamoDbAttribute("recorded_at")
    public Long getRecordedAt() { return recordedAt; }
}
