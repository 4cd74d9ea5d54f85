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
public class PushToken implements UserLinked {

    @NonNull private String id;
    @NonNull private String userId;
    @NonNull private String token;

    private String platform;
    private Long lastUsedAt;

    @Override
    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public String getId() { return id; }

    @Override
    @DynamoDbSecondaryPartitionKey(indexNames = BY_USER_ID_INDEX)
    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbAttribute("token")
    public String getToken() { return token; }

    @DynamoDbAttribute("platform")
    public String getPlatform() { return platform; }

    @DynamoDbAttribute("last_used_at")
    public Long getLastUsedAt() { return lastUsedAt; }
}
