package com.example.datalifecycle.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

/**
 * Options captured when the user asked to delete their account. Stored as a nested map on
 * the deletion request.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Getter @Setter
public class DeletionOptions {

    // null means "not specified", which is treated as true
    private Boolean anonymizeContributions;

    @DynamoDbAttribute("anonymize_contributions")
    public Boolean getAnonymizeContributions() { return anonymizeContributions; }
}
