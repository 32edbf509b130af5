package com.searchpager.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * User document as stored in the search index.
 *
 * <p>The wire names are case-sensitive: {@code ID}, {@code CreatedAt}, {@code Username}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class User {

    @JsonProperty("ID")
    private long id;

    @JsonProperty("CreatedAt")
    private OffsetDateTime createdAt;

    @JsonProperty("Username")
    private String username;
}
