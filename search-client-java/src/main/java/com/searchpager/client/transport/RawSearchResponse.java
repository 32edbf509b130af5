package com.searchpager.client.transport;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Status and undecoded body of a search response.
 */
@Getter
@AllArgsConstructor
public class RawSearchResponse {

    private final String index;
    private final int status;
    private final byte[] body;

    @Override
    public String toString() {
        return "RawSearchResponse{index=" + index + ", status=" + status
                + ", body=" + new String(body, StandardCharsets.UTF_8) + "}";
    }
}
