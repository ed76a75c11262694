package com.agentgate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ModelsListResponse(String object, List<ModelEntry> data) {

    public record ModelEntry(
        String id,
        String object,
        long created,
        @JsonProperty("owned_by") String ownedBy
    ) {}

    public static ModelsListResponse of(List<ModelEntry> data) {
        return new ModelsListResponse("list", data);
    }
}
