package com.relaygate.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI {@code /v1/models} envelope. Ids take the {@code provider/model} form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelListResponse {
    @Builder.Default
    private String object = "list";
    private List<ModelInfo> data;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelInfo {
        private String id;
        @Builder.Default
        private String object = "model";
        @JsonProperty("owned_by")
        private String ownedBy;
    }
}
