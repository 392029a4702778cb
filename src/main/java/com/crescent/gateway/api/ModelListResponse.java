package com.crescent.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "模型列表（OpenAI 兼容）")
public class ModelListResponse {

    private String object = "list";

    private List<ModelData> data;

    public ModelListResponse(List<ModelData> data) {
        this.data = data;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelData {
        private String id;
        @Builder.Default
        private String object = "model";
        private Long created;
        @JsonProperty("owned_by")
        private String ownedBy;
    }
}
