package com.crescent.gateway.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * 统一响应中的一个内容块：一段输出文本、一条 embedding 向量或一张生成的图片
 */
@Value
@Builder
public class ContentBlock {

    public enum Type {
        OUTPUT_TEXT,
        EMBEDDING,
        IMAGE
    }

    Type type;
    String role;
    String text;
    /** embedding 在原始输入中的下标，或图片在结果中的序号 */
    int index;
    float[] embedding;
    /** 图片地址与 base64 内容，二者通常只有一个 */
    String url;
    String b64Json;
    String revisedPrompt;

    public static ContentBlock text(String role, String text) {
        return ContentBlock.builder()
                .type(Type.OUTPUT_TEXT)
                .role(role == null ? "assistant" : role)
                .text(text == null ? "" : text)
                .build();
    }

    public static ContentBlock embedding(int index, float[] vector) {
        return ContentBlock.builder()
                .type(Type.EMBEDDING)
                .index(index)
                .embedding(vector)
                .build();
    }

    public static ContentBlock image(int index, String url, String b64Json, String revisedPrompt) {
        return ContentBlock.builder()
                .type(Type.IMAGE)
                .index(index)
                .url(url)
                .b64Json(b64Json)
                .revisedPrompt(revisedPrompt)
                .build();
    }

    public boolean isText() {
        return type == Type.OUTPUT_TEXT;
    }
}
