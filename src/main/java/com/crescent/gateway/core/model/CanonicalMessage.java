package com.crescent.gateway.core.model;

import lombok.Value;

/**
 * 规范化后的单条对话消息（role + 纯文本 content）
 */
@Value(staticConstructor = "of")
public class CanonicalMessage {
    String role;
    String content;
}
