package com.crescent.gateway.core.stream;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 上游 SSE 数据解析器
 * <p>
 * WebClient 在 {@code text/event-stream} 响应下已经按事件拆出 data 内容；
 * 服务商返回其它 Content-Type 时拿到的是原始文本块，需要逐行去掉 {@code data:} 前缀。
 * 两种情况都只保留 JSON 对象或终止标记 [DONE]，其它行（event:、id:、注释、心跳）被过滤。
 */
@Component
public class UpstreamSseParser {

    public static final String DONE = "[DONE]";

    /**
     * 解析一个上游数据块
     *
     * @param chunk 上游返回的原始片段（可能包含多行）
     * @return 有效 payload 列表，按出现顺序排列
     */
    public List<String> parse(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return Collections.emptyList();
        }
        String trimmed = chunk.strip();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        // 已拆好的单个事件，JSON 可能跨多行
        if (trimmed.charAt(0) == '{' && trimmed.charAt(trimmed.length() - 1) == '}') {
            return List.of(trimmed);
        }
        if (DONE.equalsIgnoreCase(trimmed)) {
            return List.of(DONE);
        }

        List<String> payloads = new ArrayList<>(2);
        for (String line : trimmed.split("\n")) {
            String payload = normalizeLine(line);
            if (payload != null) {
                payloads.add(payload);
            }
        }
        return payloads;
    }

    /**
     * 规范化单行 SSE 数据，提取出有效 payload
     * <p>
     * 直接操作索引，避免多次 trim() 和 substring() 调用。
     */
    String normalizeLine(String line) {
        if (line == null) {
            return null;
        }
        int start = 0;
        int end = line.length();
        while (start < end && Character.isWhitespace(line.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(line.charAt(end - 1))) {
            end--;
        }
        if (start >= end) {
            return null;
        }

        // 去除 "data:" 前缀（可能有多个）
        while (end - start >= 5 && line.regionMatches(true, start, "data:", 0, 5)) {
            start += 5;
            while (start < end && Character.isWhitespace(line.charAt(start))) {
                start++;
            }
        }
        if (start >= end) {
            return null;
        }

        if (line.charAt(start) == '{' && line.charAt(end - 1) == '}') {
            return line.substring(start, end);
        }
        if (end - start == DONE.length() && line.regionMatches(true, start, DONE, 0, DONE.length())) {
            return DONE;
        }
        return null;
    }
}
