package com.ryuqq.remoteops.core.batch;

import java.util.Map;

/**
 * 메시지 큐 일괄 전송용 엔트리.
 *
 * <p>선택 필드는 null로 "설정 안 함"을 명시합니다.</p>
 *
 * @param id 배치 내 고유 ID
 * @param body 메시지 본문
 * @param delaySeconds 전달 지연 (초, null 가능)
 * @param messageGroupId FIFO 그룹 ID (null 가능)
 * @param deduplicationId FIFO 중복 제거 ID (null 가능)
 * @param attributes 메시지 속성 (빈 맵 가능)
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public record MessageEntry(
    String id,
    String body,
    Integer delaySeconds,
    String messageGroupId,
    String deduplicationId,
    Map<String, String> attributes
) {

    public MessageEntry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (delaySeconds != null && delaySeconds < 0) {
            throw new IllegalArgumentException("delaySeconds must be non-negative (current: " + delaySeconds + ")");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * 기본 메시지 생성.
     */
    public static MessageEntry of(String id, String body) {
        return new MessageEntry(id, body, null, null, null, Map.of());
    }

    /**
     * 지연 전송 메시지 생성.
     */
    public static MessageEntry delayed(String id, String body, int delaySeconds) {
        return new MessageEntry(id, body, delaySeconds, null, null, Map.of());
    }

    /**
     * FIFO 메시지 생성.
     */
    public static MessageEntry fifo(String id, String body, String messageGroupId, String deduplicationId) {
        if (messageGroupId == null || messageGroupId.isBlank()) {
            throw new IllegalArgumentException("messageGroupId cannot be null or blank for fifo message");
        }
        return new MessageEntry(id, body, null, messageGroupId, deduplicationId, Map.of());
    }

    /**
     * 속성만 변경한 새 인스턴스 생성.
     */
    public MessageEntry withAttributes(Map<String, String> attributes) {
        return new MessageEntry(id, body, delaySeconds, messageGroupId, deduplicationId, attributes);
    }
}
