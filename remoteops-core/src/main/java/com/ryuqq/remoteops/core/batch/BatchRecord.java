package com.ryuqq.remoteops.core.batch;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * 스트림 적재용 단일 레코드.
 *
 * <p>엔트리 크기는 {@code data 길이 + partitionKey의 UTF-8 바이트 길이}로 계산합니다.</p>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
public final class BatchRecord {

    private final byte[] data;
    private final String partitionKey;
    private final String explicitHashKey;

    private BatchRecord(byte[] data, String partitionKey, String explicitHashKey) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        if (partitionKey == null) {
            throw new IllegalArgumentException("partitionKey cannot be null");
        }
        this.data = data.clone();
        this.partitionKey = partitionKey;
        this.explicitHashKey = explicitHashKey;
    }

    /**
     * 레코드 생성.
     *
     * @param data 페이로드
     * @param partitionKey 파티션 키 (null이면 무작위 UUID 생성)
     * @param explicitHashKey 명시적 해시 키 (null 가능)
     * @return BatchRecord
     */
    public static BatchRecord of(byte[] data, String partitionKey, String explicitHashKey) {
        String key = partitionKey != null ? partitionKey : UUID.randomUUID().toString();
        return new BatchRecord(data, key, explicitHashKey);
    }

    /**
     * 파티션 키를 자동 생성하는 레코드 생성.
     *
     * @param data 페이로드
     * @return BatchRecord
     */
    public static BatchRecord of(byte[] data) {
        return of(data, null, null);
    }

    /**
     * 문자열 페이로드(UTF-8)로 레코드 생성.
     *
     * @param data 페이로드
     * @param partitionKey 파티션 키 (null이면 무작위 UUID 생성)
     * @return BatchRecord
     */
    public static BatchRecord of(String data, String partitionKey) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        return of(data.getBytes(StandardCharsets.UTF_8), partitionKey, null);
    }

    /**
     * 한도 계산에 쓰이는 엔트리 크기.
     *
     * @return 페이로드 길이 + 파티션 키 바이트 길이
     */
    public long size() {
        return (long) data.length + partitionKey.getBytes(StandardCharsets.UTF_8).length;
    }

    public byte[] getData() {
        return data.clone();
    }

    public String getPartitionKey() {
        return partitionKey;
    }

    public String getExplicitHashKeyOrNull() {
        return explicitHashKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BatchRecord that = (BatchRecord) o;
        return Arrays.equals(data, that.data)
            && partitionKey.equals(that.partitionKey)
            && Objects.equals(explicitHashKey, that.explicitHashKey);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(data);
        result = 31 * result + partitionKey.hashCode();
        result = 31 * result + (explicitHashKey != null ? explicitHashKey.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return "BatchRecord{partitionKey=" + partitionKey + ", size=" + size() + "}";
    }
}
