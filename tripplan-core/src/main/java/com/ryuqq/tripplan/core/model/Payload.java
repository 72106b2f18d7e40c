package com.ryuqq.tripplan.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Command 생성 시 전달된 입력 파라미터.
 *
 * <p>Payload는 Command가 실행에 사용하는 입력값을 이름-값 쌍으로 보관하며,
 * describe() 결과와 로그에 노출됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Payload payload = Payload.builder()
 *     .put("tripId", 7L)
 *     .put("newBudget", new BigDecimal("1000"))
 *     .build();
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가 (입력 순서 유지)</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>키는 null 또는 빈 문자열 불가</li>
 *   <li>값은 null 허용 (선택 파라미터)</li>
 * </ul>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(Collections.emptyMap());

    private final Map<String, Object> values;

    private Payload(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Map으로부터 Payload 생성 (방어적 복사).
     *
     * @param values 파라미터 (null이면 빈 Payload)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException 키가 null이거나 빈 문자열인 경우
     */
    public static Payload of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    /**
     * 빈 Payload 조회.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 파라미터 값 조회.
     *
     * @param key 파라미터 이름
     * @return 값 (없거나 null이면 empty)
     */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * 전체 파라미터 조회.
     *
     * @return 수정 불가능한 Map (입력 순서 유지)
     */
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 로그/설명용 한 줄 요약.
     *
     * @return "key=value, key=value" 형식 문자열
     */
    public String summary() {
        return values.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(", "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return values.equals(payload.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + summary() + '}';
    }

    /**
     * Payload 빌더.
     */
    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 파라미터 추가.
         *
         * @param key 파라미터 이름
         * @param value 값 (null 허용)
         * @return this
         * @throws IllegalArgumentException key가 null이거나 빈 문자열인 경우
         */
        public Builder put(String key, Object value) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("key cannot be null or blank");
            }
            values.put(key, value);
            return this;
        }

        public Payload build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new Payload(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
