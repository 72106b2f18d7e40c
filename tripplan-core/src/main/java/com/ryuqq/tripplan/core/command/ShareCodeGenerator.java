package com.ryuqq.tripplan.core.command;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Trip 공유 코드 생성기.
 *
 * <p>공유 코드 없이 생성되는 Trip에 코드를 부여할 때 사용합니다.
 * 고유성 검사는 호출자(CreateTripCommand)가 Receiver를 조회하여 수행합니다.</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ShareCodeGenerator {

    /**
     * 기본 코드 길이.
     */
    int DEFAULT_LENGTH = 6;

    /**
     * 새 공유 코드 생성.
     *
     * @return 공유 코드 (null 또는 빈 문자열 불가)
     */
    String next();

    /**
     * 대문자 영문과 숫자로 구성된 6자리 무작위 코드 생성기.
     *
     * @return ShareCodeGenerator 인스턴스
     */
    static ShareCodeGenerator random() {
        return random(new SecureRandom());
    }

    /**
     * 주어진 난수 생성기를 사용하는 코드 생성기 (테스트용 시드 지정 가능).
     *
     * @param random 난수 생성기
     * @return ShareCodeGenerator 인스턴스
     * @throws IllegalArgumentException random이 null인 경우
     */
    static ShareCodeGenerator random(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        String alphabet = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
        return () -> {
            StringBuilder sb = new StringBuilder(DEFAULT_LENGTH);
            for (int i = 0; i < DEFAULT_LENGTH; i++) {
                sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
            }
            return sb.toString();
        };
    }
}
