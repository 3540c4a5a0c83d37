package util;

import java.util.Map;

/**
 * 로그 라인의 분해(Parse) 및 필드 추출 전략 인터페이스
 */
public interface LogLineParser {

    /**
     * 로그 라인 하나를 최상위 세그먼트 배열로 분해하는 함수
     *
     * @param rawLine 원본 로그 라인
     * @return 세그먼트 배열
     * @throws IllegalArgumentException 포맷이 맞지 않는 라인인 경우
     */
    String[] parse(String rawLine);

    String extractTimestamp(String[] parts);

    String extractLevel(String[] parts);

    /**
     * @return 스레드 식별자, 알 수 없으면 {@code "unknown"}
     */
    String extractThreadId(String[] parts);

    /**
     * @return span 이름, 없으면 빈 문자열
     */
    String extractSpan(String[] parts);

    String extractTarget(String[] parts);

    String extractMessage(String[] parts);

    /**
     * 메시지 세그먼트에서 key=value 필드를 추출하는 함수
     *
     * @return 필드 이름 → 값 (같은 키가 여러 번 나오면 마지막 값)
     */
    Map<String, String> extractFields(String[] parts);
}
