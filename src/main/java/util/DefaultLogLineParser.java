package util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * tracing 포맷 로그 라인 파서.
 *
 * <pre>
 * TIMESTAMP LEVEL ThreadId(N) SPAN:TARGET MESSAGE key=value key="value" ...
 * </pre>
 */
public class DefaultLogLineParser implements LogLineParser {

    private static final int SEGMENT_COUNT = 5;
    private static final String REGEX_DELIMITER = "\\s+";
    private static final String UNKNOWN_THREAD = "unknown";

    private static final Pattern THREAD_ID = Pattern.compile("ThreadId\\((\\d+)\\)");
    // key는 식별자, value는 공백 전까지. 왼쪽부터 겹치지 않게 스캔
    private static final Pattern FIELD = Pattern.compile("(\\w+)=(\\S+)", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public String[] parse(String rawLine) {
        if (rawLine == null || rawLine.trim().isEmpty()) {
            throw new IllegalArgumentException("로그 라인이 비어있습니다.");
        }

        // 마지막 세그먼트(메시지)는 공백을 포함한 채로 남겨둔다
        String[] parts = rawLine.trim().split(REGEX_DELIMITER, SEGMENT_COUNT);
        if (parts.length < SEGMENT_COUNT) {
            throw new IllegalArgumentException("로그 포맷이 일치하지 않습니다. (세그먼트 " + parts.length + "개)");
        }
        return parts;
    }

    @Override
    public String extractTimestamp(String[] parts) {
        return parts[0];
    }

    @Override
    public String extractLevel(String[] parts) {
        return parts[1];
    }

    @Override
    public String extractThreadId(String[] parts) {
        Matcher matcher = THREAD_ID.matcher(parts[2]);
        return matcher.lookingAt() ? matcher.group(1) : UNKNOWN_THREAD;
    }

    @Override
    public String extractSpan(String[] parts) {
        String spanTarget = parts[3];
        int colon = spanTarget.indexOf(':');
        return colon < 0 ? "" : spanTarget.substring(0, colon);
    }

    @Override
    public String extractTarget(String[] parts) {
        String spanTarget = parts[3];
        int colon = spanTarget.indexOf(':');
        return colon < 0 ? spanTarget : spanTarget.substring(colon + 1);
    }

    @Override
    public String extractMessage(String[] parts) {
        return parts[4];
    }

    @Override
    public Map<String, String> extractFields(String[] parts) {
        Map<String, String> fields = new LinkedHashMap<>();
        Matcher matcher = FIELD.matcher(parts[4]);
        while (matcher.find()) {
            // put()이 덮어쓰므로 같은 키는 마지막 값이 남는다
            fields.put(matcher.group(1), stripQuotes(matcher.group(2)));
        }
        return fields;
    }

    /**
     * 앞뒤 큰따옴표를 각각 최대 한 개씩 제거한다. 짝이 맞는지는 확인하지 않는다.
     */
    static String stripQuotes(String value) {
        String result = value;
        if (result.startsWith("\"")) {
            result = result.substring(1);
        }
        if (result.endsWith("\"")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
