package verifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 파싱된 로그 라인 한 줄. 생성 후 변경되지 않는다.
 */
public class LogEntry {
    public final String timestamp;
    public final String level;
    public final String threadId;
    public final String span;
    public final String target;
    public final String message;
    public final Map<String, String> fields;

    public LogEntry(String timestamp, String level, String threadId, String span,
                    String target, String message, Map<String, String> fields) {
        this.timestamp = timestamp;
        this.level = level;
        this.threadId = threadId;
        this.span = span;
        this.target = target;
        this.message = message;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @Override
    public String toString() {
        return timestamp + " " + level + " [thread " + threadId + "] " +
                (span.isEmpty() ? "" : span + ":") + target +
                " - " + message +
                (fields.isEmpty() ? "" : " " + fields);
    }
}
