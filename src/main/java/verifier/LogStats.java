package verifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * LogEntry 목록의 집계 결과. 생성 후 변경되지 않는다.
 *
 * <p>level은 대문자로 정규화해 집계하며, TRACE/DEBUG/INFO/WARN/ERROR 이외의 level은 {@link #levels}에만 나타난다.
 * span이 없는 엔트리는 {@link #spans}에 포함되지 않는다.</p>
 */
public class LogStats {
    public final int totalEntries;
    public final int traceCount;
    public final int debugCount;
    public final int infoCount;
    public final int warnCount;
    public final int errorCount;
    public final Map<String, Integer> levels;
    public final Map<String, Integer> targets;
    public final Map<String, Integer> spans;

    LogStats(int totalEntries, Map<String, Integer> levels, Map<String, Integer> targets, Map<String, Integer> spans) {
        this.totalEntries = totalEntries;
        this.levels = Collections.unmodifiableMap(new LinkedHashMap<>(levels));
        this.targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
        this.spans = Collections.unmodifiableMap(new LinkedHashMap<>(spans));
        this.traceCount = count("TRACE");
        this.debugCount = count("DEBUG");
        this.infoCount = count("INFO");
        this.warnCount = count("WARN");
        this.errorCount = count("ERROR");
    }

    private int count(String level) {
        return levels.getOrDefault(level.toUpperCase(Locale.ROOT), 0);
    }

    @Override
    public String toString() {
        return "total=" + totalEntries +
                " levels=" + levels +
                " targets=" + targets +
                " spans=" + spans;
    }
}
