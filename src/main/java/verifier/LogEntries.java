package verifier;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * LogEntry 목록에 대한 조회 함수 모음. 입력 목록은 변경하지 않으며 결과는 입력 순서를 유지한다.
 */
public final class LogEntries {

    private LogEntries() {
    }

    public static List<LogEntry> withMessage(List<LogEntry> entries, String text) {
        return filter(entries, e -> e.message.contains(text));
    }

    public static List<LogEntry> withMessageIgnoreCase(List<LogEntry> entries, String text) {
        String needle = text.toLowerCase(Locale.ROOT);
        return filter(entries, e -> e.message.toLowerCase(Locale.ROOT).contains(needle));
    }

    public static List<LogEntry> withSpan(List<LogEntry> entries, String text) {
        return filter(entries, e -> e.span.contains(text));
    }

    public static List<LogEntry> withTargetIgnoreCase(List<LogEntry> entries, String text) {
        String needle = text.toLowerCase(Locale.ROOT);
        return filter(entries, e -> e.target.toLowerCase(Locale.ROOT).contains(needle));
    }

    public static List<LogEntry> byLevel(List<LogEntry> entries, String level) {
        return filter(entries, e -> e.level.equalsIgnoreCase(level));
    }

    public static List<LogEntry> withField(List<LogEntry> entries, String name) {
        return filter(entries, e -> e.fields.containsKey(name));
    }

    public static List<LogEntry> withFieldValue(List<LogEntry> entries, String name, String value) {
        return filter(entries, e -> value.equals(e.fields.get(name)));
    }

    /**
     * 메시지 패턴들이 순서대로 (연속일 필요는 없이) 나타나는지 확인한다.
     *
     * @return 모든 패턴이 순서대로 발견되면 true. 패턴이 없으면 true
     */
    public static boolean containsSequence(List<LogEntry> entries, String... patterns) {
        List<String> remaining = Arrays.asList(patterns);
        int index = 0;
        for (LogEntry entry : entries) {
            if (index == remaining.size()) break;
            if (entry.message.contains(remaining.get(index))) {
                index++;
            }
        }
        return index == remaining.size();
    }

    /**
     * 전체 엔트리 수와 level / target / span 별 건수를 집계한다. 맵은 처음 등장한 순서를 유지한다.
     */
    public static LogStats stats(List<LogEntry> entries) {
        Map<String, Integer> levels = new LinkedHashMap<>();
        Map<String, Integer> targets = new LinkedHashMap<>();
        Map<String, Integer> spans = new LinkedHashMap<>();

        for (LogEntry entry : entries) {
            levels.merge(entry.level.toUpperCase(Locale.ROOT), 1, Integer::sum);
            targets.merge(entry.target, 1, Integer::sum);
            if (!entry.span.isEmpty()) {
                spans.merge(entry.span, 1, Integer::sum);
            }
        }
        return new LogStats(entries.size(), levels, targets, spans);
    }

    private static List<LogEntry> filter(List<LogEntry> entries, Predicate<LogEntry> predicate) {
        return entries.stream().filter(predicate).collect(Collectors.toUnmodifiableList());
    }
}
