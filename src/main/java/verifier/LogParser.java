package verifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import util.LogLineParser;
import util.VerifierSettings;

public class LogParser {
    private static final Logger log = LoggerFactory.getLogger(LogParser.class);

    private final LogLineParser lineParser;

    /**
     * 설정 파일에 지정된 LogLineParser를 사용하는 LogParser를 생성한다.
     */
    public LogParser() {
        this(VerifierSettings.createLineParser());
    }

    /**
     * 지정된 LogLineParser를 사용하는 LogParser를 생성한다.
     *
     * @param lineParser 라인 분해 및 필드 추출에 사용할 파서
     */
    public LogParser(LogLineParser lineParser) {
        this.lineParser = lineParser;
    }

    /**
     * 로그 텍스트 전체를 입력 순서대로 LogEntry 목록으로 변환한다.
     *
     * <p>포맷이 맞지 않거나 처리 중 예외가 발생한 라인은 건너뛴다.
     * 전체 파싱은 실패하지 않으며, 빈 입력은 빈 목록을 반환한다.</p>
     *
     * @param text 로그 파일 전체 내용
     * @return 파싱된 LogEntry 목록 (수정 불가)
     */
    public List<LogEntry> parse(String text) {
        if (text == null) {
            return Collections.emptyList();
        }

        List<LogEntry> entries = new ArrayList<>();
        int lineNo = 0;
        int skipped = 0;

        // \n 기준으로만 나눈다 (CRLF의 \r은 함께 제거)
        for (String line : text.split("\r?\n")) {
            lineNo++;
            if (line.trim().isEmpty()) continue;

            try {
                entries.add(toEntry(line));
            } catch (RuntimeException e) {
                // 라인 단위로만 복구하고 다음 라인을 계속 처리한다
                skipped++;
                log.debug("line {} skipped: {}", lineNo, e.getMessage());
            }
        }

        log.debug("parsed {} entries ({} lines skipped)", entries.size(), skipped);
        return Collections.unmodifiableList(entries);
    }

    private LogEntry toEntry(String line) {
        String[] parts = lineParser.parse(line);
        return new LogEntry(
                lineParser.extractTimestamp(parts),
                lineParser.extractLevel(parts),
                lineParser.extractThreadId(parts),
                lineParser.extractSpan(parts),
                lineParser.extractTarget(parts),
                lineParser.extractMessage(parts),
                lineParser.extractFields(parts));
    }
}
