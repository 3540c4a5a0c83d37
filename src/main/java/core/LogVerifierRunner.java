package core;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import verifier.ReportRenderer;
import verifier.VerificationEngine;
import verifier.VerificationResult;

public class LogVerifierRunner {
    private static final Logger log = LoggerFactory.getLogger(LogVerifierRunner.class);

    private final VerificationEngine engine;
    private final ReportRenderer renderer;

    public LogVerifierRunner() {
        this(new VerificationEngine(), new ReportRenderer());
    }

    public LogVerifierRunner(VerificationEngine engine, ReportRenderer renderer) {
        this.engine = engine;
        this.renderer = renderer;
    }

    public static void main(String[] args) {
        int status = new LogVerifierRunner().run(args, System.out);
        System.exit(status);
    }

    /**
     * 로그 파일 하나를 검증하고 리포트를 출력한다.
     *
     * @param args 로그 파일 경로 하나
     * @param out 리포트 출력 대상
     * @return 종료 코드 (전체 통과 0, 실패 또는 입력 오류 1)
     */
    public int run(String[] args, PrintStream out) {
        // 1. 입력 유효성 검사
        if (args == null || args.length != 1) {
            out.println("Usage: LogVerifierRunner <log_file_path>");
            log.error("expected exactly one argument, got {}", args == null ? 0 : args.length);
            return 1;
        }

        Path logFile = Paths.get(args[0]);
        if (!Files.exists(logFile)) {
            out.println("Error: Log file " + logFile + " does not exist");
            log.error("log file not found: {}", logFile);
            return 1;
        }

        // 2. 로그 파일 로드
        String content;
        try {
            content = Files.readString(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            out.println("Error: failed to read log file " + logFile + ": " + e.getMessage());
            log.error("failed to read log file {}", logFile, e);
            return 1;
        }

        // 3. 검증 및 리포트 출력
        Map<String, VerificationResult> results = engine.verify(content);
        out.print(renderer.render(results));
        return renderer.exitStatus(results);
    }
}
