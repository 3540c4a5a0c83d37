package verifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import util.VerifierSettings;

/**
 * HIVE 실행 로그를 사후 검증한다.
 *
 * <p>네 가지 검증(시스템 기동, 에이전트 생명주기, 도구 실행, LLM 상호작용)은 서로 독립적이며,
 * 같은 LogEntry 목록을 읽기만 하므로 어떤 순서로 호출해도 결과가 같다.</p>
 */
public class VerificationEngine {
    private static final Logger log = LoggerFactory.getLogger(VerificationEngine.class);

    public static final String SYSTEM_STARTUP = "system_startup";
    public static final String AGENT_LIFECYCLE = "agent_lifecycle";
    public static final String TOOL_EXECUTION = "tool_execution";
    public static final String LLM_INTERACTION = "llm_interaction";

    static final String HIVE_STARTUP_TEXT = "Starting headless HIVE multi-agent system";
    static final String ACTOR_CREATION_TEXT = "Starting actors for agent";
    static final String AGENT_START_TEXT = "Agent starting execution";
    static final String ACTOR_READY_TEXT = "Actor ready, sending ready signal";
    static final String STATE_TRANSITION_TEXT = "state transition";
    static final String LLM_REQUEST_TEXT = "Executing LLM chat request";
    static final String CONNECTION_START_TEXT = "starting new connection";

    private final LogParser parser;
    private final List<String> defaultTools;
    private final int minimumReadyActors;

    /**
     * 설정 파일(log-verification.properties)의 값을 사용하는 VerificationEngine을 생성한다.
     */
    public VerificationEngine() {
        this(new LogParser(), VerifierSettings.getExpectedTools(), VerifierSettings.getMinimumReadyActors());
    }

    /**
     * @param parser 로그 텍스트 파서
     * @param defaultTools 도구 목록이 주어지지 않았을 때 사용할 기본 도구 목록
     * @param minimumReadyActors 경고 없이 통과하기 위한 최소 ready 액터 수
     */
    public VerificationEngine(LogParser parser, List<String> defaultTools, int minimumReadyActors) {
        this.parser = parser;
        this.defaultTools = List.copyOf(defaultTools);
        this.minimumReadyActors = minimumReadyActors;
    }

    public List<String> getDefaultTools() {
        return defaultTools;
    }

    /**
     * 기본 도구 목록으로 전체 검증을 수행한다.
     */
    public Map<String, VerificationResult> verify(String logText) {
        return verify(logText, null);
    }

    /**
     * 로그 텍스트를 한 번 파싱한 뒤 네 가지 검증을 모두 수행한다.
     *
     * @param logText 로그 파일 전체 내용
     * @param expectedTools 실행 여부를 집계할 도구 이름 목록, null이면 기본 목록
     * @return 카테고리 이름 → 검증 결과 (고정 순서)
     */
    public Map<String, VerificationResult> verify(String logText, List<String> expectedTools) {
        List<LogEntry> entries = parser.parse(logText);
        log.info("verifying {} parsed log entries", entries.size());

        Map<String, VerificationResult> results = new LinkedHashMap<>();
        results.put(SYSTEM_STARTUP, verifySystemStartup(entries));
        results.put(AGENT_LIFECYCLE, verifyAgentLifecycle(entries));
        results.put(TOOL_EXECUTION, verifyToolExecution(entries, expectedTools == null ? defaultTools : expectedTools));
        results.put(LLM_INTERACTION, verifyLlmInteraction(entries));

        results.forEach((category, result) -> log.debug("{}: {}", category, result));
        return results;
    }

    public VerificationResult verifySystemStartup(List<LogEntry> entries) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Integer> summary = new LinkedHashMap<>();

        int startups = LogEntries.withMessage(entries, HIVE_STARTUP_TEXT).size();
        summary.put("hive_startup_events", startups);
        if (startups == 0) {
            errors.add("HIVE system startup not found");
        }

        int configEvents = LogEntries.withTargetIgnoreCase(entries, "config").size();
        summary.put("config_events", configEvents);
        if (configEvents == 0) {
            warnings.add("No config loading events found");
        }

        summary.put("actor_creation_events", LogEntries.withMessage(entries, ACTOR_CREATION_TEXT).size());

        return new VerificationResult(errors, warnings, summary);
    }

    public VerificationResult verifyAgentLifecycle(List<LogEntry> entries) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Integer> summary = new LinkedHashMap<>();

        int agentStarts = LogEntries.withMessage(entries, AGENT_START_TEXT).size();
        summary.put("agents_started", agentStarts);
        if (agentStarts == 0) {
            errors.add("No agents were started");
        }

        // assistant, planner, spawn_agent, plan_approval
        int readyActors = LogEntries.withMessage(entries, ACTOR_READY_TEXT).size();
        summary.put("actors_ready", readyActors);
        if (readyActors < minimumReadyActors) {
            warnings.add("Expected at least " + minimumReadyActors + " actors to be ready, got " + readyActors);
        }

        int transitions = LogEntries.withMessage(entries, STATE_TRANSITION_TEXT).size();
        summary.put("state_transitions", transitions);
        if (transitions == 0) {
            errors.add("No agent state transitions found");
        }

        return new VerificationResult(errors, warnings, summary);
    }

    /**
     * 도구 관련 이벤트를 집계한다. 집계 전용이라 에러나 경고를 만들지 않는다.
     */
    public VerificationResult verifyToolExecution(List<LogEntry> entries, List<String> expectedTools) {
        Map<String, Integer> summary = new LinkedHashMap<>();

        summary.put("tool_registration_events", LogEntries.withSpan(entries, "tools_available").size());

        List<LogEntry> llmRequests = new ArrayList<>();
        for (LogEntry entry : LogEntries.withSpan(entries, "llm_request")) {
            if (entry.fields.containsKey("tools_count")) {
                llmRequests.add(entry);
            }
        }
        summary.put("llm_requests_with_tools", llmRequests.size());

        if (!llmRequests.isEmpty()) {
            int maxTools = Integer.MIN_VALUE;
            for (LogEntry entry : llmRequests) {
                maxTools = Math.max(maxTools, toolsCount(entry));
            }
            summary.put("max_tools_in_request", maxTools);
        }

        for (String tool : expectedTools) {
            summary.put(tool + "_calls", LogEntries.withMessageIgnoreCase(entries, tool).size());
        }

        return new VerificationResult(new ArrayList<>(), new ArrayList<>(), summary);
    }

    public VerificationResult verifyLlmInteraction(List<LogEntry> entries) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Integer> summary = new LinkedHashMap<>();

        int requests = LogEntries.withMessage(entries, LLM_REQUEST_TEXT).size();
        summary.put("llm_requests", requests);
        if (requests == 0) {
            errors.add("No LLM requests found");
        }

        int connections = LogEntries.withMessage(entries, CONNECTION_START_TEXT).size();
        summary.put("network_connections", connections);
        if (requests > 0 && connections == 0) {
            warnings.add("LLM requests found but no network connections");
        }

        summary.put("user_input_events", LogEntries.withSpan(entries, "user_input").size());

        return new VerificationResult(errors, warnings, summary);
    }

    // 숫자가 아닌 tools_count는 0으로 취급
    private static int toolsCount(LogEntry entry) {
        try {
            return Integer.parseInt(entry.fields.get("tools_count").trim());
        } catch (NumberFormatException e) {
            log.debug("non-numeric tools_count '{}' treated as 0", entry.fields.get("tools_count"));
            return 0;
        }
    }
}
