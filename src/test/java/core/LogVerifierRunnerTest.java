package core;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * 커맨드라인 진입점 테스트
 *
 * <p>
 * 인자 개수 / 파일 존재 여부 오류는 리포트 없이 종료 코드 1, 정상 입력은 리포트 출력 후 검증 결과에 따른 종료 코드를 반환한다.
 * </p>
 */
class LogVerifierRunnerTest {

	private static Path tempDir;

	private ByteArrayOutputStream buffer;
	private PrintStream out;

	@BeforeAll
	static void setUpAll() throws IOException {
		// 테스트용 임시 디렉토리 생성
		tempDir = Files.createTempDirectory("log-verifier-runner-test");
	}

	@AfterAll
	static void tearDownAll() throws IOException {
		// 생성된 임시 파일 및 디렉토리 삭제
		if (Files.exists(tempDir)) {
			Files.walk(tempDir).sorted((a, b) -> -a.compareTo(b)).forEach(p -> {
				try {
					Files.delete(p);
				} catch (Exception ignored) {
				}
			});
		}
	}

	@BeforeEach
	void setUp() {
		buffer = new ByteArrayOutputStream();
		out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
	}

	private String output() {
		return buffer.toString(StandardCharsets.UTF_8);
	}

	@Test
	@DisplayName("인자가 없으면 사용법 출력 후 종료 코드 1")
	void run_NoArguments_PrintsUsage() {
		int status = new LogVerifierRunner().run(new String[0], out);

		assertEquals(1, status);
		assertTrue(output().startsWith("Usage:"));
	}

	@Test
	@DisplayName("인자가 2개 이상이면 사용법 출력 후 종료 코드 1")
	void run_TooManyArguments_PrintsUsage() {
		int status = new LogVerifierRunner().run(new String[] { "a.log", "b.log" }, out);

		assertEquals(1, status);
		assertTrue(output().startsWith("Usage:"));
	}

	@Test
	@DisplayName("파일이 없으면 오류 메시지 출력 후 종료 코드 1, 리포트는 출력하지 않음")
	void run_MissingFile_PrintsErrorWithoutReport() {
		Path missing = tempDir.resolve("missing.log");

		int status = new LogVerifierRunner().run(new String[] { missing.toString() }, out);

		assertEquals(1, status);
		assertTrue(output().contains("Error: Log file " + missing + " does not exist"));
		assertFalse(output().contains("Overall Status"));
	}

	/**
	 * 정상 로그 파일 검증 테스트.
	 *
	 * <p>
	 * 기대 결과: 리포트의 Overall Status가 PASSED이고 종료 코드 0
	 * </p>
	 */
	@Test
	@DisplayName("정상 로그 파일이면 PASSED 리포트와 종료 코드 0")
	void run_HealthyLogFile_ReturnsZero() throws IOException {
		// given
		Path logFile = tempDir.resolve("healthy.log");
		Files.write(logFile, List.of(
				"2025-06-04T18:52:02.000Z INFO ThreadId(01) hive::config: Loading config",
				"2025-06-04T18:52:02.100Z INFO ThreadId(01) hive: Starting headless HIVE multi-agent system",
				"2025-06-04T18:52:02.200Z INFO ThreadId(02) agent_run: hive::agent: Agent starting execution",
				"2025-06-04T18:52:02.300Z DEBUG ThreadId(03) actor: hive::actors: Actor ready, sending ready signal actor_id=assistant",
				"2025-06-04T18:52:02.301Z DEBUG ThreadId(03) actor: hive::actors: Actor ready, sending ready signal actor_id=planner",
				"2025-06-04T18:52:02.302Z DEBUG ThreadId(03) actor: hive::actors: Actor ready, sending ready signal actor_id=spawn_agent",
				"2025-06-04T18:52:02.303Z DEBUG ThreadId(03) actor: hive::actors: Actor ready, sending ready signal actor_id=plan_approval",
				"2025-06-04T18:52:02.900Z DEBUG ThreadId(02) agent_run: hive::agent: Agent state transition from=Idle to=Processing",
				"2025-06-04T18:52:03.000Z DEBUG ThreadId(04) llm_request: hive::llm_client: Executing LLM chat request tools_count=5",
				"2025-06-04T18:52:03.100Z TRACE ThreadId(04) hyper: hyper_util::client: starting new connection: https://api.example.com/"),
				StandardCharsets.UTF_8);

		// when
		int status = new LogVerifierRunner().run(new String[] { logFile.toString() }, out);

		// then
		assertEquals(0, status);
		assertTrue(output().contains("Overall Status: PASSED"));
		assertTrue(output().contains("System Startup: PASSED"));
		assertTrue(output().contains("  - max tools in request: 5"));
	}

	@Test
	@DisplayName("필수 이벤트가 없는 로그 파일이면 FAILED 리포트와 종료 코드 1")
	void run_LogWithoutStartup_ReturnsOne() throws IOException {
		// given
		Path logFile = tempDir.resolve("no-startup.log");
		Files.writeString(logFile, "garbage\n2025-06-04T18:52:02Z INFO ThreadId(01) hive::config: Loading config\n",
				StandardCharsets.UTF_8);

		// when
		int status = new LogVerifierRunner().run(new String[] { logFile.toString() }, out);

		// then
		assertEquals(1, status);
		assertTrue(output().contains("Overall Status: FAILED"));
		assertTrue(output().contains("  [ERROR] HIVE system startup not found"));
	}
}
