package util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * log-verification.properties 로딩 및 값 검증 테스트
 */
class VerifierSettingsTest {

	@Test
	@DisplayName("클래스패스 설정 파일에서 기본 도구 목록과 최소 ready 액터 수를 읽는다")
	void load_FromClasspath_ReturnsShippedDefaults() {
		assertEquals(List.of("planner", "spawn_agent", "command", "file_reader"), VerifierSettings.getExpectedTools());
		assertEquals(4, VerifierSettings.getMinimumReadyActors());
	}

	@Test
	@DisplayName("parser.class가 비어있으면 DefaultLogLineParser 사용")
	void createLineParser_NoCustomClass_ReturnsDefault() {
		assertTrue(VerifierSettings.createLineParser() instanceof DefaultLogLineParser);
	}

	@Test
	@DisplayName("도구 목록: 공백과 빈 항목은 제거")
	void parseTools_TrimsAndSkipsEmptyItems() {
		assertEquals(List.of("planner", "command"), VerifierSettings.parseTools(" planner , ,command,"));
	}

	@Test
	@DisplayName("도구 목록이 비어있으면 IllegalArgumentException")
	void parseTools_Blank_Throws() {
		assertThrows(IllegalArgumentException.class, () -> VerifierSettings.parseTools("  "));
		assertThrows(IllegalArgumentException.class, () -> VerifierSettings.parseTools(null));
	}

	@Test
	@DisplayName("도구 목록이 쉼표뿐이면 IllegalArgumentException")
	void parseTools_OnlySeparators_Throws() {
		assertThrows(IllegalArgumentException.class, () -> VerifierSettings.parseTools(",,,"));
		assertThrows(IllegalArgumentException.class, () -> VerifierSettings.parseTools(" , "));
	}

	@Test
	@DisplayName("parser.class로 지정한 파서를 생성")
	void createLineParser_CustomClass_ReturnsInstance() {
		assertTrue(VerifierSettings.createLineParser(UpperCaseLevelParser.class.getName()) instanceof UpperCaseLevelParser);
	}

	/**
	 * 파서 생성 실패 시 기본 파서 대체 테스트.
	 *
	 * <p>
	 * 없는 클래스(ClassNotFoundException), LogLineParser가 아닌 클래스(ClassCastException),
	 * static 초기화가 실패하는 클래스(ExceptionInInitializerError) 모두 DefaultLogLineParser로 대체된다.
	 * </p>
	 */
	@Test
	@DisplayName("parser.class 생성 실패 시 DefaultLogLineParser로 대체")
	void createLineParser_BrokenClass_FallsBackToDefault() {
		assertTrue(VerifierSettings.createLineParser("util.NoSuchParser") instanceof DefaultLogLineParser);
		assertTrue(VerifierSettings.createLineParser(String.class.getName()) instanceof DefaultLogLineParser);
		assertTrue(VerifierSettings.createLineParser(FailingInitParser.class.getName()) instanceof DefaultLogLineParser);
	}

	public static class UpperCaseLevelParser extends DefaultLogLineParser {
		@Override
		public String extractLevel(String[] parts) {
			return parts[1].toUpperCase();
		}
	}

	public static class FailingInitParser extends DefaultLogLineParser {
		static {
			if (true) {
				throw new IllegalStateException("초기화 실패");
			}
		}
	}

	@Test
	@DisplayName("최소 ready 액터 수: 음수나 숫자가 아닌 값은 거부")
	void parseMinimum_InvalidValues_Throw() {
		assertEquals(2, VerifierSettings.parseMinimum(" 2 "));
		assertThrows(IllegalArgumentException.class, () -> VerifierSettings.parseMinimum("-1"));
		assertThrows(NumberFormatException.class, () -> VerifierSettings.parseMinimum("four"));
	}
}
