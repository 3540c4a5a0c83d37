package util;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class VerifierSettings {
    private static final Logger log = LoggerFactory.getLogger(VerifierSettings.class);

    private static final String CONFIG_FILE = "log-verification.properties";

    // static final로 선언하여 런타임 중 변경 불가능하게 설정
    private static final List<String> EXPECTED_TOOLS;
    private static final int MINIMUM_READY_ACTORS;
    private static final String PARSER_CLASS;

    static {
        try {
            Properties prop = loadProperties();
            EXPECTED_TOOLS = parseTools(prop.getProperty("verification.expected.tools"));
            MINIMUM_READY_ACTORS = parseMinimum(prop.getProperty("verification.actors.ready.minimum"));
            String parserClass = prop.getProperty("parser.class");
            PARSER_CLASS = parserClass == null || parserClass.trim().isEmpty() ? null : parserClass.trim();
        } catch (Exception e) {
            // 설정이 잘못되면 클래스 로딩 자체를 실패시킨다
            throw new ExceptionInInitializerError(" [Critical] 로그 검증 설정을 로드할 수 없습니다. : " + e.getMessage());
        }
    }

    private static Properties loadProperties() throws Exception {
        Properties prop = new Properties();

        try (InputStream input = VerifierSettings.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input == null) {
                throw new RuntimeException(CONFIG_FILE + " 파일을 찾을 수 없습니다.");
            }
            prop.load(input);
            return prop;
        }
    }

    static List<String> parseTools(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("verification.expected.tools 값이 설정되어 있지 않습니다.");
        }
        List<String> tools = new ArrayList<>();
        for (String tool : value.split(",")) {
            if (!tool.trim().isEmpty()) {
                tools.add(tool.trim());
            }
        }
        if (tools.isEmpty()) {
            throw new IllegalArgumentException("verification.expected.tools에 도구 이름이 없습니다: " + value);
        }
        return Collections.unmodifiableList(tools);
    }

    static int parseMinimum(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("verification.actors.ready.minimum 값이 설정되어 있지 않습니다.");
        }
        int minimum = Integer.parseInt(value.trim());
        if (minimum < 0) {
            throw new IllegalArgumentException("verification.actors.ready.minimum은 0 이상이어야 합니다: " + minimum);
        }
        return minimum;
    }

    public static List<String> getExpectedTools() {
        return EXPECTED_TOOLS;
    }

    public static int getMinimumReadyActors() {
        return MINIMUM_READY_ACTORS;
    }

    /**
     * 설정 파일의 parser.class로 지정된 파서를 생성한다.
     * 지정되지 않았거나 생성에 실패하면 {@link DefaultLogLineParser}를 반환한다.
     */
    public static LogLineParser createLineParser() {
        return createLineParser(PARSER_CLASS);
    }

    static LogLineParser createLineParser(String className) {
        if (className == null) {
            return new DefaultLogLineParser();
        }
        try {
            Class<?> clazz = Class.forName(className);
            return (LogLineParser) clazz.getDeclaredConstructor().newInstance();
        } catch (Exception | LinkageError e) {
            // 클래스 초기화 실패(ExceptionInInitializerError, NoClassDefFoundError)도 기본 파서로 대체
            log.warn("LogLineParser 생성 실패, 기본 파서를 사용합니다: {}", className, e);
            return new DefaultLogLineParser();
        }
    }
}
