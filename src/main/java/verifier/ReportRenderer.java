package verifier;

import java.util.Map;

/**
 * 검증 결과를 사람이 읽을 수 있는 텍스트로 변환하고 종료 코드를 결정한다.
 */
public class ReportRenderer {

    private static final String TITLE = "HIVE Log Verification Results";
    private static final String RULE = "=".repeat(50);

    /**
     * 모든 카테고리가 통과했는지 여부
     */
    public boolean overallPassed(Map<String, VerificationResult> results) {
        return results.values().stream().allMatch(r -> r.passed);
    }

    /**
     * @return 전체 통과 시 0, 아니면 1
     */
    public int exitStatus(Map<String, VerificationResult> results) {
        return overallPassed(results) ? 0 : 1;
    }

    public String render(Map<String, VerificationResult> results) {
        StringBuilder sb = new StringBuilder();
        sb.append(TITLE).append("\n");
        sb.append(RULE).append("\n");
        sb.append("Overall Status: ").append(status(overallPassed(results))).append("\n\n");

        // 카테고리마다 summary → errors → warnings 순서
        for (Map.Entry<String, VerificationResult> category : results.entrySet()) {
            VerificationResult result = category.getValue();
            sb.append(title(category.getKey())).append(": ").append(status(result.passed)).append("\n");

            for (Map.Entry<String, Integer> metric : result.summary.entrySet()) {
                sb.append("  - ").append(metric.getKey().replace('_', ' '))
                        .append(": ").append(metric.getValue()).append("\n");
            }
            for (String error : result.errors) {
                sb.append("  [ERROR] ").append(error).append("\n");
            }
            for (String warning : result.warnings) {
                sb.append("  [WARN] ").append(warning).append("\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    private static String status(boolean passed) {
        return passed ? "PASSED" : "FAILED";
    }

    // system_startup → System Startup
    static String title(String category) {
        StringBuilder sb = new StringBuilder();
        for (String word : category.split("_")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
