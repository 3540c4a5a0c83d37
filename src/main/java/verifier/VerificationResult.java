package verifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 검증 카테고리 하나의 결과.
 *
 * <p>errors가 비어있을 때만 passed=true 이며, warnings는 통과 여부에 영향을 주지 않는다.</p>
 */
public class VerificationResult {
    public final boolean passed;
    public final List<String> errors;
    public final List<String> warnings;
    public final Map<String, Integer> summary;

    VerificationResult(List<String> errors, List<String> warnings, Map<String, Integer> summary) {
        this.passed = errors.isEmpty();
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.summary = Collections.unmodifiableMap(new LinkedHashMap<>(summary));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(passed ? "PASSED " : "FAILED ").append(summary);
        for (String error : errors) {
            sb.append("\n  error: ").append(error);
        }
        for (String warning : warnings) {
            sb.append("\n  warning: ").append(warning);
        }
        return sb.toString();
    }
}
