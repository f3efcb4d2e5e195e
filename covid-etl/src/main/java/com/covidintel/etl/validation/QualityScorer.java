package com.covidintel.etl.validation;

import com.covidintel.etl.model.QualityGrade;
import com.covidintel.etl.model.QualityReport;
import com.covidintel.etl.model.QualityScore;
import com.covidintel.etl.model.TableQualityReport;
import com.covidintel.etl.model.ValidationCheck;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reduces check results to pass percentage and grade, overall and per table.
 */
public class QualityScorer {

    public QualityScore score(Collection<ValidationCheck> checks) {
        int total = checks.size();
        int passed = (int) checks.stream().filter(ValidationCheck::isPassed).count();
        int failed = total - passed;
        double passPercentage = total == 0 ? 100.0 : round2(passed * 100.0 / total);
        return new QualityScore(total, passed, failed, passPercentage, QualityGrade.forFailedChecks(failed));
    }

    public Map<String, QualityScore> scoreByTable(Collection<ValidationCheck> checks) {
        Map<String, List<ValidationCheck>> byTable = checks.stream()
                .collect(Collectors.groupingBy(ValidationCheck::getTableName, LinkedHashMap::new, Collectors.toList()));
        Map<String, QualityScore> scores = new LinkedHashMap<>();
        byTable.forEach((table, tableChecks) -> scores.put(table, score(tableChecks)));
        return scores;
    }

    public QualityReport report(String runId, Instant generatedAt, List<ValidationCheck> checks,
                                List<TableQualityReport> tableReports, int malformedRecords) {
        QualityScore overall = score(checks);
        return QualityReport.builder()
                .runId(runId)
                .generatedAt(generatedAt)
                .totalChecks(overall.totalChecks())
                .passed(overall.passed())
                .failed(overall.failed())
                .passPercentage(overall.passPercentage())
                .grade(overall.grade())
                .checks(List.copyOf(checks))
                .tableScores(Collections.unmodifiableMap(scoreByTable(checks)))
                .tableReports(List.copyOf(tableReports))
                .malformedRecords(malformedRecords)
                .build();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
