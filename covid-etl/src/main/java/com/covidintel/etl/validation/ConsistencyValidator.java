package com.covidintel.etl.validation;

import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.ValidationCheck;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered check against every table it applies to.
 *
 * Checks are independent and order-insensitive. A counter that throws does not
 * abort the run: it is recorded as a failed check carrying the error message.
 */
@Slf4j
public class ConsistencyValidator {

    private final CheckRegistry registry;

    public ConsistencyValidator(CheckRegistry registry) {
        this.registry = registry;
    }

    public List<ValidationCheck> validate(ValidationBatch batch) {
        List<ValidationCheck> results = new ArrayList<>();

        for (CheckDefinition definition : registry.definitions()) {
            for (Map.Entry<DataTable, Long> target : definition.thresholds().entrySet()) {
                results.add(evaluate(definition, target.getKey(), target.getValue(), batch));
            }
        }

        long failed = results.stream().filter(c -> !c.isPassed()).count();
        log.info("Validation ran {} checks, {} failed", results.size(), failed);
        return results;
    }

    private ValidationCheck evaluate(CheckDefinition definition, DataTable table, long threshold, ValidationBatch batch) {
        ValidationCheck.ValidationCheckBuilder check = ValidationCheck.builder()
                .checkName(definition.name())
                .category(definition.category())
                .tableName(table.tableName())
                .threshold(threshold);
        try {
            CheckOutcome outcome = definition.counter().count(batch, table);
            ValidationCheck result = check.observedCount(outcome.observed()).detail(outcome.detail()).build();
            if (!result.isPassed()) {
                log.warn("Check {} failed on {}: observed {} > threshold {} ({})",
                        definition.name(), table.tableName(), outcome.observed(), threshold, outcome.detail());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Check {} errored on {}: {}", definition.name(), table.tableName(), e.getMessage(), e);
            return check.observedCount(threshold == Long.MAX_VALUE ? threshold : threshold + 1)
                    .errored(true)
                    .detail("check errored: " + e.getMessage())
                    .build();
        }
    }
}
