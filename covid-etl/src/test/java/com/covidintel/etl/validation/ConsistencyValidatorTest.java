package com.covidintel.etl.validation;

import com.covidintel.etl.model.CheckCategory;
import com.covidintel.etl.model.CheckStatus;
import com.covidintel.etl.model.DataTable;
import com.covidintel.etl.model.RegionType;
import com.covidintel.etl.model.ValidationCheck;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.covidintel.etl.validation.ValidationFixtures.*;
import static org.assertj.core.api.Assertions.*;

class ConsistencyValidatorTest {

    private static Map<DataTable, Long> thresholds(DataTable table, long threshold) {
        Map<DataTable, Long> map = new EnumMap<>(DataTable.class);
        map.put(table, threshold);
        return map;
    }

    @Test
    void validate_runsEachDefinitionPerTable() {
        Map<DataTable, Long> both = new EnumMap<>(DataTable.class);
        both.put(DataTable.COUNTRIES, 0L);
        both.put(DataTable.STATES, 5L);
        CheckRegistry registry = new CheckRegistry()
                .register(new CheckDefinition("row_count", CheckCategory.COMPLETENESS, both,
                        (batch, table) -> CheckOutcome.rows(batch.rows(table).size())));

        ValidationBatch batch = new ValidationBatch(
                Map.of(DataTable.COUNTRIES, rows(RegionType.COUNTRY, "A", "B"),
                        DataTable.STATES, rows(RegionType.STATE, "X")),
                List.of(), AS_OF);

        List<ValidationCheck> checks = new ConsistencyValidator(registry).validate(batch);

        assertThat(checks).hasSize(2);
        assertThat(checks).extracting(ValidationCheck::getTableName, ValidationCheck::getObservedCount, ValidationCheck::getStatus)
                .containsExactly(
                        tuple("covid_countries", 2L, CheckStatus.FAIL),
                        tuple("covid_states", 1L, CheckStatus.PASS));
    }

    @Test
    void validate_throwingCounter_recordedAsFailedAndRunContinues() {
        CheckRegistry registry = new CheckRegistry()
                .register(new CheckDefinition("explodes", CheckCategory.BUSINESS_RULE, thresholds(DataTable.GLOBAL, 3),
                        (batch, table) -> { throw new IllegalStateException("boom"); }))
                .register(new CheckDefinition("fine", CheckCategory.BUSINESS_RULE, thresholds(DataTable.GLOBAL, 0),
                        (batch, table) -> CheckOutcome.rows(0)));

        List<ValidationCheck> checks = new ConsistencyValidator(registry)
                .validate(new ValidationBatch(Map.of(), List.of(), AS_OF));

        assertThat(checks).hasSize(2);
        ValidationCheck errored = checks.get(0);
        assertThat(errored.isPassed()).isFalse();
        assertThat(errored.getObservedCount()).isEqualTo(4);
        assertThat(errored.getDetail()).contains("check errored").contains("boom");
        assertThat(checks.get(1).isPassed()).isTrue();
    }

    @Test
    void validate_throwingCounterWithMaximalThreshold_stillFails() {
        CheckRegistry registry = new CheckRegistry()
                .register(new CheckDefinition("explodes", CheckCategory.BUSINESS_RULE,
                        thresholds(DataTable.GLOBAL, Long.MAX_VALUE),
                        (batch, table) -> { throw new IllegalStateException("boom"); }));

        List<ValidationCheck> checks = new ConsistencyValidator(registry)
                .validate(new ValidationBatch(Map.of(), List.of(), AS_OF));

        assertThat(checks).singleElement().satisfies(c -> {
            assertThat(c.getObservedCount()).isEqualTo(Long.MAX_VALUE);
            assertThat(c.isErrored()).isTrue();
            assertThat(c.getStatus()).isEqualTo(CheckStatus.FAIL);
        });
    }

    @Test
    void validate_absentTableReadsAsZeroRows() {
        CheckRegistry registry = new CheckRegistry()
                .register(new CheckDefinition("row_count", CheckCategory.COMPLETENESS, thresholds(DataTable.CONTINENTS, 0),
                        (batch, table) -> CheckOutcome.rows(batch.rows(table).size())));

        List<ValidationCheck> checks = new ConsistencyValidator(registry)
                .validate(new ValidationBatch(null, null, AS_OF));

        assertThat(checks).singleElement().satisfies(c -> assertThat(c.getObservedCount()).isZero());
    }

    @Test
    void registry_rejectsSameNameOnOverlappingTable() {
        CheckRegistry registry = new CheckRegistry()
                .register(new CheckDefinition("dup", CheckCategory.STRUCTURAL, thresholds(DataTable.GLOBAL, 0),
                        (batch, table) -> CheckOutcome.rows(0)));

        assertThatThrownBy(() -> registry.register(new CheckDefinition("dup", CheckCategory.STRUCTURAL,
                thresholds(DataTable.GLOBAL, 1), (batch, table) -> CheckOutcome.rows(0))))
                .isInstanceOf(IllegalArgumentException.class);

        registry.register(new CheckDefinition("dup", CheckCategory.STRUCTURAL, thresholds(DataTable.STATES, 0),
                (batch, table) -> CheckOutcome.rows(0)));
        assertThat(registry.definitions()).hasSize(2);
        assertThat(registry.remove("dup").definitions()).isEmpty();
    }

    @Test
    void checkDefinition_requiresAtLeastOneTable() {
        assertThatThrownBy(() -> new CheckDefinition("empty", CheckCategory.STRUCTURAL, Map.of(),
                (batch, table) -> CheckOutcome.rows(0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
