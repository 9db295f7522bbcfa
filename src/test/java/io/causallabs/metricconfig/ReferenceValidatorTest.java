package io.causallabs.metricconfig;

import static io.causallabs.metricconfig.TestLayers.merge;
import static io.causallabs.metricconfig.TestLayers.toml;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
public class ReferenceValidatorTest {

    private final ReferenceValidator validator = new ReferenceValidator();

    @Test
    void testValidConfigurationHasNoErrors() throws Exception {
        ResolvedConfiguration config = merge(TestLayers.baselineAndEvents(),
                toml("metrics",
                        "[metrics.baseline_pings]",
                        "data_source = 'baseline'",
                        "select_expression = 'COUNT(*)'",
                        "[metrics.event_count]",
                        "data_source = 'events'",
                        "select_expression = 'COUNT(event_name)'"));

        assertThat(validator.validate(config)).isEmpty();
    }

    @Test
    void testJoinCycleIsReportedOnce() throws Exception {
        ResolvedConfiguration config = merge(toml("general",
                "[data_sources.y]",
                "from_expression = 'tbl.y'",
                "[data_sources.y.joins.x]",
                "[data_sources.x]",
                "from_expression = 'tbl.x'",
                "[data_sources.x.joins.y]"));

        List<ConfigError> errors = validator.validate(config);

        assertThat(errors).extracting(ConfigError::getKind)
                .containsExactly(ErrorKind.CYCLIC_JOIN_GRAPH);
        assertThat(errors.get(0).getRelated()).containsExactly("x", "y");
        assertThat(errors.get(0).getMessage()).contains("x -> y -> x");
    }

    @Test
    void testSelfJoinIsACycle() throws Exception {
        ResolvedConfiguration config = merge(toml("general",
                "[data_sources.x]",
                "from_expression = 'tbl.x'",
                "[data_sources.x.joins.x]"));

        List<ConfigError> errors = validator.validate(config);

        assertThat(errors).extracting(ConfigError::getKind)
                .containsExactly(ErrorKind.CYCLIC_JOIN_GRAPH);
        assertThat(errors.get(0).getRelated()).containsExactly("x");
    }

    @Test
    void testLongerCycleThroughAcyclicPrefix() throws Exception {
        ResolvedConfiguration config = merge(toml("general",
                "[data_sources.a]",
                "from_expression = 'tbl.a'",
                "[data_sources.a.joins.c]",
                "[data_sources.c]",
                "from_expression = 'tbl.c'",
                "[data_sources.c.joins.d]",
                "[data_sources.d]",
                "from_expression = 'tbl.d'",
                "[data_sources.d.joins.b]",
                "[data_sources.b]",
                "from_expression = 'tbl.b'",
                "[data_sources.b.joins.c]"));

        List<ConfigError> errors = validator.validate(config);

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getRelated()).containsExactly("b", "c", "d");
    }

    @Test
    void testUnknownReferences() throws Exception {
        ResolvedConfiguration config = merge(toml("general",
                "[data_sources.baseline]",
                "from_expression = 'mozdata.telemetry.baseline'",
                "[data_sources.baseline.joins.missing_table]",
                "[metrics.orphan]",
                "data_source = 'nowhere'",
                "select_expression = 'COUNT(*)'",
                "[dimensions.os]",
                "data_source = 'nowhere'",
                "select_expression = 'os'",
                "[segments.new_users]",
                "data_source = 'clients_first_seen'",
                "select_expression = 'TRUE'"));

        List<ConfigError> errors = validator.validate(config);

        assertThat(errors).extracting(ConfigError::getKind).containsExactlyInAnyOrder(
                ErrorKind.UNKNOWN_DATA_SOURCE, ErrorKind.UNKNOWN_DATA_SOURCE,
                ErrorKind.UNKNOWN_DATA_SOURCE, ErrorKind.UNKNOWN_JOIN_TARGET);
        assertThat(errors).filteredOn(e -> e.getKind() == ErrorKind.UNKNOWN_JOIN_TARGET)
                .extracting(ConfigError::getEntity).containsExactly("baseline");
        assertThat(errors).filteredOn(e -> e.getKind() == ErrorKind.UNKNOWN_DATA_SOURCE)
                .extracting(ConfigError::getEntity)
                .containsExactlyInAnyOrder("orphan", "os", "new_users");
    }

    @Test
    void testDuplicateMetricNames() throws Exception {
        ResolvedConfiguration config = merge(toml("general",
                "[data_sources.clients_daily]",
                "from_expression = 'mozdata.telemetry.clients_daily'",
                "[data_sources.events]",
                "from_expression = 'mozdata.telemetry.events'",
                "[metrics.Active_Hours]",
                "data_source = 'clients_daily'",
                "select_expression = 'SUM(active_hours_sum)'",
                "[metrics.active_hours]",
                "data_source = 'clients_daily'",
                "select_expression = 'SUM(active_hours_sum)'",
                "[metrics.ACTIVE_HOURS]",
                "data_source = 'events'",
                "select_expression = 'COUNT(*)'",
                "[metrics.client_id]",
                "data_source = 'events'",
                "select_expression = 'ANY_VALUE(client_id)'"));

        List<ConfigError> errors = validator.validate(config);

        assertThat(errors).extracting(ConfigError::getKind).containsOnly(
                ErrorKind.DUPLICATE_METRIC_NAME);
        assertThat(errors).extracting(ConfigError::getEntity)
                .containsExactlyInAnyOrder("active_hours", "client_id");
    }

    @Test
    void testUnknownStatisticParameter() throws Exception {
        ResolvedConfiguration config = merge(toml("general",
                "[data_sources.clients_daily]",
                "from_expression = 'mozdata.telemetry.clients_daily'",
                "[statistics.bootstrap_mean]",
                "num_samples = 1000",
                "[metrics.active_hours]",
                "data_source = 'clients_daily'",
                "select_expression = 'SUM(active_hours_sum)'",
                "[metrics.active_hours.statistics.bootstrap_mean]",
                "num_sample = 100",
                "pre_treatments = ['remove_nulls']",
                "[metrics.active_hours.statistics.deciles]",
                "anything = 1"));

        List<ConfigError> errors = validator.validate(config);

        assertThat(errors).extracting(ConfigError::getKind)
                .containsExactly(ErrorKind.UNKNOWN_STATISTIC_PARAMETER);
        assertThat(errors.get(0).getMessage()).contains("num_sample");
    }

    @Test
    void testListedMetricsMustExist() throws Exception {
        ResolvedConfiguration config = merge(toml("general",
                "default_metrics = ['active_hours', 'uri_count']",
                "[data_sources.clients_daily]",
                "from_expression = 'mozdata.telemetry.clients_daily'",
                "[metrics]",
                "weekly = ['active_hours', 'days_of_use']",
                "[metrics.active_hours]",
                "data_source = 'clients_daily'",
                "select_expression = 'SUM(active_hours_sum)'"));

        List<ConfigError> errors = validator.validate(config);

        assertThat(errors).extracting(ConfigError::getKind)
                .containsOnly(ErrorKind.UNKNOWN_METRIC);
        assertThat(errors).extracting(ConfigError::getEntity)
                .containsExactlyInAnyOrder("days_of_use", "uri_count");
    }

    @Test
    void testUnknownParameterReference() throws Exception {
        ResolvedConfiguration config = merge(toml("general",
                "[data_sources.main]",
                "from_expression = 'mozdata.telemetry.main'",
                "[metrics.sample_id_count]",
                "data_source = 'main'",
                "select_expression = 'COUNTIF(sample_id = {{ parameters.id }})'",
                "[metrics.filtered_count]",
                "data_source = 'main'",
                "select_expression = 'COUNTIF(sample_id < {{parameters.max_sample}})'",
                "[parameters.id]",
                "default = '700'"));

        List<ConfigError> errors = validator.validate(config);

        assertThat(errors).extracting(ConfigError::getKind)
                .containsExactly(ErrorKind.UNKNOWN_PARAMETER);
        assertThat(errors.get(0).getEntity()).isEqualTo("filtered_count");
    }

    @Test
    void testValidationDoesNotChangeConfiguration() throws Exception {
        ResolvedConfiguration config = merge(toml("general",
                "[data_sources.x]",
                "from_expression = 'tbl.x'",
                "[data_sources.x.joins.y]"));
        String before = config.toJson();

        validator.validate(config);

        assertThat(config.toJson()).isEqualTo(before);
    }
}
