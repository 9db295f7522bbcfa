package io.causallabs.mustache;

import static io.causallabs.metricconfig.TestLayers.merge;
import static io.causallabs.metricconfig.TestLayers.toml;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import io.causallabs.metricconfig.ConfigException;
import io.causallabs.metricconfig.ErrorKind;
import io.causallabs.metricconfig.QueryAssembler;
import io.causallabs.metricconfig.QueryPlan;
import io.causallabs.metricconfig.QueryRequest;
import io.causallabs.metricconfig.ResolvedConfiguration;
import io.causallabs.metricconfig.TestLayers;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
public class QueryRendererTest {

  private static QueryRenderer renderer;
  private ResolvedConfiguration config;

  @BeforeAll
  static void createRenderer() throws ConfigException {
    renderer = new QueryRenderer();
  }

  @BeforeEach
  void setUp() throws Exception {
    config = merge(toml("general",
        "[functions.agg_sum]",
        "definition = 'COALESCE(SUM({select_expr}), 0)'",
        "[data_sources.clients_daily]",
        "from_expression = 'tbl.clients_daily'",
        "[data_sources.events]",
        "from_expression = '{{dataset}}.events'",
        "default_dataset = 'mozdata'",
        "[metrics.days_of_use]",
        "data_source = 'clients_daily'",
        "select_expression = 'COUNT(submission_date)'",
        "[metrics.active_hours]",
        "data_source = 'clients_daily'",
        "select_expression = '{{#agg_sum}}active_hours_sum{{/agg_sum}}'",
        "[metrics.ad_clicks]",
        "data_source = 'events'",
        "select_expression = 'COUNTIF(event_name = \"ad_click\")'",
        "[metrics.enrolled_days]",
        "data_source = 'clients_daily'",
        "select_expression = "
            + "'COUNTIF(submission_date >= \"{{experiment.start_date_str}}\")'",
        "[metrics.bad_macro]",
        "data_source = 'clients_daily'",
        "select_expression = '{{#agg_median}}active_hours_sum{{/agg_median}}'",
        "[metrics.unknown_parameter]",
        "data_source = 'clients_daily'",
        "select_expression = 'COUNTIF(sample_id = {{parameters.id}})'"));
  }

  @Test
  void testSingleBlock() throws ConfigException {
    QueryPlan plan = plan(QueryRequest.builder().metric("days_of_use"));

    String sql = renderer.renderBlock(plan, "clients_daily");

    assertThat(normalize(sql)).isEqualTo("SELECT client_id, submission_date, "
        + "COUNT(submission_date) AS days_of_use FROM tbl.clients_daily "
        + "GROUP BY client_id, submission_date");
  }

  @Test
  void testJoinedQuery() throws ConfigException {
    QueryPlan plan = plan(QueryRequest.builder().metric("days_of_use").metric("ad_clicks"));

    String sql = normalize(renderer.render(plan));

    assertThat(sql).startsWith("WITH clients_daily AS ( SELECT");
    assertThat(sql).contains("), events AS ( SELECT");
    assertThat(sql).contains("FROM mozdata.events");
    assertThat(sql).contains("SELECT COALESCE(clients_daily.client_id, events.client_id)"
        + " AS client_id, COALESCE(clients_daily.submission_date, events.submission_date)"
        + " AS submission_date, clients_daily.days_of_use AS days_of_use,"
        + " events.ad_clicks AS ad_clicks FROM clients_daily");
    assertThat(sql).endsWith("FULL OUTER JOIN events ON clients_daily.client_id = "
        + "events.client_id AND clients_daily.submission_date = events.submission_date");
    assertThat(sql.split("FULL OUTER JOIN", -1)).hasSize(2);
  }

  @Test
  void testMacroExpansion() throws ConfigException {
    QueryPlan plan = plan(QueryRequest.builder().metric("active_hours"));

    String sql = normalize(renderer.renderBlock(plan, "clients_daily"));

    assertThat(sql).contains("COALESCE(SUM(active_hours_sum), 0) AS active_hours");
  }

  @Test
  void testUnknownMacroFails() {
    QueryPlan plan = plan(QueryRequest.builder().metric("bad_macro"));

    assertThatThrownBy(() -> renderer.render(plan)).isInstanceOf(ConfigException.class)
        .extracting("kind").isEqualTo(ErrorKind.MISSING_TEMPLATE_VARIABLE);
  }

  @Test
  void testExperimentVariables() throws ConfigException {
    ExperimentContext experiment = ExperimentContext.builder("new-onboarding")
        .startDate(LocalDate.of(2026, 3, 1)).build();
    QueryPlan plan =
        plan(QueryRequest.builder().metric("enrolled_days").experiment(experiment));

    String sql = renderer.render(plan);

    assertThat(sql).contains("COUNTIF(submission_date >= \"2026-03-01\") AS enrolled_days");
  }

  @Test
  void testMissingExperimentVariableFails() {
    QueryPlan withoutExperiment = plan(QueryRequest.builder().metric("enrolled_days"));
    QueryPlan withoutStart = plan(QueryRequest.builder().metric("enrolled_days")
        .experiment(ExperimentContext.builder("new-onboarding").build()));

    for (QueryPlan plan : new QueryPlan[] {withoutExperiment, withoutStart}) {
      assertThatThrownBy(() -> renderer.render(plan)).isInstanceOf(ConfigException.class)
          .hasMessageContaining("enrolled_days")
          .extracting("kind").isEqualTo(ErrorKind.MISSING_TEMPLATE_VARIABLE);
    }
  }

  @Test
  void testDatasetOverridesDefault() throws ConfigException {
    QueryPlan plan = plan(QueryRequest.builder().metric("ad_clicks").dataset("moz-fx-data"));

    assertThat(renderer.render(plan)).contains("moz-fx-data.events");
  }

  @Test
  void testMissingDatasetFails() throws Exception {
    ResolvedConfiguration noDefault = merge(toml("general",
        "[data_sources.events]",
        "from_expression = '{{dataset}}.events'",
        "[metrics.ad_clicks]",
        "data_source = 'events'",
        "select_expression = 'COUNT(*)'"));
    QueryPlan plan = new QueryAssembler()
        .assemble(QueryRequest.builder().metric("ad_clicks").build(), noDefault);

    assertThatThrownBy(() -> renderer.render(plan)).isInstanceOf(ConfigException.class)
        .extracting("kind").isEqualTo(ErrorKind.MISSING_TEMPLATE_VARIABLE);
  }

  @Test
  void testRenderingIsDeterministic() throws ConfigException {
    QueryRequest.Builder request =
        QueryRequest.builder().metric("ad_clicks").metric("active_hours").where("sample_id = 0");

    assertThat(renderer.render(plan(request))).isEqualTo(renderer.render(plan(request)));
  }

  @Test
  void testWhereClause() throws ConfigException {
    QueryPlan plan = plan(QueryRequest.builder().metric("days_of_use").where("sample_id = 0"));

    assertThat(normalize(renderer.renderBlock(plan, "clients_daily")))
        .contains("FROM tbl.clients_daily WHERE sample_id = 0 GROUP BY");
  }

  @Test
  void testEmptyQuery() {
    QueryPlan plan = plan(QueryRequest.builder().metric("no_such_metric"));

    assertThatThrownBy(() -> renderer.render(plan)).isInstanceOf(ConfigException.class)
        .extracting("kind").isEqualTo(ErrorKind.EMPTY_QUERY);
  }

  @Test
  void testJoinedBlockGroupsByExpressions() throws Exception {
    ResolvedConfiguration joined = merge(TestLayers.baselineAndEvents(), toml("metrics",
        "[metrics.baseline_pings]",
        "data_source = 'baseline'",
        "select_expression = 'COUNT(baseline.document_id)'",
        "[dimensions.os]",
        "data_source = 'baseline'",
        "select_expression = 'normalized_os'",
        "[dimensions.event_os]",
        "data_source = 'events'",
        "select_expression = 'os'"));
    QueryPlan plan = new QueryAssembler().assemble(
        QueryRequest.builder().metric("baseline_pings").groupBy(joined, "os").build(), joined);

    String sql = normalize(renderer.renderBlock(plan, "baseline"));

    assertThat(sql).isEqualTo("SELECT"
        + " COALESCE(baseline.client_id, events.client_id) AS client_id,"
        + " COALESCE(baseline.submission_date, events.submission_date) AS submission_date,"
        + " COALESCE(baseline.normalized_os, events.os) AS os,"
        + " COUNT(baseline.document_id) AS baseline_pings"
        + " FROM mozdata.telemetry.baseline AS baseline"
        + " FULL OUTER JOIN mozdata.telemetry.events AS events"
        + " ON baseline.client_id = events.client_id"
        + " AND baseline.submission_date = events.submission_date"
        + " AND baseline.normalized_os = events.os"
        + " GROUP BY COALESCE(baseline.normalized_os, events.os),"
        + " COALESCE(baseline.client_id, events.client_id),"
        + " COALESCE(baseline.submission_date, events.submission_date)");
  }

  @Test
  void testBlocksCloseWithoutBlankLine() throws ConfigException {
    QueryPlan plan = plan(QueryRequest.builder().metric("days_of_use").metric("ad_clicks"));

    String sql = renderer.render(plan);

    assertThat(sql).doesNotContainPattern("\\n[ \\t]*\\n[ \\t]*\\)");
    assertThat(sql).containsPattern("submission_date\\n\\),");
  }

  @Test
  void testParameters() throws Exception {
    ResolvedConfiguration parameterized = merge(toml("general",
        "[data_sources.main]",
        "from_expression = 'mozdata.telemetry.main'",
        "[metrics.sample_id_count]",
        "data_source = 'main'",
        "select_expression = 'COUNTIF(sample_id = {{parameters.id}})'",
        "[metrics.branch_count]",
        "data_source = 'main'",
        "select_expression = 'COUNTIF(sample_id = {{parameters.per_branch}})'",
        "[parameters.id]",
        "default = 700",
        "[parameters.per_branch]",
        "distinct_by_branch = true",
        "[parameters.per_branch.value]",
        "branch_1 = '1'"));
    QueryPlan plan = new QueryAssembler().assemble(QueryRequest.builder()
        .metric("sample_id_count").metric("branch_count").build(), parameterized);

    String sql = renderer.renderBlock(plan, "main");

    assertThat(sql).contains("COUNTIF(sample_id = 700) AS sample_id_count");
    assertThat(sql).contains(
        "COUNTIF(sample_id = CASE e.branch WHEN \"branch_1\" THEN \"1\" END) AS branch_count");
  }

  @Test
  void testUnknownParameterFails() {
    QueryPlan plan = plan(QueryRequest.builder().metric("unknown_parameter"));

    assertThatThrownBy(() -> renderer.render(plan)).isInstanceOf(ConfigException.class)
        .hasMessageContaining("unknown_parameter")
        .extracting("kind").isEqualTo(ErrorKind.MISSING_TEMPLATE_VARIABLE);
  }

  @Test
  void testMissingTemplates() {
    assertThatThrownBy(() -> new QueryRenderer("no/such/path/"))
        .isInstanceOf(ConfigException.class)
        .extracting("kind").isEqualTo(ErrorKind.LOAD_FAILURE);
  }

  private QueryPlan plan(QueryRequest.Builder request) {
    return new QueryAssembler().assemble(request.build(), config);
  }

  private static String normalize(String sql) {
    return sql.replaceAll("\\s+", " ").trim();
  }
}
