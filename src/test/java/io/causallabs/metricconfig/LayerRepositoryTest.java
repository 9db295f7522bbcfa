package io.causallabs.metricconfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
public class LayerRepositoryTest {

    @TempDir
    Path root;

    @Test
    void testLayersInMergeOrder() throws Exception {
        write("definitions/functions.toml", "[functions.agg_sum]",
                "definition = 'SUM({select_expr})'");
        write("definitions/general.toml", "[data_sources.clients_daily]",
                "from_expression = 'mozdata.telemetry.clients_daily'");
        write("definitions/firefox_desktop.toml", "[metrics.active_hours]",
                "data_source = 'clients_daily'", "select_expression = 'SUM(active_hours_sum)'");
        write("defaults/firefox_desktop.toml", "[metrics.active_hours]",
                "friendly_name = 'Active hours'");
        write("new-onboarding.toml", "[metrics.active_hours]",
                "select_expression = 'SUM(active_hours)'");

        List<Layer> layers = new LayerRepository(root)
                .layersFor("firefox_desktop", "firefox_desktop", "new-onboarding");

        assertThat(layers).extracting(Layer::getName).containsExactly(
                "definitions/functions.toml", "definitions/general.toml",
                "definitions/firefox_desktop.toml", "defaults/firefox_desktop.toml",
                "new-onboarding.toml");

        ResolvedConfiguration config = new LayerMerger().merge(layers);
        assertThat(config.getErrors()).isEmpty();
        assertThat(config.getMetric("active_hours").getSelectExpression())
                .isEqualTo("SUM(active_hours)");
        assertThat(config.getMetric("active_hours").getFriendlyName())
                .isEqualTo("Active hours");
    }

    @Test
    void testOutcomesMergeBeforeTheExperiment() throws Exception {
        write("definitions/firefox_desktop.toml", "[data_sources.main]",
                "from_expression = 'mozdata.telemetry.main'");
        write("outcomes/firefox_desktop/parameterized.toml",
                "friendly_name = 'Outcome with a parameter'",
                "default_metrics = ['sample_id_count']",
                "[metrics.sample_id_count]", "data_source = 'main'",
                "select_expression = 'COUNTIF(sample_id = {{parameters.id}})'",
                "[parameters.id]", "default = '700'");
        write("new-onboarding.toml", "[parameters.id]", "value = '42'");

        List<Layer> layers = new LayerRepository(root).layersFor("firefox_desktop", null,
                "new-onboarding", List.of("parameterized"));

        assertThat(layers).extracting(Layer::getName).containsExactly(
                "definitions/firefox_desktop.toml", "outcomes/firefox_desktop/parameterized.toml",
                "new-onboarding.toml");
        ResolvedConfiguration config = new LayerMerger().merge(layers);
        assertThat(config.getErrors()).isEmpty();
        assertThat(config.getDefaultMetrics()).containsExactly("sample_id_count");
        assertThat(config.getParameter("id").getValue()).isEqualTo("42");
    }

    @Test
    void testUnknownOutcomeFails() {
        LayerRepository repository = new LayerRepository(root);

        assertThatThrownBy(() -> repository.layersFor("fenix", null, null, List.of("nope")))
                .isInstanceOf(ConfigException.class).hasMessageContaining("nope")
                .extracting("kind").isEqualTo(ErrorKind.LOAD_FAILURE);
    }

    @Test
    void testMissingFilesAreSkipped() throws Exception {
        write("definitions/general.toml", "[data_sources.events]",
                "from_expression = 'mozdata.telemetry.events'");

        List<Layer> layers = new LayerRepository(root).layersFor("fenix", null, "unknown");

        assertThat(layers).extracting(Layer::getName)
                .containsExactly("definitions/general.toml");
    }

    @Test
    void testLoadJsonAndToml() throws Exception {
        Path json = write("layer.json", "{\"metrics\": {\"active_hours\": ",
                "{\"data_source\": \"clients_daily\"}}}");
        Path toml = write("layer.toml", "[metrics.active_hours]",
                "data_source = 'clients_daily'");

        Layer fromJson = LayerLoader.load(json);
        Layer fromToml = LayerLoader.load(toml);

        assertThat(fromJson.getName()).isEqualTo("layer");
        assertThat(fromJson.getRoot()).isEqualTo(fromToml.getRoot());
    }

    @Test
    void testEmptyFileIsAnEmptyLayer() throws Exception {
        Layer layer = LayerLoader.load(write("empty.toml", ""));

        assertThat(layer.getRoot().isEmpty()).isTrue();
    }

    @Test
    void testLoadFailures() throws Exception {
        Path broken = write("broken.toml", "[metrics.active_hours", "data_source = ");

        assertThatThrownBy(() -> LayerLoader.load(broken)).isInstanceOf(ConfigException.class)
                .extracting("kind").isEqualTo(ErrorKind.LOAD_FAILURE);
        assertThatThrownBy(() -> LayerLoader.load(root.resolve("missing.toml")))
                .isInstanceOf(ConfigException.class)
                .extracting("kind").isEqualTo(ErrorKind.LOAD_FAILURE);
        assertThatThrownBy(() -> LayerLoader.loadResource("no/such/layer.toml"))
                .isInstanceOf(ConfigException.class)
                .extracting("kind").isEqualTo(ErrorKind.LOAD_FAILURE);
    }

    @Test
    void testBundledFunctions() throws Exception {
        Layer functions = LayerLoader.loadResource(MetricQueryGenerator.BUILTIN_FUNCTIONS);

        ResolvedConfiguration config = new LayerMerger().merge(List.of(functions));

        assertThat(config.getErrors()).isEmpty();
        assertThat(config.getFunctions()).containsKeys("agg_sum", "agg_any", "agg_count",
                "count_distinct");
        assertThat(config.getFunctions().get("agg_sum").apply("active_hours"))
                .isEqualTo("COALESCE(SUM(active_hours), 0)");
    }

    private Path write(String name, String... lines) throws IOException {
        Path file = root.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, String.join("\n", lines), StandardCharsets.UTF_8);
        return file;
    }
}
