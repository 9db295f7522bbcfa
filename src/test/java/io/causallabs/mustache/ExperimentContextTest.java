package io.causallabs.mustache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.time.LocalDate;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
public class ExperimentContextTest {

  @Test
  void testTemplateVariables() {
    ExperimentContext experiment = ExperimentContext.builder("new-onboarding")
        .appName("firefox_desktop").startDate(LocalDate.of(2026, 3, 1))
        .endDate(LocalDate.of(2026, 4, 12)).enrollmentPeriod(7).build();

    assertThat(experiment.getLastEnrollmentDate()).isEqualTo(LocalDate.of(2026, 3, 8));
    assertThat(experiment.toTemplateVariables()).containsExactly(
        entry("slug", "new-onboarding"),
        entry("app_name", "firefox_desktop"),
        entry("start_date_str", "2026-03-01"),
        entry("end_date_str", "2026-04-12"),
        entry("last_enrollment_date_str", "2026-03-08"),
        entry("enrollment_period", 7));
  }

  @Test
  void testUnsetValuesAreAbsent() {
    ExperimentContext experiment =
        ExperimentContext.builder("new-onboarding").startDate(LocalDate.of(2026, 3, 1)).build();

    assertThat(experiment.getLastEnrollmentDate()).isNull();
    assertThat(experiment.toTemplateVariables()).containsOnlyKeys("slug", "start_date_str");
  }

  @Test
  void testBuilderStartsOverAfterBuild() {
    ExperimentContext.Builder builder = ExperimentContext.builder("a").appName("fenix");
    ExperimentContext first = builder.build();
    ExperimentContext second = builder.build();

    assertThat(first.getAppName()).isEqualTo("fenix");
    assertThat(second.getAppName()).isNull();
    assertThat(second.getSlug()).isEqualTo("a");
  }

  @Test
  void testSlugIsRequired() {
    assertThatThrownBy(() -> ExperimentContext.builder(null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
