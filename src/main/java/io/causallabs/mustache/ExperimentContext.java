package io.causallabs.mustache;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The experiment a query is generated for. Its values are available to every SQL fragment as
 * {{experiment.slug}}, {{experiment.app_name}}, {{experiment.start_date_str}},
 * {{experiment.end_date_str}}, {{experiment.last_enrollment_date_str}} and
 * {{experiment.enrollment_period}}. Values that are not set are absent, so a fragment that uses
 * them fails to render.
 */
public class ExperimentContext {

  public static Builder builder(String slug) {
    return new Builder(slug);
  }

  public static class Builder {

    public Builder appName(String x) {
      m_obj.m_appName = x;
      return this;
    }

    public Builder startDate(LocalDate x) {
      m_obj.m_startDate = x;
      return this;
    }

    public Builder endDate(LocalDate x) {
      m_obj.m_endDate = x;
      return this;
    }

    /** Number of days clients are enrolled for, counted from the start date */
    public Builder enrollmentPeriod(int days) {
      m_obj.m_enrollmentPeriod = days;
      return this;
    }

    public ExperimentContext build() {
      ExperimentContext result = m_obj;
      m_obj = new ExperimentContext(result.m_slug);
      return result;
    }

    private Builder(String slug) {
      if (slug == null)
        throw new IllegalArgumentException("An experiment needs a slug");
      m_obj = new ExperimentContext(slug);
    }

    private ExperimentContext m_obj;
  }

  public String getSlug() {
    return m_slug;
  }

  public String getAppName() {
    return m_appName;
  }

  public LocalDate getStartDate() {
    return m_startDate;
  }

  public LocalDate getEndDate() {
    return m_endDate;
  }

  public Integer getEnrollmentPeriod() {
    return m_enrollmentPeriod;
  }

  /** The last day of enrollment, null unless both the start date and the period are known */
  public LocalDate getLastEnrollmentDate() {
    if (m_startDate == null || m_enrollmentPeriod == null)
      return null;
    return m_startDate.plusDays(m_enrollmentPeriod);
  }

  /** The variables exposed to templates under "experiment" */
  public Map<String, Object> toTemplateVariables() {
    Map<String, Object> vars = new LinkedHashMap<>();
    vars.put("slug", m_slug);
    if (m_appName != null)
      vars.put("app_name", m_appName);
    if (m_startDate != null)
      vars.put("start_date_str", m_startDate.format(DATE_FORMAT));
    if (m_endDate != null)
      vars.put("end_date_str", m_endDate.format(DATE_FORMAT));
    if (getLastEnrollmentDate() != null)
      vars.put("last_enrollment_date_str", getLastEnrollmentDate().format(DATE_FORMAT));
    if (m_enrollmentPeriod != null)
      vars.put("enrollment_period", m_enrollmentPeriod);
    return Collections.unmodifiableMap(vars);
  }

  private ExperimentContext(String slug) {
    m_slug = slug;
  }

  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

  private final String m_slug;
  private String m_appName;
  private LocalDate m_startDate;
  private LocalDate m_endDate;
  private Integer m_enrollmentPeriod;
}
