package io.causallabs.metricconfig;

import java.io.IOException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import io.causallabs.mustache.QueryRenderer;

/** Options that change the behavior of a query generator. */
public class GeneratorOptions {

  /** system property overriding the default classpath location of the SQL templates */
  public static final String TEMPLATE_PATH_PROPERTY = "io.causallabs.metricconfig.templatePath";

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {

    /**
     * Should generation fail on the first configuration problem instead of leaving out what can't
     * be computed. Off by default, so one broken metric does not block the others.
     */
    public Builder failOnValidationErrors(boolean x) {
      m_obj.m_failOnValidationErrors = x;
      return this;
    }

    /** Should the bundled aggregation macros be merged in before any other layer */
    public Builder includeBuiltinFunctions(boolean x) {
      m_obj.m_includeBuiltinFunctions = x;
      return this;
    }

    /** Classpath prefix holding metrics_query, segments_query and block templates */
    public Builder templatePath(String x) {
      m_obj.m_templatePath = x;
      return this;
    }

    public GeneratorOptions build() {
      GeneratorOptions result = m_obj;
      m_obj = new GeneratorOptions();
      return result;
    }

    private Builder() {
      m_obj = new GeneratorOptions();
    }

    private GeneratorOptions m_obj;
  }

  public void serialize(JsonGenerator gen) throws IOException {
    gen.writeStartObject();
    gen.writeBooleanField("fail_on_validation_errors", m_failOnValidationErrors);
    gen.writeBooleanField("include_builtin_functions", m_includeBuiltinFunctions);
    gen.writeStringField("template_path", m_templatePath);
    gen.writeEndObject();
  }

  public boolean isFailOnValidationErrors() {
    return m_failOnValidationErrors;
  }

  public boolean isIncludeBuiltinFunctions() {
    return m_includeBuiltinFunctions;
  }

  public String getTemplatePath() {
    return m_templatePath;
  }

  private boolean m_failOnValidationErrors = false;
  private boolean m_includeBuiltinFunctions = true;
  private String m_templatePath =
      System.getProperty(TEMPLATE_PATH_PROPERTY, QueryRenderer.DEFAULT_TEMPLATE_PATH);

  private GeneratorOptions() {}

  /**
   * Read options from JSON, e.g. a section of a larger settings file. Absent keys keep their
   * defaults.
   *
   * @param jsonNode
   */
  public GeneratorOptions(JsonNode jsonNode) {
    if (jsonNode.has("fail_on_validation_errors")) {
      m_failOnValidationErrors = jsonNode.get("fail_on_validation_errors").asBoolean();
    }
    if (jsonNode.has("include_builtin_functions")) {
      m_includeBuiltinFunctions = jsonNode.get("include_builtin_functions").asBoolean();
    }
    if (jsonNode.has("template_path")) {
      m_templatePath = jsonNode.get("template_path").asText();
    }
  }

  public static final GeneratorOptions DEFAULTS = new GeneratorOptions();
}
