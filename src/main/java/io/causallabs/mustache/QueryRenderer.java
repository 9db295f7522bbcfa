package io.causallabs.mustache;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import com.samskivert.mustache.Mustache;
import com.samskivert.mustache.MustacheException;
import com.samskivert.mustache.Template;
import io.causallabs.metricconfig.ConfigException;
import io.causallabs.metricconfig.ErrorKind;
import io.causallabs.metricconfig.Function;
import io.causallabs.metricconfig.Parameter;
import io.causallabs.metricconfig.QueryBlock;
import io.causallabs.metricconfig.QueryPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a query plan into SQL text with JMustache. Every fragment of the plan (from expressions,
 * select expressions, filters) is rendered first, with the experiment variables, {{dataset}},
 * {{parameters.&lt;name&gt;}} and the aggregation macros in scope. The rendered blocks are then handed to the query template.
 *
 * <p>
 * Nothing is escaped and nothing is defaulted: a fragment that refers to a variable or macro that
 * does not exist fails the whole query. Compiled templates are the only state, so one renderer can
 * be shared between threads.
 */
public class QueryRenderer {

  public static final String DEFAULT_TEMPLATE_PATH = "io/causallabs/mustache/";
  public static final String METRICS_TEMPLATE = "metrics_query";
  public static final String SEGMENTS_TEMPLATE = "segments_query";
  public static final String BLOCK_TEMPLATE = "block";

  public QueryRenderer() throws ConfigException {
    this(DEFAULT_TEMPLATE_PATH);
  }

  /**
   * @param templatePath classpath prefix the templates are loaded from, ending with a slash
   */
  public QueryRenderer(String templatePath) throws ConfigException {
    m_templatePath = templatePath.endsWith("/") ? templatePath : templatePath + "/";
    m_fragments = Mustache.compiler().escapeHTML(false).strictSections(true);
    Mustache.Compiler compiler = m_fragments.withLoader(name -> open(name));
    m_metrics = compiler.compile(load(METRICS_TEMPLATE));
    m_segments = compiler.compile(load(SEGMENTS_TEMPLATE));
    m_block = compiler.compile(load(BLOCK_TEMPLATE));
  }

  /** Render the whole query */
  public String render(QueryPlan plan) throws ConfigException {
    if (plan.isEmpty()) {
      throw new ConfigException(ErrorKind.EMPTY_QUERY, "Nothing left to query");
    }
    List<Block> blocks = new ArrayList<>();
    for (QueryBlock b : plan.getBlocks()) {
      blocks.add(block(plan, b));
    }
    Context context = new QueryContext(plan, blocks);
    Template template = plan.getKind() == QueryPlan.Kind.SEGMENTS ? m_segments : m_metrics;
    String sql = execute(template, context, "query");
    logger.debug("Rendered {} blocks into {} characters of SQL", blocks.size(), sql.length());
    return sql;
  }

  /** Render the aggregation subquery of one block on its own */
  public String renderBlock(QueryPlan plan, String name) throws ConfigException {
    QueryBlock b = plan.getBlock(name);
    if (b == null)
      throw new IllegalArgumentException("No block named " + name);
    return execute(m_block, block(plan, b), name);
  }

  private Block block(QueryPlan plan, QueryBlock b) throws ConfigException {
    Map<String, Object> scope = fragmentScope(plan, b);
    List<Column> columns = new ArrayList<>();
    Map<String, String> rendered = new HashMap<>();
    for (Map.Entry<String, String> e : b.getColumns().entrySet()) {
      String expression =
          fragment(e.getValue(), scope, "column " + e.getKey() + " of " + b.getName());
      columns.add(new ColumnView(e.getKey(), expression));
      rendered.put(e.getKey(), expression);
    }
    String from = fragment(b.getFrom(), scope, "from expression of " + b.getName());
    String where =
        b.getWhere() == null ? null : fragment(b.getWhere(), scope, "filter of " + b.getName());
    List<String> groupBy = b.getGroupBy();
    if (b.isGroupedByExpression()) {
      groupBy = new ArrayList<>();
      for (String name : b.getGroupBy()) {
        groupBy.add(rendered.get(name));
      }
    }
    return new BlockView(b.getName(), columns, from, where, groupBy);
  }

  // what a fragment may refer to
  private Map<String, Object> fragmentScope(QueryPlan plan, QueryBlock b) {
    Map<String, Object> scope = new HashMap<>();
    for (Function f : plan.getFunctions().values()) {
      scope.put(f.getSlug(), macro(f));
    }
    if (plan.getExperiment() != null)
      scope.put("experiment", plan.getExperiment().toTemplateVariables());
    if (!plan.getParameters().isEmpty()) {
      Map<String, String> parameters = new HashMap<>();
      for (Parameter p : plan.getParameters().values()) {
        parameters.put(p.getName(), p.toSql());
      }
      scope.put("parameters", parameters);
    }
    String dataset = plan.getDataset() != null ? plan.getDataset() : b.getDefaultDataset();
    if (dataset != null)
      scope.put("dataset", dataset);
    return scope;
  }

  private static Mustache.Lambda macro(Function f) {
    return (frag, out) -> out.write(f.apply(frag.execute()));
  }

  private String fragment(String text, Map<String, Object> scope, String what)
      throws ConfigException {
    try {
      return m_fragments.compile(text).execute(scope);
    } catch (MustacheException e) {
      throw new ConfigException(ErrorKind.MISSING_TEMPLATE_VARIABLE,
          "Unable to render " + what + ": " + e.getMessage(), e);
    }
  }

  private static String execute(Template template, Object context, String what)
      throws ConfigException {
    try {
      return template.execute(context);
    } catch (MustacheException e) {
      throw new ConfigException(ErrorKind.MISSING_TEMPLATE_VARIABLE,
          "Unable to render " + what + ": " + e.getMessage(), e);
    }
  }

  private String load(String name) throws ConfigException {
    try (Reader reader = open(name)) {
      StringBuilder sb = new StringBuilder();
      char[] buf = new char[4096];
      int n;
      while ((n = reader.read(buf)) >= 0) {
        sb.append(buf, 0, n);
      }
      return sb.toString();
    } catch (IOException e) {
      throw new ConfigException(ErrorKind.LOAD_FAILURE,
          "Unable to load template " + m_templatePath + name, e);
    }
  }

  private Reader open(String name) throws FileNotFoundException {
    String resource = m_templatePath + name + ".mustache";
    InputStream in = QueryRenderer.class.getClassLoader().getResourceAsStream(resource);
    if (in == null)
      throw new FileNotFoundException("No template on the classpath at " + resource);
    return new InputStreamReader(in, StandardCharsets.UTF_8);
  }

  /** The top level context of the query templates */
  public static class QueryContext implements Context {

    QueryContext(QueryPlan plan, List<Block> blocks) {
      m_blocks = blocks;
      m_anchor = blocks.get(0).getName();
      boolean joined = blocks.size() > 1;
      List<String> shared = new ArrayList<>(plan.getKeyColumns());
      shared.addAll(plan.getGroupBy().keySet());

      m_columns = new ArrayList<>();
      for (String name : shared) {
        m_columns.add(new ColumnView(name, joined ? coalesce(name) : m_anchor + "." + name));
      }
      for (QueryBlock b : plan.getBlocks()) {
        for (String value : b.getValues()) {
          m_columns.add(new ColumnView(value, b.getName() + "." + value));
        }
      }

      m_joins = new ArrayList<>();
      for (Block b : blocks.subList(1, blocks.size())) {
        List<String> conditions = new ArrayList<>();
        for (String name : shared) {
          conditions.add(m_anchor + "." + name + " = " + b.getName() + "." + name);
        }
        m_joins.add(new JoinView(b.getName(), String.join(" AND ", conditions)));
      }
    }

    private String coalesce(String column) {
      List<String> parts = new ArrayList<>();
      for (Block b : m_blocks) {
        parts.add(b.getName() + "." + column);
      }
      return "COALESCE(" + String.join(", ", parts) + ")";
    }

    @Override
    public List<Block> getBlocks() {
      return m_blocks;
    }

    @Override
    public List<Column> getColumns() {
      return m_columns;
    }

    @Override
    public String getAnchor() {
      return m_anchor;
    }

    @Override
    public List<JoinClause> getJoins() {
      return m_joins;
    }

    private final List<Block> m_blocks;
    private final String m_anchor;
    private final List<Column> m_columns;
    private final List<JoinClause> m_joins;
  }

  public static class BlockView implements Block {

    BlockView(String name, List<Column> columns, String from, String where,
        List<String> groupBy) {
      m_name = name;
      m_columns = columns;
      m_from = from;
      m_where = where;
      m_groupBy = groupBy;
    }

    @Override
    public String getName() {
      return m_name;
    }

    @Override
    public List<Column> getColumns() {
      return m_columns;
    }

    @Override
    public String getFrom() {
      return m_from;
    }

    @Override
    public boolean hasWhere() {
      return m_where != null && !m_where.isBlank();
    }

    @Override
    public String getWhere() {
      return m_where;
    }

    @Override
    public List<String> getGroupBy() {
      return m_groupBy;
    }

    private final String m_name;
    private final List<Column> m_columns;
    private final String m_from;
    private final String m_where;
    private final List<String> m_groupBy;
  }

  public static class ColumnView implements Column {

    ColumnView(String name, String expression) {
      m_name = name;
      m_expression = expression;
    }

    @Override
    public String getName() {
      return m_name;
    }

    @Override
    public String getExpression() {
      return m_expression;
    }

    @Override
    public String getSql() {
      if (m_expression.equals(m_name))
        return m_name;
      return m_expression + " AS " + m_name;
    }

    private final String m_name;
    private final String m_expression;
  }

  public static class JoinView implements JoinClause {

    JoinView(String name, String condition) {
      m_name = name;
      m_condition = condition;
    }

    @Override
    public String getName() {
      return m_name;
    }

    @Override
    public String getCondition() {
      return m_condition;
    }

    private final String m_name;
    private final String m_condition;
  }

  private final String m_templatePath;
  private final Mustache.Compiler m_fragments;
  private final Template m_metrics;
  private final Template m_segments;
  private final Template m_block;
  private static final Logger logger = LoggerFactory.getLogger(QueryRenderer.class);
}
