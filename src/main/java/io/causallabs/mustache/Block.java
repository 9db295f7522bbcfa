package io.causallabs.mustache;

import java.util.List;

/** One aggregation subquery. All SQL is already rendered. */
public interface Block {

  /** The name of the subquery in the WITH clause */
  public String getName();

  public List<Column> getColumns();

  /** The FROM clause, joins between data sources included */
  public String getFrom();

  public boolean hasWhere();

  public String getWhere();

  /** The names of the grouping columns */
  public List<String> getGroupBy();
}
