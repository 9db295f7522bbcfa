package io.causallabs.mustache;

import java.util.List;

/** This is the top level context provided to the query templates */
public interface Context {

  /** The aggregation blocks, one per WITH subquery. The anchor comes first. */
  public List<Block> getBlocks();

  /** The columns of the final select: key columns, dimensions, then every computed value */
  public List<Column> getColumns();

  /** The name of the block all the others are joined onto */
  public String getAnchor();

  /** One full outer join per block other than the anchor */
  public List<JoinClause> getJoins();
}
