package io.causallabs.mustache;

/** Joins a block onto the anchor of the query */
public interface JoinClause {

  /** The name of the block being joined */
  public String getName();

  /** The key columns and dimensions of both blocks compared for equality */
  public String getCondition();
}
