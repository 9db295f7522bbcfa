package io.causallabs.mustache;

/** A selected column */
public interface Column {

  /** The output name */
  public String getName();

  /** The expression computing the column */
  public String getExpression();

  /**
   * What goes in the select list: the expression aliased to the name, or just the name when the
   * expression is the column itself.
   */
  public String getSql();
}
