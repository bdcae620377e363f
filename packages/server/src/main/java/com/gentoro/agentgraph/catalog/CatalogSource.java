package com.gentoro.agentgraph.catalog;

/** Remote listing operation of the tool gateway. */
@FunctionalInterface
public interface CatalogSource {
  /**
   * List one page of capabilities.
   *
   * @param cursor null for the first page, otherwise the cursor returned by the previous page
   */
  CatalogPage listPage(String cursor);
}
