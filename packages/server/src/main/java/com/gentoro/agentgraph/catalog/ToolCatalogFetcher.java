package com.gentoro.agentgraph.catalog;

import com.gentoro.agentgraph.context.RequestContext;
import com.gentoro.agentgraph.exception.CatalogException;
import com.gentoro.agentgraph.exception.EmptyCatalogException;
import com.gentoro.agentgraph.exception.ExceptionUtil;
import com.gentoro.agentgraph.exception.PaginationOverflowException;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the full capability catalog by following the listing cursor until it runs out.
 *
 * <p>The number of pages is capped so that a gateway that keeps returning a cursor cannot hold the
 * request forever.
 */
public class ToolCatalogFetcher {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(ToolCatalogFetcher.class);

  private final int maxPages;

  public ToolCatalogFetcher(int maxPages) {
    if (maxPages <= 0) {
      throw new IllegalArgumentException("maxPages must be positive: " + maxPages);
    }
    this.maxPages = maxPages;
  }

  public Catalog fetchAll(CatalogSource source, RequestContext context) {
    List<Capability> accumulated = new ArrayList<>();
    String cursor = null;
    int pages = 0;
    do {
      if (pages == maxPages) {
        throw new PaginationOverflowException(maxPages, accumulated.size());
      }
      final int pageNumber = pages + 1;
      CatalogPage page;
      try {
        page = source.listPage(cursor);
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            ex ->
                new CatalogException(
                    "Failed to list capabilities (page %d)".formatted(pageNumber), ex));
      }
      if (page == null) {
        throw new CatalogException("Gateway returned no listing for page %d".formatted(pageNumber));
      }
      pages++;
      accumulated.addAll(page.capabilities());
      log.debug(
          "Catalog page {} returned {} capabilities (session {})",
          pages,
          page.capabilities().size(),
          context.sessionId());
      cursor = page.hasMore() ? page.nextCursor() : null;
    } while (cursor != null);

    if (accumulated.isEmpty()) {
      throw new EmptyCatalogException(pages);
    }
    Catalog catalog = new Catalog(accumulated);
    log.info("Fetched {} capabilities in {} page(s): {}", catalog.size(), pages, catalog.names());
    return catalog;
  }
}
