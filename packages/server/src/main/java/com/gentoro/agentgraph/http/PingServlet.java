package com.gentoro.agentgraph.http;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;

/** Health probe: {@code GET /ping} answers {@code {"status":"Healthy"}}. */
public class PingServlet extends HttpServlet {
  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    resp.setStatus(200);
    resp.setContentType("application/json");
    try (PrintWriter out = resp.getWriter()) {
      out.print("{\"status\":\"Healthy\"}");
    }
  }
}
