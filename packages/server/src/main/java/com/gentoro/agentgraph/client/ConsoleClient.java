package com.gentoro.agentgraph.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentgraph.decode.DecodedResult;
import com.gentoro.agentgraph.exception.ExceptionUtil;
import com.gentoro.agentgraph.utility.StringUtility;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Scanner;
import java.util.UUID;

/** Interactive prompt loop against a runtime. One session id for the whole console session. */
public class ConsoleClient {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(ConsoleClient.class);

  private static final String GREEN = "\u001B[32m";
  private static final String RED = "\u001B[31m";
  private static final String YELLOW = "\u001B[33m";
  private static final String RESET = "\u001B[0m";

  private final RuntimeClient client;
  private final PrintStream out;
  private final String sessionId = UUID.randomUUID().toString();

  public ConsoleClient(RuntimeClient client, PrintStream out) {
    this.client = Objects.requireNonNull(client, "client");
    this.out = Objects.requireNonNull(out, "out");
  }

  public void run(InputStream in) {
    Scanner scanner = new Scanner(in, StandardCharsets.UTF_8);
    out.println("Type a message (or 'exit' to quit), e.g. \"Summarize the URLs shared in Slack\":");
    while (true) {
      out.print("> ");
      if (!scanner.hasNextLine()) {
        break;
      }
      String input = scanner.nextLine().trim();
      if (input.equalsIgnoreCase("exit") || input.equalsIgnoreCase("quit")) {
        out.println("Goodbye!");
        break;
      }
      if (input.isEmpty()) continue;
      try {
        out.println(render(client.invoke(input, sessionId)));
      } catch (RuntimeException e) {
        log.error("Invocation failed", e);
        out.printf("%s%s%s%n", RED, ExceptionUtil.describe(e), RESET);
      }
    }
  }

  static String render(DecodedResult result) {
    return switch (result.kind()) {
      case EMPTY -> "(empty response)";
      case ERROR -> RED + "Error: " + result.text() + RESET;
      case TEXT -> result.text();
      case STRUCTURED -> renderStructured(result.data());
    };
  }

  private static String renderStructured(JsonNode data) {
    if (!data.has("agents")) {
      return data.toPrettyString();
    }
    StringBuilder sb = new StringBuilder();
    sb.append("Status: ").append(data.path("status").asText()).append('\n');
    for (JsonNode agent : data.path("agents")) {
      String status = agent.path("status").asText();
      String colour =
          switch (status) {
            case "completed" -> GREEN;
            case "skipped" -> YELLOW;
            default -> RED;
          };
      sb.append(colour)
          .append("  ")
          .append(agent.path("name").asText())
          .append(": ")
          .append(status)
          .append(RESET)
          .append(" (")
          .append(agent.path("execution_time_ms").asLong())
          .append(" ms)\n");
      if (agent.has("error")) {
        sb.append(StringUtility.formatWithIndent(agent.path("error").asText(), 4)).append('\n');
      }
    }
    sb.append('\n').append(data.path("full_text").asText());
    return sb.toString();
  }
}
