package com.gentoro.agentgraph.graph;

import static com.gentoro.agentgraph.Fixtures.capability;
import static com.gentoro.agentgraph.Fixtures.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gentoro.agentgraph.agent.AgentInvocationResult;
import com.gentoro.agentgraph.agent.ContentBlock;
import com.gentoro.agentgraph.agent.TokenUsage;
import com.gentoro.agentgraph.exception.NodeExecutionException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NodeFactory and node kinds")
class NodeFactoryTest {

  @Test
  @DisplayName("No capabilities and no prompt gives a terminal node that never calls the runtime")
  void degenerateNodeIsTerminal() {
    ScriptedRuntime runtime = new ScriptedRuntime();
    GraphNode node = new NodeFactory(runtime).build("end", List.of(), "  ");

    assertThat(node.kind()).isEqualTo(NodeKind.TERMINAL);
    assertThat(node.execute("anything", context())).isEmpty();
    assertThat(runtime.invocations).isEmpty();
  }

  @Test
  void textNodePassesPromptAndCapabilities() {
    ScriptedRuntime runtime =
        new ScriptedRuntime().answer("n", inv -> AgentInvocationResult.ofText("hi", TokenUsage.ZERO));
    GraphNode node = new NodeFactory(runtime).build("n", List.of(capability("slack___x")), "sys");

    List<AgentInvocationResult> out = node.execute("user input", context());

    assertThat(node.kind()).isEqualTo(NodeKind.TEXT);
    assertThat(out).hasSize(1);
    assertThat(runtime.invocations.get(0).systemPrompt()).isEqualTo("sys");
    assertThat(runtime.invocations.get(0).capabilities()).extracting(c -> c.name()).containsExactly("slack___x");
  }

  @Test
  @DisplayName("Runtime failures carry the node id")
  void wrapsRuntimeFailure() {
    ScriptedRuntime runtime =
        new ScriptedRuntime()
            .answer(
                "n",
                inv -> {
                  throw new IllegalStateException("boom");
                });
    GraphNode node = new NodeFactory(runtime).build("n", List.of(), "sys");

    assertThatThrownBy(() -> node.execute("x", context()))
        .isInstanceOf(NodeExecutionException.class)
        .hasMessageContaining("boom")
        .satisfies(e -> assertThat(((NodeExecutionException) e).getNodeId()).isEqualTo("n"));
  }

  @Test
  @DisplayName("Structured node parses fenced and bare JSON, keeps prose as text")
  void structuredNodeParsesJson() {
    ScriptedRuntime runtime =
        new ScriptedRuntime()
            .answer(
                "s",
                inv ->
                    new AgentInvocationResult(
                        List.of(
                            ContentBlock.text("```json\n{\"urls\":[\"https://a\"]}\n```"),
                            ContentBlock.text("[1, 2]"),
                            ContentBlock.text("just words")),
                        TokenUsage.ZERO));
    GraphNode node = new NodeFactory(runtime).structured("s", List.of(), "sys");

    List<ContentBlock> content = node.execute("x", context()).get(0).content();

    assertThat(node.kind()).isEqualTo(NodeKind.STRUCTURED);
    assertThat(content.get(0)).isInstanceOf(ContentBlock.StructuredBlock.class);
    assertThat(((ContentBlock.StructuredBlock) content.get(0)).data().get("urls").get(0).asText())
        .isEqualTo("https://a");
    assertThat(content.get(1)).isInstanceOf(ContentBlock.StructuredBlock.class);
    assertThat(content.get(2)).isEqualTo(ContentBlock.text("just words"));
  }
}
