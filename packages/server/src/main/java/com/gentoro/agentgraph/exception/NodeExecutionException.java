package com.gentoro.agentgraph.exception;

import java.util.Map;

/** The agent invocation behind one graph node failed. Always carries the node id. */
public class NodeExecutionException extends AgentGraphException {
  private final String nodeId;

  public NodeExecutionException(String nodeId, String message, Throwable cause) {
    super(AgentGraphErrorCode.NODE_EXECUTION_ERROR, message, Map.of("node", nodeId), cause);
    this.nodeId = nodeId;
  }

  private NodeExecutionException(
      AgentGraphErrorCode code, String nodeId, String message, Throwable cause) {
    super(code, message, Map.of("node", nodeId), cause);
    this.nodeId = nodeId;
  }

  /** Node execution abandoned because the run was cancelled or timed out. */
  public static NodeExecutionException cancelled(String nodeId, String reason, Throwable cause) {
    return new NodeExecutionException(
        AgentGraphErrorCode.CANCELLED,
        nodeId,
        "Execution of node '%s' was cancelled: %s".formatted(nodeId, reason),
        cause);
  }

  public String getNodeId() {
    return nodeId;
  }
}
