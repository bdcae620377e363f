package com.gentoro.agentgraph.catalog;

import com.gentoro.agentgraph.agent.ContentBlock;
import java.util.Map;

/** Opaque way to invoke one capability through the session that listed it. */
@FunctionalInterface
public interface CapabilityHandle {
  ContentBlock.ToolResultBlock call(Map<String, Object> arguments);
}
