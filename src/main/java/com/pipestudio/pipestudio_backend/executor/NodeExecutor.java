package com.pipestudio.pipestudio_backend.executor;

import com.pipestudio.pipestudio_backend.model.context.NodeExecutionContext;
import com.pipestudio.pipestudio_backend.model.domain.NodeType;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;

import java.util.Map;

public interface NodeExecutor {

    NodeType supportedType();

    // Runs the node against the inputs gathered in the context and returns its outputs; failures throw NodeExecutionException
    Map<String, Object> execute(PipelineNode node, NodeExecutionContext context);
}
