package com.pipestudio.pipestudio_backend.engine;

import com.pipestudio.pipestudio_backend.model.event.PipelineEvent;

/**
 * Receives every event of every execution. Implementations must not block the coordinator for long.
 */
public interface PipelineEventListener {

    void onEvent(String topic, PipelineEvent event);
}
