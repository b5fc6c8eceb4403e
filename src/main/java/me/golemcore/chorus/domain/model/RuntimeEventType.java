package me.golemcore.chorus.domain.model;

/**
 * Stable live-update event types emitted while an agent turn runs.
 */
public enum RuntimeEventType {
    MESSAGE_STARTED, STREAM_CONTENT, STREAM_REASONING, TOOL_CALL, STREAMING_STOPPED, MESSAGE_FINALIZED, TURN_ERROR
}
