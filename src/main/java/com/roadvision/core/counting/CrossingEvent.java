package com.roadvision.core.counting;

/** Засчитанное событие в режиме без трекинга; живёт не дольше окна дедупликации. */
public record CrossingEvent(long timestampMs, Center position, String lineName, String counterName) {
}
