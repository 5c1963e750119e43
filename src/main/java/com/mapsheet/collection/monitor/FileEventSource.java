package com.mapsheet.collection.monitor;

import java.util.function.Consumer;

/**
 * Producer of file events. Implementations only hand events to the sink; they never touch
 * work unit state.
 */
public interface FileEventSource extends AutoCloseable {

    /**
     * Starts producing events into the sink. Returns once the source is running.
     */
    void start(Consumer<FileEvent> sink);

    @Override
    void close();
}
