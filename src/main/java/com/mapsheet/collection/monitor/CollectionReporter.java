package com.mapsheet.collection.monitor;

import com.mapsheet.collection.resolve.Rejection;
import com.mapsheet.collection.resolve.ResolvedFile;

import java.nio.file.Path;

/**
 * Receives everything the monitor has to tell: accepted files, rejections, periodic status
 * and the end-of-period snapshot. Called from the dispatch thread only.
 */
public interface CollectionReporter {

    void onResolved(ResolvedFile file);

    void onRejected(Path path, Rejection rejection);

    void onStatus(StatusReport report);

    void onPeriodClosed(PeriodSnapshot snapshot);
}
