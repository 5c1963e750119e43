package com.mapsheet.collection.monitor;

import com.mapsheet.collection.resolve.Rejection;
import com.mapsheet.collection.resolve.ResolvedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Default reporter writing every notification to the log.
 */
public class LoggingCollectionReporter implements CollectionReporter {
    private static final Logger log = LoggerFactory.getLogger(LoggingCollectionReporter.class);

    @Override
    public void onResolved(ResolvedFile file) {
        log.info("collection.accepted workUnit={} category={} date={} path={}",
                file.identity().identifier(), file.category(), file.fileDate(), file.path());
    }

    @Override
    public void onRejected(Path path, Rejection rejection) {
        log.warn("collection.rejected path={} reason={} detail={}", path, rejection.reason(), rejection.detail());
    }

    @Override
    public void onStatus(StatusReport report) {
        if (report.urgent()) {
            log.warn("collection.status {}", report.describe());
        } else {
            log.info("collection.status {}", report.describe());
        }
    }

    @Override
    public void onPeriodClosed(PeriodSnapshot snapshot) {
        log.info("collection.closed date={} reason={} satisfied={}/{}",
                snapshot.periodDate(), snapshot.terminationReason(),
                snapshot.satisfiedCount(), snapshot.statuses().size());
        for (CategoryOutcome outcome : snapshot.outcomes()) {
            log.info("collection.outcome workUnit={} category={} result={}",
                    outcome.identifier(), outcome.category(), outcome.describe());
        }
    }
}
