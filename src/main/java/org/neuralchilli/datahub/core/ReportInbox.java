package org.neuralchilli.datahub.core;

import com.hazelcast.collection.IQueue;
import com.hazelcast.core.HazelcastInstance;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Queue of execution reports between the backend and the tracker loop.
 * Backends write from any thread; only the tracker drains.
 */
@ApplicationScoped
public class ReportInbox {

    private static final Logger log = LoggerFactory.getLogger(ReportInbox.class);

    static final String QUEUE_NAME = "execution-reports";

    @Inject
    HazelcastInstance hazelcast;

    private IQueue<ExecutionReport> reports;

    @PostConstruct
    void init() {
        reports = hazelcast.getQueue(QUEUE_NAME);
    }

    /**
     * Called by execution backends when an attempt finishes
     */
    public void report(ExecutionReport report) {
        if (!reports.offer(report)) {
            throw new IllegalStateException("Report queue is full, dropped: " + report);
        }
        log.debug("Queued report: {}", report);
    }

    /**
     * Take everything reported so far, in arrival order
     */
    public List<ExecutionReport> drain() {
        List<ExecutionReport> drained = new ArrayList<>();
        reports.drainTo(drained);
        if (!drained.isEmpty()) {
            log.debug("Drained {} execution reports", drained.size());
        }
        return drained;
    }

    public int size() {
        return reports.size();
    }
}
