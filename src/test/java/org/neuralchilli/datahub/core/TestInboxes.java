package org.neuralchilli.datahub.core;

import com.hazelcast.core.HazelcastInstance;

/**
 * Report inboxes over a test Hazelcast member, for tests outside this package.
 */
public final class TestInboxes {

    private TestInboxes() {
    }

    public static ReportInbox over(HazelcastInstance hazelcast) {
        ReportInbox inbox = new ReportInbox();
        inbox.hazelcast = hazelcast;
        inbox.init();
        return inbox;
    }
}
