package org.neuralchilli.datahub;

import com.hazelcast.config.Config;
import com.hazelcast.core.DistributedObject;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import org.neuralchilli.datahub.config.HazelcastConfig;

/**
 * One embedded, isolated Hazelcast member shared by the plain unit tests.
 */
public final class TestHazelcast {

    private static HazelcastInstance instance;

    private TestHazelcast() {
    }

    public static synchronized HazelcastInstance get() {
        if (instance == null || !instance.getLifecycleService().isRunning()) {
            Config config = HazelcastConfig.createConfig("datahub-unit-" + System.nanoTime(), 1000);
            config.setProperty("hazelcast.operation.call.timeout.millis", "5000");
            config.getMapConfig("*").setBackupCount(0).setAsyncBackupCount(0);
            config.getMetricsConfig().setEnabled(false);
            instance = Hazelcast.newHazelcastInstance(config);
        }
        return instance;
    }

    /**
     * Drop every map and queue so each test starts from empty state
     */
    public static void reset() {
        get().getDistributedObjects().forEach(DistributedObject::destroy);
    }
}
