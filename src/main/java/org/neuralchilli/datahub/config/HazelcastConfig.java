package org.neuralchilli.datahub.config;

import com.hazelcast.config.Config;
import com.hazelcast.config.JoinConfig;
import com.hazelcast.config.QueueConfig;
import com.hazelcast.config.SerializerConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.datahub.domain.Instance;
import org.neuralchilli.datahub.serializer.InstanceSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the embedded Hazelcast member that holds scheduler state
 * (instances, lineage index, fired cycles) and the report/work queues.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @ConfigProperty(name = "hazelcast.cluster-name", defaultValue = "datahub-dev")
    String clusterName;

    @ConfigProperty(name = "datahub.worker.queue-capacity", defaultValue = "1000")
    int workQueueCapacity;

    @Produces
    @Singleton
    @Startup
    public HazelcastInstance hazelcastInstance() {
        HazelcastInstance instance = Hazelcast.newHazelcastInstance(createConfig(clusterName, workQueueCapacity));
        log.info("Embedded Hazelcast member started (cluster {}, work queue bound {})", clusterName, workQueueCapacity);
        return instance;
    }

    void shutdown(@Disposes HazelcastInstance instance) {
        if (instance.getLifecycleService().isRunning()) {
            log.info("Shutting down Hazelcast");
            instance.shutdown();
        }
    }

    /**
     * Embedded, non-joining member configuration. Shared with tests.
     */
    public static Config createConfig(String clusterName, int workQueueCapacity) {
        Config config = new Config();
        config.setClusterName(clusterName);

        // Single member, never looks for peers
        JoinConfig join = config.getNetworkConfig().getJoin();
        join.getMulticastConfig().setEnabled(false);
        join.getTcpIpConfig().setEnabled(false);
        join.getAutoDetectionConfig().setEnabled(false);
        config.setProperty("hazelcast.phone.home.enabled", "false");

        config.addQueueConfig(new QueueConfig("work-queue").setMaxSize(workQueueCapacity));

        config.getSerializationConfig().addSerializerConfig(new SerializerConfig()
                .setTypeClass(Instance.class)
                .setImplementation(new InstanceSerializer()));
        return config;
    }
}
