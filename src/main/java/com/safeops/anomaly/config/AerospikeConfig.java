package com.safeops.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.WritePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("!test")
public class AerospikeConfig {

    public static final String SET_PIPELINE_RUNS = "pipeline_runs";
    public static final String SET_ANOMALY_REPORTS = "anomaly_reports";

    private static final Logger log = LoggerFactory.getLogger(AerospikeConfig.class);

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:safeops}")
    private String namespace;

    @Value("${aerospike.connect-attempts:10}")
    private int connectAttempts;

    @Value("${aerospike.connect-backoff-ms:2000}")
    private long connectBackoffMs;

    /**
     * Connects to the cluster, retrying with a fixed backoff. Exhausting the attempts fails
     * context startup.
     */
    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() throws InterruptedException {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;

        clientPolicy.readPolicyDefault.totalTimeout = 3000;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        int attempts = Math.max(1, connectAttempts);
        AerospikeException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                AerospikeClient client = new AerospikeClient(clientPolicy, host, port);
                log.info("Connected to Aerospike at {}:{} (namespace={}, attempt {}/{})",
                        host, port, namespace, attempt, attempts);
                return client;
            } catch (AerospikeException e) {
                lastFailure = e;
                log.warn("Aerospike not reachable at {}:{} (attempt {}/{}): {}",
                        host, port, attempt, attempts, e.getMessage());
                if (attempt < attempts) {
                    Thread.sleep(connectBackoffMs);
                }
            }
        }
        throw new IllegalStateException(
                "Could not connect to Aerospike at " + host + ":" + port + " after " + attempts + " attempts",
                lastFailure);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
