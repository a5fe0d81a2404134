package io.antecedent.ownership.spring;

import io.antecedent.kube.KubernetesBackendConnector;
import io.antecedent.ownership.OwnershipVerifier;
import io.antecedent.ownership.OwnershipWriter;
import io.antecedent.ownership.ReleaseOwnership;
import io.antecedent.ownership.manifest.ManifestDecomposer;
import io.antecedent.ownership.ports.BackendConnector;
import io.antecedent.ownership.retry.BoundedRetry;
import io.antecedent.ownership.retry.RetryPolicy;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires release ownership verification and claiming against the Kubernetes cluster the
 * process is configured for.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnClass(KubernetesClient.class)
@ConditionalOnProperty(prefix = "antecedent.ownership", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ReleaseOwnershipProperties.class)
public class ReleaseOwnershipAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ReleaseOwnershipAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    RetryPolicy ownershipRetryPolicy(ReleaseOwnershipProperties properties) {
        return properties.getRetry().toPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    ManifestDecomposer manifestDecomposer() {
        return new ManifestDecomposer();
    }

    @Bean
    @ConditionalOnMissingBean
    BackendConnector ownershipBackendConnector(ObjectProvider<Config> kubernetesConfig,
                                               ReleaseOwnershipProperties properties) {
        Config config = kubernetesConfig.getIfAvailable(
            () -> Config.autoConfigure(properties.getKubernetes().getContext()));
        String masterUrl = properties.getKubernetes().getMasterUrl();
        if (masterUrl != null) {
            config = new ConfigBuilder(config).withMasterUrl(masterUrl).build();
        }
        log.info("Release ownership will connect to Kubernetes API at {}", config.getMasterUrl());
        return new KubernetesBackendConnector(config);
    }

    @Bean
    @ConditionalOnMissingBean
    OwnershipVerifier ownershipVerifier(ManifestDecomposer decomposer, RetryPolicy ownershipRetryPolicy) {
        return new OwnershipVerifier(decomposer, new BoundedRetry(), ownershipRetryPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    OwnershipWriter ownershipWriter(ManifestDecomposer decomposer) {
        return new OwnershipWriter(decomposer);
    }

    @Bean
    @ConditionalOnMissingBean
    ReleaseOwnership releaseOwnership(BackendConnector ownershipBackendConnector,
                                      OwnershipVerifier ownershipVerifier,
                                      OwnershipWriter ownershipWriter) {
        return new ReleaseOwnership(ownershipBackendConnector, ownershipVerifier, ownershipWriter);
    }
}
