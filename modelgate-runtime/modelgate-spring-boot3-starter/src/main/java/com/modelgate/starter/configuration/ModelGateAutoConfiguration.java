package com.modelgate.starter.configuration;

import com.modelgate.core.audit.AuditManager;
import com.modelgate.core.config.ModelGateConfig;
import com.modelgate.core.config.PermissionOrder;
import com.modelgate.core.event.EventBus;
import com.modelgate.core.model.ModelDefinition;
import com.modelgate.core.model.ModelDefinitionLoader;
import com.modelgate.core.replication.ReplicationOrchestrator;
import com.modelgate.core.role.RoleRegistry;
import com.modelgate.core.security.DefaultAccessControlService;
import com.modelgate.core.security.ScopeService;
import com.modelgate.core.spi.ModelRegistry;
import com.modelgate.core.store.DefaultModelRegistry;
import com.modelgate.starter.config.ModelGateProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

@Slf4j
@Configuration
@EnableConfigurationProperties(ModelGateProperties.class)
@ConditionalOnProperty(prefix = "modelgate", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ModelGateAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ModelGateConfig modelGateConfig(ModelGateProperties properties) {
        ModelGateProperties.Replication replication = properties.getReplication();
        ModelGateConfig config = ModelGateConfig.builder()
                .defaultPermission(properties.getDefaultPermission())
                .permissionOrder(properties.getPermissionOrder().isEmpty()
                        ? PermissionOrder.defaults()
                        : PermissionOrder.parse(properties.getPermissionOrder()))
                .multipleUserModels(properties.isMultipleUserModels())
                .roleCheckThreads(properties.getRoleCheckThreads())
                .replicationChunkSize(replication.getChunkSize())
                .maxReplicationAttempts(replication.getMaxAttempts())
                .bulkUpdateChunkSize(replication.getBulkUpdateChunkSize())
                .hashAlgorithm(replication.getHashAlgorithm())
                .ignoreChangeErrors(replication.isIgnoreChangeErrors())
                .changeCleanupIntervalMs(replication.getChangeCleanupIntervalMs())
                .build();
        log.info("ModelGate config: {}", config);
        return config;
    }

    // 将事件总线注册为 Bean (解耦)
    @Bean
    @ConditionalOnMissingBean
    public EventBus modelGateEventBus() {
        return new EventBus();
    }

    @Bean
    @ConditionalOnMissingBean(ModelRegistry.class)
    public DefaultModelRegistry modelRegistry(ModelGateProperties properties, ResourceLoader resourceLoader) {
        DefaultModelRegistry registry = new DefaultModelRegistry();
        for (String location : properties.getModelLocations()) {
            Resource resource = resourceLoader.getResource(location);
            try (InputStream in = resource.getInputStream()) {
                for (ModelDefinition definition : ModelDefinitionLoader.load(in)) {
                    registry.register(definition);
                    log.info("Registered model {} from {}", definition.getName(), location);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read model definitions from " + location, e);
            }
        }
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public RoleRegistry roleRegistry(ModelRegistry modelRegistry, ModelGateConfig config) {
        return new RoleRegistry(modelRegistry, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditManager auditManager() {
        return new AuditManager();
    }

    @Bean
    @ConditionalOnMissingBean
    public DefaultAccessControlService accessControlService(ModelRegistry modelRegistry, RoleRegistry roleRegistry,
                                                            AuditManager auditManager, ModelGateConfig config) {
        return new DefaultAccessControlService(modelRegistry, roleRegistry, auditManager, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScopeService scopeService(ModelRegistry modelRegistry, DefaultAccessControlService accessControlService) {
        return new ScopeService(modelRegistry, accessControlService);
    }

    // 复用角色检查线程池，冲突两端的并发读取很轻
    @Bean
    @ConditionalOnMissingBean
    public ReplicationOrchestrator replicationOrchestrator(ModelGateConfig config, EventBus eventBus,
                                                           RoleRegistry roleRegistry) {
        return new ReplicationOrchestrator(config, eventBus, roleRegistry.getExecutor());
    }
}
