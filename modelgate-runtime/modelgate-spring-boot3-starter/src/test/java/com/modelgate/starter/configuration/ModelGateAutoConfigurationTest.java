package com.modelgate.starter.configuration;

import com.modelgate.api.security.AccessType;
import com.modelgate.api.security.Permission;
import com.modelgate.api.security.Principal;
import com.modelgate.core.config.ModelGateConfig;
import com.modelgate.core.event.EventBus;
import com.modelgate.core.replication.ReplicationOrchestrator;
import com.modelgate.core.role.RoleRegistry;
import com.modelgate.core.security.DefaultAccessControlService;
import com.modelgate.core.security.ScopeService;
import com.modelgate.core.spi.ModelRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ModelGate 自动配置测试")
class ModelGateAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ModelGateAutoConfiguration.class));

    @Test
    @DisplayName("默认注册全部核心 Bean")
    void shouldRegisterCoreBeans() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(ModelGateConfig.class);
            assertThat(context).hasSingleBean(EventBus.class);
            assertThat(context).hasSingleBean(ModelRegistry.class);
            assertThat(context).hasSingleBean(RoleRegistry.class);
            assertThat(context).hasSingleBean(DefaultAccessControlService.class);
            assertThat(context).hasSingleBean(ScopeService.class);
            assertThat(context).hasSingleBean(ReplicationOrchestrator.class);
        });
    }

    @Test
    @DisplayName("modelgate.enabled=false 时不注册")
    void shouldBackOffWhenDisabled() {
        runner.withPropertyValues("modelgate.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(DefaultAccessControlService.class));
    }

    @Test
    @DisplayName("属性映射到配置 Bean")
    void shouldBindProperties() {
        runner.withPropertyValues(
                        "modelgate.default-permission=DENY",
                        "modelgate.replication.max-attempts=5",
                        "modelgate.replication.bulk-update-chunk-size=10")
                .run(context -> {
                    ModelGateConfig config = context.getBean(ModelGateConfig.class);
                    assertThat(config.getDefaultPermission()).isEqualTo(Permission.DENY);
                    assertThat(config.getMaxReplicationAttempts()).isEqualTo(5);
                    assertThat(config.getBulkUpdateChunkSize()).isEqualTo(10);
                });
    }

    @Test
    @DisplayName("从 modelLocations 加载模型定义并参与鉴权")
    void shouldLoadModelDefinitions() {
        runner.withPropertyValues("modelgate.model-locations=classpath:models/order.yml")
                .run(context -> {
                    ModelRegistry registry = context.getBean(ModelRegistry.class);
                    assertThat(registry.findModel("Order")).isNotNull();

                    DefaultAccessControlService acl = context.getBean(DefaultAccessControlService.class);
                    assertThat(acl.checkPermission(Principal.USER, "u1", "Order", "find", AccessType.WRITE)
                            .getPermission()).isEqualTo(Permission.DENY);
                });
    }
}
