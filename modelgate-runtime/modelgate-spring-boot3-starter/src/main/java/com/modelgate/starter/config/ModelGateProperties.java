package com.modelgate.starter.config;

import com.modelgate.api.security.Permission;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Setter
@Getter
@ConfigurationProperties(prefix = "modelgate")
public class ModelGateProperties {

    private boolean enabled = true;

    // 没有任何规则匹配时的权限
    private Permission defaultPermission = Permission.ALLOW;

    // 从低到高，必须恰好包含五种权限
    private List<String> permissionOrder = new ArrayList<>();

    private boolean multipleUserModels = false;

    private int roleCheckThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    // 模型定义 YAML，例如 classpath:models/order.yml
    private List<String> modelLocations = new ArrayList<>();

    private Replication replication = new Replication();

    @Setter
    @Getter
    public static class Replication {
        private int chunkSize = 0;
        private int maxAttempts = 3;
        private int bulkUpdateChunkSize = 100;
        private String hashAlgorithm = "SHA-1";
        private boolean ignoreChangeErrors = false;
        private long changeCleanupIntervalMs = 0L;
    }
}
