package com.modelgate.core.replication;

import com.modelgate.core.change.Change;
import com.modelgate.core.change.ChangeType;

/**
 * 差异
 *
 * @param type   变更类型
 * @param change 产生差异的变更记录
 * @param origin SOURCE: 需要应用到目标端；TARGET: 只存在于目标端，留给反向复制
 */
public record Delta(ChangeType type, Change change, Origin origin) {

    public enum Origin {
        SOURCE, TARGET
    }

    public static Delta source(Change change) {
        return new Delta(change.type(), change, Origin.SOURCE);
    }

    public static Delta target(Change change) {
        return new Delta(change.type(), change, Origin.TARGET);
    }

    public Object modelId() {
        return change.getModelId();
    }
}
