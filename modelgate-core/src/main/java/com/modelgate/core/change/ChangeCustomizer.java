package com.modelgate.core.change;

import java.util.Map;

/**
 * 向变更记录复制实体字段，使 changes() 可以直接按这些字段过滤
 * <p>
 * 例如多租户场景下把 tenantId 写入 {@link Change#getCustomProperties()}。
 * </p>
 */
@FunctionalInterface
public interface ChangeCustomizer {

    void fillCustomChangeProperties(Map<String, Object> instance, Change change);
}
