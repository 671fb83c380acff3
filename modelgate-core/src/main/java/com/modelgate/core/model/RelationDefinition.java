package com.modelgate.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 模型关系
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationDefinition {

    public enum Type {
        BELONGS_TO, HAS_ONE, HAS_MANY
    }

    private String name;
    private Type type;

    /**
     * 关联的模型名
     */
    private String model;

    /**
     * 外键，缺省为 关系名 + "Id"
     */
    private String foreignKey;

    public String getForeignKeyOrDefault() {
        return foreignKey != null ? foreignKey : name + "Id";
    }
}
