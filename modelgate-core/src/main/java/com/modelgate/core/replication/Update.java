package com.modelgate.core.replication;

import com.modelgate.core.change.Change;
import com.modelgate.core.change.ChangeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 物化后的更新指令
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Update {

    private ChangeType type;
    private Change change;
    private Object id;

    /**
     * 源端实体快照，DELETE 时为 null
     */
    private Map<String, Object> data;
}
