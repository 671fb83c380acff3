package com.modelgate.core.replication;

import com.modelgate.api.exception.ModelGateException;
import lombok.Getter;

import java.util.List;

/**
 * bulkUpdate 存在冲突
 * 调用方应检查 {@link #getConflicts()} 并决定如何解决，而不是当作致命错误。
 */
@Getter
public class ConflictException extends ModelGateException {

    public static final String REPLICATION_CONFLICT = "REPLICATION_CONFLICT";

    private final transient List<UpdateConflict> conflicts;

    public ConflictException(List<UpdateConflict> conflicts) {
        super(REPLICATION_CONFLICT, 409, "Bulk update failed due to " + conflicts.size() + " conflict(s)");
        this.conflicts = List.copyOf(conflicts);
    }
}
