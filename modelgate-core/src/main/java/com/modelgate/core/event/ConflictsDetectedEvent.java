package com.modelgate.core.event;

import com.modelgate.api.event.AbstractModelGateEvent;
import com.modelgate.core.change.Conflict;
import lombok.Getter;

import java.util.List;

/**
 * 复制过程中发现冲突
 */
@Getter
public class ConflictsDetectedEvent extends AbstractModelGateEvent {

    private final String targetModelName;
    private final transient List<Conflict> conflicts;

    public ConflictsDetectedEvent(String sourceModelName, String targetModelName, List<Conflict> conflicts) {
        super(sourceModelName);
        this.targetModelName = targetModelName;
        this.conflicts = List.copyOf(conflicts);
    }
}
