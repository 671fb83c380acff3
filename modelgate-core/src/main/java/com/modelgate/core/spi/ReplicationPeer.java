package com.modelgate.core.spi;

import com.modelgate.core.change.Change;
import com.modelgate.core.replication.BulkUpdateResult;
import com.modelgate.core.replication.Delta;
import com.modelgate.core.replication.DiffResult;
import com.modelgate.core.replication.ReplicationOptions;
import com.modelgate.core.replication.Update;
import com.modelgate.core.store.Filter;

import java.util.List;
import java.util.Map;

/**
 * SPI: 复制的一端
 * <p>
 * 本地实现为 {@link com.modelgate.core.replication.TrackedModel}；
 * 远程传输 (HTTP / RPC) 实现此接口即可参与复制，传输格式不在 Core 范围内。
 * </p>
 */
public interface ReplicationPeer {

    String getModelName();

    /**
     * 推进 checkpoint 并返回新的 seq
     */
    long checkpoint();

    long currentCheckpoint();

    List<Change> changes(long since, Filter filter);

    DiffResult diff(long since, List<Change> remoteChanges);

    List<Update> createUpdates(List<Delta> deltas);

    /**
     * 非原子地批量应用更新
     *
     * @throws com.modelgate.core.replication.ConflictException 存在冲突时
     */
    BulkUpdateResult bulkUpdate(List<Update> updates, ReplicationOptions options);

    Change findLastChange(Object modelId);

    Change updateLastChange(Object modelId, Map<String, Object> data);

    Map<String, Object> findById(Object modelId);

    /**
     * 整体替换或创建实体
     */
    Map<String, Object> save(Map<String, Object> data);

    boolean deleteById(Object modelId);
}
