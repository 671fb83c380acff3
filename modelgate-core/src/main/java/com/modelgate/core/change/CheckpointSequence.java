package com.modelgate.core.change;

import com.modelgate.core.spi.ModelStore;
import com.modelgate.core.store.Filter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checkpoint 序列
 * <p>
 * 单调递增的整数，被追踪模型与其变更集合共用。记录形如 {id, seq, time}。
 * </p>
 */
@Slf4j
public class CheckpointSequence {

    private final ModelStore store;

    public CheckpointSequence(ModelStore store) {
        this.store = store;
    }

    /**
     * 当前最大 seq，没有任何记录时创建 seq 1
     */
    public synchronized long current() {
        Map<String, Object> last = last();
        if (last == null) {
            create(1L);
            return 1L;
        }
        return seqOf(last);
    }

    /**
     * 追加 seq + 1 并返回新值
     */
    public synchronized long bumpLastSeq() {
        long next = current() + 1;
        create(next);
        log.debug("Checkpoint bumped to {}", next);
        return next;
    }

    private Map<String, Object> last() {
        List<Map<String, Object>> found = store.find(Filter.builder().order("seq DESC").limit(1).build());
        return found.isEmpty() ? null : found.get(0);
    }

    private void create(long seq) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seq", seq);
        data.put("time", System.currentTimeMillis());
        store.create(data);
    }

    private static long seqOf(Map<String, Object> doc) {
        return ((Number) doc.get("seq")).longValue();
    }
}
