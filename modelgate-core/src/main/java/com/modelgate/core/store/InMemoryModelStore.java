package com.modelgate.core.store;

import com.modelgate.api.exception.ModelGateException;
import com.modelgate.api.exception.NotFoundException;
import com.modelgate.core.spi.ModelStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于内存的持久化能力集
 * <p>
 * 单条操作在实例锁内完成，返回值都是副本，调用方修改不会影响存储内容。
 * 未指定 ID 时分配自增数字 ID。
 * </p>
 */
@Slf4j
public class InMemoryModelStore implements ModelStore {

    public static final String DUPLICATE_ID = "DUPLICATE_ID";

    private final String modelName;
    private final String idName;
    private final Map<String, Map<String, Object>> records = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryModelStore(String modelName) {
        this(modelName, "id");
    }

    public InMemoryModelStore(String modelName, String idName) {
        this.modelName = modelName;
        this.idName = idName;
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    @Override
    public String getIdName() {
        return idName;
    }

    @Override
    public synchronized Map<String, Object> create(Map<String, Object> data) {
        Map<String, Object> doc = new LinkedHashMap<>(data);
        Object id = doc.get(idName);
        if (id == null) {
            id = nextId();
            doc.put(idName, id);
        } else if (records.containsKey(key(id))) {
            throw new ModelGateException(DUPLICATE_ID, 409,
                    "Duplicate entry for " + modelName + "." + idName + ": " + id);
        }
        records.put(key(id), doc);
        log.debug("[{}] created {}", modelName, id);
        return new LinkedHashMap<>(doc);
    }

    @Override
    public synchronized Map<String, Object> findById(Object id) {
        if (id == null) {
            return null;
        }
        Map<String, Object> doc = records.get(key(id));
        return doc == null ? null : new LinkedHashMap<>(doc);
    }

    @Override
    public synchronized List<Map<String, Object>> find(Filter filter) {
        Filter f = filter == null ? Filter.all() : filter;
        List<Map<String, Object>> matched = new ArrayList<>();
        for (Map<String, Object> doc : records.values()) {
            if (f.getWhere() == null || f.getWhere().matches(doc)) {
                matched.add(doc);
            }
        }
        if (f.getOrder() != null && !f.getOrder().isBlank()) {
            matched.sort(comparatorFor(f.getOrder()));
        }
        int from = f.getSkip() == null ? 0 : Math.min(f.getSkip(), matched.size());
        int to = f.getLimit() == null ? matched.size() : Math.min(matched.size(), from + f.getLimit());

        List<Map<String, Object>> result = new ArrayList<>(to - from);
        for (Map<String, Object> doc : matched.subList(from, to)) {
            result.add(project(doc, f.getFields()));
        }
        return result;
    }

    @Override
    public synchronized Map<String, Object> updateAttributes(Object id, Map<String, Object> data) {
        Map<String, Object> doc = records.get(key(id));
        if (doc == null) {
            throw new NotFoundException("Unknown " + modelName + " id " + id);
        }
        data.forEach((k, v) -> {
            if (!idName.equals(k)) {
                doc.put(k, v);
            }
        });
        return new LinkedHashMap<>(doc);
    }

    @Override
    public synchronized Map<String, Object> replaceOrCreate(Map<String, Object> data) {
        Object id = data.get(idName);
        if (id == null || !records.containsKey(key(id))) {
            return create(data);
        }
        Map<String, Object> doc = new LinkedHashMap<>(data);
        records.put(key(id), doc);
        return new LinkedHashMap<>(doc);
    }

    @Override
    public synchronized boolean destroyById(Object id) {
        return id != null && records.remove(key(id)) != null;
    }

    @Override
    public synchronized int destroyAll(Where where) {
        int before = records.size();
        records.values().removeIf(doc -> where == null || where.matches(doc));
        return before - records.size();
    }

    @Override
    public synchronized int count(Where where) {
        if (where == null) {
            return records.size();
        }
        return (int) records.values().stream().filter(where::matches).count();
    }

    @Override
    public synchronized int updateAll(Where where, Map<String, Object> data) {
        int count = 0;
        for (Map<String, Object> doc : records.values()) {
            if (where == null || where.matches(doc)) {
                data.forEach((k, v) -> {
                    if (!idName.equals(k)) {
                        doc.put(k, v);
                    }
                });
                count++;
            }
        }
        return count;
    }

    private Object nextId() {
        long candidate = sequence.incrementAndGet();
        while (records.containsKey(key(candidate))) {
            candidate = sequence.incrementAndGet();
        }
        return candidate;
    }

    private static String key(Object id) {
        return id.toString();
    }

    private Map<String, Object> project(Map<String, Object> doc, List<String> fields) {
        if (fields == null || fields.isEmpty()) {
            return new LinkedHashMap<>(doc);
        }
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String field : fields) {
            if (doc.containsKey(field)) {
                projected.put(field, doc.get(field));
            }
        }
        return projected;
    }

    private static Comparator<Map<String, Object>> comparatorFor(String order) {
        Comparator<Map<String, Object>> comparator = null;
        for (String clause : order.split(",")) {
            String[] parts = clause.trim().split("\\s+");
            String field = parts[0];
            boolean desc = parts.length > 1 && "DESC".equalsIgnoreCase(parts[1]);
            Comparator<Map<String, Object>> next = (a, b) -> compareNullable(a.get(field), b.get(field));
            if (desc) {
                next = next.reversed();
            }
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        return comparator;
    }

    private static int compareNullable(Object a, Object b) {
        if (a == null) {
            return b == null ? 0 : -1;
        }
        if (b == null) {
            return 1;
        }
        return Where.compare(a, b);
    }
}
