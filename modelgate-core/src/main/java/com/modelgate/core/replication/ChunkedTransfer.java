package com.modelgate.core.replication;

import com.modelgate.core.store.Filter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 分块下载与上传
 * chunkSize &lt;= 0 时不分块，一次完成。
 */
@Slf4j
public final class ChunkedTransfer {

    private ChunkedTransfer() {
    }

    /**
     * 以 skip / limit 分页下载，直到某页不足 chunkSize
     * <p>
     * 页的范围只有成功返回后才知道，所以第一次失败即停止下载并抛出。
     * </p>
     */
    public static <T> List<T> download(Filter filter, int chunkSize, Function<Filter, List<T>> fetch) {
        Filter base = filter == null ? Filter.all() : filter;
        if (chunkSize <= 0) {
            return fetch.apply(base);
        }
        List<T> all = new ArrayList<>();
        int skip = 0;
        while (true) {
            List<T> page = fetch.apply(base.toBuilder().skip(skip).limit(chunkSize).build());
            all.addAll(page);
            log.debug("downloaded chunk skip={} size={}", skip, page.size());
            if (page.size() < chunkSize) {
                return all;
            }
            skip += chunkSize;
        }
    }

    /**
     * 逐块处理，所有块都会被尝试
     */
    public static <T, R> ChunkAccumulator<R> upload(List<T> items, int chunkSize, Function<List<T>, R> process) {
        ChunkAccumulator<R> accumulator = new ChunkAccumulator<>();
        List<List<T>> chunks = split(items, chunkSize);
        for (int i = 0; i < chunks.size(); i++) {
            try {
                accumulator.add(process.apply(chunks.get(i)));
            } catch (RuntimeException e) {
                accumulator.fail(i, e);
            }
        }
        return accumulator;
    }

    /**
     * 切分为若干块；空列表得到一个空块，保证处理函数至少被调用一次
     */
    public static <T> List<List<T>> split(List<T> items, int chunkSize) {
        List<List<T>> chunks = new ArrayList<>();
        if (chunkSize <= 0 || items.size() <= chunkSize) {
            chunks.add(items);
            return chunks;
        }
        for (int from = 0; from < items.size(); from += chunkSize) {
            chunks.add(items.subList(from, Math.min(from + chunkSize, items.size())));
        }
        return chunks;
    }
}
