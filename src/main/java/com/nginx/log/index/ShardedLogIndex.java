package com.nginx.log.index;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.apache.lucene.search.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Partitions documents over N shards by a hash of their id and fans searches out in
 * parallel. Each shard is asked for its top {@code from + size} hits; the merged list
 * is re-sorted and paginated.
 */
public class ShardedLogIndex implements LogIndex {

    static final Logger logger = LoggerFactory.getLogger(ShardedLogIndex.class);

    private static final HashFunction SHARD_HASH = Hashing.murmur3_32_fixed();

    private final List<LogIndex> shards;
    private final ExecutorService executor;

    public ShardedLogIndex(List<LogIndex> shards) {
        if (shards.isEmpty()) {
            throw new IllegalArgumentException("at least one shard is required");
        }
        this.shards = List.copyOf(shards);
        this.executor = Executors.newFixedThreadPool(shards.size(),
                new ThreadFactoryBuilder().setNameFormat("index-shard-search-%d").setDaemon(true).build());
    }

    /**
     * Opens {@code shardCount} Lucene indexes under {@code root/shard-N}.
     */
    public static ShardedLogIndex open(Path root, int shardCount) throws IOException {
        List<LogIndex> shards = new ArrayList<>(shardCount);
        try {
            for (int i = 0; i < shardCount; i++) {
                shards.add(LuceneLogIndex.open(root.resolve("shard-" + i)));
            }
        } catch (IOException e) {
            for (LogIndex shard : shards) {
                try {
                    shard.close();
                } catch (IOException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            throw e;
        }
        return new ShardedLogIndex(shards);
    }

    public int getShardCount() {
        return shards.size();
    }

    int shardFor(String id) {
        return Math.floorMod(SHARD_HASH.hashString(id, StandardCharsets.UTF_8).asInt(), shards.size());
    }

    @Override
    public IndexBatch newBatch() {
        return new ShardedBatch();
    }

    @Override
    public IndexSearchResult search(IndexSearchRequest request) throws IOException {
        Stopwatch stopwatch = Stopwatch.createStarted();
        int perShardSize = request.getSize() <= 0 ? 0 : (int) Math.min(Integer.MAX_VALUE, (long) request.getFrom() + request.getSize());

        List<IndexSearchResult> results = fanOut(shard -> shard.search(new IndexSearchRequest(request.getQuery(), perShardSize, 0)
                .setSort(request.getSortField(), request.isDescending())
                .setFields(request.getFields())));

        long total = 0;
        List<IndexHit> merged = new ArrayList<>();
        for (IndexSearchResult result : results) {
            total += result.getTotal();
            merged.addAll(result.getHits());
        }
        merged.sort(hitComparator(request.isDescending()));

        int from = Math.min(request.getFrom(), merged.size());
        int to = (int) Math.min(merged.size(), (long) from + Math.max(0, request.getSize()));
        List<IndexHit> page = new ArrayList<>(merged.subList(from, to));
        return new IndexSearchResult(total, page, stopwatch.elapsed(TimeUnit.MILLISECONDS));
    }

    @Override
    public long count(Query query) throws IOException {
        long total = 0;
        for (Long count : fanOut(shard -> shard.count(query))) {
            total += count;
        }
        return total;
    }

    @Override
    public long docCount() throws IOException {
        long total = 0;
        for (LogIndex shard : shards) {
            total += shard.docCount();
        }
        return total;
    }

    @Override
    public void scan(Query query, Set<String> fields, int pageSize, Consumer<IndexHit> consumer) throws IOException {
        for (LogIndex shard : shards) {
            shard.scan(query, fields, pageSize, consumer);
        }
    }

    @Override
    public void reset() throws IOException {
        for (LogIndex shard : shards) {
            shard.reset();
        }
    }

    @Override
    public void close() throws IOException {
        executor.shutdown();
        IOException failure = null;
        for (LogIndex shard : shards) {
            try {
                shard.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @FunctionalInterface
    private interface ShardCall<T> {
        T call(LogIndex shard) throws IOException;
    }

    private <T> List<T> fanOut(ShardCall<T> call) throws IOException {
        if (shards.size() == 1) {
            return List.of(call.call(shards.get(0)));
        }
        List<Future<T>> futures = new ArrayList<>(shards.size());
        for (LogIndex shard : shards) {
            Callable<T> task = () -> call.call(shard);
            futures.add(executor.submit(task));
        }
        List<T> results = new ArrayList<>(futures.size());
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted waiting for shard search", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof IOException) {
                    throw (IOException) cause;
                }
                throw new IOException("Shard search failed", cause);
            }
        }
        return results;
    }

    /**
     * Orders by the first sort value, nulls last.
     */
    static Comparator<IndexHit> hitComparator(boolean descending) {
        Comparator<IndexHit> comparator = (a, b) -> {
            Object va = firstSortValue(a);
            Object vb = firstSortValue(b);
            if (va == null && vb == null) {
                return 0;
            }
            if (va == null) {
                return descending ? -1 : 1;
            }
            if (vb == null) {
                return descending ? 1 : -1;
            }
            return compareSortValues(va, vb);
        };
        return descending ? comparator.reversed() : comparator;
    }

    static int compareSortValues(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            if (a instanceof Double || b instanceof Double || a instanceof Float || b instanceof Float) {
                return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
            }
            return Long.compare(((Number) a).longValue(), ((Number) b).longValue());
        }
        return a.toString().compareTo(b.toString());
    }

    private static Object firstSortValue(IndexHit hit) {
        Object[] values = hit.getSortValues();
        return values == null || values.length == 0 ? null : values[0];
    }

    private class ShardedBatch implements IndexBatch {

        private final List<IndexBatch> batches = new ArrayList<>(shards.size());
        private int size;

        ShardedBatch() {
            for (LogIndex shard : shards) {
                batches.add(shard.newBatch());
            }
        }

        @Override
        public void index(LogDocument document) {
            batches.get(shardFor(document.getId())).index(document);
            size++;
        }

        @Override
        public void delete(String id) {
            batches.get(shardFor(id)).delete(id);
            size++;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public void execute() throws IOException {
            for (IndexBatch batch : batches) {
                if (batch.size() > 0) {
                    batch.execute();
                }
            }
            size = 0;
        }
    }
}
