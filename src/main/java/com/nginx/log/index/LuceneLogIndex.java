package com.nginx.log.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexWriterConfig.OpenMode;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.CollectorManager;
import org.apache.lucene.search.FieldDoc;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.TopFieldCollector;
import org.apache.lucene.search.TopFieldDocs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.BytesRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;

/**
 * {@link LogIndex} over a single Lucene directory. Writes go through one
 * {@link IndexWriter}; each batch is committed and the searcher refreshed before
 * {@link IndexBatch#execute()} returns.
 */
public class LuceneLogIndex implements LogIndex {

    static final Logger logger = LoggerFactory.getLogger(LuceneLogIndex.class);

    private final Directory directory;
    private final String name;
    private final Analyzer analyzer = new StandardAnalyzer();

    // guards swapping writer and searcher manager on reset/close
    private final ReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private final Object writeLock = new Object();
    private IndexWriter writer;
    private SearcherManager searcherManager;
    private boolean closed;

    LuceneLogIndex(Directory directory, String name) throws IOException {
        this.directory = directory;
        this.name = name;
        open(OpenMode.CREATE_OR_APPEND);
    }

    public static LuceneLogIndex open(Path path) throws IOException {
        Files.createDirectories(path);
        logger.info("Opening log index at {}", path);
        return new LuceneLogIndex(FSDirectory.open(path), path.toString());
    }

    @VisibleForTesting
    public static LuceneLogIndex inMemory() throws IOException {
        return new LuceneLogIndex(new ByteBuffersDirectory(), "memory");
    }

    private void open(OpenMode mode) throws IOException {
        IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(mode);
        config.setRAMBufferSizeMB(64);
        writer = new IndexWriter(directory, config);
        searcherManager = new SearcherManager(writer, null);
    }

    public Analyzer getAnalyzer() {
        return analyzer;
    }

    @Override
    public IndexBatch newBatch() {
        return new LuceneBatch();
    }

    @Override
    public IndexSearchResult search(IndexSearchRequest request) throws IOException {
        Stopwatch stopwatch = Stopwatch.createStarted();
        lifecycle.readLock().lock();
        try {
            ensureOpen();
            IndexSearcher searcher = searcherManager.acquire();
            try {
                if (request.getSize() <= 0) {
                    long total = searcher.count(request.getQuery());
                    return new IndexSearchResult(total, List.of(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
                }

                int maxDoc = Math.max(1, searcher.getIndexReader().maxDoc());
                long wanted = (long) request.getFrom() + request.getSize();
                int numHits = (int) Math.min(wanted, maxDoc);
                Sort sort = new Sort(IndexFields.sortField(request.getSortField(), request.isDescending()));
                CollectorManager<TopFieldCollector, TopFieldDocs> manager =
                        TopFieldCollector.createSharedManager(sort, numHits, null, Integer.MAX_VALUE);
                TopFieldDocs topDocs = searcher.search(request.getQuery(), manager);

                ScoreDoc[] scoreDocs = topDocs.scoreDocs;
                List<IndexHit> hits = new ArrayList<>(Math.max(0, scoreDocs.length - request.getFrom()));
                StoredFields storedFields = searcher.storedFields();
                Set<String> fields = withId(request.getFields());
                for (int i = request.getFrom(); i < scoreDocs.length; i++) {
                    hits.add(toHit(storedFields, scoreDocs[i], fields));
                }
                return new IndexSearchResult(topDocs.totalHits.value, hits, stopwatch.elapsed(TimeUnit.MILLISECONDS));
            } finally {
                searcherManager.release(searcher);
            }
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    @Override
    public long count(Query query) throws IOException {
        lifecycle.readLock().lock();
        try {
            ensureOpen();
            IndexSearcher searcher = searcherManager.acquire();
            try {
                return searcher.count(query);
            } finally {
                searcherManager.release(searcher);
            }
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    @Override
    public long docCount() throws IOException {
        lifecycle.readLock().lock();
        try {
            ensureOpen();
            IndexSearcher searcher = searcherManager.acquire();
            try {
                return searcher.getIndexReader().numDocs();
            } finally {
                searcherManager.release(searcher);
            }
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    @Override
    public void scan(Query query, Set<String> fields, int pageSize, Consumer<IndexHit> consumer) throws IOException {
        lifecycle.readLock().lock();
        try {
            ensureOpen();
            IndexSearcher searcher = searcherManager.acquire();
            try {
                Set<String> wanted = withId(fields);
                StoredFields storedFields = searcher.storedFields();
                ScoreDoc after = null;
                while (true) {
                    TopFieldDocs page = searcher.searchAfter(after, query, pageSize, Sort.INDEXORDER, false);
                    if (page.scoreDocs.length == 0) {
                        break;
                    }
                    for (ScoreDoc scoreDoc : page.scoreDocs) {
                        consumer.accept(toHit(storedFields, scoreDoc, wanted));
                    }
                    if (page.scoreDocs.length < pageSize) {
                        break;
                    }
                    after = page.scoreDocs[page.scoreDocs.length - 1];
                }
            } finally {
                searcherManager.release(searcher);
            }
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    @Override
    public void reset() throws IOException {
        lifecycle.writeLock().lock();
        try {
            ensureOpen();
            closeResources();
            open(OpenMode.CREATE);
            writer.commit();
            searcherManager.maybeRefreshBlocking();
            logger.info("Log index {} reset", name);
        } finally {
            lifecycle.writeLock().unlock();
        }
    }

    @Override
    public void close() throws IOException {
        lifecycle.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            closeResources();
            directory.close();
            logger.info("Closed log index {}", name);
        } finally {
            lifecycle.writeLock().unlock();
        }
    }

    private void closeResources() throws IOException {
        try {
            searcherManager.close();
        } finally {
            writer.close();
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Log index " + name + " is closed");
        }
    }

    private static Set<String> withId(Set<String> fields) {
        if (fields == null) {
            return null;
        }
        Set<String> copy = new HashSet<>(fields);
        copy.add(IndexFields.ID);
        return copy;
    }

    private static IndexHit toHit(StoredFields storedFields, ScoreDoc scoreDoc, Set<String> fields) throws IOException {
        Document doc = fields == null ? storedFields.document(scoreDoc.doc) : storedFields.document(scoreDoc.doc, fields);
        Map<String, Object> values = IndexFields.storedValues(doc);
        Object[] sortValues = null;
        if (scoreDoc instanceof FieldDoc) {
            Object[] raw = ((FieldDoc) scoreDoc).fields;
            sortValues = new Object[raw.length];
            for (int i = 0; i < raw.length; i++) {
                sortValues[i] = raw[i] instanceof BytesRef ? ((BytesRef) raw[i]).utf8ToString() : raw[i];
            }
        }
        return new IndexHit(doc.get(IndexFields.ID), values, sortValues);
    }

    private class LuceneBatch implements IndexBatch {

        private final List<Object> operations = new ArrayList<>();

        @Override
        public void index(LogDocument document) {
            operations.add(document);
        }

        @Override
        public void delete(String id) {
            operations.add(id);
        }

        @Override
        public int size() {
            return operations.size();
        }

        @Override
        public void execute() throws IOException {
            if (operations.isEmpty()) {
                return;
            }
            lifecycle.readLock().lock();
            try {
                ensureOpen();
                synchronized (writeLock) {
                    for (Object operation : operations) {
                        if (operation instanceof LogDocument) {
                            LogDocument document = (LogDocument) operation;
                            writer.updateDocument(new Term(IndexFields.ID, document.getId()), IndexFields.toDocument(document));
                        } else {
                            writer.deleteDocuments(new Term(IndexFields.ID, (String) operation));
                        }
                    }
                    writer.commit();
                }
                searcherManager.maybeRefreshBlocking();
                logger.debug("Committed {} operations to {}", operations.size(), name);
                operations.clear();
            } finally {
                lifecycle.readLock().unlock();
            }
        }
    }
}
