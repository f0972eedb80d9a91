package com.nginx.log.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.DoubleDocValuesField;
import org.apache.lucene.document.DoublePoint;
import org.apache.lucene.document.Field.Store;
import org.apache.lucene.document.IntPoint;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.search.SortField;
import org.apache.lucene.util.BytesRef;

import com.nginx.log.parser.model.AccessLogEntry;

/**
 * Field names and the mapping between {@link LogDocument} and Lucene documents.
 * <ul>
 * <li>keyword fields (whole value is one term): ids, paths, ip, method, UA and geo classes</li>
 * <li>analyzed text: raw, user_agent, referer</li>
 * <li>points plus doc values: timestamp, status, bytes_sent, request_time</li>
 * </ul>
 */
public final class IndexFields {

    public static final String ID = "id";
    public static final String TIMESTAMP = "timestamp";
    public static final String IP = "ip";
    public static final String REGION_CODE = "region_code";
    public static final String PROVINCE = "province";
    public static final String CITY = "city";
    public static final String METHOD = "method";
    public static final String PATH = "path";
    public static final String PROTOCOL = "protocol";
    public static final String STATUS = "status";
    public static final String BYTES_SENT = "bytes_sent";
    public static final String REFERER = "referer";
    public static final String USER_AGENT = "user_agent";
    public static final String BROWSER = "browser";
    public static final String BROWSER_VERSION = "browser_version";
    public static final String OS = "os";
    public static final String OS_VERSION = "os_version";
    public static final String DEVICE_TYPE = "device_type";
    public static final String REQUEST_TIME = "request_time";
    public static final String UPSTREAM_TIME = "upstream_time";
    public static final String RAW = "raw";
    public static final String FILE_PATH = "file_path";
    public static final String MAIN_LOG_PATH = "main_log_path";
    public static final String SOURCE_FILE = "source_file";

    /** Sortable fields and how their doc values are read. */
    private static final Map<String, SortField.Type> SORT_TYPES;

    static {
        Map<String, SortField.Type> types = new LinkedHashMap<>();
        types.put(TIMESTAMP, SortField.Type.LONG);
        types.put(STATUS, SortField.Type.LONG);
        types.put(BYTES_SENT, SortField.Type.LONG);
        types.put(REQUEST_TIME, SortField.Type.DOUBLE);
        types.put(IP, SortField.Type.STRING);
        types.put(METHOD, SortField.Type.STRING);
        types.put(PATH, SortField.Type.STRING);
        types.put(BROWSER, SortField.Type.STRING);
        types.put(OS, SortField.Type.STRING);
        types.put(DEVICE_TYPE, SortField.Type.STRING);
        SORT_TYPES = Collections.unmodifiableMap(types);
    }

    private IndexFields() {
    }

    public static boolean isSortable(String field) {
        return SORT_TYPES.containsKey(field);
    }

    public static Set<String> sortableFields() {
        return SORT_TYPES.keySet();
    }

    /**
     * Unknown fields sort by timestamp.
     */
    public static SortField sortField(String field, boolean descending) {
        SortField.Type type = SORT_TYPES.get(field);
        if (type == null) {
            return new SortField(TIMESTAMP, SortField.Type.LONG, descending);
        }
        SortField sortField = new SortField(field, type, descending);
        if (type == SortField.Type.STRING) {
            sortField.setMissingValue(descending ? SortField.STRING_FIRST : SortField.STRING_LAST);
        }
        return sortField;
    }

    public static Document toDocument(LogDocument logDocument) {
        AccessLogEntry entry = logDocument.getEntry();
        Document doc = new Document();

        doc.add(new StringField(ID, logDocument.getId(), Store.YES));
        doc.add(new StringField(FILE_PATH, logDocument.getFilePath(), Store.YES));
        doc.add(new StringField(MAIN_LOG_PATH, logDocument.getMainLogPath(), Store.YES));
        doc.add(new StringField(SOURCE_FILE, logDocument.getSourceFile(), Store.YES));

        addLong(doc, TIMESTAMP, entry.getTimestamp());
        addLong(doc, BYTES_SENT, entry.getBytesSent());
        doc.add(new IntPoint(STATUS, entry.getStatus()));
        doc.add(new NumericDocValuesField(STATUS, entry.getStatus()));
        doc.add(new StoredField(STATUS, entry.getStatus()));

        doc.add(new DoublePoint(REQUEST_TIME, entry.getRequestTime()));
        doc.add(new DoubleDocValuesField(REQUEST_TIME, entry.getRequestTime()));
        doc.add(new StoredField(REQUEST_TIME, entry.getRequestTime()));
        if (entry.getUpstreamTime() != null) {
            doc.add(new DoublePoint(UPSTREAM_TIME, entry.getUpstreamTime()));
            doc.add(new StoredField(UPSTREAM_TIME, entry.getUpstreamTime()));
        }

        addSortableKeyword(doc, IP, entry.getIp());
        addSortableKeyword(doc, METHOD, entry.getMethod());
        addSortableKeyword(doc, PATH, entry.getPath());
        addSortableKeyword(doc, BROWSER, entry.getBrowser());
        addSortableKeyword(doc, OS, entry.getOs());
        addSortableKeyword(doc, DEVICE_TYPE, entry.getDeviceType());
        addKeyword(doc, REGION_CODE, entry.getRegionCode());
        addKeyword(doc, PROVINCE, entry.getProvince());
        addKeyword(doc, CITY, entry.getCity());
        addKeyword(doc, BROWSER_VERSION, entry.getBrowserVersion());
        addKeyword(doc, OS_VERSION, entry.getOsVersion());
        addKeyword(doc, PROTOCOL, entry.getProtocol());

        doc.add(new TextField(REFERER, nullToEmpty(entry.getReferer()), Store.YES));
        doc.add(new TextField(USER_AGENT, nullToEmpty(entry.getUserAgent()), Store.YES));
        doc.add(new TextField(RAW, nullToEmpty(entry.getRaw()), Store.YES));
        return doc;
    }

    public static Map<String, Object> storedValues(Document doc) {
        Map<String, Object> values = new LinkedHashMap<>();
        doc.forEach(field -> {
            Number number = field.numericValue();
            values.putIfAbsent(field.name(), number != null ? number : field.stringValue());
        });
        return values;
    }

    /**
     * Rebuilds a record from stored values; absent fields keep their defaults.
     */
    public static AccessLogEntry toEntry(Map<String, Object> values) {
        AccessLogEntry entry = new AccessLogEntry();
        Number number;
        if ((number = number(values, TIMESTAMP)) != null) {
            entry.setTimestamp(number.longValue());
        }
        if ((number = number(values, STATUS)) != null) {
            entry.setStatus(number.intValue());
        }
        if ((number = number(values, BYTES_SENT)) != null) {
            entry.setBytesSent(number.longValue());
        }
        if ((number = number(values, REQUEST_TIME)) != null) {
            entry.setRequestTime(number.doubleValue());
        }
        if ((number = number(values, UPSTREAM_TIME)) != null) {
            entry.setUpstreamTime(number.doubleValue());
        }

        String value;
        if ((value = string(values, IP)) != null) entry.setIp(value);
        if ((value = string(values, REGION_CODE)) != null) entry.setRegionCode(value);
        if ((value = string(values, PROVINCE)) != null) entry.setProvince(value);
        if ((value = string(values, CITY)) != null) entry.setCity(value);
        if ((value = string(values, METHOD)) != null) entry.setMethod(value);
        if ((value = string(values, PATH)) != null) entry.setPath(value);
        if ((value = string(values, PROTOCOL)) != null) entry.setProtocol(value);
        if ((value = string(values, REFERER)) != null) entry.setReferer(value);
        if ((value = string(values, USER_AGENT)) != null) entry.setUserAgent(value);
        if ((value = string(values, BROWSER)) != null) entry.setBrowser(value);
        if ((value = string(values, BROWSER_VERSION)) != null) entry.setBrowserVersion(value);
        if ((value = string(values, OS)) != null) entry.setOs(value);
        if ((value = string(values, OS_VERSION)) != null) entry.setOsVersion(value);
        if ((value = string(values, DEVICE_TYPE)) != null) entry.setDeviceType(value);
        if ((value = string(values, RAW)) != null) entry.setRaw(value);
        return entry;
    }

    private static Number number(Map<String, Object> values, String field) {
        Object value = values.get(field);
        return value instanceof Number ? (Number) value : null;
    }

    private static String string(Map<String, Object> values, String field) {
        Object value = values.get(field);
        return value instanceof String ? (String) value : null;
    }

    private static void addLong(Document doc, String name, long value) {
        doc.add(new LongPoint(name, value));
        doc.add(new NumericDocValuesField(name, value));
        doc.add(new StoredField(name, value));
    }

    private static void addKeyword(Document doc, String name, String value) {
        doc.add(new StringField(name, nullToEmpty(value), Store.YES));
    }

    private static void addSortableKeyword(Document doc, String name, String value) {
        String v = nullToEmpty(value);
        doc.add(new StringField(name, v, Store.YES));
        doc.add(new SortedDocValuesField(name, new BytesRef(v)));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
