package com.nginx.log.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An event on the bus: a topic plus a payload that serializes to JSON.
 */
public class LogIndexEvent {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final EventType type;
    private final Object data;
    private final long timestamp;

    public LogIndexEvent(EventType type, Object data) {
        this.type = type;
        this.data = data;
        this.timestamp = System.currentTimeMillis();
    }

    public EventType getType() {
        return type;
    }

    public String getTopic() {
        return type.getTopic();
    }

    public Object getData() {
        return data;
    }

    @SuppressWarnings("unchecked")
    public <T> T getData(Class<T> dataClass) {
        if (dataClass.isInstance(data)) {
            return (T) data;
        }
        throw new IllegalStateException("Event " + type + " carries " +
                (data == null ? "null" : data.getClass().getSimpleName()) + ", not " + dataClass.getSimpleName());
    }

    public long getTimestamp() {
        return timestamp;
    }

    public ObjectNode toJsonNode() {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", type.getTopic());
        node.put("timestamp", timestamp);
        node.set("data", objectMapper.valueToTree(data));
        return node;
    }

    public String toJson() throws JsonProcessingException {
        return objectMapper.writeValueAsString(toJsonNode());
    }

    @Override
    public String toString() {
        return "LogIndexEvent [type=" + type + ", data=" + data + "]";
    }
}
