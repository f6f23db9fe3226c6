package io.twingraph.events.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.twingraph.events.model.DomainEvent;

/**
 * CloudEvents JSON event format (structured content mode).
 */
public final class CloudEventJson {

    public static final String STRUCTURED_CONTENT_TYPE = "application/cloudevents+json";

    private CloudEventJson() {
    }

    public static ObjectNode toStructured(ObjectMapper objectMapper, DomainEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("specversion", DomainEvent.SPEC_VERSION);
        node.put("id", event.id());
        node.put("source", event.source());
        node.put("type", event.type());
        if (event.subject() != null) {
            node.put("subject", event.subject());
        }
        if (event.time() != null) {
            node.put("time", event.time().toString());
        }
        node.put("datacontenttype", event.dataContentType());
        if (event.dataSchema() != null) {
            node.put("dataschema", event.dataSchema());
        }
        if (event.data() != null) {
            node.set("data", event.data());
        }
        return node;
    }

    public static byte[] toStructuredBytes(ObjectMapper objectMapper, DomainEvent event) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(toStructured(objectMapper, event));
    }
}
