package org.dxworks.probconv.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.probconv.exception.RenderException;
import org.dxworks.probconv.model.InternalNode;
import org.dxworks.probconv.model.Node;
import org.dxworks.probconv.model.Problem;

import java.util.Map;

/**
 * Dumps a canonical tree as JSON: {@code {"type": ..., <attributes>, "children": [...]}} per
 * node, with {@code children} present on internal nodes only.
 */
public class TreeJsonWriter implements ProblemRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String render(Problem problem) {
        try {
            return MAPPER.writeValueAsString(toJson(problem));
        } catch (JsonProcessingException e) {
            throw new RenderException("Failed to serialize tree: " + e.getMessage(), e);
        }
    }

    private static ObjectNode toJson(Node node) {
        if (node.getType().isTransient()) {
            throw new RenderException("Cannot render transient node " + node.getType().getDisplayName()
                    + "; reconstruct paragraphs before rendering");
        }
        ObjectNode json = MAPPER.createObjectNode();
        json.put("type", node.getType().getName());
        for (Map.Entry<String, Object> attribute : node.attributes().entrySet()) {
            Object value = attribute.getValue();
            if (value instanceof Boolean flag) {
                json.put(attribute.getKey(), flag);
            } else {
                json.put(attribute.getKey(), String.valueOf(value));
            }
        }
        if (node instanceof InternalNode internal) {
            ArrayNode children = json.putArray("children");
            for (Node child : internal.getChildren()) {
                children.add(toJson(child));
            }
        }
        return json;
    }
}
