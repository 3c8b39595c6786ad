package app.lessico.transfer.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tree operations on every {@code userId} field of a JSON document, at any depth. Both
 * operations mutate the node they are given; callers pass a copy.
 */
public final class OwnerFields {

    private OwnerFields() {
    }

    public static int overwrite(JsonNode node, String tenantId) {
        if (node == null) {
            return 0;
        }
        int touched = 0;
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<Map.Entry<String, JsonNode>> fields = new ArrayList<>(object.properties());
            for (Map.Entry<String, JsonNode> field : fields) {
                if (VocabularyRecord.OWNER_FIELD.equals(field.getKey())) {
                    object.put(VocabularyRecord.OWNER_FIELD, tenantId);
                    touched++;
                } else {
                    touched += overwrite(field.getValue(), tenantId);
                }
            }
        } else if (node.isArray()) {
            for (JsonNode item : (ArrayNode) node) {
                touched += overwrite(item, tenantId);
            }
        }
        return touched;
    }

    public static void strip(JsonNode node) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            object.remove(VocabularyRecord.OWNER_FIELD);
            for (JsonNode child : object) {
                strip(child);
            }
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                strip(item);
            }
        }
    }

    /**
     * Values of every owner field in the tree, in document order.
     */
    public static List<String> collect(JsonNode node) {
        List<String> owners = new ArrayList<>();
        collect(node, owners);
        return owners;
    }

    private static void collect(JsonNode node, List<String> owners) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            node.properties().forEach(field -> {
                if (VocabularyRecord.OWNER_FIELD.equals(field.getKey())) {
                    owners.add(field.getValue().asText(null));
                } else {
                    collect(field.getValue(), owners);
                }
            });
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                collect(item, owners);
            }
        }
    }
}
