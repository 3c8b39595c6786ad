package app.lessico.transfer.codec;

import app.lessico.transfer.domain.TransferScope;
import app.lessico.transfer.model.DerivedIds;
import app.lessico.transfer.model.OwnerFields;
import app.lessico.transfer.model.TestSessionRecord;
import app.lessico.transfer.model.VocabularyRecord;
import app.lessico.transfer.reconcile.ScopeMismatchPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts between the portable bundle format of each {@link TransferScope} and the internal
 * record list. Decoding accepts every historical bundle shape:
 * <ul>
 *     <li>a bare array of records;</li>
 *     <li>an object keyed by the scope's bundle key, holding an array, an object map of
 *     records, or (statistics) a single record;</li>
 *     <li>an unkeyed single statistics object;</li>
 *     <li>a one-element array wrapping a keyed object.</li>
 * </ul>
 */
@Component
public class ScopedBundleCodec {

    static final String EXPORT_DATE_FIELD = "exportDate";
    static final String EXPORT_TYPE_FIELD = "exportType";

    private final ObjectMapper objectMapper;

    public ScopedBundleCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Bundle encode(TransferScope scope, List<ObjectNode> records) {
        List<ObjectNode> stripped = new ArrayList<>(records.size());
        for (ObjectNode record : records) {
            ObjectNode copy = record.deepCopy();
            OwnerFields.strip(copy);
            stripped.add(copy);
        }
        return new Bundle(scope, stripped, Instant.now());
    }

    public byte[] toBytes(Bundle bundle) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode records = root.putArray(bundle.scope().bundleKey());
        bundle.records().forEach(records::add);
        root.put(EXPORT_DATE_FIELD, bundle.exportDate().toString());
        root.put(EXPORT_TYPE_FIELD, bundle.scope().exportType());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + bundle.scope() + " bundle", ex);
        }
    }

    public DecodedBundle decode(byte[] bytes, TransferScope scope, ScopeMismatchPolicy policy) {
        JsonNode root = parse(bytes);

        String declaredType = null;
        String exportDate = null;
        if (root.isObject()) {
            declaredType = VocabularyRecord.text(root, EXPORT_TYPE_FIELD);
            exportDate = VocabularyRecord.text(root, EXPORT_DATE_FIELD);
        }
        if (declaredType != null && !declaredType.equals(scope.exportType()) && policy == ScopeMismatchPolicy.reject) {
            throw new ScopeMismatchException(scope, declaredType);
        }

        List<JsonNode> entries = normalize(root, scope);
        List<VocabularyRecord> records = new ArrayList<>(entries.size());
        int discarded = 0;
        for (JsonNode entry : entries) {
            if (!entry.isObject()) {
                discarded++;
                continue;
            }
            ObjectNode body = ((ObjectNode) entry).deepCopy();
            ensureId(scope, body);
            records.add(VocabularyRecord.of(scope, body));
        }
        return new DecodedBundle(scope, records, declaredType, exportDate, discarded);
    }

    private JsonNode parse(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new MalformedBundleException("Bundle is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(bytes);
        } catch (IOException ex) {
            throw new MalformedBundleException("Bundle is not valid JSON", ex);
        }
        if (root == null || !(root.isObject() || root.isArray())) {
            throw new MalformedBundleException("Bundle must be a JSON object or array");
        }
        return root;
    }

    private List<JsonNode> normalize(JsonNode root, TransferScope scope) {
        if (root.isArray()) {
            if (root.size() == 1 && root.get(0).isObject() && root.get(0).has(scope.bundleKey())) {
                return normalize(root.get(0), scope);
            }
            return elements(root);
        }

        JsonNode keyed = root.get(scope.bundleKey());
        if (keyed == null || keyed.isNull()) {
            // unkeyed object: only a lone statistics document is meaningful here
            return scope == TransferScope.statistics && looksLikeRecord(root) ? List.of(root) : List.of();
        }
        if (keyed.isArray()) {
            return elements(keyed);
        }
        if (keyed.isObject()) {
            if (scope == TransferScope.statistics) {
                return List.of(keyed);
            }
            return elements(keyed);
        }
        return List.of();
    }

    private boolean looksLikeRecord(JsonNode root) {
        return !(root.size() <= 2 && root.has(EXPORT_TYPE_FIELD));
    }

    private List<JsonNode> elements(JsonNode container) {
        List<JsonNode> out = new ArrayList<>(container.size());
        container.forEach(out::add);
        return out;
    }

    private void ensureId(TransferScope scope, ObjectNode body) {
        if (VocabularyRecord.text(body, "id") != null) {
            return;
        }
        switch (scope) {
            case performance -> {
                // identity comes from the matching word at import time
            }
            case words -> {
                String derived = DerivedIds.forWord(VocabularyRecord.text(body, "english"));
                if (derived != null) {
                    body.put("id", derived);
                }
            }
            case history -> {
                String sessionId = VocabularyRecord.text(body, TestSessionRecord.SESSION_ID_FIELD);
                body.put("id", sessionId != null ? sessionId : DerivedIds.forBody(scope.collection(), body));
            }
            case statistics -> body.put("id", DerivedIds.forBody(scope.collection(), body));
        }
    }
}
