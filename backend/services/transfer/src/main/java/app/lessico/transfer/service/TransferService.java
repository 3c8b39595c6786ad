package app.lessico.transfer.service;

import app.lessico.transfer.codec.Bundle;
import app.lessico.transfer.codec.DecodedBundle;
import app.lessico.transfer.codec.MalformedBundleException;
import app.lessico.transfer.codec.ScopeMismatchException;
import app.lessico.transfer.codec.ScopedBundleCodec;
import app.lessico.transfer.domain.TransferScope;
import app.lessico.transfer.notify.DataChangeNotifier;
import app.lessico.transfer.reconcile.BatchCommitter;
import app.lessico.transfer.reconcile.BatchResult;
import app.lessico.transfer.reconcile.ScopeMismatchPolicy;
import app.lessico.transfer.store.DocumentQuery;
import app.lessico.transfer.store.DocumentStore;
import app.lessico.transfer.store.StoredDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Import and export of one scope for one tenant. Knows nothing about HTTP or the job log.
 */
@Service
public class TransferService {

    private static final Logger log = LoggerFactory.getLogger(TransferService.class);

    private final ScopedBundleCodec codec;
    private final BatchCommitter committer;
    private final DocumentStore store;
    private final DataChangeNotifier notifier;
    private final ObjectMapper objectMapper;

    public TransferService(ScopedBundleCodec codec,
                           BatchCommitter committer,
                           DocumentStore store,
                           DataChangeNotifier notifier,
                           ObjectMapper objectMapper) {
        this.codec = codec;
        this.committer = committer;
        this.store = store;
        this.notifier = notifier;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws MalformedBundleException when the bundle cannot be parsed; nothing is written
     * @throws ScopeMismatchException   when the bundle declares another scope and the policy is
     *                                  {@link ScopeMismatchPolicy#reject}
     */
    public BatchResult importBundle(TransferScope scope, byte[] bundle, String tenantId, ScopeMismatchPolicy policy) {
        DecodedBundle decoded = codec.decode(bundle, scope, policy);

        List<String> warnings = new ArrayList<>();
        if (decoded.scopeMismatch()) {
            log.warn("Importing bundle with mismatched scope: requested={}, declared={}, tenantId={}",
                    scope.exportType(), decoded.declaredExportType(), tenantId);
            warnings.add("Bundle declares " + decoded.declaredExportType() + " but was imported as " + scope.exportType());
        }
        if (decoded.discarded() > 0) {
            warnings.add(decoded.discarded() + " bundle entries were not records and were ignored");
        }

        BatchResult result = committer.commit(scope, decoded.records(), tenantId, warnings);
        if (result.committed() > 0) {
            notifier.dataChanged(tenantId, scope);
        }
        return result;
    }

    public ExportedBundle exportBundle(TransferScope scope, String tenantId) {
        List<StoredDocument> documents = store.query(scope.collection(), DocumentQuery.activeOwnedBy(tenantId));
        List<ObjectNode> records = new ArrayList<>(documents.size());
        for (StoredDocument document : documents) {
            records.add(withDocumentId(document));
        }

        Bundle bundle = codec.encode(scope, records);
        byte[] content = codec.toBytes(bundle);
        String fileName = scope.filePrefix() + "_" + LocalDate.ofInstant(bundle.exportDate(), ZoneOffset.UTC) + ".json";
        log.info("Exported bundle: scope={}, tenantId={}, records={}, bytes={}", scope, tenantId, records.size(), content.length);
        return new ExportedBundle(scope, fileName, records.size(), content);
    }

    private ObjectNode withDocumentId(StoredDocument document) {
        ObjectNode record = objectMapper.createObjectNode();
        record.put("id", document.id());
        document.body().properties().forEach(field -> {
            if (!"id".equals(field.getKey())) {
                record.set(field.getKey(), field.getValue());
            }
        });
        return record;
    }
}
