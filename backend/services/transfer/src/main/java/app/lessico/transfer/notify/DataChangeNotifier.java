package app.lessico.transfer.notify;

import app.lessico.transfer.domain.TransferScope;

/**
 * Tells whoever renders a tenant's data that it should reload. Carries no payload beyond the
 * tenant and the scope that changed.
 */
public interface DataChangeNotifier {

    void dataChanged(String tenantId, TransferScope scope);
}
