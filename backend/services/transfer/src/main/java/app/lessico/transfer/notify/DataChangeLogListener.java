package app.lessico.transfer.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class DataChangeLogListener {

    private static final Logger log = LoggerFactory.getLogger(DataChangeLogListener.class);

    @EventListener
    public void onDataChanged(TenantDataChangedEvent event) {
        log.info("Tenant data changed: tenantId={}, scope={}, at={}", event.tenantId(), event.scope(), event.occurredAt());
    }
}
