package app.lessico.transfer.notify;

import app.lessico.transfer.domain.TransferScope;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class ApplicationEventDataChangeNotifier implements DataChangeNotifier {

    private final ApplicationEventPublisher publisher;

    public ApplicationEventDataChangeNotifier(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void dataChanged(String tenantId, TransferScope scope) {
        publisher.publishEvent(new TenantDataChangedEvent(tenantId, scope, Instant.now()));
    }
}
