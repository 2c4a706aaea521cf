package com.nosota.roundup.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Notifies users about connection changes that need their attention.
 *
 * <p>Delivery channels (push, e-mail) live outside this service; the notification is
 * written to the log with a stable prefix the delivery pipeline picks up.
 */
@Component
@Slf4j
public class UserNotificationListener {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onConnectionTerminated(ConnectionTerminatedEvent event) {
        log.info("USER_NOTIFICATION userId={} connectionId={} status={} configId={}: {}",
                event.userId(), event.connectionId(), event.status(), event.roundUpConfigId(), event.reason());
    }
}
