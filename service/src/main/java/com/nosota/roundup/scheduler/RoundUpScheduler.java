package com.nosota.roundup.scheduler;

import com.nosota.roundup.service.SettlementService;
import com.nosota.roundup.service.TransactionSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntSupplier;

/**
 * Scheduled jobs of the round-up pipeline.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Pull new transactions for every active connection (cron: every 4 hours)</li>
 *   <li>Settle all enabled configs and start the new month (cron: 1st of the month)</li>
 *   <li>Resolve donations stuck in PENDING (cron: every 5 minutes)</li>
 * </ul>
 *
 * <p>A run that is still going when the next one fires is skipped.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   roundup:
 *     enabled: true
 *     sync-cron: "0 0 *&#47;4 * * *"
 *     monthly-sweep-cron: "0 0 0 1 * *"
 *     pending-recovery-cron: "0 *&#47;5 * * * *"
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.roundup.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class RoundUpScheduler {

    private final TransactionSyncService transactionSyncService;
    private final SettlementService settlementService;

    private final AtomicBoolean syncRunning = new AtomicBoolean();
    private final AtomicBoolean sweepRunning = new AtomicBoolean();
    private final AtomicBoolean recoveryRunning = new AtomicBoolean();

    @Scheduled(cron = "${scheduler.roundup.sync-cron:0 0 */4 * * *}")
    public void syncTransactions() {
        runGuarded("transaction sync", syncRunning, transactionSyncService::syncActiveConnections);
    }

    @Scheduled(cron = "${scheduler.roundup.monthly-sweep-cron:0 0 0 1 * *}")
    public void monthlySweep() {
        runGuarded("monthly settlement sweep", sweepRunning, settlementService::runMonthlySweep);
    }

    @Scheduled(cron = "${scheduler.roundup.pending-recovery-cron:0 */5 * * * *}")
    public void recoverPendingDonations() {
        runGuarded("pending donation recovery", recoveryRunning, settlementService::recoverStalePendingDonations);
    }

    private void runGuarded(String job, AtomicBoolean running, IntSupplier work) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Skipping scheduled job {}: previous run still in progress", job);
            return;
        }

        log.info("Starting scheduled job: {}", job);
        try {
            int processed = work.getAsInt();
            if (processed > 0) {
                log.info("Scheduled job {} processed {} item(s)", job, processed);
            } else {
                log.debug("Scheduled job {} found nothing to do", job);
            }
        } catch (Exception e) {
            log.error("Scheduled job {} failed: {}", job, e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }
}
