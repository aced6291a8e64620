package com.gatekeeper.authgovernor.infrastructure.maintenance;

import com.gatekeeper.authgovernor.config.SecurityGovernorProperties;
import com.gatekeeper.authgovernor.domain.ports.AttemptLedger;
import com.gatekeeper.authgovernor.domain.ports.BlockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Deactivates naturally expired blocks and purges old audit rows.
 * Request handling also expires blocks lazily, so nothing depends on this running on time.
 */
@Component
public class SecurityMaintenanceJob {
  private static final Logger log = LoggerFactory.getLogger(SecurityMaintenanceJob.class);

  private final AttemptLedger ledger;
  private final BlockRepository blocks;
  private final Clock clock;
  private final SecurityGovernorProperties.Maintenance config;

  public SecurityMaintenanceJob(AttemptLedger ledger, BlockRepository blocks, Clock clock,
                                SecurityGovernorProperties properties) {
    this.ledger = ledger;
    this.blocks = blocks;
    this.clock = clock;
    this.config = properties.getMaintenance();

    log.info("SecurityMaintenanceJob initialized - enabled: {}, retention: {} days, cron: {}",
            config.isEnabled(), config.getRetentionDays(), config.getCron());
  }

  @Scheduled(cron = "${app.security.maintenance.cron:0 30 3 * * *}")
  public void runScheduled() {
    if (!config.isEnabled()) {
      log.debug("Security maintenance is disabled");
      return;
    }
    try {
      run();
    } catch (Exception e) {
      log.error("SecurityMaintenanceJob: error during maintenance run", e);
    }
  }

  public MaintenanceReport run() {
    OffsetDateTime now = OffsetDateTime.now(clock);
    OffsetDateTime cutoff = now.minusDays(config.getRetentionDays());

    int expired = blocks.deactivateExpired(now);
    int attemptsPurged = ledger.purgeOlderThan(cutoff);
    int blocksPurged = blocks.purgeInactiveOlderThan(cutoff);

    if (expired + attemptsPurged + blocksPurged > 0) {
      log.info("SecurityMaintenanceJob: deactivated {} expired block(s), purged {} attempt(s) and {} inactive block(s) older than {}",
              expired, attemptsPurged, blocksPurged, cutoff);
    }
    return new MaintenanceReport(expired, attemptsPurged, blocksPurged);
  }

  public record MaintenanceReport(int expiredBlocksDeactivated, int attemptsPurged, int blocksPurged) {
  }
}
