package com.example.guardianservice.scheduler;

import com.example.guardianservice.reactionroles.ReactionPanelManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Periodically recreates reaction panels whose message was deleted.
 * 
 * - @SchedulerLock: one replica runs the check at a time
 * - Can be disabled via guardian.panel.integrity.enabled=false
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "guardian.panel.integrity.enabled", havingValue = "true", matchIfMissing = true)
public class PanelIntegrityScheduler {

    private final ReactionPanelManager panelManager;

    @Scheduled(cron = "${guardian.panel.integrity.cron:0 */10 * * * *}")
    @SchedulerLock(
            name = "panelIntegrity",
            lockAtMostFor = "9m",
            lockAtLeastFor = "30s"
    )
    public void verifyPanels() {
        String correlationId = "PANELS-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            int repaired = panelManager.repairAll();
            if (repaired > 0) {
                log.warn("Panel integrity check recreated {} panels", repaired);
            } else {
                log.debug("Panel integrity check: all panels present");
            }
        } catch (Exception e) {
            log.error("Error in panel integrity check: {}", e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }
}
