package com.verve.trigger.job;

import com.verve.trigger.application.command.EpicCommandService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * active epic 完成判定守护进程。
 */
@Slf4j
@Component
public class EpicCompletionDaemon {

    private final EpicCommandService epicCommandService;

    public EpicCompletionDaemon(EpicCommandService epicCommandService) {
        this.epicCommandService = epicCommandService;
    }

    @Scheduled(fixedDelayString = "${verve.epic-completion.interval-ms:30000}", scheduler = "daemonScheduler")
    public void checkCompletion() {
        try {
            int completed = epicCommandService.checkActiveEpicsCompletion();
            if (completed > 0) {
                log.info("Epic completion check finished. completed={}", completed);
            }
        } catch (Exception ex) {
            log.warn("Epic completion check failed. error={}", ex.getMessage());
        }
    }
}
