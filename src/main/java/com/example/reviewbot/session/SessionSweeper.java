package com.example.reviewbot.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class SessionSweeper {

    private static final Logger logger = LoggerFactory.getLogger(SessionSweeper.class);

    private final TimeoutSupervisor timeoutSupervisor;

    @Value("${app.session.sweep-enabled:true}")
    private boolean enabled;

    @Value("${app.session.scan-limit:1000}")
    private int scanLimit;

    public SessionSweeper(TimeoutSupervisor timeoutSupervisor) {
        this.timeoutSupervisor = timeoutSupervisor;
    }

    @Scheduled(fixedDelayString = "${app.session.sweep-interval-ms:60000}", initialDelay = 5000L)
    public void run() {
        if (!enabled) return;
        try {
            int delivered = timeoutSupervisor.sweep(scanLimit);
            if (delivered > 0) {
                logger.info("Session sweep delivered {} notices", delivered);
            }
        } catch (RuntimeException e) {
            logger.warn("Session sweep failed, will retry next run: {}", e.getMessage());
        }
    }
}
