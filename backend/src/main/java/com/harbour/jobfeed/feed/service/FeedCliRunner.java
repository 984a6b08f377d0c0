package com.harbour.jobfeed.feed.service;

import com.harbour.jobfeed.config.FeedProperties;
import com.harbour.jobfeed.feed.model.AdmissionSummary;
import com.harbour.jobfeed.feed.model.PurgeSummary;
import com.harbour.jobfeed.feed.model.RetentionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * One-shot run for cron-style hosting: retention sweep, admission from the channel export,
 * then an optional purge cycle.
 */
@Component
public class FeedCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(FeedCliRunner.class);

    private final FeedProperties properties;
    private final JobRetentionService retentionService;
    private final JobAdmissionService admissionService;
    private final JobPurgeService purgeService;
    private final ConfigurableApplicationContext applicationContext;

    public FeedCliRunner(
        FeedProperties properties,
        JobRetentionService retentionService,
        JobAdmissionService admissionService,
        JobPurgeService purgeService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.retentionService = retentionService;
        this.admissionService = admissionService;
        this.purgeService = purgeService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        FeedProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }
        log.info("=== Feed run started ===");
        int exitCode = 0;

        if (cli.isRetentionBeforeAdmission()) {
            try {
                RetentionSummary retention = retentionService.purgeExpired();
                log.info("Retention: deleted {} of {} expired records", retention.deleted(), retention.scheduled());
            } catch (Exception e) {
                log.warn("Retention sweep failed; continuing with admission", e);
            }
        }

        if (cli.isAdmit()) {
            try {
                AdmissionSummary admission = admissionService.admitFromChannel();
                log.info("Admission: inserted {} of {} candidates", admission.inserted(), admission.candidates());
            } catch (Exception e) {
                log.error("Admission run failed", e);
                exitCode = 1;
            }
        }

        if (cli.isPurge()) {
            try {
                PurgeSummary purge = purgeService.purge();
                log.info("Purge: deleted {} of {} scheduled records", purge.deleted(), purge.scheduled());
            } catch (Exception e) {
                log.warn("Purge cycle failed", e);
            }
        }
        log.info("=== Feed run finished ===");

        if (cli.isExitAfterRun()) {
            int finalExitCode = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> finalExitCode));
        }
    }
}
