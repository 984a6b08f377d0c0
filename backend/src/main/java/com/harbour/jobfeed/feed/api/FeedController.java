package com.harbour.jobfeed.feed.api;

import com.harbour.jobfeed.feed.channel.ChannelUrlExtractor;
import com.harbour.jobfeed.feed.model.AdmissionSummary;
import com.harbour.jobfeed.feed.model.PurgeSummary;
import com.harbour.jobfeed.feed.model.RetentionSummary;
import com.harbour.jobfeed.feed.model.StatusResponse;
import com.harbour.jobfeed.feed.service.FeedStatusService;
import com.harbour.jobfeed.feed.service.JobAdmissionService;
import com.harbour.jobfeed.feed.service.JobPurgeService;
import com.harbour.jobfeed.feed.service.JobRetentionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class FeedController {
    private final JobAdmissionService admissionService;
    private final JobPurgeService purgeService;
    private final JobRetentionService retentionService;
    private final FeedStatusService statusService;
    private final ChannelUrlExtractor urlExtractor;

    public FeedController(
        JobAdmissionService admissionService,
        JobPurgeService purgeService,
        JobRetentionService retentionService,
        FeedStatusService statusService,
        ChannelUrlExtractor urlExtractor
    ) {
        this.admissionService = admissionService;
        this.purgeService = purgeService;
        this.retentionService = retentionService;
        this.statusService = statusService;
        this.urlExtractor = urlExtractor;
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.getStatus();
    }

    @PostMapping("/admission/run")
    public AdmissionSummary runAdmission(@RequestBody(required = false) AdmissionApiRunRequest request) {
        if (request == null || (request.urls() == null && request.messages() == null)) {
            return admissionService.admitFromChannel();
        }
        List<String> candidates = new ArrayList<>();
        if (request.urls() != null) {
            candidates.addAll(request.urls());
        }
        if (request.messages() != null) {
            candidates.addAll(urlExtractor.extract(request.messages()));
        }
        return admissionService.admit(candidates);
    }

    @PostMapping("/purge/run")
    public PurgeSummary runPurge() {
        return purgeService.purge();
    }

    @PostMapping("/retention/run")
    public RetentionSummary runRetention(@RequestParam(name = "maxAgeDays", required = false) Integer maxAgeDays) {
        if (maxAgeDays == null) {
            return retentionService.purgeExpired();
        }
        if (maxAgeDays < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "maxAgeDays must be at least 1");
        }
        return retentionService.purgeOlderThan(Duration.ofDays(maxAgeDays));
    }
}
