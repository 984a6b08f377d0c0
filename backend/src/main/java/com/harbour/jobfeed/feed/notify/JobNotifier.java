package com.harbour.jobfeed.feed.notify;

import com.harbour.jobfeed.feed.model.JobRecord;

public interface JobNotifier {

    /**
     * @return {@code true} when the notification was accepted; failures are reported, not thrown
     */
    boolean notifyNewJob(JobRecord job);
}
