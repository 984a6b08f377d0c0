package com.harbour.jobfeed.feed.api;

import java.util.List;

public record AdmissionApiRunRequest(
    List<String> urls,
    List<String> messages
) {
}
