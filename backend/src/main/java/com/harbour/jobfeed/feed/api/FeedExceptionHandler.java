package com.harbour.jobfeed.feed.api;

import com.harbour.jobfeed.feed.seen.SeenUrlStoreException;
import com.harbour.jobfeed.feed.service.ActiveAdmissionRunException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class FeedExceptionHandler {

  @ExceptionHandler(ActiveAdmissionRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveAdmissionRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_admission_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(SeenUrlStoreException.class)
  public ResponseEntity<Map<String, String>> handleSeenStore(SeenUrlStoreException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "seen_url_store_unavailable", "message", ex.getMessage()));
  }
}
