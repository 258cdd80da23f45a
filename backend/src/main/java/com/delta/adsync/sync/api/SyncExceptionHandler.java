package com.delta.adsync.sync.api;

import com.delta.adsync.sync.http.GraphApiException;
import com.delta.adsync.sync.http.GraphAuthException;
import com.delta.adsync.sync.http.GraphNotFoundException;
import com.delta.adsync.sync.media.MediaCacheException;
import com.delta.adsync.sync.service.ActiveSyncJobException;
import com.delta.adsync.sync.service.ConnectionInUseException;
import com.delta.adsync.sync.service.ConnectionUnavailableException;
import com.delta.adsync.sync.service.ConnectionValidationException;
import com.delta.adsync.sync.token.TokenEncryptionException;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SyncExceptionHandler {

  @ExceptionHandler(ActiveSyncJobException.class)
  public ResponseEntity<Map<String, String>> handleActiveJob(ActiveSyncJobException ex) {
    return error(HttpStatus.CONFLICT, "active_sync_job", ex.getMessage());
  }

  @ExceptionHandler(ConnectionInUseException.class)
  public ResponseEntity<Map<String, String>> handleConnectionInUse(ConnectionInUseException ex) {
    return error(HttpStatus.CONFLICT, "connection_in_use", ex.getMessage());
  }

  @ExceptionHandler(ConnectionUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleConnectionUnavailable(ConnectionUnavailableException ex) {
    return error(HttpStatus.UNPROCESSABLE_ENTITY, "connection_unavailable", ex.getMessage());
  }

  @ExceptionHandler(ConnectionValidationException.class)
  public ResponseEntity<Map<String, String>> handleConnectionValidation(ConnectionValidationException ex) {
    return error(HttpStatus.BAD_REQUEST, "connection_invalid", ex.getMessage());
  }

  @ExceptionHandler(GraphAuthException.class)
  public ResponseEntity<Map<String, String>> handleGraphAuth(GraphAuthException ex) {
    return error(HttpStatus.BAD_GATEWAY, "upstream_auth", ex.getMessage());
  }

  @ExceptionHandler(GraphNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleGraphNotFound(GraphNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "upstream_not_found", ex.getMessage());
  }

  @ExceptionHandler(GraphApiException.class)
  public ResponseEntity<Map<String, String>> handleGraph(GraphApiException ex) {
    return error(HttpStatus.BAD_GATEWAY, "upstream_" + ex.getCategory().name().toLowerCase(Locale.ROOT), ex.getMessage());
  }

  @ExceptionHandler(MediaCacheException.class)
  public ResponseEntity<Map<String, String>> handleMediaCache(MediaCacheException ex) {
    return error(HttpStatus.BAD_GATEWAY, "media_cache_failed", ex.getMessage());
  }

  @ExceptionHandler(TokenEncryptionException.class)
  public ResponseEntity<Map<String, String>> handleTokenEncryption(TokenEncryptionException ex) {
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "token_encryption", ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status)
        .body(Map.of("error", code, "message", message == null ? "" : message));
  }
}
