package com.community.leaderboard.controller;

import com.community.leaderboard.dto.CommonResponse;
import com.community.leaderboard.service.PipelineBusyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures of the pipeline and store to {@link CommonResponse} errors.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final int LOCKED = 423;

    @ExceptionHandler(PipelineBusyException.class)
    public ResponseEntity<CommonResponse<Void>> handleBusy(PipelineBusyException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity.status(LOCKED).body(CommonResponse.error(LOCKED, ex.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<CommonResponse<Void>> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(CommonResponse.error(400, ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<CommonResponse<Void>> handleStoreFailure(DataAccessException ex) {
        log.error("Record store failure: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(CommonResponse.error(500, "Record store failure, rerun the request once the store is available"));
    }
}
