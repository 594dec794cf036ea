package com.sampleci.tracker.api;

import com.sampleci.tracker.service.ComparisonNotFoundException;
import com.sampleci.tracker.service.OutputMatchedException;
import com.sampleci.tracker.service.RunAlreadyFinishedException;
import com.sampleci.tracker.storage.ArtifactNotFoundException;
import com.sampleci.tracker.storage.DecodingFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.NoSuchElementException;

/**
 * Maps service-layer exceptions to HTTP answers.
 *
 * Missing result files get their own 404 so the UI can tell the user the
 * diff cannot be generated instead of showing an empty one.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ArtifactNotFoundException.class)
    public ProblemDetail artifactNotFound(ArtifactNotFoundException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND,
                "Cannot generate diff: " + e.getMessage());
    }

    @ExceptionHandler(DecodingFailureException.class)
    public ProblemDetail undecodable(DecodingFailureException e) {
        log.error("Result file is corrupt: {}", e.getMessage());
        return ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY,
                "Cannot generate diff: " + e.getMessage());
    }

    @ExceptionHandler({ComparisonNotFoundException.class, NoSuchElementException.class})
    public ProblemDetail notFound(RuntimeException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({RunAlreadyFinishedException.class, OutputMatchedException.class})
    public ProblemDetail conflict(RuntimeException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail badRequest(IllegalArgumentException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
    }
}
