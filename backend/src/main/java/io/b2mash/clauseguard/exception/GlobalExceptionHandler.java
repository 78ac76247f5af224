package io.b2mash.clauseguard.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidClauseInputException.class)
  public ResponseEntity<ProblemDetail> handleInvalidClauseInput(
      InvalidClauseInputException ex, HttpServletRequest request) {
    log.warn(
        "Rejected clause input: path={}, method={}, violations={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getViolations());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }
}
