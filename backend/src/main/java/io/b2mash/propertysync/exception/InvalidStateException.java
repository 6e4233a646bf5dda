package io.b2mash.propertysync.exception;

import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a record is handed to the persistence gate in a state the backend would reject.
 * Results in HTTP 400 Bad Request; field-level messages travel in the {@code errors} property.
 */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail, Map<String, String> fieldErrors) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, fieldErrors), null);
  }

  private static ProblemDetail createProblem(
      String title, String detail, Map<String, String> fieldErrors) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (!fieldErrors.isEmpty()) {
      problem.setProperty("errors", fieldErrors);
    }
    return problem;
  }
}
