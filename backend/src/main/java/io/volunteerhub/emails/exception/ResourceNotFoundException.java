package io.volunteerhub.emails.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A record addressed by id does not exist. Triggers raise it when their subject disappears between
 * evaluation and building the action; the worker API maps it to 404.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;
  private final UUID resourceId;

  public ResourceNotFoundException(String resourceType, UUID resourceId) {
    super(HttpStatus.NOT_FOUND, notFound(resourceType, resourceId), null);
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public UUID getResourceId() {
    return resourceId;
  }

  private static ProblemDetail notFound(String resourceType, UUID resourceId) {
    var problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.NOT_FOUND, resourceType + " " + resourceId + " does not exist");
    problem.setTitle(resourceType + " not found");
    problem.setProperty("resource", resourceType);
    problem.setProperty("id", resourceId);
    return problem;
  }
}
