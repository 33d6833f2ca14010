package io.b2mash.tasks.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Converts every failure at the request boundary into an {@link ErrorResponse}. Storage and
 * unexpected errors are logged in full and reported to the client with a generic message.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  static final String INTERNAL_ERROR = "Internal server error";
  static final String ROUTE_NOT_FOUND = "Route not found";

  @ExceptionHandler(TaskNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleTaskNotFound(
      TaskNotFoundException ex, HttpServletRequest request) {
    log.warn(
        "Task not found: path={}, method={}, taskId={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getTaskId());
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ErrorResponse(ex.getBody().getTitle()));
  }

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ErrorResponse> handleInvalidRequest(
      InvalidRequestException ex, HttpServletRequest request) {
    log.warn(
        "Invalid request: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ErrorResponse(ex.getBody().getDetail()));
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ErrorResponse> handleDataAccess(
      DataAccessException ex, HttpServletRequest request) {
    log.error(
        "Storage failure: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse(INTERNAL_ERROR));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
    log.error(
        "Unhandled error: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse(INTERNAL_ERROR));
  }

  // --- Framework exceptions ---

  @Override
  protected ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getDefaultMessage)
            .findFirst()
            .orElse("Invalid request");
    log.warn("Validation failed: path={}, reason={}", requestPath(request), message);
    return handleExceptionInternal(
        ex, new ErrorResponse(message), headers, HttpStatus.BAD_REQUEST, request);
  }

  @Override
  protected ResponseEntity<Object> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    log.warn("Unreadable request body: path={}, reason={}", requestPath(request), ex.getMessage());
    return handleExceptionInternal(
        ex, new ErrorResponse("Malformed request body"), headers, HttpStatus.BAD_REQUEST, request);
  }

  /** A non-numeric id in the path can never resolve to a stored row. */
  @Override
  protected ResponseEntity<Object> handleTypeMismatch(
      TypeMismatchException ex, HttpHeaders headers, HttpStatusCode status, WebRequest request) {
    if (ex instanceof MethodArgumentTypeMismatchException mismatch
        && mismatch.getParameter().hasParameterAnnotation(PathVariable.class)) {
      log.warn(
          "Unresolvable path variable: path={}, value={}", requestPath(request), ex.getValue());
      return handleExceptionInternal(
          ex, new ErrorResponse("Resource not found"), headers, HttpStatus.NOT_FOUND, request);
    }
    return super.handleTypeMismatch(ex, headers, status, request);
  }

  @Override
  protected ResponseEntity<Object> handleNoResourceFoundException(
      NoResourceFoundException ex, HttpHeaders headers, HttpStatusCode status, WebRequest request) {
    return routeNotFound(ex, headers, request);
  }

  @Override
  protected ResponseEntity<Object> handleNoHandlerFoundException(
      NoHandlerFoundException ex, HttpHeaders headers, HttpStatusCode status, WebRequest request) {
    return routeNotFound(ex, headers, request);
  }

  /** Any method not mapped for a path is treated as an unmatched route. */
  @Override
  protected ResponseEntity<Object> handleHttpRequestMethodNotSupported(
      HttpRequestMethodNotSupportedException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    return routeNotFound(ex, headers, request);
  }

  @Override
  protected ResponseEntity<Object> handleExceptionInternal(
      Exception ex,
      Object body,
      HttpHeaders headers,
      HttpStatusCode statusCode,
      WebRequest request) {
    if (!(body instanceof ErrorResponse)) {
      var status = HttpStatus.resolve(statusCode.value());
      body = new ErrorResponse(status != null ? status.getReasonPhrase() : "Request failed");
    }
    return super.handleExceptionInternal(ex, body, headers, statusCode, request);
  }

  private ResponseEntity<Object> routeNotFound(
      Exception ex, HttpHeaders headers, WebRequest request) {
    String path = requestPath(request);
    log.warn("No route: path={}", path);
    return handleExceptionInternal(
        ex, new ErrorResponse(ROUTE_NOT_FOUND, path), headers, HttpStatus.NOT_FOUND, request);
  }

  private static String requestPath(WebRequest request) {
    if (request instanceof ServletWebRequest servletRequest) {
      var httpRequest = servletRequest.getRequest();
      String query = httpRequest.getQueryString();
      String uri = httpRequest.getRequestURI();
      return query != null ? uri + "?" + query : uri;
    }
    return request.getDescription(false);
  }
}
