package org.kartograph.mutations.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RFC 7807 Problem Details for HTTP APIs.
 * Used for every request-level error response of the mutation server.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProblemDetail {

  private String type = "about:blank";
  private String title;
  private int status;
  private String detail;
  private String code;
  private Map<String, Object> extras;

  /**
   * Default constructor for JSON deserialization.
   */
  public ProblemDetail() {
    // Required for JSON deserialization
  }

  /**
   * Constructor with title, status, and code.
   *
   * @param title human-readable summary
   * @param status HTTP status code
   * @param code canonical error code
   */
  public ProblemDetail(String title, int status, String code) {
    this.title = title;
    this.status = status;
    this.code = code;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public int getStatus() {
    return status;
  }

  public void setStatus(int status) {
    this.status = status;
  }

  public String getDetail() {
    return detail;
  }

  public void setDetail(String detail) {
    this.detail = detail;
  }

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  /**
   * Adds a property that is serialized as a top-level field.
   *
   * @param name property name
   * @param value property value
   */
  public void addExtra(String name, Object value) {
    if (extras == null) {
      extras = new LinkedHashMap<>();
    }
    extras.put(name, value);
  }

  /**
   * Gets additional properties for serialization as top-level fields.
   *
   * @return map of additional properties
   */
  @JsonAnyGetter
  public Map<String, Object> getExtras() {
    return extras != null ? Map.copyOf(extras) : Map.of();
  }
}
