package org.kartograph.mutations.domain;

import java.util.Objects;

/**
 * Fatal problem in a mutation batch. Any fatal error blocks the whole batch from being applied.
 *
 * @param category parse (undecodable line) or structural (missing/invalid mandatory field)
 * @param line 1-based line the problem was found on
 * @param operationIndex batch index of the affected operation, or null for parse errors
 * @param detail description of the problem
 */
public record BatchError(Category category, int line, Integer operationIndex, String detail) {

  /**
   * Fatal error categories.
   */
  public enum Category {
    PARSE,
    STRUCTURAL
  }

  /**
   * Creates a batch error.
   */
  public BatchError {
    Objects.requireNonNull(category, "Category cannot be null");
    Objects.requireNonNull(detail, "Detail cannot be null");
  }

  /**
   * Error for a line that could not be decoded into an operation.
   *
   * @param line the line number
   * @param detail what went wrong
   * @return the error
   */
  public static BatchError parse(int line, String detail) {
    return new BatchError(Category.PARSE, line, null, detail);
  }

  /**
   * Error for an operation that lacks a mandatory field.
   *
   * @param operation the offending operation
   * @param detail what is missing
   * @return the error
   */
  public static BatchError structural(MutationOperation operation, String detail) {
    return new BatchError(
        Category.STRUCTURAL, operation.span().startLine(), operation.index(), detail);
  }

  /**
   * Formats the error for authors, e.g. {@code "Line 5: invalid syntax"} or
   * {@code "Line 3 (operation 2): CREATE requires 'label'"}.
   *
   * @return the formatted message
   */
  public String message() {
    if (operationIndex == null) {
      return "Line " + line + ": " + detail;
    }
    return "Line " + line + " (operation " + operationIndex + "): " + detail;
  }

  @Override
  public String toString() {
    return message();
  }
}
