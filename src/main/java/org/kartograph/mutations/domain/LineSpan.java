package org.kartograph.mutations.domain;

/**
 * 1-based, inclusive range of input lines an operation was decoded from.
 * Used for diagnostics only; never part of an operation's identity.
 *
 * @param startLine first line
 * @param endLine last line
 */
public record LineSpan(int startLine, int endLine) {

  /**
   * Creates a line span.
   *
   * @throws IllegalArgumentException if the range is empty or not 1-based
   */
  public LineSpan {
    if (startLine < 1) {
      throw new IllegalArgumentException("Line numbers are 1-based: " + startLine);
    }
    if (endLine < startLine) {
      throw new IllegalArgumentException(
          "End line " + endLine + " precedes start line " + startLine);
    }
  }

  /**
   * Span covering a single line.
   *
   * @param line the line number
   * @return the span
   */
  public static LineSpan of(int line) {
    return new LineSpan(line, line);
  }
}
