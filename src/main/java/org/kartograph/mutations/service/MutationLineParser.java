package org.kartograph.mutations.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.kartograph.mutations.domain.BatchError;
import org.kartograph.mutations.domain.CreateOperation;
import org.kartograph.mutations.domain.DefineOperation;
import org.kartograph.mutations.domain.DeleteOperation;
import org.kartograph.mutations.domain.EntityKind;
import org.kartograph.mutations.domain.LineParseResult;
import org.kartograph.mutations.domain.LineSpan;
import org.kartograph.mutations.domain.MutationOperation;
import org.kartograph.mutations.domain.OperationKind;
import org.kartograph.mutations.domain.UpdateOperation;
import org.springframework.stereotype.Service;

/**
 * Decodes newline-delimited mutation records into operations.
 *
 * <p>Blank lines and lines starting with {@code //} or {@code #} are skipped and do not
 * consume an operation index. A line that cannot be decoded contributes no operation and
 * yields a line-scoped error; parsing continues with the next line so that all errors of a
 * batch are reported together.
 */
@Service
public class MutationLineParser {

  static final String FIELD_OP = "op";
  static final String FIELD_TYPE = "type";
  static final String FIELD_ID = "id";
  static final String FIELD_LABEL = "label";
  static final String FIELD_START_ID = "start_id";
  static final String FIELD_END_ID = "end_id";
  static final String FIELD_SET_PROPERTIES = "set_properties";
  static final String FIELD_REMOVE_PROPERTIES = "remove_properties";
  static final String FIELD_DESCRIPTION = "description";
  static final String FIELD_REQUIRED_PROPERTIES = "required_properties";
  static final String FIELD_OPTIONAL_PROPERTIES = "optional_properties";
  static final String FIELD_EXAMPLE_FILE_PATH = "example_file_path";
  static final String FIELD_EXAMPLE_IN_FILE_PATH = "example_in_file_path";

  private static final Set<String> DEFINE_FIELDS = Set.of(
      FIELD_OP, FIELD_TYPE, FIELD_LABEL, FIELD_DESCRIPTION,
      FIELD_REQUIRED_PROPERTIES, FIELD_OPTIONAL_PROPERTIES,
      FIELD_EXAMPLE_FILE_PATH, FIELD_EXAMPLE_IN_FILE_PATH);
  private static final Set<String> CREATE_FIELDS = Set.of(
      FIELD_OP, FIELD_TYPE, FIELD_ID, FIELD_LABEL, FIELD_START_ID, FIELD_END_ID,
      FIELD_SET_PROPERTIES);
  private static final Set<String> UPDATE_FIELDS = Set.of(
      FIELD_OP, FIELD_TYPE, FIELD_ID, FIELD_SET_PROPERTIES, FIELD_REMOVE_PROPERTIES);
  private static final Set<String> DELETE_FIELDS = Set.of(FIELD_OP, FIELD_TYPE, FIELD_ID);

  private static final TypeReference<LinkedHashMap<String, Object>> PROPERTY_MAP =
      new TypeReference<>() { };

  private final ObjectMapper objectMapper;
  private final ObjectReader lineReader;

  /**
   * Constructs a MutationLineParser.
   *
   * @param objectMapper the JSON mapper used to decode lines
   */
  public MutationLineParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.lineReader = objectMapper.reader()
        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Checks whether a line is skipped by the parser.
   *
   * @param line the raw line
   * @return true for blank and comment lines
   */
  public static boolean isSkippable(String line) {
    String trimmed = line.trim();
    return trimmed.isEmpty() || trimmed.startsWith("//") || trimmed.startsWith("#");
  }

  /**
   * Parses mutation text.
   *
   * @param text the raw text, one operation per line
   * @return decoded operations and line-scoped errors
   */
  public LineParseResult parse(String text) {
    List<MutationOperation> operations = new ArrayList<>();
    List<BatchError> errors = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return new LineParseResult(operations, errors);
    }

    Iterator<String> lines = text.lines().iterator();
    int lineNumber = 0;
    while (lines.hasNext()) {
      String line = lines.next();
      lineNumber++;
      if (isSkippable(line)) {
        continue;
      }
      try {
        operations.add(decodeLine(line.trim(), lineNumber, operations.size()));
      } catch (MalformedLineException e) {
        errors.add(BatchError.parse(lineNumber, e.getMessage()));
      }
    }
    return new LineParseResult(operations, errors);
  }

  private MutationOperation decodeLine(String line, int lineNumber, int index)
      throws MalformedLineException {
    JsonNode record;
    try {
      record = lineReader.readTree(line);
    } catch (JsonProcessingException e) {
      throw new MalformedLineException("invalid syntax");
    }
    if (record == null || !record.isObject()) {
      throw new MalformedLineException("operation must be a JSON object");
    }

    String rawOp = text(record, FIELD_OP);
    if (rawOp == null) {
      throw new MalformedLineException("missing required field 'op'");
    }
    OperationKind kind = OperationKind.fromWire(rawOp)
        .orElseThrow(() -> new MalformedLineException(
            "unknown op '" + rawOp + "' (expected DEFINE, CREATE, UPDATE or DELETE)"));

    String rawType = text(record, FIELD_TYPE);
    if (rawType == null) {
      throw new MalformedLineException(kind + " requires 'type'");
    }
    EntityKind entityKind = EntityKind.fromWire(rawType)
        .orElseThrow(() -> new MalformedLineException(
            "invalid type '" + rawType + "' (expected 'node' or 'edge')"));

    LineSpan span = LineSpan.of(lineNumber);
    return switch (kind) {
      case DEFINE -> new DefineOperation(
          index, span, entityKind,
          text(record, FIELD_LABEL),
          text(record, FIELD_DESCRIPTION),
          stringList(record, FIELD_REQUIRED_PROPERTIES),
          stringList(record, FIELD_OPTIONAL_PROPERTIES),
          text(record, FIELD_EXAMPLE_FILE_PATH),
          text(record, FIELD_EXAMPLE_IN_FILE_PATH),
          extraneous(record, DEFINE_FIELDS));
      case CREATE -> new CreateOperation(
          index, span, entityKind,
          text(record, FIELD_ID),
          text(record, FIELD_LABEL),
          text(record, FIELD_START_ID),
          text(record, FIELD_END_ID),
          properties(record, FIELD_SET_PROPERTIES),
          extraneous(record, CREATE_FIELDS));
      case UPDATE -> new UpdateOperation(
          index, span, entityKind,
          text(record, FIELD_ID),
          properties(record, FIELD_SET_PROPERTIES),
          stringList(record, FIELD_REMOVE_PROPERTIES),
          extraneous(record, UPDATE_FIELDS));
      case DELETE -> new DeleteOperation(
          index, span, entityKind,
          text(record, FIELD_ID),
          extraneous(record, DELETE_FIELDS));
    };
  }

  private static String text(JsonNode record, String field) throws MalformedLineException {
    JsonNode value = record.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isTextual()) {
      throw new MalformedLineException("'" + field + "' must be a string");
    }
    return value.asText();
  }

  private static List<String> stringList(JsonNode record, String field)
      throws MalformedLineException {
    JsonNode value = record.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isArray()) {
      throw new MalformedLineException("'" + field + "' must be an array of strings");
    }
    List<String> result = new ArrayList<>(value.size());
    for (JsonNode element : value) {
      if (!element.isTextual()) {
        throw new MalformedLineException("'" + field + "' must be an array of strings");
      }
      result.add(element.asText());
    }
    return result;
  }

  private Map<String, Object> properties(JsonNode record, String field)
      throws MalformedLineException {
    JsonNode value = record.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isObject()) {
      throw new MalformedLineException("'" + field + "' must be an object");
    }
    return objectMapper.convertValue(value, PROPERTY_MAP);
  }

  private static Set<String> extraneous(JsonNode record, Set<String> knownFields) {
    Set<String> extra = new LinkedHashSet<>();
    record.fieldNames().forEachRemaining(name -> {
      if (!knownFields.contains(name)) {
        extra.add(name);
      }
    });
    return extra;
  }

  /**
   * Signals that a line cannot become an operation.
   */
  private static final class MalformedLineException extends Exception {

    private static final long serialVersionUID = 1L;

    MalformedLineException(String message) {
      super(message);
    }
  }
}
