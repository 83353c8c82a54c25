package org.kartograph.mutations.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.kartograph.mutations.config.MutationProperties;
import org.kartograph.mutations.domain.BatchError;
import org.kartograph.mutations.domain.CreateOperation;
import org.kartograph.mutations.domain.DefineOperation;
import org.kartograph.mutations.domain.DeleteOperation;
import org.kartograph.mutations.domain.EntityId;
import org.kartograph.mutations.domain.EntityKind;
import org.kartograph.mutations.domain.LineParseResult;
import org.kartograph.mutations.domain.MutationOperation;
import org.kartograph.mutations.domain.ParsedBatch;
import org.kartograph.mutations.domain.ParsedOperation;
import org.kartograph.mutations.domain.SystemProperties;
import org.kartograph.mutations.domain.TypeDefinition;
import org.kartograph.mutations.domain.UpdateOperation;
import org.kartograph.mutations.repository.SchemaLookup;
import org.springframework.stereotype.Service;

/**
 * Applies structural (fatal) and schema (warning) rules to decoded operations.
 *
 * <p>Structural rules never consult the schema registry, so a batch can be fully
 * structurally validated without one. Schema-conformance warnings use definitions declared
 * anywhere in the batch (DEFINE runs first) and, when a registry is supplied, registered
 * definitions.
 */
@Service
public class MutationValidator {

  private final MutationProperties properties;

  /**
   * Constructs a MutationValidator.
   *
   * @param properties mutation settings
   */
  public MutationValidator(MutationProperties properties) {
    this.properties = properties;
  }

  /**
   * Checks fatal structural rules only.
   *
   * @param operations the operations
   * @return structural errors, in operation order
   */
  public List<BatchError> checkStructure(List<MutationOperation> operations) {
    List<BatchError> errors = new ArrayList<>();
    StructureRules rules = new StructureRules();
    for (MutationOperation operation : operations) {
      for (String problem : operation.accept(rules)) {
        errors.add(BatchError.structural(operation, problem));
      }
    }
    return errors;
  }

  /**
   * Validates a parsed batch: structural errors are merged with the parse errors, and every
   * operation is annotated with its warnings.
   *
   * @param parsed parser output
   * @param schema registered definitions
   * @return the validated batch
   */
  public ParsedBatch validate(LineParseResult parsed, SchemaLookup schema) {
    Objects.requireNonNull(schema, "Schema lookup cannot be null");
    return annotate(parsed, schema);
  }

  /**
   * Validates a parsed batch without consulting registered definitions. Labels defined
   * earlier in the same batch are still checked.
   *
   * @param parsed parser output
   * @return the validated batch
   */
  public ParsedBatch validate(LineParseResult parsed) {
    return annotate(parsed, null);
  }

  private ParsedBatch annotate(LineParseResult parsed, SchemaLookup schema) {
    List<MutationOperation> operations = parsed.operations();
    List<BatchError> errors = fatalErrors(parsed);

    WarningRules warningRules = new WarningRules(batchDefinitions(operations), schema);
    List<ParsedOperation> annotated = new ArrayList<>(operations.size());
    for (MutationOperation operation : operations) {
      annotated.add(new ParsedOperation(operation, operation.accept(warningRules)));
    }
    return new ParsedBatch(annotated, errors);
  }

  /**
   * Validates structure only. Operations carry no warnings; used where full linting is too
   * expensive but submission must still be judged the same way apply judges it.
   *
   * @param parsed parser output
   * @return the batch with parse and structural errors
   */
  public ParsedBatch validateStructure(LineParseResult parsed) {
    List<ParsedOperation> bare = parsed.operations().stream()
        .map(operation -> new ParsedOperation(operation, List.of()))
        .toList();
    return new ParsedBatch(bare, fatalErrors(parsed));
  }

  private List<BatchError> fatalErrors(LineParseResult parsed) {
    List<BatchError> errors = new ArrayList<>(parsed.errors());
    errors.addAll(checkStructure(parsed.operations()));
    errors.sort(Comparator.comparingInt(BatchError::line));
    return errors;
  }

  private static Map<DefinitionKey, TypeDefinition> batchDefinitions(
      List<MutationOperation> operations) {
    Map<DefinitionKey, TypeDefinition> defined = new HashMap<>();
    for (MutationOperation operation : operations) {
      if (operation instanceof DefineOperation define && !isBlank(define.label())) {
        defined.put(
            new DefinitionKey(define.entityKind(), define.label()), define.toTypeDefinition());
      }
    }
    return defined;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private record DefinitionKey(EntityKind entityKind, String label) {
  }

  /**
   * Fatal rules: mandatory fields of each variant.
   */
  private static final class StructureRules implements MutationOperation.Visitor<List<String>> {

    @Override
    public List<String> visitDefine(DefineOperation operation) {
      List<String> problems = new ArrayList<>();
      if (isBlank(operation.label())) {
        problems.add("DEFINE requires 'label'");
      }
      return problems;
    }

    @Override
    public List<String> visitCreate(CreateOperation operation) {
      List<String> problems = new ArrayList<>();
      if (isBlank(operation.id())) {
        problems.add("CREATE requires 'id'");
      }
      if (isBlank(operation.label())) {
        problems.add("CREATE requires 'label'");
      }
      if (operation.entityKind() == EntityKind.EDGE
          && (isBlank(operation.startId()) || isBlank(operation.endId()))) {
        problems.add("CREATE edge requires 'start_id' and 'end_id'");
      }
      Map<String, Object> set = operation.setProperties();
      if (set == null) {
        problems.add("CREATE requires 'set_properties' with '"
            + SystemProperties.DATA_SOURCE_ID + "' and '" + SystemProperties.SOURCE_PATH + "'");
      } else {
        for (String provenance : SystemProperties.PROVENANCE) {
          if (set.get(provenance) == null) {
            problems.add("CREATE requires '" + provenance + "' in set_properties");
          }
        }
      }
      return problems;
    }

    @Override
    public List<String> visitUpdate(UpdateOperation operation) {
      return isBlank(operation.id()) ? List.of("UPDATE requires 'id'") : List.of();
    }

    @Override
    public List<String> visitDelete(DeleteOperation operation) {
      return isBlank(operation.id()) ? List.of("DELETE requires 'id'") : List.of();
    }
  }

  /**
   * Non-blocking rules: id shape, schema conformance, ambiguous updates.
   */
  private final class WarningRules implements MutationOperation.Visitor<List<String>> {

    private final Map<DefinitionKey, TypeDefinition> batchDefinitions;
    // null when registry checks are skipped
    private final SchemaLookup schema;

    WarningRules(Map<DefinitionKey, TypeDefinition> batchDefinitions, SchemaLookup schema) {
      this.batchDefinitions = batchDefinitions;
      this.schema = schema;
    }

    @Override
    public List<String> visitDefine(DefineOperation operation) {
      List<String> warnings = new ArrayList<>();
      if (isBlank(operation.description())) {
        warnings.add("DEFINE without description");
      }
      Set<String> systemManaged = SystemProperties.forKind(operation.entityKind());
      Set<String> declared = new LinkedHashSet<>(operation.requiredProperties());
      declared.addAll(operation.optionalProperties());
      for (String property : declared) {
        if (systemManaged.contains(property)) {
          warnings.add("property '" + property + "' is system-managed and need not be declared");
        }
      }
      addExtraneous(operation, warnings);
      return warnings;
    }

    @Override
    public List<String> visitCreate(CreateOperation operation) {
      List<String> warnings = new ArrayList<>();
      checkIdShape("id", operation.id(), warnings);
      if (operation.entityKind() == EntityKind.EDGE) {
        checkIdShape("start_id", operation.startId(), warnings);
        checkIdShape("end_id", operation.endId(), warnings);
      }
      String label = operation.label();
      if (!isBlank(label)) {
        EntityId.labelPrefix(operation.id())
            .filter(prefix -> !prefix.equals(label))
            .ifPresent(prefix -> warnings.add(
                "id prefix '" + prefix + "' does not match label '" + label + "'"));
        checkSchema(operation, label, warnings);
      }
      Map<String, Object> set = operation.setProperties();
      if (properties.isRequireNodeSlug()
          && operation.entityKind() == EntityKind.NODE
          && set != null
          && set.get(SystemProperties.SLUG) == null) {
        warnings.add("CREATE node without '" + SystemProperties.SLUG + "' in set_properties");
      }
      addExtraneous(operation, warnings);
      return warnings;
    }

    @Override
    public List<String> visitUpdate(UpdateOperation operation) {
      List<String> warnings = new ArrayList<>();
      checkIdShape("id", operation.id(), warnings);
      Map<String, Object> set = operation.setProperties();
      List<String> remove = operation.removeProperties();
      boolean nothingToSet = set == null || set.isEmpty();
      boolean nothingToRemove = remove == null || remove.isEmpty();
      if (nothingToSet && nothingToRemove) {
        warnings.add("UPDATE has neither set_properties nor remove_properties");
      }
      if (!nothingToSet && !nothingToRemove) {
        List<String> overlap = remove.stream().filter(set::containsKey).distinct().toList();
        if (!overlap.isEmpty()) {
          warnings.add("properties in both set_properties and remove_properties "
              + "(remove wins): " + String.join(", ", overlap));
        }
      }
      addExtraneous(operation, warnings);
      return warnings;
    }

    @Override
    public List<String> visitDelete(DeleteOperation operation) {
      List<String> warnings = new ArrayList<>();
      checkIdShape("id", operation.id(), warnings);
      addExtraneous(operation, warnings);
      return warnings;
    }

    private void checkSchema(CreateOperation operation, String label, List<String> warnings) {
      DefinitionKey key = new DefinitionKey(operation.entityKind(), label);
      Optional<TypeDefinition> definition = Optional.ofNullable(batchDefinitions.get(key))
          .or(() -> schema != null
              ? schema.find(operation.entityKind(), label)
              : Optional.empty());

      if (definition.isEmpty()) {
        if (schema != null) {
          warnings.add("label '" + label + "' undefined");
        }
        return;
      }

      Map<String, Object> set = operation.setProperties() != null
          ? operation.setProperties()
          : Map.of();
      List<String> missing = definition.get().requiredProperties().stream()
          .filter(required -> !set.containsKey(required))
          .toList();
      if (!missing.isEmpty()) {
        warnings.add("missing required properties for " + operation.entityKind().wireValue()
            + " '" + label + "': " + String.join(", ", missing));
      }
    }

    private void checkIdShape(String field, String id, List<String> warnings) {
      if (!isBlank(id) && !EntityId.isCanonical(id)) {
        warnings.add(field + " '" + id
            + "' does not match the canonical shape <label>:<16 lowercase hex>");
      }
    }

    private void addExtraneous(MutationOperation operation, List<String> warnings) {
      for (String field : operation.extraneousFields()) {
        warnings.add("field '" + field + "' is not used by " + operation.kind());
      }
    }
  }
}
