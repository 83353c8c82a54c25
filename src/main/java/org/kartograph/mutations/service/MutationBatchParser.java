package org.kartograph.mutations.service;

import org.kartograph.mutations.domain.LineParseResult;
import org.kartograph.mutations.domain.ParsedBatch;
import org.kartograph.mutations.repository.SchemaLookup;
import org.kartograph.mutations.repository.TypeDefinitionRepository;
import org.springframework.stereotype.Service;

/**
 * Single parse-and-validate pipeline for mutation batches.
 * Live feedback, dry runs and the pre-apply check all go through this class, so a preview
 * can never accept a batch that apply then rejects.
 */
@Service
public class MutationBatchParser {

  private final MutationLineParser lineParser;
  private final MutationValidator validator;
  private final TypeDefinitionRepository registry;

  /**
   * Constructs a MutationBatchParser.
   *
   * @param lineParser the line parser
   * @param validator the validator
   * @param registry the schema registry consulted for warnings
   */
  public MutationBatchParser(
      MutationLineParser lineParser,
      MutationValidator validator,
      TypeDefinitionRepository registry) {
    this.lineParser = lineParser;
    this.validator = validator;
    this.registry = registry;
  }

  /**
   * Parses and fully validates a batch against the schema registry.
   *
   * @param text batch text
   * @return the validated batch
   */
  public ParsedBatch parse(String text) {
    return parse(text, registry);
  }

  /**
   * Parses and fully validates a batch against the given definitions.
   *
   * @param text batch text
   * @param schema definitions to check against
   * @return the validated batch
   */
  public ParsedBatch parse(String text, SchemaLookup schema) {
    LineParseResult decoded = lineParser.parse(text);
    return validator.validate(decoded, schema);
  }

  /**
   * Parses a batch and checks structure only, without warnings.
   *
   * @param text batch text
   * @return the batch with fatal errors only
   */
  public ParsedBatch parseStructure(String text) {
    return validator.validateStructure(lineParser.parse(text));
  }
}
