package org.kartograph.mutations.testutil;

/**
 * JSONL fixtures for mutation tests.
 */
public final class MutationLines {

  public static final String ALICE = "person:a1b2c3d4e5f67890";
  public static final String BOB = "person:0123456789abcdef";
  public static final String KNOWS = "knows:fedcba9876543210";

  private MutationLines() {
    // Utility class
  }

  /**
   * Node DEFINE line.
   *
   * @param label the label
   * @param required required properties as a JSON array body, e.g. {@code "\"name\""}
   * @return the line
   */
  public static String defineNode(String label, String required) {
    return "{\"op\":\"DEFINE\",\"type\":\"node\",\"label\":\"" + label + "\","
        + "\"description\":\"A " + label + "\","
        + "\"required_properties\":[" + required + "],\"optional_properties\":[]}";
  }

  /**
   * Edge DEFINE line.
   *
   * @param label the label
   * @return the line
   */
  public static String defineEdge(String label) {
    return "{\"op\":\"DEFINE\",\"type\":\"edge\",\"label\":\"" + label + "\","
        + "\"description\":\"A " + label + " relationship\","
        + "\"required_properties\":[],\"optional_properties\":[]}";
  }

  /**
   * Node CREATE line with provenance.
   *
   * @param id the id
   * @param label the label
   * @param name the name property
   * @return the line
   */
  public static String createNode(String id, String label, String name) {
    return "{\"op\":\"CREATE\",\"type\":\"node\",\"label\":\"" + label + "\",\"id\":\"" + id
        + "\",\"set_properties\":{\"name\":\"" + name
        + "\",\"data_source_id\":\"ds1\",\"source_path\":\"p.md\"}}";
  }

  /**
   * Edge CREATE line with provenance.
   *
   * @param id the id
   * @param label the label
   * @param startId start node
   * @param endId end node
   * @return the line
   */
  public static String createEdge(String id, String label, String startId, String endId) {
    return "{\"op\":\"CREATE\",\"type\":\"edge\",\"label\":\"" + label + "\",\"id\":\"" + id
        + "\",\"start_id\":\"" + startId + "\",\"end_id\":\"" + endId
        + "\",\"set_properties\":{\"since\":2020,"
        + "\"data_source_id\":\"ds1\",\"source_path\":\"p.md\"}}";
  }

  /**
   * UPDATE line.
   *
   * @param type node or edge
   * @param id the id
   * @param setJson set_properties object body, e.g. {@code "\"a\":1"}
   * @param removeJson remove_properties array body, e.g. {@code "\"a\""}
   * @return the line
   */
  public static String update(String type, String id, String setJson, String removeJson) {
    return "{\"op\":\"UPDATE\",\"type\":\"" + type + "\",\"id\":\"" + id
        + "\",\"set_properties\":{" + setJson + "},\"remove_properties\":[" + removeJson + "]}";
  }

  /**
   * DELETE line.
   *
   * @param type node or edge
   * @param id the id
   * @return the line
   */
  public static String delete(String type, String id) {
    return "{\"op\":\"DELETE\",\"type\":\"" + type + "\",\"id\":\"" + id + "\"}";
  }

  /**
   * Joins lines into a batch.
   *
   * @param lines the lines
   * @return the batch text
   */
  public static String batch(String... lines) {
    return String.join("\n", lines) + "\n";
  }
}
