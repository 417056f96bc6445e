package com.branchat.backend.shared.vector;

/** Table layout of a pgvector-backed store. The schema itself is managed by Liquibase. */
public class VectorStorage {

  private String vectorTable;

  /** Must match the output size of the embedding model and the {@code vector(n)} column. */
  private int dimensions = 1536;

  /** Validates the table and its dimensions on startup. */
  private boolean schemaValidation = false;

  public VectorStorage() {}

  public VectorStorage(String vectorTable) {
    this.vectorTable = vectorTable;
  }

  public String getVectorTable() {
    return vectorTable;
  }

  public void setVectorTable(String vectorTable) {
    this.vectorTable = vectorTable;
  }

  public int getDimensions() {
    return dimensions;
  }

  public void setDimensions(int dimensions) {
    this.dimensions = dimensions;
  }

  public boolean isSchemaValidation() {
    return schemaValidation;
  }

  public void setSchemaValidation(boolean schemaValidation) {
    this.schemaValidation = schemaValidation;
  }
}
