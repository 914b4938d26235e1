package io.intellixity.dynaq.error;

/** An INCLUDE hop for which no foreign key pair exists in either direction. */
public final class SchemaResolutionException extends DslException {
  private final String tableA;
  private final String tableB;

  public SchemaResolutionException(String tableA, String tableB) {
    super("No foreign key relationship found between '" + tableA + "' and '" + tableB + "'");
    this.tableA = tableA;
    this.tableB = tableB;
  }

  public SchemaResolutionException(String tableA, String tableB, Throwable cause) {
    super("Schema lookup failed for '" + tableA + "' and '" + tableB + "': " + cause.getMessage(), cause);
    this.tableA = tableA;
    this.tableB = tableB;
  }

  public String tableA() { return tableA; }
  public String tableB() { return tableB; }
}
