package io.intellixity.dynaq.jdbc;

import io.intellixity.dynaq.error.SchemaResolutionException;
import io.intellixity.dynaq.schema.ForeignKey;
import io.intellixity.dynaq.schema.SchemaLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves INCLUDE keys from the database's declared foreign keys.
 * <p>
 * For {@code (tableA, tableB)} it looks for a key imported by {@code tableB} that references
 * {@code tableA}: the result's parent key is the referenced column, the child key the referencing one.
 * Table names are tried as given, then upper- and lower-cased, since catalogs differ in how they
 * store unquoted identifiers.
 */
public final class JdbcSchemaLookup implements SchemaLookup {
  private static final Logger log = LoggerFactory.getLogger(JdbcSchemaLookup.class);

  private final DataSource ds;
  private final String catalog;
  private final String schema;

  public JdbcSchemaLookup(DataSource ds, String catalog, String schema) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.catalog = catalog;
    this.schema = schema;
  }

  public JdbcSchemaLookup(DataSource ds) {
    this(ds, null, null);
  }

  @Override
  public Optional<ForeignKey> resolveForeignKey(String tableA, String tableB) {
    try (Connection c = ds.getConnection()) {
      DatabaseMetaData md = c.getMetaData();
      for (String child : spellings(tableB)) {
        Optional<ForeignKey> fk = imported(md, child, tableA);
        if (fk.isPresent()) {
          if (log.isDebugEnabled()) {
            log.debug("dynaq.schema parent={} child={} parentKey={} childKey={}",
                tableA, tableB, fk.get().parentKey(), fk.get().childKey());
          }
          return fk;
        }
      }
      return Optional.empty();
    } catch (SQLException e) {
      throw new SchemaResolutionException(tableA, tableB, e);
    }
  }

  private Optional<ForeignKey> imported(DatabaseMetaData md, String childTable, String parentTable) throws SQLException {
    try (ResultSet rs = md.getImportedKeys(catalog, schema, childTable)) {
      while (rs.next()) {
        String pkTable = rs.getString("PKTABLE_NAME");
        if (pkTable != null && pkTable.equalsIgnoreCase(parentTable)) {
          return Optional.of(new ForeignKey(rs.getString("PKCOLUMN_NAME"), rs.getString("FKCOLUMN_NAME")));
        }
      }
    }
    return Optional.empty();
  }

  private static String[] spellings(String table) {
    String upper = table.toUpperCase(java.util.Locale.ROOT);
    String lower = table.toLowerCase(java.util.Locale.ROOT);
    if (table.equals(upper) && table.equals(lower)) return new String[] {table};
    if (table.equals(lower)) return new String[] {table, upper};
    if (table.equals(upper)) return new String[] {table, lower};
    return new String[] {table, upper, lower};
  }
}
