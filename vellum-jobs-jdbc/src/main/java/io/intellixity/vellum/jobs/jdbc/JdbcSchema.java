package io.intellixity.vellum.jobs.jdbc;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Creates the job and error log tables from {@code schema-postgres.sql}. Idempotent. */
public final class JdbcSchema {
  static final String RESOURCE = "schema-postgres.sql";

  private JdbcSchema() {}

  public static void create(DataSource ds) {
    Objects.requireNonNull(ds, "ds");
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      for (String ddl : statements()) st.execute(ddl);
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  static List<String> statements() {
    String script;
    try (InputStream in = JdbcSchema.class.getResourceAsStream(RESOURCE)) {
      if (in == null) throw new IllegalStateException("Missing resource " + RESOURCE);
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + RESOURCE, e);
    }
    List<String> out = new ArrayList<>();
    for (String s : script.split(";")) {
      if (!s.isBlank()) out.add(s.strip());
    }
    return out;
  }
}
