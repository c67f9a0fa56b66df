package space.ketterling.dataviento.db;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies an idempotent DDL script from the classpath at startup.
 */
public final class SchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    private SchemaInitializer() {
    }

    /**
     * Runs every statement in the script in one transaction. A blank script
     * name means the schema is managed elsewhere.
     */
    public static void apply(HikariDataSource ds, String script) throws Exception {
        if (script == null || script.isBlank()) {
            log.info("Schema init skipped (no script configured)");
            return;
        }
        List<String> statements = split(readScript(script));
        try (Connection c = ds.getConnection()) {
            boolean auto = c.getAutoCommit();
            c.setAutoCommit(false);
            try (Statement st = c.createStatement()) {
                for (String sql : statements) {
                    st.execute(sql);
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(auto);
            }
        }
        log.info("Schema script {} applied ({} statements)", script, statements.size());
    }

    private static String readScript(String script) throws IOException {
        try (InputStream in = SchemaInitializer.class.getClassLoader().getResourceAsStream(script)) {
            if (in == null) {
                throw new IOException("Schema script not found on classpath: " + script);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Drops "--" comment lines, then splits on ';'.
     */
    static List<String> split(String text) {
        StringBuilder sb = new StringBuilder();
        for (String line : text.split("\\R")) {
            if (line.trim().startsWith("--"))
                continue;
            sb.append(line).append('\n');
        }
        List<String> out = new ArrayList<>();
        for (String part : sb.toString().split(";")) {
            if (!part.isBlank())
                out.add(part.trim());
        }
        return out;
    }
}
