package org.rttrail.init;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;

import lombok.RequiredArgsConstructor;

/** Migration running the script {@code db_migrations/<id>.sql}. */
@RequiredArgsConstructor
public class DatabaseMigration implements Migration {

	private final String id;
	
	@Override
	public String id() {
		return id;
	}
	
	@Override
	public void execute(R2dbcEntityTemplate db) throws Exception {
		try (InputStream in = DatabaseMigration.class.getClassLoader().getResourceAsStream("db_migrations/" + id + ".sql")) {
			if (in == null) throw new IllegalStateException("Missing migration script " + id);
			String sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
			db.getDatabaseClient().sql(sql).then().block();
		}
	}
	
}
