package org.rttrail.init;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.rttrail.global.RttrailUtils;
import org.rttrail.user.UserService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;

import lombok.extern.slf4j.Slf4j;

/**
 * Creates the schema and applies the pending migrations, then the first administrator.
 * <p>
 * On a fresh database, the creation scripts already contain the latest schema so every known
 * migration is only recorded as done. On an existing database, only the missing tables are
 * created before the pending migrations run.
 */
@Slf4j(topic = RttrailUtils.LOG_ERROR)
@SuppressWarnings("java:S6813") // use autowired instead of constructor
public class InitDB {

	@Autowired private R2dbcEntityTemplate db;
	@Autowired private UserService userService;
	@Autowired private SuperuserProperties superuser;
	
	static final String MIGRATIONS_TABLE = "migrations";
	
	static final String[] TABLES = {
		"core_user", "core_user_unconfirmed", "core_user_recover_request", "core_user_email_migration_code",
		"poi", "poi_vote",
		"flappybird_score",
		MIGRATIONS_TABLE
	};
	
	static final Migration[] migrations = {
		new DatabaseMigration("0.2_core_user_add_is_active"),
		new DatabaseMigration("0.3_poi_vote_unique_poi_user"),
	};
	
	public void init() {
		boolean fresh = !tableExists(MIGRATIONS_TABLE);
		// existing tables only change through migrations
		for (var table : TABLES)
			if (fresh || !tableExists(table)) createTable(table);
		if (fresh) markMigrationsDone();
		else doMigrations();
		if (superuser.getEmail() != null && !superuser.getEmail().isBlank()) {
			userService.createSuperuser(superuser.getEmail(), superuser.getPassword(), superuser.getName()).block();
		}
	}
	
	private boolean tableExists(String tableName) {
		return Boolean.TRUE.equals(
			db.getDatabaseClient().sql("SELECT EXISTS (SELECT 1 FROM information_schema.tables WHERE table_schema = current_schema() AND table_name = $1)")
			.bind(0, tableName)
			.map((row, meta) -> row.get(0, Boolean.class))
			.one()
			.block()
		);
	}
	
	@SuppressWarnings("java:S112") // RuntimeException
	private void createTable(String tableName) {
		log.info("Create table {}", tableName);
		try (InputStream in = InitDB.class.getClassLoader().getResourceAsStream("db_init/" + tableName + ".sql")) {
			if (in == null) throw new IllegalStateException("Missing creation script for table " + tableName);
			String sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
			db.getDatabaseClient().sql(sql).then().block();
		} catch (Exception e) {
			log.error("Error creating table {}", tableName, e);
			throw new RuntimeException("Database initialization error", e);
		}
	}
	
	private void markMigrationsDone() {
		log.info("New database, {} migrations marked as done", migrations.length);
		for (var migration : migrations) recordMigration(migration);
	}
	
	@SuppressWarnings("java:S112") // RuntimeException
	private void doMigrations() {
		log.info("Retrieving migrations...");
		List<String> done = db.getDatabaseClient().sql("SELECT id FROM migrations ORDER BY id").map((row,meta) -> row.get(0, String.class)).all().collectList().block();
		List<Migration> todo = Arrays.stream(migrations).filter(m -> !done.contains(m.id())).toList();
		log.info("Migrations done: {}, to be executed: {}", done.size(), todo.size());
		for (var migration : todo) {
			try {
				log.info("Doing migration {}", migration.id());
				migration.execute(db);
				recordMigration(migration);
				log.info("Migration done: {}", migration.id());
			} catch (Exception e) {
				log.error("Error doing migration {}", migration.id(), e);
				throw new RuntimeException("Migration error", e);
			}
		}
	}
	
	private void recordMigration(Migration migration) {
		db.getDatabaseClient().sql("INSERT INTO migrations (id) VALUES ($1) ON CONFLICT DO NOTHING").bind(0, migration.id()).then().block();
	}
	
}
