package org.springaicommunity.commitwatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite implementation of {@link CheckpointStore}.
 *
 * <p>
 * Each identity gets its own table of {@code (id INTEGER PRIMARY KEY AUTOINCREMENT,
 * scan_date TEXT)} rows. Timestamps are written as ISO-8601 instants. Rows written as
 * zone-less local date-times are read in the clock's zone.
 */
public class SqliteCheckpointStore implements CheckpointStore {

	private static final Logger logger = LoggerFactory.getLogger(SqliteCheckpointStore.class);

	private final Path databaseFile;

	private final Clock clock;

	private final Duration lookback;

	public SqliteCheckpointStore(Path databaseFile, Clock clock, Duration lookback) {
		this.databaseFile = databaseFile;
		this.clock = clock;
		this.lookback = lookback;
	}

	@Override
	public Instant getLastScan(ScanIdentity identity, boolean freshMirror) {
		if (freshMirror) {
			Instant since = clock.instant().minus(lookback);
			logger.info("Fresh mirror for {}, scanning the last {} days (since {})", identity, lookback.toDays(),
					since);
			return since;
		}
		Optional<ScanCheckpoint> latest = latest(identity);
		if (latest.isEmpty()) {
			logger.info("No checkpoint recorded for {}, scanning full history", identity);
			return Instant.EPOCH;
		}
		logger.info("Last checkpoint for {}: {}", identity, latest.get().scanTimestamp());
		return latest.get().scanTimestamp();
	}

	@Override
	public void recordScan(ScanIdentity identity, Instant timestamp) {
		String sql = "INSERT INTO " + quote(identity.tableName()) + " (scan_date) VALUES (?)";
		try (Connection connection = open(identity); PreparedStatement statement = connection.prepareStatement(sql)) {
			statement.setString(1, timestamp.toString());
			statement.executeUpdate();
			logger.info("Recorded checkpoint {} for {}", timestamp, identity);
		}
		catch (SQLException e) {
			throw new CheckpointStoreException("Failed to record checkpoint for " + identity + " in " + databaseFile,
					e);
		}
	}

	@Override
	public Optional<ScanCheckpoint> latest(ScanIdentity identity) {
		String sql = "SELECT id, scan_date FROM " + quote(identity.tableName()) + " ORDER BY id DESC LIMIT 1";
		List<ScanCheckpoint> rows = query(identity, sql);
		return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
	}

	@Override
	public List<ScanCheckpoint> history(ScanIdentity identity) {
		return query(identity, "SELECT id, scan_date FROM " + quote(identity.tableName()) + " ORDER BY id ASC");
	}

	private List<ScanCheckpoint> query(ScanIdentity identity, String sql) {
		try (Connection connection = open(identity);
				Statement statement = connection.createStatement();
				ResultSet resultSet = statement.executeQuery(sql)) {
			List<ScanCheckpoint> rows = new ArrayList<>();
			while (resultSet.next()) {
				rows.add(new ScanCheckpoint(resultSet.getLong("id"), parseTimestamp(resultSet.getString("scan_date"))));
			}
			return rows;
		}
		catch (SQLException e) {
			throw new CheckpointStoreException("Failed to read checkpoints for " + identity + " from " + databaseFile,
					e);
		}
	}

	private Connection open(ScanIdentity identity) throws SQLException {
		try {
			Path parent = databaseFile.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
		}
		catch (Exception e) {
			throw new SQLException("Cannot create directory for " + databaseFile, e);
		}

		Connection connection = DriverManager.getConnection("jdbc:sqlite:" + databaseFile);
		try (Statement statement = connection.createStatement()) {
			statement.execute("CREATE TABLE IF NOT EXISTS " + quote(identity.tableName())
					+ " (id INTEGER PRIMARY KEY AUTOINCREMENT, scan_date TEXT NOT NULL)");
		}
		catch (SQLException e) {
			connection.close();
			throw e;
		}
		return connection;
	}

	private Instant parseTimestamp(String value) {
		try {
			return Instant.parse(value);
		}
		catch (DateTimeParseException e) {
			try {
				return LocalDateTime.parse(value).atZone(clock.getZone()).toInstant();
			}
			catch (DateTimeParseException inner) {
				throw new CheckpointStoreException("Unreadable checkpoint timestamp: " + value, inner);
			}
		}
	}

	static String quote(String identifier) {
		return "\"" + identifier.replace("\"", "\"\"") + "\"";
	}

}
