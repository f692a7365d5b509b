package org.edsim.derby;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import org.apache.derby.jdbc.EmbeddedDriver;
import org.apache.log4j.Logger;
import org.edsim.events.HospitalSnapshot;
import org.edsim.events.SimulationEvent;
import org.edsim.publish.EventSink;

/**
 * DerbyEventStore - embedded analysis database for a simulation run
 *
 * ================================================================================
 * TABLES
 * ================================================================================
 *
 * SIM_EVENTS          one row per published event, typed columns for the common
 *                     fields plus the full JSON payload
 * HOSPITAL_SNAPSHOTS  one row per hospital per sampling instant
 *
 * Tables are created on first use and kept otherwise, so several runs can
 * share one database. Writes come from the publisher worker thread; the
 * query methods are for after the run.
 */
public class DerbyEventStore implements EventSink {

	private static final Logger logger = Logger.getLogger(DerbyEventStore.class);

	public static final String EVENTS_TABLE = "SIM_EVENTS";
	public static final String SNAPSHOTS_TABLE = "HOSPITAL_SNAPSHOTS";

	private static final int PAYLOAD_LENGTH = 4000;

	private final String dbUrl;
	private final Connection connection;
	private final PreparedStatement insertEvent;
	private final PreparedStatement insertSnapshot;
	private long eventRows;
	private long snapshotRows;
	private boolean closed;

	public DerbyEventStore(String dbUrl) throws SQLException {
		this(dbUrl, connect(dbUrl));
	}

	/**
	 * Takes ownership of the connection: it is closed here if the schema or
	 * the insert statements cannot be prepared.
	 */
	DerbyEventStore(String dbUrl, Connection connection) throws SQLException {
		this.dbUrl = dbUrl;
		this.connection = connection;
		PreparedStatement events = null;
		PreparedStatement snapshots = null;
		try {
			try (Statement statement = connection.createStatement()) {
				createTables(statement);
			}
			events = connection.prepareStatement("INSERT INTO " + EVENTS_TABLE
					+ " (KIND, HOSPITAL_ID, PATIENT_ID, SIM_TIME, TRIAGE_LEVEL, PAYLOAD) VALUES (?, ?, ?, ?, ?, ?)");
			snapshots = connection.prepareStatement("INSERT INTO " + SNAPSHOTS_TABLE
					+ " (HOSPITAL_ID, SIM_TIME, CONSULTATION_OCCUPIED, CONSULTATION_CAPACITY, CONSULTATION_QUEUE,"
					+ " OBSERVATION_OCCUPIED, OBSERVATION_CAPACITY, MEAN_CONSULTATION_WAIT, ARRIVALS_LAST_HOUR,"
					+ " TREATED_LAST_HOUR, SATURATION, EMERGENCY_ACTIVE, PAYLOAD)"
					+ " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)");
		} catch (SQLException e) {
			logger.error("Cannot prepare Derby analysis store " + dbUrl + ": " + e.getMessage());
			closeAfterFailure(events, e);
			closeAfterFailure(snapshots, e);
			closeAfterFailure(connection, e);
			throw e;
		}
		this.insertEvent = events;
		this.insertSnapshot = snapshots;
		logger.info("Connected to Derby analysis store: " + dbUrl);
	}

	private static Connection connect(String dbUrl) throws SQLException {
		DriverManager.registerDriver(new EmbeddedDriver());
		return DriverManager.getConnection(dbUrl);
	}

	private static void closeAfterFailure(AutoCloseable resource, SQLException failure) {
		if (resource == null) {
			return;
		}
		try {
			resource.close();
		} catch (Exception e) {
			failure.addSuppressed(e);
		}
	}

	// =========================================================================
	// SCHEMA
	// =========================================================================

	private void createTables(Statement statement) throws SQLException {
		String createEventsSQL = "CREATE TABLE " + EVENTS_TABLE + " ("
				+ "ID BIGINT NOT NULL GENERATED ALWAYS AS IDENTITY,"
				+ "KIND VARCHAR(32) NOT NULL,"
				+ "HOSPITAL_ID VARCHAR(64),"
				+ "PATIENT_ID VARCHAR(64),"
				+ "SIM_TIME DOUBLE NOT NULL,"
				+ "TRIAGE_LEVEL VARCHAR(16),"
				+ "PAYLOAD VARCHAR(" + PAYLOAD_LENGTH + "),"
				+ "PRIMARY KEY (ID))";
		manageTable(statement, EVENTS_TABLE, createEventsSQL);

		String createSnapshotsSQL = "CREATE TABLE " + SNAPSHOTS_TABLE + " ("
				+ "ID BIGINT NOT NULL GENERATED ALWAYS AS IDENTITY,"
				+ "HOSPITAL_ID VARCHAR(64) NOT NULL,"
				+ "SIM_TIME DOUBLE NOT NULL,"
				+ "CONSULTATION_OCCUPIED INT,"
				+ "CONSULTATION_CAPACITY INT,"
				+ "CONSULTATION_QUEUE INT,"
				+ "OBSERVATION_OCCUPIED INT,"
				+ "OBSERVATION_CAPACITY INT,"
				+ "MEAN_CONSULTATION_WAIT DOUBLE,"
				+ "ARRIVALS_LAST_HOUR INT,"
				+ "TREATED_LAST_HOUR INT,"
				+ "SATURATION DOUBLE,"
				+ "EMERGENCY_ACTIVE BOOLEAN,"
				+ "PAYLOAD VARCHAR(" + PAYLOAD_LENGTH + "),"
				+ "PRIMARY KEY (ID))";
		manageTable(statement, SNAPSHOTS_TABLE, createSnapshotsSQL);
	}

	private boolean tableExists(Statement statement, String tableName) throws SQLException {
		try (ResultSet rs = statement.getConnection().getMetaData().getTables(null, null, tableName.toUpperCase(), null)) {
			return rs.next();
		}
	}

	private void manageTable(Statement statement, String tableName, String createSQL) throws SQLException {
		if (tableExists(statement, tableName)) {
			logger.info("Table " + tableName + " already exists");
		} else {
			statement.execute(createSQL);
			logger.info("Table " + tableName + " created successfully");
		}
	}

	// =========================================================================
	// WRITES
	// =========================================================================

	@Override
	public synchronized void write(SimulationEvent event) throws SQLException {
		insertEvent.setString(1, event.getKind().name());
		insertEvent.setString(2, event.getHospitalId());
		insertEvent.setString(3, event.getPatientId());
		insertEvent.setDouble(4, event.getTimestamp());
		insertEvent.setString(5, event.getTriageLevel() == null ? null : event.getTriageLevel().name());
		insertEvent.setString(6, truncate(event.toJson()));
		insertEvent.executeUpdate();
		eventRows++;
	}

	@Override
	public synchronized void write(HospitalSnapshot snapshot) throws SQLException {
		insertSnapshot.setString(1, snapshot.getHospitalId());
		insertSnapshot.setDouble(2, snapshot.getTimestamp());
		insertSnapshot.setInt(3, snapshot.getConsultationOccupied());
		insertSnapshot.setInt(4, snapshot.getConsultationCapacity());
		insertSnapshot.setInt(5, snapshot.getConsultationQueue());
		insertSnapshot.setInt(6, snapshot.getObservationOccupied());
		insertSnapshot.setInt(7, snapshot.getObservationCapacity());
		insertSnapshot.setDouble(8, snapshot.getMeanConsultationWait());
		insertSnapshot.setInt(9, snapshot.getArrivalsLastHour());
		insertSnapshot.setInt(10, snapshot.getTreatedLastHour());
		insertSnapshot.setDouble(11, snapshot.getSaturation());
		insertSnapshot.setBoolean(12, snapshot.isEmergencyActive());
		insertSnapshot.setString(13, truncate(snapshot.toJson()));
		insertSnapshot.executeUpdate();
		snapshotRows++;
	}

	private static String truncate(String payload) {
		return payload.length() <= PAYLOAD_LENGTH ? payload : payload.substring(0, PAYLOAD_LENGTH);
	}

	// =========================================================================
	// QUERIES
	// =========================================================================

	public synchronized int countEvents() throws SQLException {
		return count("SELECT COUNT(*) FROM " + EVENTS_TABLE, null);
	}

	public synchronized int countEvents(String kind) throws SQLException {
		return count("SELECT COUNT(*) FROM " + EVENTS_TABLE + " WHERE KIND = ?", kind);
	}

	public synchronized int countSnapshots(String hospitalId) throws SQLException {
		return count("SELECT COUNT(*) FROM " + SNAPSHOTS_TABLE + " WHERE HOSPITAL_ID = ?", hospitalId);
	}

	/** Mean saturation of one hospital over its stored snapshots; 0 when there are none. */
	public synchronized double meanSaturation(String hospitalId) throws SQLException {
		String sql = "SELECT AVG(SATURATION) FROM " + SNAPSHOTS_TABLE + " WHERE HOSPITAL_ID = ?";
		try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
			pstmt.setString(1, hospitalId);
			try (ResultSet rs = pstmt.executeQuery()) {
				return rs.next() ? rs.getDouble(1) : 0.0;
			}
		}
	}

	private int count(String sql, String parameter) throws SQLException {
		try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
			if (parameter != null) {
				pstmt.setString(1, parameter);
			}
			try (ResultSet rs = pstmt.executeQuery()) {
				return rs.next() ? rs.getInt(1) : 0;
			}
		}
	}

	// =========================================================================
	// RESOURCE CLEANUP
	// =========================================================================

	@Override
	public synchronized void close() {
		if (closed) {
			return;
		}
		closed = true;
		closeStatement(insertEvent);
		closeStatement(insertSnapshot);
		try {
			connection.close();
		} catch (SQLException e) {
			logger.error("Error closing Derby connection " + dbUrl, e);
		}
		logger.info(String.format("DERBY_STORE_CLOSED: events=%d, snapshots=%d", eventRows, snapshotRows));
	}

	private void closeStatement(Statement statement) {
		try {
			statement.close();
		} catch (SQLException e) {
			logger.error("Error closing statement", e);
		}
	}

	public long getEventRows() {
		return eventRows;
	}

	public long getSnapshotRows() {
		return snapshotRows;
	}

	public boolean isClosed() {
		return closed;
	}
}
