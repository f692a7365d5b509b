package org.edsim.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import org.apache.log4j.Logger;
import org.edsim.coordinator.control.ClearIncidentsCommand;
import org.edsim.coordinator.control.ControlCommand;
import org.edsim.coordinator.control.ControlInbox;
import org.edsim.coordinator.control.DemandSignalCommand;
import org.edsim.coordinator.control.InjectIncidentCommand;
import org.edsim.coordinator.control.StaffAssignmentCommand;
import org.edsim.demand.DemandSignal;
import org.edsim.exceptions.InvalidInputException;
import org.edsim.model.GeoLocation;
import org.edsim.model.Incident;
import org.edsim.model.IncidentType;

/**
 * Reads operator commands, one per line, and submits them to the control
 * inbox. Runs on its own daemon thread; the commands take effect at the next
 * coordinator tick.
 *
 * <pre>
 * incident &lt;id&gt; &lt;TYPE&gt; &lt;lat&gt; &lt;lon&gt; &lt;patients&gt; [durationMinutes]
 * clear [incidentId]
 * demand &lt;hospital&gt; &lt;temperatureC&gt; &lt;precipitationMm&gt; &lt;eventLoad&gt; &lt;holiday&gt;
 * staff &lt;hospital&gt; &lt;room|all&gt; &lt;doctors&gt;
 * </pre>
 */
public class ConsoleControlReader implements Runnable {

	private static final Logger logger = Logger.getLogger(ConsoleControlReader.class);

	private final InputStream in;
	private final ControlInbox inbox;

	public ConsoleControlReader(InputStream in, ControlInbox inbox) {
		this.in = in;
		this.inbox = inbox;
	}

	public Thread startDaemon() {
		Thread thread = new Thread(this, "edsim-console");
		thread.setDaemon(true);
		thread.start();
		return thread;
	}

	@Override
	public void run() {
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (line.trim().isEmpty() || line.trim().startsWith("#")) {
					continue;
				}
				try {
					ControlCommand command = parse(line);
					inbox.submit(command);
					logger.info("CONSOLE_SUBMITTED: " + command.describe());
				} catch (InvalidInputException e) {
					logger.warn("CONSOLE_REJECTED: line='" + line.trim() + "', reason=" + e.getMessage());
				}
			}
		} catch (IOException e) {
			logger.error("Console input failed", e);
		}
	}

	/**
	 * Parses one command line.
	 *
	 * @throws InvalidInputException for unknown commands and malformed arguments
	 */
	public static ControlCommand parse(String line) throws InvalidInputException {
		String[] parts = line.trim().split("\\s+");
		String verb = parts[0].toLowerCase();
		switch (verb) {
			case "incident":
				expect(parts, 7, 8, "incident <id> <TYPE> <lat> <lon> <patients> [durationMinutes]");
				IncidentType type;
				try {
					type = IncidentType.valueOf(parts[2].toUpperCase());
				} catch (IllegalArgumentException e) {
					throw new InvalidInputException("Unknown incident type " + parts[2], "console");
				}
				Double duration = parts.length == 8 ? Double.valueOf(number(parts[7])) : null;
				return new InjectIncidentCommand(new Incident(parts[1], type,
						new GeoLocation(number(parts[3]), number(parts[4])),
						wholeNumber(parts[5]), 0.0, duration, null));

			case "clear":
				expect(parts, 1, 2, "clear [incidentId]");
				return parts.length == 2 ? new ClearIncidentsCommand(parts[1]) : new ClearIncidentsCommand();

			case "demand":
				expect(parts, 6, 6, "demand <hospital> <temperatureC> <precipitationMm> <eventLoad> <holiday>");
				return new DemandSignalCommand(parts[1], new DemandSignal(number(parts[2]), number(parts[3]),
						number(parts[4]), Boolean.parseBoolean(parts[5])));

			case "staff":
				expect(parts, 4, 4, "staff <hospital> <room|all> <doctors>");
				int room = "all".equalsIgnoreCase(parts[2]) ? StaffAssignmentCommand.ALL_ROOMS : wholeNumber(parts[2]);
				return new StaffAssignmentCommand(parts[1], room, wholeNumber(parts[3]));

			default:
				throw new InvalidInputException("Unknown command '" + parts[0] + "'", "console");
		}
	}

	private static void expect(String[] parts, int min, int max, String usage) throws InvalidInputException {
		if (parts.length < min || parts.length > max) {
			throw new InvalidInputException("Usage: " + usage, "console");
		}
	}

	private static double number(String text) throws InvalidInputException {
		try {
			return Double.parseDouble(text);
		} catch (NumberFormatException e) {
			throw new InvalidInputException("Not a number: " + text, "console");
		}
	}

	private static int wholeNumber(String text) throws InvalidInputException {
		try {
			return Integer.parseInt(text);
		} catch (NumberFormatException e) {
			throw new InvalidInputException("Not a whole number: " + text, "console");
		}
	}
}
