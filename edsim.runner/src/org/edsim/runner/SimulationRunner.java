package org.edsim.runner;

import java.io.File;
import java.sql.SQLException;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.edsim.config.SimulationConfig;
import org.edsim.config.SimulationConfigLoader;
import org.edsim.derby.DerbyEventStore;
import org.edsim.events.EventPublisher;
import org.edsim.exceptions.ConfigurationException;
import org.edsim.publish.AsyncEventPublisher;

/**
 * Command-line entry point.
 *
 * <pre>
 * java org.edsim.runner.SimulationRunner [-config file.xml] [-duration minutes] [-seed n]
 *                                        [-timescale s] [-derby jdbcUrl] [-quiet]
 * </pre>
 *
 * Without -config the bundled simulation.xml is used. A time scale above zero
 * paces the clock (simulated minutes per wall-clock second) and enables
 * operator commands on standard input; see {@link ConsoleControlReader}.
 * Exit status is 1 when the configuration is rejected, 2 on a usage error.
 */
public class SimulationRunner {

	private static final Logger logger = Logger.getLogger(SimulationRunner.class);

	private static final String USAGE = "Usage: java org.edsim.runner.SimulationRunner [-config <file>] [-duration <minutes>]"
			+ " [-seed <n>] [-timescale <simulated minutes per second>] [-derby <jdbcUrl>] [-quiet]";

	private String configPath;
	private Double duration;
	private Long seed;
	private Double timeScale;
	private String derbyUrl;
	private boolean quiet;

	public static void main(String[] args) {
		SimulationRunner runner = new SimulationRunner();
		try {
			runner.parseArguments(args);
		} catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.err.println(USAGE);
			System.exit(2);
			return;
		}
		try {
			runner.execute();
		} catch (ConfigurationException e) {
			logger.error("CONFIGURATION_REJECTED: " + e);
			System.err.println("Configuration error: " + e.getMessage());
			System.exit(1);
		}
	}

	void parseArguments(String[] args) {
		for (int i = 0; i < args.length; i++) {
			String arg = args[i].toLowerCase();
			switch (arg) {
				case "-config":
				case "--config":
					configPath = valueAfter(args, i++);
					break;
				case "-duration":
				case "--duration":
					duration = parseDouble(arg, valueAfter(args, i++));
					break;
				case "-seed":
				case "--seed":
					try {
						seed = Long.valueOf(valueAfter(args, i++));
					} catch (NumberFormatException e) {
						throw new IllegalArgumentException("Invalid value for -seed: " + args[i]);
					}
					break;
				case "-timescale":
				case "--timescale":
					timeScale = parseDouble(arg, valueAfter(args, i++));
					break;
				case "-derby":
				case "--derby":
					derbyUrl = valueAfter(args, i++);
					break;
				case "-quiet":
				case "--quiet":
					quiet = true;
					break;
				default:
					throw new IllegalArgumentException("Unknown argument: " + args[i]);
			}
		}
	}

	private static String valueAfter(String[] args, int i) {
		if (i + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + args[i]);
		}
		return args[i + 1];
	}

	private static double parseDouble(String arg, String value) {
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid value for " + arg + ": " + value);
		}
	}

	/** Loads the configuration and applies the command-line overrides. */
	SimulationConfig buildConfig() throws ConfigurationException {
		SimulationConfigLoader loader = new SimulationConfigLoader();
		SimulationConfig config = configPath != null
				? loader.loadFile(new File(configPath))
				: loader.loadResource(SimulationConfigLoader.DEFAULT_RESOURCE);
		if (duration != null) {
			config.setDurationMinutes(duration);
		}
		if (seed != null) {
			config.setSeed(seed);
		}
		if (timeScale != null) {
			config.setTimeScale(timeScale);
		}
		if (derbyUrl != null) {
			config.setDerbySink(true);
			config.setDerbyUrl(derbyUrl);
		}
		if (quiet) {
			config.setJsonLogSink(false);
		}
		config.validate();
		return config;
	}

	void execute() throws ConfigurationException {
		SimulationConfig config = buildConfig();
		if (quiet) {
			Logger.getRootLogger().setLevel(Level.WARN);
		}
		HospitalNetworkSimulation simulation = HospitalNetworkSimulation.withConfiguredSinks(config);
		if (config.getTimeScale() > 0.0) {
			new ConsoleControlReader(System.in, simulation.getCoordinator().getInbox()).startDaemon();
			logger.info("CONSOLE_READY: commands on standard input take effect at the next coordinator tick");
		}
		try {
			simulation.run();
			System.out.println(simulation.summarize().format());
			reportDerby(simulation);
		} finally {
			simulation.close();
		}
	}

	private void reportDerby(HospitalNetworkSimulation simulation) {
		DerbyEventStore store = simulation.getDerbyStore();
		if (store == null) {
			return;
		}
		EventPublisher publisher = simulation.getContext().getPublisher();
		try {
			if (publisher instanceof AsyncEventPublisher && !((AsyncEventPublisher) publisher).flush(10000)) {
				logger.warn("DERBY_FLUSH_TIMEOUT: counts below may be incomplete");
			}
			System.out.println(String.format("Derby store: events=%d, arrivals=%d, diversions=%d",
					store.countEvents(), store.countEvents("ARRIVAL"), store.countEvents("DIVERSION")));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("DERBY_REPORT_INTERRUPTED");
		} catch (SQLException e) {
			logger.error("Error querying Derby store", e);
		}
	}
}
