package org.edsim.publish;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.log4j.Logger;
import org.edsim.events.EventPublisher;
import org.edsim.events.HospitalSnapshot;
import org.edsim.events.SimulationEvent;

/**
 * AsyncEventPublisher
 * Decouples the simulation thread from the sinks.
 *
 * Items go into a bounded buffer and a daemon worker hands them to every
 * sink in order. When the buffer is full the item is dropped and counted;
 * publish never blocks the clock. A sink that throws is logged and counted,
 * and the remaining sinks still receive the item.
 */
public class AsyncEventPublisher implements EventPublisher {

	private static final Logger logger = Logger.getLogger(AsyncEventPublisher.class);

	private static final long POLL_MS = 100;
	private static final long CLOSE_WAIT_MS = 5000;

	private final BlockingQueue<Object> buffer;
	private final List<EventSink> sinks;
	private final Thread worker;

	private final AtomicLong accepted = new AtomicLong();
	private final AtomicLong delivered = new AtomicLong();
	private final AtomicLong dropped = new AtomicLong();
	private final AtomicLong failures = new AtomicLong();

	private volatile boolean closing;
	private boolean closed;

	public AsyncEventPublisher(int capacity, List<EventSink> sinks) {
		this.buffer = new ArrayBlockingQueue<>(capacity);
		this.sinks = Collections.unmodifiableList(new ArrayList<>(sinks));
		this.worker = new Thread(new Runnable() {
			@Override
			public void run() {
				drainLoop();
			}
		}, "edsim-publisher");
		this.worker.setDaemon(true);
		this.worker.start();
		logger.info(String.format("PUBLISHER_STARTED: capacity=%d, sinks=%d", capacity, this.sinks.size()));
	}

	// ========== EventPublisher ==========

	@Override
	public void publish(SimulationEvent event) {
		enqueue(event);
	}

	@Override
	public void publish(HospitalSnapshot snapshot) {
		enqueue(snapshot);
	}

	private void enqueue(Object item) {
		if (closing) {
			dropped.incrementAndGet();
			return;
		}
		if (buffer.offer(item)) {
			accepted.incrementAndGet();
		} else {
			long count = dropped.incrementAndGet();
			// one line per thousand drops is enough to notice
			if (count % 1000 == 1) {
				logger.warn(String.format("PUBLISH_DROPPED: dropped=%d, capacity=%d", count, buffer.remainingCapacity() + buffer.size()));
			}
		}
	}

	/**
	 * Waits until everything accepted so far has been delivered.
	 *
	 * @return false if the timeout elapsed first
	 */
	public boolean flush(long timeoutMillis) throws InterruptedException {
		long deadline = System.currentTimeMillis() + timeoutMillis;
		while (delivered.get() < accepted.get()) {
			if (System.currentTimeMillis() >= deadline) {
				return false;
			}
			Thread.sleep(5);
		}
		return true;
	}

	/**
	 * Stops accepting items, lets the worker deliver what is buffered, then
	 * closes the sinks.
	 */
	@Override
	public synchronized void close() {
		if (closed) {
			return;
		}
		closed = true;
		closing = true;
		try {
			worker.join(CLOSE_WAIT_MS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("PUBLISHER_CLOSE_INTERRUPTED: buffered=" + buffer.size());
		}
		if (worker.isAlive()) {
			logger.warn("PUBLISHER_CLOSE_TIMEOUT: buffered=" + buffer.size());
		}
		for (EventSink sink : sinks) {
			sink.close();
		}
		logger.info(String.format("PUBLISHER_CLOSED: accepted=%d, delivered=%d, dropped=%d, failures=%d",
				accepted.get(), delivered.get(), dropped.get(), failures.get()));
	}

	// ========== Worker ==========

	private void drainLoop() {
		while (true) {
			Object item;
			try {
				item = buffer.poll(POLL_MS, TimeUnit.MILLISECONDS);
			} catch (InterruptedException e) {
				logger.warn("PUBLISHER_INTERRUPTED: buffered=" + buffer.size());
				return;
			}
			if (item == null) {
				if (closing) {
					return;
				}
				continue;
			}
			deliver(item);
		}
	}

	private void deliver(Object item) {
		for (EventSink sink : sinks) {
			try {
				if (item instanceof SimulationEvent) {
					sink.write((SimulationEvent) item);
				} else {
					sink.write((HospitalSnapshot) item);
				}
			} catch (Exception e) {
				failures.incrementAndGet();
				logger.error("SINK_FAILURE: sink=" + sink.getClass().getSimpleName() + ", item=" + item, e);
			}
		}
		delivered.incrementAndGet();
	}

	// ========== Query Methods ==========

	public long getAcceptedCount() {
		return accepted.get();
	}

	public long getDeliveredCount() {
		return delivered.get();
	}

	public long getDroppedCount() {
		return dropped.get();
	}

	public long getFailureCount() {
		return failures.get();
	}

	public int getBufferedCount() {
		return buffer.size();
	}

	public boolean isClosed() {
		return closed;
	}
}
