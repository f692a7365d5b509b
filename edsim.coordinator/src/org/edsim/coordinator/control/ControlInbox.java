package org.edsim.coordinator.control;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.log4j.Logger;
import org.edsim.coordinator.HospitalCoordinator;
import org.edsim.exceptions.InvalidInputException;

/**
 * Thread-safe mailbox for runtime inputs. Any thread may submit; only the
 * simulation thread drains, so commands never race with the engine.
 * A rejected command is logged and counted; it changes nothing.
 */
public class ControlInbox {

    private static final Logger logger = Logger.getLogger(ControlInbox.class);

    private final ConcurrentLinkedQueue<ControlCommand> pending = new ConcurrentLinkedQueue<>();
    private final AtomicLong submitted = new AtomicLong();
    private long applied;
    private long rejected;

    public void submit(ControlCommand command) {
        pending.add(command);
        submitted.incrementAndGet();
    }

    /**
     * Applies every pending command in submission order.
     *
     * @return number of commands applied successfully
     */
    public int drain(HospitalCoordinator coordinator) {
        int ok = 0;
        ControlCommand command;
        while ((command = pending.poll()) != null) {
            try {
                command.apply(coordinator);
                applied++;
                ok++;
                logger.info(String.format("CONTROL_APPLIED: t=%.2f, %s", coordinator.getContext().now(), command.describe()));
            } catch (InvalidInputException e) {
                rejected++;
                logger.warn(String.format("CONTROL_REJECTED: t=%.2f, %s, reason=%s",
                        coordinator.getContext().now(), command.describe(), e));
            }
        }
        return ok;
    }

    public int getPendingCount() {
        return pending.size();
    }

    public long getSubmittedCount() {
        return submitted.get();
    }

    public long getAppliedCount() {
        return applied;
    }

    public long getRejectedCount() {
        return rejected;
    }
}
