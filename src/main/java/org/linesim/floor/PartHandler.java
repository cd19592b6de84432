package org.linesim.floor;

import org.linesim.runtime.EventType;
import org.linesim.runtime.Simulation;
import org.linesim.runtime.StateViolationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;

/**
 * A device that holds one part at a time for a cycle time before passing it downstream.
 * <p>
 * A part moves through two slots. It enters the input slot, stays there for one cycle and then
 * moves to the output slot, from where a {@link EventType#PASS_PART} event hands it downstream.
 * Only one slot is occupied at a time. A cycle of zero length moves the part to the output slot
 * right away.
 * </p>
 * <p>
 * {@link #shutdown()} parks the device's scheduled events so that {@link #restore()} continues
 * the same cycle. {@link #fail()} cancels them and loses the part in the input slot; a part that
 * already reached the output slot is kept.
 * </p>
 */
public class PartHandler extends PartFlowController {

    /**
     * Called when a device shuts down or fails.
     */
    @FunctionalInterface
    public interface ShutdownCallback {
        /**
         * @param device   the device
         * @param failure  true for {@link #fail()}, false for {@link #shutdown()}
         * @param lostPart the part lost by a failure, or null
         */
        void onShutdown(PartHandler device, boolean failure, Part lostPart);
    }

    protected Part input;
    protected Part output;
    private DoubleSupplier cycleTime;
    private double nextCycleTimeOffset = 0.0;
    private Double waitingSince;
    private boolean waitingForDownstreamSpace = false;
    private DeviceState state = DeviceState.OPERATIONAL;
    private final List<BiConsumer<PartHandler, Part>> receivedPartCallbacks = new ArrayList<>();
    private final List<ShutdownCallback> shutdownCallbacks = new ArrayList<>();
    private final List<Consumer<PartHandler>> restoredCallbacks = new ArrayList<>();

    /**
     * Creates a part handler.
     *
     * @param simulation simulation the device belongs to
     * @param name       name of the device, or null for a generated one
     * @param cycleTime  how long a part is held, at least 0
     * @param value      starting value
     */
    public PartHandler(Simulation simulation, String name, double cycleTime, double value) {
        super(simulation, name, value);
        setCycleTime(cycleTime);
    }

    public PartHandler(Simulation simulation, String name, double cycleTime) {
        this(simulation, name, cycleTime, 0.0);
    }

    @Override
    protected void onInitialize() {
        waitingSince = getSimulation().getNow();
    }

    @Override
    public boolean isOperational() {
        return state == DeviceState.OPERATIONAL;
    }

    public DeviceState getState() {
        return state;
    }

    /**
     * Sets a constant cycle time for all cycles that start from now on.
     *
     * @param cycleTime cycle time, at least 0
     */
    public void setCycleTime(double cycleTime) {
        if (Double.isNaN(cycleTime) || cycleTime < 0) {
            throw new IllegalArgumentException("Cycle time must be >= 0, got " + cycleTime);
        }
        this.cycleTime = () -> cycleTime;
    }

    /**
     * Samples the cycle time of every cycle from a function. Negative samples count as 0.
     *
     * @param sampler cycle time sampler
     */
    public void setCycleTime(DoubleSupplier sampler) {
        this.cycleTime = Objects.requireNonNull(sampler, "Cycle time sampler cannot be null");
    }

    /**
     * Changes the length of the next cycle only. Offsets add up until the next cycle starts and
     * are reset then; a cycle never gets shorter than 0.
     *
     * @param offset time to add to the next cycle, may be negative
     */
    public void offsetNextCycleTime(double offset) {
        nextCycleTimeOffset += offset;
    }

    @Override
    public Double getWaitingSince() {
        return waitingSince;
    }

    /**
     * Returns the part currently being processed.
     * @return the input part or null
     */
    public Part getInputPart() {
        return input;
    }

    /**
     * Returns the processed part waiting to be passed downstream.
     * @return the output part or null
     */
    public Part getOutputPart() {
        return output;
    }

    @Override
    public void setUpstream(List<? extends PartFlowController> newUpstream) {
        super.setUpstream(newUpstream);
        if (waitingSince != null && isInitialized()) {
            waitingSince = getSimulation().getNow();
        }
    }

    @Override
    public void notifyUpstreamOfAvailableSpace() {
        if (waitingSince == null) {
            waitingSince = getSimulation().getNow();
        }
        super.notifyUpstreamOfAvailableSpace();
    }

    /**
     * Schedules a new attempt to pass the output part, but only if an earlier attempt found no
     * taker.
     */
    @Override
    public void spaceAvailableDownstream() {
        if (isOperational() && waitingForDownstreamSpace) {
            schedulePassPartDownstream();
        }
    }

    @Override
    public boolean givePart(Part part) {
        if (!canAcceptPart(part)) {
            return false;
        }
        acceptPart(part);
        return true;
    }

    @Override
    protected boolean canAcceptPart(Part part) {
        return super.canAcceptPart(part) && input == null && output == null;
    }

    /**
     * Puts an accepted part into the input slot.
     *
     * @param part the part
     */
    protected void acceptPart(Part part) {
        input = part;
        part.addRoutingHistory(this);
        waitingSince = null;
        onReceivedPart(part);
    }

    protected void onReceivedPart(Part part) {
        announceReceivedPart(part);
        if (output == null) {
            tryMoveToOutput();
        }
    }

    /**
     * Records the {@code received_part} datapoint and runs the receive callbacks.
     *
     * @param part the received part
     */
    protected final void announceReceivedPart(Part part) {
        record("received_part", partDatapoint(part));
        for (BiConsumer<PartHandler, Part> c : receivedPartCallbacks) {
            c.accept(this, part);
        }
    }

    /**
     * Starts a cycle if a part waits in the input slot and the output slot is free.
     */
    protected void tryMoveToOutput() {
        if (isOperational() && input != null && output == null) {
            startCycle();
        }
    }

    /**
     * Samples the length of the cycle that starts now and consumes the one-shot offset.
     *
     * @return cycle length, at least 0
     */
    protected final double nextCycleDuration() {
        double duration = Math.max(0.0, cycleTime.getAsDouble() + nextCycleTimeOffset);
        nextCycleTimeOffset = 0.0;
        return duration;
    }

    private void startCycle() {
        double duration = nextCycleDuration();
        onCycleStarted();
        if (duration <= 0) {
            finishCycle();
        } else {
            clock().schedule(getSimulation().getNow() + duration, getId(), this::finishCycle,
                    EventType.FINISH_PROCESSING, "By " + getName());
        }
    }

    /**
     * Hook that runs when a processing cycle starts.
     */
    protected void onCycleStarted() {
    }

    /**
     * Ends the cycle: the part moves from the input slot to the output slot and a pass attempt is
     * scheduled.
     *
     * @throws StateViolationException if the device is not operational or its slots are not in
     *                                 the state a running cycle leaves them in
     */
    protected void finishCycle() {
        if (!isOperational()) {
            throw new StateViolationException(String.format(
                    "Cycle finished on device '%s' (id %d) in state %s at t=%s.",
                    getName(), getId(), state, getSimulation().getNow()));
        }
        if (input == null || output != null) {
            throw new StateViolationException(String.format(
                    "Cycle finished on device '%s' (id %d) with input=%s and output=%s at t=%s.",
                    getName(), getId(), input, output, getSimulation().getNow()));
        }
        output = input;
        input = null;
        schedulePassPartDownstream();
    }

    protected void schedulePassPartDownstream() {
        waitingForDownstreamSpace = false;
        clock().schedule(getSimulation().getNow(), getId(), this::passPartDownstream,
                EventType.PASS_PART, "From " + getName());
    }

    /**
     * Offers the output part to the downstream devices in priority order. If nobody takes it the
     * device waits for a {@link #spaceAvailableDownstream()} signal.
     */
    protected void passPartDownstream() {
        if (!isOperational() || output == null) {
            return;
        }
        for (PartFlowController d : getSortedDownstream()) {
            if (d.givePart(output)) {
                Part passed = output;
                output = null;
                onPartPassed(passed);
                if (input == null && output == null) {
                    notifyUpstreamOfAvailableSpace();
                }
                return;
            }
        }
        waitingForDownstreamSpace = true;
    }

    /**
     * Hook that runs after a part left the output slot.
     *
     * @param part the part that was passed
     */
    protected void onPartPassed(Part part) {
    }

    protected final void setWaitingForDownstreamSpace(boolean waiting) {
        this.waitingForDownstreamSpace = waiting;
    }

    protected final void setWaitingSince(Double since) {
        this.waitingSince = since;
    }

    /**
     * Pauses the device. Parked events resume with their remaining delay on {@link #restore()}.
     * Does nothing unless the device is operational.
     */
    public void shutdown() {
        if (state != DeviceState.OPERATIONAL) {
            return;
        }
        state = DeviceState.SHUTDOWN;
        clock().pauseMatching(getId());
        waitingSince = null;
        onShutdown(false, null);
        for (ShutdownCallback c : shutdownCallbacks) {
            c.onShutdown(this, false, null);
        }
    }

    /**
     * Breaks the device down. The part in the input slot is lost, the part in the output slot is
     * kept, and every scheduled or parked event of the device is cancelled. A device that is
     * already failed is left alone.
     */
    public void fail() {
        if (state == DeviceState.FAILED) {
            return;
        }
        Part lost = input;
        input = null;
        state = DeviceState.FAILED;
        clock().cancelMatching(getId());
        waitingSince = null;
        record("device_failure", Arrays.asList(getSimulation().getNow(), lost == null ? null : lost.getId()));
        onShutdown(true, lost);
        for (ShutdownCallback c : shutdownCallbacks) {
            c.onShutdown(this, true, lost);
        }
    }

    /**
     * Hook that runs after the device shut down or failed, before the shutdown callbacks.
     *
     * @param failure  whether it was a failure
     * @param lostPart the lost part or null
     */
    protected void onShutdown(boolean failure, Part lostPart) {
    }

    /**
     * Brings a shut down or failed device back. Parked events resume and part flow restarts.
     * Does nothing if the device is operational.
     */
    public void restore() {
        if (state == DeviceState.OPERATIONAL) {
            return;
        }
        state = DeviceState.OPERATIONAL;
        clock().resumeMatching(getId());
        onRestored();
        resumeFlow();
        for (Consumer<PartHandler> c : restoredCallbacks) {
            c.accept(this);
        }
    }

    /**
     * Hook that runs when the device is restored, before part flow resumes.
     */
    protected void onRestored() {
    }

    /**
     * Restarts part flow after a restore.
     */
    protected void resumeFlow() {
        if (output != null) {
            schedulePassPartDownstream();
        } else if (input == null) {
            notifyUpstreamOfAvailableSpace();
        }
    }

    /**
     * Registers a callback for every received part. If it changes the cycle time the new value
     * already applies to the part that triggered it.
     *
     * @param callback receives this device and the part
     */
    public void addReceivePartCallback(BiConsumer<PartHandler, Part> callback) {
        receivedPartCallbacks.add(Objects.requireNonNull(callback, "Callback cannot be null"));
    }

    public void addShutdownCallback(ShutdownCallback callback) {
        shutdownCallbacks.add(Objects.requireNonNull(callback, "Callback cannot be null"));
    }

    public void addRestoredCallback(Consumer<PartHandler> callback) {
        restoredCallbacks.add(Objects.requireNonNull(callback, "Callback cannot be null"));
    }

    protected final List<Object> partDatapoint(Part part) {
        return List.of(getSimulation().getNow(), part.getId(), part.getQuality(), part.getValue());
    }
}
