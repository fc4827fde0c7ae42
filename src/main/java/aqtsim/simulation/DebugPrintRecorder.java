package aqtsim.simulation;

import aqtsim.network.BufferNetwork;
import aqtsim.packet.Packet;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Prints the whole network after every step, labelled {@code r:} after injection and
 * {@code r':} after forwarding.
 */
public final class DebugPrintRecorder implements Recorder {

    private final PrintStream out;

    public DebugPrintRecorder(PrintStream out) {
        this.out = Objects.requireNonNull(out, "Output stream cannot be null");
    }

    @Override
    public void record(long round, boolean postForward, BufferNetwork network, List<Packet> absorbed) {
        out.println(postForward ? round + "':" : round + ":");
        out.println(network);
        if (absorbed != null && !absorbed.isEmpty()) {
            out.println("absorbed: " + absorbed);
        }
    }

    @Override
    public void close() {
        out.println("Simulation finished.");
    }

    @Override
    public RecorderType type() {
        return RecorderType.DEBUG_PRINT;
    }
}
