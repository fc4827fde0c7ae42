package aqtsim.simulation;

import aqtsim.network.BufferNetwork;
import aqtsim.packet.Packet;

import java.nio.file.Path;
import java.util.List;

/**
 * Takes snapshots of a running simulation.
 *
 * The simulation calls {@link #record} twice per round (after injection with {@code absorbed} set
 * to null, after forwarding with the absorbed packets) and {@link #close()} exactly once at the end.
 */
public sealed interface Recorder permits DebugPrintRecorder, CsvRecorder {

    /**
     * Creates a recorder of the given type with default settings.
     */
    static Recorder create(RecorderType type) {
        return switch (type) {
            case DEBUG_PRINT -> new DebugPrintRecorder(System.out);
            case BUFFER_LOAD_CSV -> new BufferLoadRecorder();
            case ABSORPTION_CSV -> new AbsorptionRecorder();
        };
    }

    /**
     * @param round the current round
     * @param postForward false after injection, true after forwarding
     * @param network the network state to record
     * @param absorbed packets absorbed by this round's forwarding, null after injection
     */
    void record(long round, boolean postForward, BufferNetwork network, List<Packet> absorbed);

    /**
     * Flushes anything still buffered.
     */
    void close();

    /**
     * Directory where file based recorders write their output. Ignored by console recorders.
     */
    default void setOutputDirectory(Path directory) {
    }

    /**
     * @return true if this recorder needs an output directory
     */
    default boolean writesFiles() {
        return false;
    }

    RecorderType type();
}
