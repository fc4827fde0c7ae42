package aqtsim.simulation;

import aqtsim.network.BufferNetwork;
import aqtsim.network.EdgeId;
import aqtsim.packet.Packet;

import java.util.List;

/**
 * Records the load of every buffer after every step.
 * Columns: round, whether the row is post-forwarding (0/1), buffer from, buffer to, load.
 */
public final class BufferLoadRecorder extends CsvRecorder {

    public static final String FILE_NAME = "buffer_loads.csv";
    public static final String HEADER = "rd,prime,buffer_from,buffer_to,load";

    public BufferLoadRecorder() {
        this(DEFAULT_LINE_LIMIT);
    }

    public BufferLoadRecorder(int lineLimit) {
        super(FILE_NAME, HEADER, lineLimit);
    }

    @Override
    public void record(long round, boolean postForward, BufferNetwork network, List<Packet> absorbed) {
        int prime = postForward ? 1 : 0;
        for (EdgeId edge : network.edges()) {
            write(round + "," + prime + "," + edge.from() + "," + edge.to() + "," + network.load(edge.from(), edge.to()));
        }
    }

    @Override
    public RecorderType type() {
        return RecorderType.BUFFER_LOAD_CSV;
    }
}
