package aqtsim.simulation;

import aqtsim.network.BufferNetwork;
import aqtsim.packet.Packet;

import java.util.List;

/**
 * Records every absorbed packet with the round it left the network.
 */
public final class AbsorptionRecorder extends CsvRecorder {

    public static final String FILE_NAME = "absorptions.csv";
    public static final String HEADER = "rd,packet_id,injection_rd,path_length";

    public AbsorptionRecorder() {
        this(DEFAULT_LINE_LIMIT);
    }

    public AbsorptionRecorder(int lineLimit) {
        super(FILE_NAME, HEADER, lineLimit);
    }

    @Override
    public void record(long round, boolean postForward, BufferNetwork network, List<Packet> absorbed) {
        if (absorbed == null) {
            return;
        }
        for (Packet packet : absorbed) {
            write(round + "," + packet.id() + "," + packet.injectionRound() + "," + packet.path().size());
        }
    }

    @Override
    public RecorderType type() {
        return RecorderType.ABSORPTION_CSV;
    }
}
