package aqtsim.adversary;

import aqtsim.network.BufferNetwork;
import aqtsim.packet.Packet;
import aqtsim.packet.PacketFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Injects a scripted list of packets: the k-th call to {@link #nextPackets} injects the k-th entry
 * of the script. Once the script is exhausted nothing more is injected.
 */
public final class PresetAdversary implements Adversary {

    private final List<List<Injection>> rounds;
    private final PacketFactory factory = new PacketFactory();
    private int nextRound = 0;

    public PresetAdversary(List<List<Injection>> rounds) {
        Objects.requireNonNull(rounds, "Rounds cannot be null");
        List<List<Injection>> copy = new ArrayList<>(rounds.size());
        for (List<Injection> round : rounds) {
            copy.add(List.copyOf(round));
        }
        this.rounds = List.copyOf(copy);
    }

    @Override
    public List<Packet> nextPackets(BufferNetwork network, long round) {
        if (nextRound >= rounds.size()) {
            return List.of();
        }
        List<Packet> packets = new ArrayList<>();
        for (Injection injection : rounds.get(nextRound++)) {
            packets.add(factory.create(injection.path(), round, injection.cursor()));
        }
        return packets;
    }

    /**
     * @return the scripted rounds, in injection order
     */
    public List<List<Injection>> rounds() {
        return rounds;
    }

    /**
     * @return the number of scripted rounds
     */
    public int scriptedRounds() {
        return rounds.size();
    }

    public boolean isExhausted() {
        return nextRound >= rounds.size();
    }

    @Override
    public AdversaryType type() {
        return AdversaryType.PRESET;
    }
}
