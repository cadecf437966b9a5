package com.papertrail.core.derive;

import com.papertrail.core.config.DerivationOptions;
import com.papertrail.core.facts.Bid;
import com.papertrail.core.facts.Contract;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeEvidence;
import com.papertrail.core.model.EdgeType;
import com.papertrail.core.model.RecordPair;
import com.papertrail.core.model.WinPattern;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * CO_BID_WITH between contractors that bid on at least
 * {@link DerivationOptions#getMinSharedContracts()} of the same contracts.
 *
 * <p>The win pattern is {@code rotating} when, over the shared contracts in
 * award order, both contractors won and no contractor of the pair won twice in
 * a row; otherwise {@code competitive}.</p>
 */
public class CoBiddingDeriver implements EdgeDeriver {

    private final DerivationOptions options;

    public CoBiddingDeriver(DerivationOptions options) {
        this.options = options;
    }

    @Override
    public String getName() {
        return "co-bidding";
    }

    @Override
    public List<DerivedEdge> derive(ResolvedGraph graph) {
        Map<String, List<Bid>> bidsByContract = graph.getFacts().bidsByContract();
        Map<RecordPair, List<SharedContract>> shared = new TreeMap<>();

        for (Map.Entry<String, List<Bid>> entry : bidsByContract.entrySet()) {
            String ref = entry.getKey();
            TreeSet<String> bidders = new TreeSet<>();
            entry.getValue().forEach(b -> bidders.add(b.contractorId()));
            if (bidders.size() < 2) {
                continue;
            }
            Optional<Contract> contract = graph.getFacts().contract(ref);
            LocalDate date = contract.map(Contract::awardDate).orElse(LocalDate.MIN);
            String winner = winnerOf(entry.getValue(), contract);
            List<String> ordered = new ArrayList<>(bidders);
            for (int i = 0; i < ordered.size(); i++) {
                for (int j = i + 1; j < ordered.size(); j++) {
                    shared.computeIfAbsent(RecordPair.of(ordered.get(i), ordered.get(j)), k -> new ArrayList<>())
                            .add(new SharedContract(ref, date, winner));
                }
            }
        }

        List<DerivedEdge> edges = new ArrayList<>();
        shared.forEach((pair, contracts) -> {
            if (contracts.size() < options.getMinSharedContracts()) {
                return;
            }
            contracts.sort(Comparator.comparing(SharedContract::date).thenComparing(SharedContract::ref));
            List<String> refs = contracts.stream().map(SharedContract::ref).toList();
            EdgeEvidence evidence = new EdgeEvidence.CoBid(contracts.size(), classify(pair, contracts), refs);
            edges.add(new DerivedEdge(EdgeType.CO_BID_WITH, pair.first(), pair.second(), evidence));
        });
        return edges;
    }

    static WinPattern classify(RecordPair pair, List<SharedContract> ordered) {
        List<String> wins = new ArrayList<>();
        for (SharedContract c : ordered) {
            if (c.winner() != null && pair.contains(c.winner())) {
                wins.add(c.winner());
            }
        }
        if (wins.size() < 2 || !wins.contains(pair.first()) || !wins.contains(pair.second())) {
            return WinPattern.COMPETITIVE;
        }
        for (int i = 1; i < wins.size(); i++) {
            if (wins.get(i).equals(wins.get(i - 1))) {
                return WinPattern.COMPETITIVE;
            }
        }
        return WinPattern.ROTATING;
    }

    private static String winnerOf(List<Bid> bids, Optional<Contract> contract) {
        return bids.stream()
                .filter(Bid::winning)
                .map(Bid::contractorId)
                .findFirst()
                .orElseGet(() -> contract.map(Contract::awardeeId).orElse(null));
    }

    record SharedContract(String ref, LocalDate date, String winner) {
    }
}
