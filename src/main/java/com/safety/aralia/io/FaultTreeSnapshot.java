package com.safety.aralia.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.safety.aralia.api.ConversionWarning;
import com.safety.aralia.engine.FaultTree;
import com.safety.aralia.node.Argument;
import com.safety.aralia.node.BasicEvent;
import com.safety.aralia.node.Gate;
import com.safety.aralia.node.HouseEvent;
import com.safety.aralia.node.UndefinedEvent;

import lombok.Data;

/**
 * POJO representation of a compiled fault tree, written by
 * {@link JsonSnapshotWriter}. Gates are listed in topological order.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "name", "multiTop", "topGates", "gates", "basicEvents", "houseEvents", "undefinedEvents",
        "warnings" })
public final class FaultTreeSnapshot {
    private String name;
    private boolean multiTop;
    private List<String> topGates;
    private List<GateDef> gates;
    private List<BasicEventDef> basicEvents;
    private List<HouseEventDef> houseEvents;
    private List<String> undefinedEvents;
    private List<WarningDef> warnings;

    /** One gate with its resolved arguments in declared order. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "name", "operator", "min", "max", "arguments" })
    public static final class GateDef {
        private String name, operator;
        private Integer min, max;
        private List<ArgumentDef> arguments;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "name", "kind", "complement" })
    public static final class ArgumentDef {
        private String name, kind;
        private boolean complement;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BasicEventDef {
        private String name, probability;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class HouseEventDef {
        private String name;
        private boolean state;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "kind", "subject", "message" })
    public static final class WarningDef {
        private String kind, subject, message;
    }

    /** Copies the fault tree into a fresh snapshot. */
    public static FaultTreeSnapshot from(FaultTree tree) {
        FaultTreeSnapshot snapshot = new FaultTreeSnapshot();
        snapshot.setName(tree.name());
        snapshot.setMultiTop(tree.isMultiTop());
        snapshot.setTopGates(tree.topGates().stream().map(Gate::name).toList());

        List<GateDef> gates = new ArrayList<>();
        for (Gate gate : tree.sortedGates()) {
            GateDef def = new GateDef();
            def.setName(gate.name());
            def.setOperator(gate.operator().element());
            def.setMin(gate.minNumber());
            def.setMax(gate.maxNumber());
            List<ArgumentDef> args = new ArrayList<>();
            for (Argument a : gate.arguments()) {
                ArgumentDef ad = new ArgumentDef();
                ad.setName(a.name());
                ad.setKind(a.kind().referenceElement());
                ad.setComplement(a.complement());
                args.add(ad);
            }
            def.setArguments(args);
            gates.add(def);
        }
        snapshot.setGates(gates);

        List<BasicEventDef> basics = new ArrayList<>();
        for (BasicEvent event : tree.basicEvents()) {
            BasicEventDef def = new BasicEventDef();
            def.setName(event.name());
            def.setProbability(event.probability());
            basics.add(def);
        }
        snapshot.setBasicEvents(basics);

        List<HouseEventDef> houses = new ArrayList<>();
        for (HouseEvent event : tree.houseEvents()) {
            HouseEventDef def = new HouseEventDef();
            def.setName(event.name());
            def.setState(event.state());
            houses.add(def);
        }
        snapshot.setHouseEvents(houses);

        snapshot.setUndefinedEvents(tree.undefinedEvents().stream().map(UndefinedEvent::name).toList());

        List<WarningDef> warnings = new ArrayList<>();
        for (ConversionWarning w : tree.warnings()) {
            WarningDef def = new WarningDef();
            def.setKind(w.kind().name());
            def.setSubject(w.subject());
            def.setMessage(w.message());
            warnings.add(def);
        }
        snapshot.setWarnings(warnings);
        return snapshot;
    }
}
