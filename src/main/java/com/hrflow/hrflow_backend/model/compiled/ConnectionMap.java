package com.hrflow.hrflow_backend.model.compiled;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Engine connection map: source node name to {"main": [port0 targets, port1 targets, ...]}.
 * Insertion order of sources and of targets within a port is preserved.
 */
public class ConnectionMap {

    private static final String MAIN = "main";

    private final Map<String, Map<String, List<List<ConnectionTarget>>>> connections = new LinkedHashMap<>();

    public void connect(String fromName, String toName, int port) {
        if (port < 0) {
            throw new IllegalArgumentException("Output port must be >= 0, got " + port);
        }
        List<List<ConnectionTarget>> ports = connections
                .computeIfAbsent(fromName, k -> new LinkedHashMap<>())
                .computeIfAbsent(MAIN, k -> new ArrayList<>());
        // A false branch without a true branch still needs an (empty) port 0
        while (ports.size() <= port) {
            ports.add(new ArrayList<>());
        }
        ports.get(port).add(ConnectionTarget.main(toName));
    }

    /** Target node names on one port of a source, empty when unconnected. */
    public List<String> targets(String fromName, int port) {
        Map<String, List<List<ConnectionTarget>>> byType = connections.get(fromName);
        if (byType == null) return List.of();
        List<List<ConnectionTarget>> ports = byType.get(MAIN);
        if (ports == null || ports.size() <= port) return List.of();
        return ports.get(port).stream().map(ConnectionTarget::node).toList();
    }

    public int portCount(String fromName) {
        Map<String, List<List<ConnectionTarget>>> byType = connections.get(fromName);
        if (byType == null || byType.get(MAIN) == null) return 0;
        return byType.get(MAIN).size();
    }

    public boolean isEmpty() {
        return connections.isEmpty();
    }

    @JsonValue
    public Map<String, Map<String, List<List<ConnectionTarget>>>> asMap() {
        return connections;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionMap other)) return false;
        return connections.equals(other.connections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connections);
    }

    @Override
    public String toString() {
        return "ConnectionMap" + connections;
    }
}
