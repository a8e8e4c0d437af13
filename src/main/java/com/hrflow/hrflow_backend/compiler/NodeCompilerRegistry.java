package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.domain.NodeKind;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class NodeCompilerRegistry {

    private final List<NodeCompiler> compilers;
    private final Map<NodeKind, NodeCompiler> registry = new EnumMap<>(NodeKind.class);

    @PostConstruct
    public void init() {
        compilers.forEach(compiler -> registry.put(compiler.supportedKind(), compiler));
        if (!registry.containsKey(NodeKind.UNKNOWN)) {
            throw new IllegalStateException("No pass-through compiler registered for unknown node kinds");
        }
        log.debug("Registered node compilers for kinds {}", registry.keySet());
    }

    /** Kinds without a dedicated compiler (condition, legacy kinds) get the inert pass-through node. */
    public NodeCompiler get(NodeKind kind) {
        NodeCompiler compiler = registry.get(kind);
        return compiler != null ? compiler : registry.get(NodeKind.UNKNOWN);
    }
}
