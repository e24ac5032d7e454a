package org.pragmatica.plc.model;

import java.util.List;
import java.util.Optional;

public record Pou(String name, PouKind kind, Optional<String> description, PouInterface pouInterface,
                  Optional<Body> body) {

    public static Pou of(String name, PouKind kind, PouInterface pouInterface, Optional<Body> body) {
        return new Pou(name, kind, Optional.empty(), pouInterface, body);
    }

    /**
     * A POU without a body, or with a body that has no content.
     */
    public boolean isEmpty() {
        return body.map(Body::isEmpty).orElse(true);
    }

    public List<Variable> allVariables() {
        return pouInterface.allVariables();
    }

    public Optional<Variable> findVariable(String variableName) {
        return pouInterface.findVariable(variableName);
    }
}
