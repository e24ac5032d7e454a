package org.pragmatica.plc.project;

import org.pragmatica.plc.rll.RllParseError;
import org.pragmatica.plc.rll.Rung;

import java.util.List;
import java.util.Optional;

/**
 * A parsed rung together with where it came from.
 */
public record LocatedRung(RungLocation location, Rung rung) {

    public List<LocatedTagReference> tagReferences() {
        return rung.tagReferences()
                   .stream()
                   .map(reference -> new LocatedTagReference(location, reference))
                   .toList();
    }

    /**
     * The parse error with the rung location attached.
     */
    public Optional<RllParseError> parseError() {
        return rung.parseError().map(error -> error.withContext(location.toErrorContext()));
    }

    public boolean hasError() {
        return !rung.isParsed();
    }
}
