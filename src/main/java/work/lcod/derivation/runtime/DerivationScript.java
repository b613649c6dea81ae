package work.lcod.derivation.runtime;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.derivation.state.Lexicon;

/**
 * A loaded derivation script: its lexicon and the raw step maps to run against it.
 */
public record DerivationScript(Optional<Path> source, Lexicon lexicon, List<Map<String, Object>> steps) {
    public DerivationScript {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(lexicon, "lexicon");
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public DerivationScript withLexicon(Lexicon replacement) {
        return new DerivationScript(source, replacement, steps);
    }

    public String display() {
        return source.map(Path::toString).orElse("<inline>");
    }
}
