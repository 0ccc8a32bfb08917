package dumb.smt;

import java.util.Optional;

/** Value kinds understood by the front end. */
public enum Sort {
    BOOL("Bool"),
    REAL("Real");

    public final String smtName;

    Sort(String smtName) {
        this.smtName = smtName;
    }

    /** Resolves an SMT-LIB sort symbol; only {@code Bool} and {@code Real} are known. */
    public static Optional<Sort> of(String smtName) {
        for (var s : values())
            if (s.smtName.equals(smtName)) return Optional.of(s);
        return Optional.empty();
    }

    @Override
    public String toString() {
        return smtName;
    }
}
