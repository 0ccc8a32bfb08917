package dumb.smt;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Untyped parse tree of an S-expression: either an {@link Atom} or a {@link Lst}.
 */
sealed public interface Term permits Term.Atom, Term.Lst {

    /** Exhaustive case analysis over the two node kinds. */
    <R> R match(Function<Atom, R> atom, Function<Lst, R> list);

    /** Canonical text: atoms verbatim, lists parenthesized with single spaces. */
    String toString();

    /**
     * A token, kept as a view into the parsed source. The text is only copied out
     * when {@link #text()} is called.
     */
    record Atom(String source, int start, int end) implements Term {

        public Atom {
            requireNonNull(source);
            if (start < 0 || end < start || end > source.length())
                throw new IndexOutOfBoundsException("Atom span [" + start + ", " + end + ") outside source of length " + source.length());
        }

        public String text() {
            return source.substring(start, end);
        }

        public int length() {
            return end - start;
        }

        public boolean isEmpty() {
            return start == end;
        }

        public char charAt(int i) {
            return source.charAt(start + i);
        }

        /** Compares against {@code s} without copying the span. */
        public boolean is(String s) {
            return s.length() == length() && source.regionMatches(start, s, 0, s.length());
        }

        @Override
        public <R> R match(Function<Atom, R> atom, Function<Lst, R> list) {
            return atom.apply(this);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Atom that && length() == that.length()
                    && source.regionMatches(start, that.source, that.start, length()));
        }

        @Override
        public int hashCode() {
            var h = 0;
            for (var i = start; i < end; i++) h = 31 * h + source.charAt(i);
            return h;
        }

        @Override
        public String toString() {
            return text();
        }
    }

    final class Lst implements Term {
        public final List<Term> terms;

        public Lst(List<Term> terms) {
            this.terms = List.copyOf(terms);
        }

        public Term get(int index) {
            return terms.get(index);
        }

        public int size() {
            return terms.size();
        }

        public boolean isEmpty() {
            return terms.isEmpty();
        }

        /** The head atom, if this list has one. */
        public Optional<Atom> op() {
            return terms.isEmpty()
                    ? Optional.empty()
                    : terms.get(0).<Optional<Atom>>match(Optional::of, l -> Optional.empty());
        }

        @Override
        public <R> R match(Function<Atom, R> atom, Function<Lst, R> list) {
            return list.apply(this);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Lst that && terms.equals(that.terms));
        }

        @Override
        public int hashCode() {
            return terms.hashCode();
        }

        @Override
        public String toString() {
            return terms.stream().map(Term::toString).collect(Collectors.joining(" ", "(", ")"));
        }
    }
}
