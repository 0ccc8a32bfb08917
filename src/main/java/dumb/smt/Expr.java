package dumb.smt;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Sorted expression produced by the {@link Elaborator}.
 * <p>
 * A {@code let} is an {@link Kind#APPLY} named {@code let} whose arguments are
 * one {@link Kind#BINDING} per bound name, each holding the bound value as its
 * only child, followed by the body.
 */
public record Expr(Kind kind, String name, List<Expr> args, Sort sort) {

    public static final String LET = "let";

    public Expr {
        requireNonNull(kind);
        requireNonNull(name);
        requireNonNull(sort);
        args = List.copyOf(args);
    }

    public static Expr literal(String numeral) {
        return new Expr(Kind.LITERAL, numeral, List.of(), Sort.REAL);
    }

    public static Expr variable(String name, Sort sort) {
        return new Expr(Kind.VARIABLE, name, List.of(), sort);
    }

    public static Expr apply(String op, List<Expr> args, Sort sort) {
        return new Expr(Kind.APPLY, op, args, sort);
    }

    public static Expr binding(String name, Expr value) {
        return new Expr(Kind.BINDING, name, List.of(value), value.sort());
    }

    @JsonIgnore
    public boolean isLet() {
        return kind == Kind.APPLY && LET.equals(name);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case LITERAL, VARIABLE -> name;
            case APPLY, BINDING -> args.stream().map(Expr::toString).collect(Collectors.joining(" ", "(" + name + " ", ")"));
        };
    }

    public enum Kind {
        LITERAL, VARIABLE, APPLY, BINDING
    }
}
