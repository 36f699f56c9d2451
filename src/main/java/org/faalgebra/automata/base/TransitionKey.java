package org.faalgebra.automata.base;

import lombok.Getter;

import java.util.Comparator;
import java.util.Objects;

/**
 * 迁移映射的键：(源状态, 符号)。
 * 此类是不可变的。
 */
@Getter
public final class TransitionKey implements Comparable<TransitionKey> {

    private static final Comparator<TransitionKey> ORDER =
            Comparator.comparing(TransitionKey::getSource).thenComparing(TransitionKey::getSymbol);

    private final State source;
    private final Symbol symbol;

    private final int hashCode;

    /**
     * @param source 源状态 (q)
     * @param symbol 读入的符号 (a)，对 NFA 可以是 EPSILON
     */
    public TransitionKey(State source, Symbol symbol) {
        this.source = Objects.requireNonNull(source, "Source state cannot be null.");
        this.symbol = Objects.requireNonNull(symbol, "Symbol cannot be null.");
        this.hashCode = Objects.hash(source, symbol);
    }

    public static TransitionKey of(State source, Symbol symbol) {
        return new TransitionKey(source, symbol);
    }

    /**
     * 直接用标签创建键，空字符串符号即 EPSILON。
     */
    public static TransitionKey of(String source, String symbol) {
        return new TransitionKey(State.of(source), Symbol.of(symbol));
    }

    @Override
    public int compareTo(TransitionKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TransitionKey that = (TransitionKey) o;
        return source.equals(that.source) &&
                symbol.equals(that.symbol);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + source + ", " + symbol + ")";
    }
}
