package org.faalgebra.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 输入符号。除了保留的 {@link #EPSILON} 以外，所有符号都是不透明的标签。
 * EPSILON 只能出现在 NFA 的迁移上，永远不属于任何字母表。
 */
@Getter
public final class Symbol implements Comparable<Symbol> {

    private static final Logger logger = LoggerFactory.getLogger(Symbol.class);

    // 空字符串表示 epsilon
    public static final Symbol EPSILON = new Symbol("");

    private final String label;
    private final boolean isEpsilon;

    private final int hashCode;

    private Symbol(String label) {
        this.label = Objects.requireNonNull(label, "Symbol label cannot be null");
        this.isEpsilon = label.isEmpty();
        this.hashCode = Objects.hash(label);
        logger.trace("创建 Symbol: {}", this);
    }

    /**
     * 工厂方法：创建一个符号。空字符串返回 {@link #EPSILON}。
     * @param label 符号的标签。
     * @return 对应的 Symbol 实例。
     */
    public static Symbol of(String label) {
        Objects.requireNonNull(label, "Symbol label cannot be null");
        if (label.isEmpty()) {
            return EPSILON;
        }
        return new Symbol(label);
    }

    /**
     * 把一个字符串拆成输入序列，每个字符是一个符号。空串得到空序列。
     * @param word 输入字符串。
     * @return 符号序列。
     */
    public static List<Symbol> word(String word) {
        Objects.requireNonNull(word, "Word cannot be null");
        List<Symbol> symbols = new ArrayList<>(word.length());
        word.codePoints().forEach(cp -> symbols.add(new Symbol(new String(Character.toChars(cp)))));
        return Collections.unmodifiableList(symbols);
    }

    public boolean isEpsilon() {
        return isEpsilon;
    }

    @Override
    public String toString() {
        return isEpsilon ? "ε" : label;
    }

    @Override
    public int compareTo(Symbol other) {
        // epsilon 排在最前面，其余按标签字母顺序
        if (this.isEpsilon() && !other.isEpsilon()) {
            return -1;
        }
        if (!this.isEpsilon() && other.isEpsilon()) {
            return 1;
        }
        return this.label.compareTo(other.label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Symbol symbol = (Symbol) o;
        return label.equals(symbol.label);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
