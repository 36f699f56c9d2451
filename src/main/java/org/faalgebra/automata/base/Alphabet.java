package org.faalgebra.automata.base;

import lombok.Getter;
import org.faalgebra.automata.exceptions.InvalidAutomatonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 代表一个有限自动机的字母表。
 * Alphabet 是不可变对象，一旦创建，其包含的符号集合就不会改变。
 * 与迁移上允许出现 EPSILON 不同，字母表永远不包含 {@link Symbol#EPSILON}。
 */
public final class Alphabet implements Iterable<Symbol> {

    private static final Logger logger = LoggerFactory.getLogger(Alphabet.class);

    public static final Alphabet EMPTY = new Alphabet(Collections.emptySet());

    @Getter
    private final SortedSet<Symbol> symbols;
    private final int hashCode;

    /**
     * 私有构造函数，通过符号集合创建 Alphabet。
     * @param symbols 包含所有符号的集合。
     */
    private Alphabet(Collection<Symbol> symbols) {
        Objects.requireNonNull(symbols, "Symbols cannot be null");
        if (symbols.contains(Symbol.EPSILON)) {
            logger.warn("尝试把 EPSILON 放入字母表：{}", symbols);
            throw new InvalidAutomatonException("字母表不能包含 EPSILON");
        }
        this.symbols = Collections.unmodifiableSortedSet(new TreeSet<>(symbols));
        this.hashCode = Objects.hash(this.symbols);
        logger.trace("创建 Alphabet，包含 {} 个符号。详情：{}", this.symbols.size(), this.symbols);
    }

    /**
     * 工厂方法：从一个符号集合创建 Alphabet 实例。
     * @param symbols 构成字母表的符号集合。
     * @return Alphabet 实例。
     */
    public static Alphabet of(Collection<Symbol> symbols) {
        return new Alphabet(symbols);
    }

    /**
     * 工厂方法：从一系列符号标签创建 Alphabet 实例。
     * @param labels 符号标签的可变参数。
     * @return Alphabet 实例。
     */
    public static Alphabet of(String... labels) {
        return new Alphabet(Arrays.stream(labels).map(Symbol::of).collect(Collectors.toSet()));
    }

    /**
     * 返回两个字母表的并集。
     */
    public Alphabet union(Alphabet other) {
        if (this.symbols.containsAll(other.symbols)) {
            return this;
        }
        SortedSet<Symbol> merged = new TreeSet<>(this.symbols);
        merged.addAll(other.symbols);
        logger.debug("合并字母表 {} 和 {}", this, other);
        return new Alphabet(merged);
    }

    public boolean contains(Symbol symbol) {
        return symbols.contains(symbol);
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public Stream<Symbol> stream() {
        return symbols.stream();
    }

    /**
     * 按符号顺序迭代。
     */
    @Override
    public Iterator<Symbol> iterator() {
        return symbols.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Alphabet alphabet = (Alphabet) o;
        return symbols.equals(alphabet.symbols);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Alphabet{" +
                symbols.stream()
                        .map(Symbol::toString)
                        .collect(Collectors.joining(", ")) +
                '}';
    }
}
