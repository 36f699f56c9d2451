package org.faalgebra.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表有限自动机中的一个状态。
 * State 是不可变对象，只由其标签决定：标签相同的两个状态相等。
 * 状态之间按标签的字典序全序比较，规范重命名依赖这一顺序。
 */
public final class State implements Comparable<State> {

    private static final Logger logger = LoggerFactory.getLogger(State.class);

    @Getter
    private final String label;

    private final int hashCode;

    /**
     * 私有构造函数，外部应通过工厂方法创建 State。
     * @param label 状态的标签。
     */
    private State(String label) {
        this.label = Objects.requireNonNull(label, "State label cannot be null");
        this.hashCode = label.hashCode();
        logger.trace("创建了一个State: {}", label);
    }

    /**
     * 工厂方法：按标签创建状态。
     * @param label 状态的标签，不能为空字符串。
     * @return 对应的 State 实例。
     */
    public static State of(String label) {
        Objects.requireNonNull(label, "State label cannot be null");
        if (label.isEmpty()) {
            throw new IllegalArgumentException("状态标签不能为空字符串");
        }
        return new State(label);
    }

    /**
     * 返回在标签后追加后缀得到的新状态，例如 q0 + "_1" = q0_1。
     */
    public State withSuffix(String suffix) {
        return new State(label + suffix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State state = (State) o;
        return label.equals(state.label);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return label;
    }

    @Override
    public int compareTo(State other) {
        return this.label.compareTo(other.label);
    }
}
