package org.faalgebra.utils;

import org.faalgebra.automata.base.State;

import java.util.Set;

/**
 * 状态命名约定：保留的陷阱状态标签、并/连接运算使用的操作数后缀、规范标签序列。
 * @author Ayalyt
 */
public final class StateNames {

    /**
     * 补全时加入的陷阱状态的保留标签。
     */
    public static final String SINK_LABEL = "-";

    public static final String LEFT_SUFFIX = "_0";
    public static final String RIGHT_SUFFIX = "_1";

    private static final String CANONICAL_PREFIX = "q";

    private StateNames() {
    }

    /**
     * 返回一个不在 taken 中的陷阱状态："-"，若已被占用则依次尝试 "--"、"---" ...
     */
    public static State freshSink(Set<State> taken) {
        String label = SINK_LABEL;
        while (taken.contains(State.of(label))) {
            label = label + SINK_LABEL;
        }
        return State.of(label);
    }

    /**
     * 返回以 base 为基础、不在 taken 中的状态：优先使用 base 本身，否则追加撇号。
     */
    public static State fresh(State base, Set<State> taken) {
        State candidate = base;
        while (taken.contains(candidate)) {
            candidate = candidate.withSuffix("'");
        }
        return candidate;
    }

    /**
     * 第 index 个编号标签：q0, q1, q2 ...
     */
    public static State numbered(int index) {
        checkIndex(index);
        return State.of(CANONICAL_PREFIX + index);
    }

    /**
     * 第 index 个字母标签：A ... Z, AA, AB ... (双射 26 进制)。
     */
    public static State lettered(int index) {
        checkIndex(index);
        StringBuilder sb = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            n--;
            sb.append((char) ('A' + n % 26));
            n /= 26;
        }
        return State.of(sb.reverse().toString());
    }

    private static void checkIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("标签序号不能为负数: " + index);
        }
    }
}
