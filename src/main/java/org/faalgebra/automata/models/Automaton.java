package org.faalgebra.automata.models;

import org.faalgebra.automata.base.Alphabet;
import org.faalgebra.automata.base.State;
import org.faalgebra.automata.base.Symbol;

import java.util.List;
import java.util.Set;

/**
 * 有限自动机的公共视图。DFA 与 NFA 都是不可变的值对象，所有变换都返回新的自动机。
 */
public interface Automaton {

    Alphabet getAlphabet();

    Set<State> getStates();

    State getInitialState();

    Set<State> getFinalStates();

    /**
     * 从初始状态出发读完整个输入序列，判断是否停在终态。
     * @param input 输入符号序列。
     * @return 接受则返回 true。
     */
    boolean accept(List<Symbol> input);

    /**
     * 字符串形式的 {@link #accept(List)}，每个字符是一个符号。
     */
    default boolean accept(String word) {
        return accept(Symbol.word(word));
    }

    default boolean isFinal(State state) {
        return getFinalStates().contains(state);
    }
}
