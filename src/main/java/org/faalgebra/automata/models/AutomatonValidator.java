package org.faalgebra.automata.models;

import org.faalgebra.automata.base.Alphabet;
import org.faalgebra.automata.base.State;
import org.faalgebra.automata.base.Symbol;
import org.faalgebra.automata.base.TransitionKey;
import org.faalgebra.automata.exceptions.InvalidAutomatonException;

import java.util.Collection;
import java.util.Set;

/**
 * DFA 与 NFA 共用的不变量检查，违反时抛出 {@link InvalidAutomatonException}。
 */
final class AutomatonValidator {

    private AutomatonValidator() {
    }

    static void checkInitial(State initialState, Set<State> states) {
        if (!states.contains(initialState)) {
            throw new InvalidAutomatonException("初始状态 " + initialState + " 不在状态集中");
        }
    }

    static void checkFinals(Set<State> finalStates, Set<State> states) {
        for (State state : finalStates) {
            if (!states.contains(state)) {
                throw new InvalidAutomatonException("终态 " + state + " 不在状态集中");
            }
        }
    }

    /**
     * 检查迁移的源状态和符号。epsilonAllowed 为 false 时 EPSILON 不能作为迁移符号。
     */
    static void checkKey(TransitionKey key, Set<State> states, Alphabet alphabet, boolean epsilonAllowed) {
        if (!states.contains(key.getSource())) {
            throw new InvalidAutomatonException("迁移 " + key + " 的源状态不在状态集中");
        }
        Symbol symbol = key.getSymbol();
        if (symbol.isEpsilon()) {
            if (!epsilonAllowed) {
                throw new InvalidAutomatonException("迁移 " + key + " 使用了 EPSILON");
            }
        } else if (!alphabet.contains(symbol)) {
            throw new InvalidAutomatonException("迁移 " + key + " 的符号不在字母表中");
        }
    }

    static void checkTargets(TransitionKey key, Collection<State> targets, Set<State> states) {
        for (State target : targets) {
            if (!states.contains(target)) {
                throw new InvalidAutomatonException("迁移 " + key + " 的目标状态 " + target + " 不在状态集中");
            }
        }
    }
}
