package org.faalgebra.automata.exceptions;

import lombok.Getter;
import org.faalgebra.automata.base.State;
import org.faalgebra.automata.base.Symbol;

/**
 * DFA 在 (状态, 符号) 上没有定义迁移。
 * 这是部分 DFA 的正常情况，调用方可以捕获后继续；模拟运行时会把它当作拒绝。
 */
@Getter
public class UndefinedTransitionException extends RuntimeException {

    private final State state;
    private final Symbol symbol;

    public UndefinedTransitionException(State state, Symbol symbol) {
        super("未定义的迁移: (" + state + ", " + symbol + ")");
        this.state = state;
        this.symbol = symbol;
    }
}
