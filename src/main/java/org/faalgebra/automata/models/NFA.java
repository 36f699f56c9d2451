package org.faalgebra.automata.models;

import lombok.Getter;
import org.faalgebra.automata.base.Alphabet;
import org.faalgebra.automata.base.State;
import org.faalgebra.automata.base.Symbol;
import org.faalgebra.automata.base.TransitionKey;
import org.faalgebra.automata.exceptions.InvalidAutomatonException;
import org.faalgebra.automata.exceptions.NotDeterministicException;
import org.faalgebra.utils.StateNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 代表一个带 epsilon 迁移的非确定有限自动机 (NFA)。
 * 迁移关系把 (状态, 符号或 EPSILON) 映射到非空的目标状态集合；EPSILON 不计入字母表。
 * NFA 是不可变的值对象，所有变换都返回新的 NFA（或 DFA）。
 */
@Getter
public final class NFA implements Automaton {

    private static final Logger logger = LoggerFactory.getLogger(NFA.class);

    public static final Symbol EPSILON = Symbol.EPSILON;

    private final Alphabet alphabet;
    private final Set<State> states;
    private final State initialState;
    private final Map<TransitionKey, Set<State>> transitions;
    private final Set<State> finalStates;

    private final int hashCode;

    /**
     * 构造一个 NFA，并立即检查结构不变量。
     *
     * @param alphabet     字母表（不含 EPSILON）。
     * @param states       状态集合。
     * @param initialState 初始状态，必须属于 states。
     * @param transitions  迁移关系，每个目标集合都必须非空。
     * @param finalStates  终态集合，必须是 states 的子集。
     * @throws InvalidAutomatonException 违反不变量时。
     */
    public NFA(Alphabet alphabet, Set<State> states, State initialState, Map<TransitionKey, Set<State>> transitions, Set<State> finalStates) {
        this.alphabet = Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        this.states = Set.copyOf(Objects.requireNonNull(states, "States set cannot be null."));
        this.initialState = Objects.requireNonNull(initialState, "Initial state cannot be null.");
        this.finalStates = Set.copyOf(Objects.requireNonNull(finalStates, "Final states set cannot be null."));
        Objects.requireNonNull(transitions, "Transitions map cannot be null.");

        AutomatonValidator.checkInitial(this.initialState, this.states);
        AutomatonValidator.checkFinals(this.finalStates, this.states);
        Map<TransitionKey, Set<State>> copy = new HashMap<>();
        for (Map.Entry<TransitionKey, Set<State>> entry : transitions.entrySet()) {
            TransitionKey key = entry.getKey();
            AutomatonValidator.checkKey(key, this.states, this.alphabet, true);
            if (entry.getValue().isEmpty()) {
                throw new InvalidAutomatonException("迁移 " + key + " 的目标集合为空");
            }
            AutomatonValidator.checkTargets(key, entry.getValue(), this.states);
            copy.put(key, Set.copyOf(entry.getValue()));
        }
        this.transitions = Map.copyOf(copy);

        this.hashCode = Objects.hash(this.alphabet, this.states, this.initialState, this.transitions, this.finalStates);
        logger.debug("创建 NFA：{} 个状态，{} 个符号，{} 条迁移", this.states.size(), this.alphabet.size(), this.transitions.size());
    }

    /**
     * 只给出初始状态、迁移与终态来创建 NFA：状态集合是所有出现过的状态，
     * 字母表是迁移中出现过的所有非 epsilon 符号。
     */
    public static NFA create(State initialState, Map<TransitionKey, Set<State>> transitions, Set<State> finalStates) {
        Set<State> states = new HashSet<>();
        states.add(initialState);
        states.addAll(finalStates);
        Set<Symbol> symbols = new HashSet<>();
        transitions.forEach((key, targets) -> {
            states.add(key.getSource());
            states.addAll(targets);
            if (!key.getSymbol().isEpsilon()) {
                symbols.add(key.getSymbol());
            }
        });
        return new NFA(Alphabet.of(symbols), states, initialState, transitions, finalStates);
    }

    /**
     * 直接目标：(state, symbol) 的目标集合，没有迁移时为空集。
     */
    public Set<State> targets(State state, Symbol symbol) {
        return transitions.getOrDefault(TransitionKey.of(state, symbol), Collections.emptySet());
    }

    /**
     * 从 state 出发经零条或多条 epsilon 迁移可达的状态集合，总包含 state 本身。
     */
    public Set<State> epsilonClosure(State state) {
        return epsilonClosure(Set.of(state));
    }

    /**
     * 一组状态的 epsilon 闭包，用工作表迭代到不动点。
     */
    public Set<State> epsilonClosure(Set<State> start) {
        Set<State> closure = new HashSet<>(start);
        Deque<State> worklist = new ArrayDeque<>(start);
        while (!worklist.isEmpty()) {
            State current = worklist.poll();
            for (State next : targets(current, EPSILON)) {
                if (closure.add(next)) {
                    worklist.add(next);
                }
            }
        }
        return closure;
    }

    /**
     * 子集构造的一步：先取 stateSet 的 epsilon 闭包，再沿 symbol 迁移，最后再取一次 epsilon 闭包。
     * 没有任何 symbol 迁移时返回空集。
     */
    public Set<State> step(Set<State> stateSet, Symbol symbol) {
        if (symbol.isEpsilon()) {
            throw new IllegalArgumentException("NFA.step 不接受 EPSILON 作为输入符号");
        }
        Set<State> moved = new HashSet<>();
        for (State state : epsilonClosure(stateSet)) {
            moved.addAll(targets(state, symbol));
        }
        if (moved.isEmpty()) {
            return Collections.emptySet();
        }
        return epsilonClosure(moved);
    }

    @Override
    public boolean accept(List<Symbol> input) {
        Set<State> current = epsilonClosure(initialState);
        for (Symbol symbol : input) {
            current = step(current, symbol);
            if (current.isEmpty()) {
                return false;
            }
        }
        return !Collections.disjoint(current, finalStates);
    }

    /**
     * 非 epsilon 意义下是否确定：没有 epsilon 迁移，且每个 (状态, 符号) 至多一个目标。
     */
    public boolean isDeterministic() {
        return transitions.entrySet().stream()
                .noneMatch(entry -> entry.getKey().getSymbol().isEpsilon() || entry.getValue().size() > 1);
    }

    /**
     * 补全：所有缺少目标的 (状态, 非 epsilon 符号) 都指向新的陷阱状态，陷阱状态在每个符号上自环。
     * 字母表为空（例如只有 epsilon 迁移）或没有缺失迁移时原样返回。
     */
    public NFA complete() {
        if (alphabet.isEmpty()) {
            return this;
        }
        boolean missing = states.stream()
                .anyMatch(state -> alphabet.stream().anyMatch(symbol -> !transitions.containsKey(TransitionKey.of(state, symbol))));
        if (!missing) {
            return this;
        }
        State sink = StateNames.freshSink(states);
        Set<State> completedStates = new HashSet<>(states);
        completedStates.add(sink);
        Map<TransitionKey, Set<State>> completedTransitions = new HashMap<>(transitions);
        for (State state : completedStates) {
            for (Symbol symbol : alphabet) {
                completedTransitions.putIfAbsent(TransitionKey.of(state, symbol), Set.of(sink));
            }
        }
        logger.debug("NFA.complete: 加入陷阱状态 {}", sink);
        return new NFA(alphabet, completedStates, initialState, completedTransitions, finalStates);
    }

    /**
     * 取补，要求自动机在非 epsilon 意义下确定：补全后翻转每个状态的终态标记。
     * @throws NotDeterministicException 如果存在 epsilon 迁移或多目标迁移。
     */
    public NFA complement() {
        if (!isDeterministic()) {
            logger.warn("NFA.complement: 输入不是确定的，拒绝取补");
            throw new NotDeterministicException("只能对确定的 NFA 取补，请先使用 toDfa()");
        }
        NFA completed = complete();
        Set<State> flipped = completed.states.stream()
                .filter(state -> !completed.finalStates.contains(state))
                .collect(Collectors.toSet());
        return new NFA(completed.alphabet, completed.states, completed.initialState, completed.transitions, flipped);
    }

    /**
     * 连接：两边状态分别加后缀 _0、_1，左边每个终态用 epsilon 迁移连到右边的初始状态。
     * 左边原来的终态在结果中不再是终态。
     */
    public NFA concatenate(NFA other) {
        Objects.requireNonNull(other, "Other NFA cannot be null.");
        NFA left = this.withSuffix(StateNames.LEFT_SUFFIX);
        NFA right = other.withSuffix(StateNames.RIGHT_SUFFIX);

        Map<TransitionKey, Set<State>> joined = new HashMap<>(left.transitions);
        joined.putAll(right.transitions);
        for (State finalState : left.finalStates) {
            joined.merge(TransitionKey.of(finalState, EPSILON), Set.of(right.initialState), NFA::unionOf);
        }
        Set<State> joinedStates = unionOf(left.states, right.states);
        return new NFA(left.alphabet.union(right.alphabet), joinedStates, left.initialState, joined, right.finalStates);
    }

    /**
     * 并：两边状态分别加后缀，新的初始状态用 epsilon 迁移连到两个初始状态。
     * 新初始状态沿用本自动机初始状态的原标签，被占用时追加撇号。
     */
    public NFA union(NFA other) {
        Objects.requireNonNull(other, "Other NFA cannot be null.");
        NFA left = this.withSuffix(StateNames.LEFT_SUFFIX);
        NFA right = other.withSuffix(StateNames.RIGHT_SUFFIX);

        Set<State> joinedStates = unionOf(left.states, right.states);
        State start = StateNames.fresh(initialState, joinedStates);
        joinedStates.add(start);

        Map<TransitionKey, Set<State>> joined = new HashMap<>(left.transitions);
        joined.putAll(right.transitions);
        joined.put(TransitionKey.of(start, EPSILON), Set.of(left.initialState, right.initialState));
        return new NFA(left.alphabet.union(right.alphabet), joinedStates, start, joined,
                unionOf(left.finalStates, right.finalStates));
    }

    /**
     * 消除 epsilon 迁移：每个状态在每个符号上的新目标是其 epsilon 闭包中所有状态的直接目标之并；
     * 闭包与原终态相交的状态成为终态。
     */
    public NFA removeEpsilonTransitions() {
        Map<TransitionKey, Set<State>> direct = new HashMap<>();
        Set<State> newFinals = new HashSet<>();
        for (State state : states) {
            Set<State> closure = epsilonClosure(state);
            if (!Collections.disjoint(closure, finalStates)) {
                newFinals.add(state);
            }
            for (Symbol symbol : alphabet) {
                Set<State> targets = new HashSet<>();
                for (State member : closure) {
                    targets.addAll(targets(member, symbol));
                }
                if (!targets.isEmpty()) {
                    direct.put(TransitionKey.of(state, symbol), targets);
                }
            }
        }
        logger.debug("NFA.removeEpsilonTransitions: {} 条迁移变为 {} 条", transitions.size(), direct.size());
        return new NFA(alphabet, states, initialState, direct, newFinals);
    }

    /**
     * 子集构造。初始 DFA 状态是初始状态的 epsilon 闭包；每个新发现的非空子集按发现顺序命名为 q0, q1, ...
     * 空子集不会成为状态，通向它的迁移直接省略。
     */
    public DFA toDfa() {
        Map<Set<State>, State> names = new HashMap<>();
        Deque<Set<State>> worklist = new ArrayDeque<>();
        Set<State> start = epsilonClosure(initialState);
        names.put(start, StateNames.numbered(0));
        worklist.add(start);

        Map<TransitionKey, State> dfaTransitions = new HashMap<>();
        Set<State> dfaFinals = new HashSet<>();
        while (!worklist.isEmpty()) {
            Set<State> subset = worklist.poll();
            State source = names.get(subset);
            if (!Collections.disjoint(subset, finalStates)) {
                dfaFinals.add(source);
            }
            for (Symbol symbol : alphabet) {
                Set<State> next = step(subset, symbol);
                if (next.isEmpty()) {
                    continue;
                }
                State target = names.get(next);
                if (target == null) {
                    target = StateNames.numbered(names.size());
                    names.put(next, target);
                    worklist.add(next);
                }
                dfaTransitions.put(TransitionKey.of(source, symbol), target);
            }
        }
        logger.debug("NFA.toDfa: {} 个 NFA 状态得到 {} 个 DFA 状态", states.size(), names.size());
        return new DFA(alphabet, new HashSet<>(names.values()), names.get(start), dfaTransitions, dfaFinals);
    }

    private NFA withSuffix(String suffix) {
        Map<TransitionKey, Set<State>> renamed = new HashMap<>();
        transitions.forEach((key, targets) -> renamed.put(
                TransitionKey.of(key.getSource().withSuffix(suffix), key.getSymbol()),
                targets.stream().map(target -> target.withSuffix(suffix)).collect(Collectors.toSet())));
        return new NFA(alphabet,
                states.stream().map(state -> state.withSuffix(suffix)).collect(Collectors.toSet()),
                initialState.withSuffix(suffix),
                renamed,
                finalStates.stream().map(state -> state.withSuffix(suffix)).collect(Collectors.toSet()));
    }

    private static Set<State> unionOf(Set<State> first, Set<State> second) {
        Set<State> union = new HashSet<>(first);
        union.addAll(second);
        return union;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NFA that = (NFA) o;
        return alphabet.equals(that.alphabet) &&
                states.equals(that.states) &&
                initialState.equals(that.initialState) &&
                transitions.equals(that.transitions) &&
                finalStates.equals(that.finalStates);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "NFA(states=" + new TreeSet<>(states) +
                ", initial=" + initialState +
                ", finals=" + new TreeSet<>(finalStates) +
                ", transitions=" + new TreeMap<>(transitions) + ")";
    }
}
