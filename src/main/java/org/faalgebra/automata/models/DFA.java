package org.faalgebra.automata.models;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.faalgebra.automata.base.Alphabet;
import org.faalgebra.automata.base.State;
import org.faalgebra.automata.base.Symbol;
import org.faalgebra.automata.base.TransitionKey;
import org.faalgebra.automata.exceptions.UndefinedTransitionException;
import org.faalgebra.utils.StateNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 代表一个确定有限自动机 (Deterministic Finite Automaton, DFA)。
 * 迁移函数可以是部分的：没有映射的 (状态, 符号) 在模拟时视为拒绝。
 * DFA 是不可变的值对象，相等性由五个组成部分的结构相等决定。
 * 所有变换（补全、取补、乘积、剪枝、最小化、重命名、转换）都返回新的 DFA。
 */
@Getter
public final class DFA implements Automaton {

    private static final Logger logger = LoggerFactory.getLogger(DFA.class);

    private final Alphabet alphabet;
    private final Set<State> states;
    private final State initialState;
    private final Map<TransitionKey, State> transitions;
    private final Set<State> finalStates;

    private final int hashCode;

    /**
     * 构造一个 DFA，并立即检查结构不变量。
     *
     * @param alphabet     字母表。
     * @param states       状态集合。
     * @param initialState 初始状态，必须属于 states。
     * @param transitions  部分迁移函数 (状态, 符号) → 状态。
     * @param finalStates  终态集合，必须是 states 的子集。
     * @throws org.faalgebra.automata.exceptions.InvalidAutomatonException 违反不变量时。
     */
    public DFA(Alphabet alphabet, Set<State> states, State initialState, Map<TransitionKey, State> transitions, Set<State> finalStates) {
        this.alphabet = Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        this.states = Set.copyOf(Objects.requireNonNull(states, "States set cannot be null."));
        this.initialState = Objects.requireNonNull(initialState, "Initial state cannot be null.");
        this.transitions = Map.copyOf(Objects.requireNonNull(transitions, "Transitions map cannot be null."));
        this.finalStates = Set.copyOf(Objects.requireNonNull(finalStates, "Final states set cannot be null."));

        AutomatonValidator.checkInitial(this.initialState, this.states);
        AutomatonValidator.checkFinals(this.finalStates, this.states);
        for (Map.Entry<TransitionKey, State> entry : this.transitions.entrySet()) {
            AutomatonValidator.checkKey(entry.getKey(), this.states, this.alphabet, false);
            AutomatonValidator.checkTargets(entry.getKey(), List.of(entry.getValue()), this.states);
        }

        this.hashCode = Objects.hash(this.alphabet, this.states, this.initialState, this.transitions, this.finalStates);
        logger.debug("创建 DFA：{} 个状态，{} 个符号，{} 条迁移", this.states.size(), this.alphabet.size(), this.transitions.size());
    }

    /**
     * 只给出初始状态、迁移与终态来创建 DFA：状态集合是所有出现过的状态，
     * 字母表是迁移中出现过的所有符号。
     */
    public static DFA create(State initialState, Map<TransitionKey, State> transitions, Set<State> finalStates) {
        Set<State> states = new HashSet<>();
        states.add(initialState);
        states.addAll(finalStates);
        Set<Symbol> symbols = new HashSet<>();
        transitions.forEach((key, target) -> {
            states.add(key.getSource());
            states.add(target);
            symbols.add(key.getSymbol());
        });
        return new DFA(Alphabet.of(symbols), states, initialState, transitions, finalStates);
    }

    /**
     * 查找迁移，不存在时返回空。
     */
    public Optional<State> transition(State state, Symbol symbol) {
        return Optional.ofNullable(transitions.get(TransitionKey.of(state, symbol)));
    }

    /**
     * 执行一步迁移。
     * @throws UndefinedTransitionException 如果 (state, symbol) 没有映射。
     */
    public State step(State state, Symbol symbol) {
        return transition(state, symbol).orElseThrow(() -> new UndefinedTransitionException(state, symbol));
    }

    @Override
    public boolean accept(List<Symbol> input) {
        State current = initialState;
        for (Symbol symbol : input) {
            Optional<State> next = transition(current, symbol);
            if (next.isEmpty()) {
                logger.debug("DFA.accept: 在 ({}, {}) 处没有迁移，拒绝输入", current, symbol);
                return false;
            }
            current = next.get();
        }
        return finalStates.contains(current);
    }

    /**
     * 迁移函数在 states × alphabet 上是否全定义。键已经过校验，所以只需比较数量。
     */
    public boolean isComplete() {
        return transitions.size() == states.size() * alphabet.size();
    }

    /**
     * 补全迁移函数：所有缺失的 (状态, 符号) 都指向一个新的陷阱状态，陷阱状态在每个符号上自环。
     * 已经完全的 DFA 原样返回。
     */
    public DFA complete() {
        return completeOver(alphabet);
    }

    /**
     * 在 alphabet ∪ extra 上补全。乘积运算需要两个操作数在同一个字母表上是完全的。
     */
    private DFA completeOver(Alphabet extra) {
        Alphabet merged = alphabet.union(extra);
        if (merged.equals(alphabet) && isComplete()) {
            return this;
        }
        State sink = StateNames.freshSink(states);
        Set<State> completedStates = new HashSet<>(states);
        completedStates.add(sink);
        Map<TransitionKey, State> completedTransitions = new HashMap<>(transitions);
        for (State state : completedStates) {
            for (Symbol symbol : merged) {
                completedTransitions.putIfAbsent(TransitionKey.of(state, symbol), sink);
            }
        }
        logger.debug("DFA.complete: 加入陷阱状态 {}，补全了 {} 条迁移", sink, completedTransitions.size() - transitions.size());
        return new DFA(merged, completedStates, initialState, completedTransitions, finalStates);
    }

    /**
     * 取补：先补全，再翻转每个状态的终态标记。
     */
    public DFA complement() {
        DFA completed = complete();
        Set<State> flipped = completed.states.stream()
                .filter(state -> !completed.finalStates.contains(state))
                .collect(Collectors.toSet());
        return new DFA(completed.alphabet, completed.states, completed.initialState, completed.transitions, flipped);
    }

    public DFA union(DFA other) {
        return product(other, ProductRule.UNION);
    }

    public DFA difference(DFA other) {
        return product(other, ProductRule.DIFFERENCE);
    }

    public DFA intersection(DFA other) {
        return product(other, ProductRule.INTERSECTION);
    }

    /**
     * 同步乘积构造，只保留从 (初始, 初始) 可达的状态对。
     * 两个操作数先在并字母表上补全，所以每一步都有定义。
     */
    private DFA product(DFA other, ProductRule rule) {
        Objects.requireNonNull(other, "Other DFA cannot be null.");
        Alphabet merged = alphabet.union(other.alphabet);
        DFA left = this.completeOver(merged);
        DFA right = other.completeOver(merged);

        Map<Pair<State, State>, State> names = new HashMap<>();
        Deque<Pair<State, State>> worklist = new ArrayDeque<>();
        Pair<State, State> start = Pair.of(left.initialState, right.initialState);
        names.put(start, StateNames.numbered(0));
        worklist.add(start);

        Map<TransitionKey, State> productTransitions = new HashMap<>();
        Set<State> productFinals = new HashSet<>();
        while (!worklist.isEmpty()) {
            Pair<State, State> pair = worklist.poll();
            State source = names.get(pair);
            if (rule.isFinal(left.isFinal(pair.getLeft()), right.isFinal(pair.getRight()))) {
                productFinals.add(source);
            }
            for (Symbol symbol : merged) {
                Pair<State, State> next = Pair.of(left.step(pair.getLeft(), symbol), right.step(pair.getRight(), symbol));
                State target = names.get(next);
                if (target == null) {
                    target = StateNames.numbered(names.size());
                    names.put(next, target);
                    worklist.add(next);
                }
                productTransitions.put(TransitionKey.of(source, symbol), target);
            }
        }
        logger.debug("DFA.{}: 乘积自动机有 {} 个状态，{} 个终态", rule, names.size(), productFinals.size());
        return new DFA(merged, new HashSet<>(names.values()), names.get(start), productTransitions, productFinals);
    }

    /**
     * 连接：确定性无法通过直接乘积保持，因此先嵌入 NFA，用 epsilon 连接后做子集构造，最后规范重命名。
     */
    public DFA concatenate(DFA other) {
        Objects.requireNonNull(other, "Other DFA cannot be null.");
        return toNfa().concatenate(other.toNfa()).toDfa().rename();
    }

    /**
     * 规范重命名：从初始状态出发广度优先遍历，符号按顺序访问，第 n 个被发现的状态得到第 n 个字母标签。
     * 从初始状态不可达的状态随后按标签顺序继续遍历，状态集合大小保持不变。
     */
    public DFA rename() {
        Map<State, State> names = new HashMap<>();
        List<State> roots = new ArrayList<>();
        roots.add(initialState);
        roots.addAll(new TreeSet<>(states));

        Deque<State> worklist = new ArrayDeque<>();
        for (State root : roots) {
            if (names.containsKey(root)) {
                continue;
            }
            names.put(root, StateNames.lettered(names.size()));
            worklist.add(root);
            while (!worklist.isEmpty()) {
                State current = worklist.poll();
                for (Symbol symbol : alphabet) {
                    State target = transitions.get(TransitionKey.of(current, symbol));
                    if (target != null && !names.containsKey(target)) {
                        names.put(target, StateNames.lettered(names.size()));
                        worklist.add(target);
                    }
                }
            }
        }
        return relabel(names);
    }

    private DFA relabel(Map<State, State> names) {
        Map<TransitionKey, State> renamed = new HashMap<>();
        transitions.forEach((key, target) ->
                renamed.put(TransitionKey.of(names.get(key.getSource()), key.getSymbol()), names.get(target)));
        Set<State> renamedStates = states.stream().map(names::get).collect(Collectors.toSet());
        Set<State> renamedFinals = finalStates.stream().map(names::get).collect(Collectors.toSet());
        return new DFA(alphabet, renamedStates, names.get(initialState), renamed, renamedFinals);
    }

    /**
     * 删除从初始状态不可达的状态。字母表重新计算为剩余迁移实际使用的符号。
     */
    public DFA removeUnreachable() {
        Set<State> reachable = reachableFrom(initialState);
        Map<TransitionKey, State> kept = transitions.entrySet().stream()
                .filter(entry -> reachable.contains(entry.getKey().getSource()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
        Set<State> keptFinals = finalStates.stream().filter(reachable::contains).collect(Collectors.toSet());
        logger.debug("DFA.removeUnreachable: 删除了 {} 个不可达状态", states.size() - reachable.size());
        return new DFA(usedSymbols(kept.keySet()), reachable, initialState, kept, keptFinals);
    }

    /**
     * 删除死状态（无法到达任何终态的状态）以及指向它们的迁移。
     * 初始状态即使是死状态也保留；字母表重新计算，可能变为空。
     */
    public DFA removeDead() {
        Map<State, Set<State>> predecessors = new HashMap<>();
        transitions.forEach((key, target) ->
                predecessors.computeIfAbsent(target, k -> new HashSet<>()).add(key.getSource()));

        Set<State> live = new HashSet<>(finalStates);
        Deque<State> worklist = new ArrayDeque<>(finalStates);
        while (!worklist.isEmpty()) {
            State current = worklist.poll();
            for (State predecessor : predecessors.getOrDefault(current, Collections.emptySet())) {
                if (live.add(predecessor)) {
                    worklist.add(predecessor);
                }
            }
        }

        // 前驱为活状态的迁移源也一定是活的，所以只需按目标过滤
        Map<TransitionKey, State> kept = transitions.entrySet().stream()
                .filter(entry -> live.contains(entry.getValue()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
        Set<State> keptStates = new HashSet<>(live);
        keptStates.add(initialState);
        logger.debug("DFA.removeDead: 删除了 {} 个死状态", states.size() - keptStates.size());
        return new DFA(usedSymbols(kept.keySet()), keptStates, initialState, kept, finalStates);
    }

    /**
     * 表格填充法最小化。在补全后的自动机上计算可区分状态对，不可区分的状态合并为一个等价类。
     * 补全时新加入的陷阱状态所在的类（不含初始状态时）会被丢弃，结果保持部分迁移函数。
     * 等价类从初始类开始按广度优先顺序命名为 q0, q1, ...
     */
    public DFA mergeNondistinguishable() {
        DFA completed = complete();
        List<State> ordered = new ArrayList<>(new TreeSet<>(completed.states));
        Map<State, Integer> index = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            index.put(ordered.get(i), i);
        }
        int n = ordered.size();

        // distinct[i][j] 只使用 i < j 的部分
        boolean[][] distinct = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                distinct[i][j] = completed.isFinal(ordered.get(i)) != completed.isFinal(ordered.get(j));
            }
        }

        boolean changed = true;
        int rounds = 0;
        while (changed) {
            changed = false;
            rounds++;
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    if (distinct[i][j]) {
                        continue;
                    }
                    for (Symbol symbol : completed.alphabet) {
                        int a = index.get(completed.step(ordered.get(i), symbol));
                        int b = index.get(completed.step(ordered.get(j), symbol));
                        if (a != b && distinct[Math.min(a, b)][Math.max(a, b)]) {
                            distinct[i][j] = true;
                            changed = true;
                            break;
                        }
                    }
                }
            }
        }

        int[] representative = new int[n];
        for (int i = 0; i < n; i++) {
            representative[i] = i;
            for (int j = 0; j < i; j++) {
                if (!distinct[j][i]) {
                    representative[i] = representative[j];
                    break;
                }
            }
        }

        int initialClass = representative[index.get(initialState)];
        Set<Integer> dropped = new HashSet<>();
        completed.states.stream()
                .filter(state -> !states.contains(state))
                .findFirst()
                .ifPresent(sink -> {
                    int sinkClass = representative[index.get(sink)];
                    if (sinkClass != initialClass) {
                        dropped.add(sinkClass);
                    }
                });

        List<Integer> roots = new ArrayList<>();
        roots.add(initialClass);
        for (int i = 0; i < n; i++) {
            if (representative[i] == i && !dropped.contains(i)) {
                roots.add(i);
            }
        }

        Map<Integer, State> names = new HashMap<>();
        Map<TransitionKey, State> merged = new HashMap<>();
        Set<State> mergedFinals = new HashSet<>();
        Deque<Integer> worklist = new ArrayDeque<>();
        for (int root : roots) {
            if (names.containsKey(root)) {
                continue;
            }
            names.put(root, StateNames.numbered(names.size()));
            worklist.add(root);
            while (!worklist.isEmpty()) {
                int current = worklist.poll();
                State source = names.get(current);
                State currentState = ordered.get(current);
                if (completed.isFinal(currentState)) {
                    mergedFinals.add(source);
                }
                for (Symbol symbol : completed.alphabet) {
                    int targetClass = representative[index.get(completed.step(currentState, symbol))];
                    if (dropped.contains(targetClass)) {
                        continue;
                    }
                    State target = names.get(targetClass);
                    if (target == null) {
                        target = StateNames.numbered(names.size());
                        names.put(targetClass, target);
                        worklist.add(targetClass);
                    }
                    merged.put(TransitionKey.of(source, symbol), target);
                }
            }
        }
        logger.debug("DFA.mergeNondistinguishable: {} 轮后收敛，{} 个状态合并为 {} 个", rounds, states.size(), names.size());
        return new DFA(alphabet, new HashSet<>(names.values()), names.get(initialClass), merged, mergedFinals);
    }

    /**
     * 结构嵌入为 NFA：每条迁移的目标变为单元素集合，不引入 epsilon 迁移。
     */
    public NFA toNfa() {
        Map<TransitionKey, Set<State>> lifted = new HashMap<>();
        transitions.forEach((key, target) -> lifted.put(key, Set.of(target)));
        return new NFA(alphabet, states, initialState, lifted, finalStates);
    }

    /**
     * 语言是否为空：从初始状态不可达任何终态。
     */
    public boolean isEmpty() {
        return Collections.disjoint(reachableFrom(initialState), finalStates);
    }

    /**
     * 语言相等：两个方向的差都为空。
     */
    public boolean isEquivalent(DFA other) {
        return difference(other).isEmpty() && other.difference(this).isEmpty();
    }

    private Set<State> reachableFrom(State start) {
        Set<State> reachable = new HashSet<>();
        reachable.add(start);
        Deque<State> worklist = new ArrayDeque<>();
        worklist.add(start);
        while (!worklist.isEmpty()) {
            State current = worklist.poll();
            for (Symbol symbol : alphabet) {
                State target = transitions.get(TransitionKey.of(current, symbol));
                if (target != null && reachable.add(target)) {
                    worklist.add(target);
                }
            }
        }
        return reachable;
    }

    private static Alphabet usedSymbols(Collection<TransitionKey> keys) {
        return Alphabet.of(keys.stream().map(TransitionKey::getSymbol).collect(Collectors.toSet()));
    }

    /**
     * 乘积构造的终态规则。
     */
    private enum ProductRule {
        UNION,
        DIFFERENCE,
        INTERSECTION;

        boolean isFinal(boolean leftFinal, boolean rightFinal) {
            return switch (this) {
                case UNION -> leftFinal || rightFinal;
                case DIFFERENCE -> leftFinal && !rightFinal;
                case INTERSECTION -> leftFinal && rightFinal;
            };
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DFA that = (DFA) o;
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
        return "DFA(states=" + new TreeSet<>(states) +
                ", initial=" + initialState +
                ", finals=" + new TreeSet<>(finalStates) +
                ", transitions=" + new TreeMap<>(transitions) + ")";
    }
}
