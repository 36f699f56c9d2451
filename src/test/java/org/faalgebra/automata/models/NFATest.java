package org.faalgebra.automata.models;

import org.faalgebra.automata.base.Alphabet;
import org.faalgebra.automata.base.Symbol;
import org.faalgebra.automata.exceptions.InvalidAutomatonException;
import org.faalgebra.automata.exceptions.NotDeterministicException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.faalgebra.automata.models.AutomatonFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class NFATest {

    // --- Test Setup ---
    private NFA automaton;

    private NFA onlyA;
    private NFA onlyB;

    // 接受 a*b*
    private NFA aStarBStar;

    @BeforeEach
    void setUp() {
        automaton = sixStateNfa();
        onlyA = nfa("q0", states("q1"), "q0 a q1");
        onlyB = nfa("q0", states("q1"), "q0 b q1");
        aStarBStar = nfa("q0", states("q1"), "q0 a q0", "q0 ε q1", "q1 b q1");
    }

    private static void assertSameLanguage(Automaton expected, Automaton actual, String letters) {
        for (String word : words(letters, 5)) {
            assertEquals(expected.accept(word), actual.accept(word), "Disagreement on '" + word + "'");
        }
    }

    @Nested
    @DisplayName("构造与校验 (Construction and Validation)")
    class ConstructionTests {

        @Test
        @DisplayName("create 推断字母表时不计入 EPSILON")
        void testCreate_AlphabetExcludesEpsilon() {
            assertEquals(Alphabet.of("a", "b"), aStarBStar.getAlphabet());
            assertEquals(states("q0", "q1"), aStarBStar.getStates());
        }

        @Test
        @DisplayName("目标集合为空应抛出异常")
        void testConstruction_WithEmptyTargets_ShouldThrow() {
            assertThrows(InvalidAutomatonException.class, () ->
                    new NFA(Alphabet.of("a"), states("q0"), state("q0"), Map.of(key("q0", "a"), Set.of()), Set.of()));
        }

        @Test
        @DisplayName("字母表不能包含 EPSILON")
        void testAlphabet_WithEpsilon_ShouldThrow() {
            assertThrows(InvalidAutomatonException.class, () -> Alphabet.of(Set.of(Symbol.EPSILON)));
        }
    }

    @Nested
    @DisplayName("模拟与 epsilon 闭包 (Simulation and Epsilon Closure)")
    class SimulationTests {

        @Test
        @DisplayName("accept (0110 拒绝, 0010 接受)")
        void testAccept() {
            assertFalse(automaton.accept("0110"));
            assertTrue(automaton.accept("0010"));
        }

        @Test
        @DisplayName("epsilon 闭包包含状态本身")
        void testEpsilonClosure() {
            assertEquals(states("q0", "q1"), aStarBStar.epsilonClosure(state("q0")));
            assertEquals(states("q1"), aStarBStar.epsilonClosure(state("q1")));
        }

        @Test
        @DisplayName("epsilon 环不会导致无限循环")
        void testEpsilonClosure_WithCycle() {
            NFA cyclic = nfa("q0", states("q2"), "q0 ε q1", "q1 ε q0,q2");
            assertEquals(states("q0", "q1", "q2"), cyclic.epsilonClosure(state("q1")));
        }

        @Test
        @DisplayName("子集构造的一步")
        void testStep() {
            assertEquals(states("q0", "q1"), aStarBStar.step(states("q0"), Symbol.of("a")));
            assertEquals(states("q1"), aStarBStar.step(states("q0", "q1"), Symbol.of("b")));
            assertTrue(aStarBStar.step(states("q1"), Symbol.of("a")).isEmpty());
        }

        @Test
        @DisplayName("空输入通过 epsilon 到达终态时接受")
        void testAccept_EmptyInputThroughEpsilon() {
            assertTrue(aStarBStar.accept(""));
            assertTrue(aStarBStar.accept("aabb"));
            assertFalse(aStarBStar.accept("ba"));
        }
    }

    @Nested
    @DisplayName("补全与取补 (Completion and Complement)")
    class CompletionTests {

        @Test
        @DisplayName("补全加入陷阱状态")
        void testComplete() {
            NFA complete = onlyA.complete();

            assertAll("Completed automaton",
                    () -> assertEquals(states("q0", "q1", "-"), complete.getStates()),
                    () -> assertEquals(states("-"), complete.getTransitions().get(key("q1", "a"))),
                    () -> assertEquals(states("-"), complete.getTransitions().get(key("-", "a")))
            );
        }

        @Test
        @DisplayName("只有 epsilon 迁移时不加陷阱状态")
        void testComplete_EpsilonOnly() {
            NFA epsilonOnly = nfa("q0", states("q1"), "q0 ε q1");
            assertEquals(states("q0", "q1"), epsilonOnly.complete().getStates());
        }

        @Test
        @DisplayName("确定的 NFA 取补")
        void testComplement() {
            NFA complement = onlyA.complement();

            assertAll("Complement",
                    () -> assertEquals(state("q0"), complement.getInitialState()),
                    () -> assertEquals(nfaTransitions("q0 a q1", "q1 a -", "- a -"), complement.getTransitions()),
                    () -> assertEquals(states("q0", "-"), complement.getFinalStates())
            );
        }

        @Test
        @DisplayName("非确定的 NFA 取补应抛出异常")
        void testComplement_NotDeterministic() {
            NFA branching = nfa("q0", states("q1"), "q0 a q0,q1");

            assertFalse(branching.isDeterministic());
            assertFalse(aStarBStar.isDeterministic());
            assertThrows(NotDeterministicException.class, branching::complement);
            assertThrows(NotDeterministicException.class, aStarBStar::complement);
        }
    }

    @Nested
    @DisplayName("结构组合 (Structural Combination)")
    class CombinationTests {

        @Test
        @DisplayName("连接用 epsilon 迁移连接两个自动机")
        void testConcatenate() {
            NFA concatenation = onlyA.concatenate(onlyB);

            assertAll("Concatenation",
                    () -> assertEquals(state("q0_0"), concatenation.getInitialState()),
                    () -> assertEquals(nfaTransitions("q0_0 a q1_0", "q1_0 ε q0_1", "q0_1 b q1_1"),
                            concatenation.getTransitions()),
                    () -> assertEquals(states("q1_1"), concatenation.getFinalStates())
            );
        }

        @Test
        @DisplayName("并加入新的初始状态")
        void testUnion() {
            NFA union = onlyA.union(onlyB);

            assertAll("Union",
                    () -> assertEquals(state("q0"), union.getInitialState()),
                    () -> assertEquals(nfaTransitions("q0 ε q0_0,q0_1", "q0_0 a q1_0", "q0_1 b q1_1"),
                            union.getTransitions()),
                    () -> assertEquals(states("q1_0", "q1_1"), union.getFinalStates())
            );
        }

        @Test
        @DisplayName("新初始状态的标签被占用时追加撇号")
        void testUnion_InitialLabelTaken() {
            NFA left = nfa("s_1", states("s_1"), "s_1 a s_1");
            NFA right = nfa("s", states("s"), "s b s");
            NFA union = left.union(right);

            assertEquals(state("s_1'"), union.getInitialState());
            assertTrue(union.getStates().contains(state("s_1")));
        }

        @Test
        @DisplayName("并与连接的语言")
        void testCombinations_Language() {
            NFA union = aStarBStar.union(onlyA);
            NFA concatenation = aStarBStar.concatenate(onlyA);
            for (String word : words("ab", 5)) {
                assertEquals(word.matches("a*b*|a"), union.accept(word), word);
                assertEquals(word.matches("a*b*a"), concatenation.accept(word), word);
            }
        }
    }

    @Nested
    @DisplayName("消除 epsilon 与子集构造 (Epsilon Removal and Subset Construction)")
    class ConversionTests {

        @Test
        @DisplayName("消除 epsilon 迁移")
        void testRemoveEpsilonTransitions() {
            NFA nfa = nfa("q0", states("q2"),
                    "q0 0 q2", "q0 1 q1",
                    "q1 0 q0", "q1 ε q2",
                    "q2 1 q0", "q2 ε q1");
            NFA epsilonFree = nfa.removeEpsilonTransitions();

            assertAll("Epsilon-free",
                    () -> assertEquals(state("q0"), epsilonFree.getInitialState()),
                    () -> assertEquals(nfaTransitions(
                            "q0 0 q2", "q0 1 q1",
                            "q1 0 q0", "q1 1 q0",
                            "q2 0 q0", "q2 1 q0"), epsilonFree.getTransitions()),
                    () -> assertEquals(states("q1", "q2"), epsilonFree.getFinalStates())
            );
            assertSameLanguage(nfa, epsilonFree, "01");
        }

        @Test
        @DisplayName("子集构造 (a+)")
        void testToDfa() {
            DFA dfa = onlyA.toDfa();
            assertEquals(dfaTransitions("q0 a q1"), dfa.getTransitions());
            assertEquals(states("q1"), dfa.getFinalStates());
        }

        @Test
        @DisplayName("带 epsilon 的子集构造 (a*b*)")
        void testToDfa_WithEpsilon() {
            DFA dfa = aStarBStar.toDfa();

            assertAll("Subset construction",
                    () -> assertEquals(states("q0", "q1"), dfa.getStates()),
                    () -> assertEquals(states("q0", "q1"), dfa.getFinalStates()),
                    () -> assertEquals(state("q0"), dfa.getInitialState()),
                    () -> assertEquals(dfaTransitions("q0 a q0", "q0 b q1", "q1 b q1"), dfa.getTransitions())
            );
        }

        @Test
        @DisplayName("子集构造与消除 epsilon 保持语言")
        void testConversions_Language() {
            NFA branching = nfa("q0", states("q2"), "q0 a q0,q1", "q1 b q2", "q0 ε q2", "q2 a q1");
            assertSameLanguage(branching, branching.toDfa(), "ab");
            assertSameLanguage(branching, branching.removeEpsilonTransitions(), "ab");
            assertSameLanguage(automaton, automaton.toDfa(), "01");
        }
    }
}
