package org.faalgebra.io;

import org.faalgebra.automata.models.DFA;
import org.faalgebra.automata.models.NFA;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static org.faalgebra.automata.models.AutomatonFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class AutomatonCodecTest {

    private static AutomatonCodec codec;

    @BeforeAll
    static void setUp() {
        codec = new AutomatonCodec();
    }

    private static Reader resource(String name) {
        InputStream in = Objects.requireNonNull(AutomatonCodecTest.class.getResourceAsStream("/" + name), name);
        return new InputStreamReader(in, StandardCharsets.UTF_8);
    }

    /**
     * 辅助方法：解码失败时返回出错的字段名。
     */
    private static String failingField(String json) {
        AutomatonDecodeException e = assertThrows(AutomatonDecodeException.class, () -> codec.readDfa(json));
        return e.getField();
    }

    @Nested
    @DisplayName("往返 (Round Trip)")
    class RoundTripTests {

        @Test
        @DisplayName("DFA 写出后读回结构相等")
        void testDumpAndLoadDfa() throws IOException {
            StringWriter out = new StringWriter();
            codec.dumpDfa(out, sixStateDfa());
            DFA loaded = codec.loadDfa(new StringReader(out.toString()));

            assertEquals(sixStateDfa(), loaded);
        }

        @Test
        @DisplayName("NFA（含 epsilon 迁移）写出后读回结构相等")
        void testDumpAndLoadNfa() throws IOException {
            NFA withEpsilon = nfa("q0", states("q1"), "q0 a q0,q1", "q0 ε q1", "q1 b q1");

            assertEquals(sixStateNfa(), codec.readNfa(codec.writeNfa(sixStateNfa())));
            assertEquals(withEpsilon, codec.readNfa(codec.writeNfa(withEpsilon)));
        }

        @Test
        @DisplayName("编码是确定的，epsilon 编码为空字符串")
        void testEncoding_IsDeterministic() throws IOException {
            AutomatonCodec compact = new AutomatonCodec(false);
            NFA nfa = nfa("q0", states("q1"), "q0 ε q1,q0");

            assertEquals(compact.writeDfa(sixStateDfa()), compact.writeDfa(compact.readDfa(compact.writeDfa(sixStateDfa()))));
            assertEquals("{\"alphabet\":[],\"states\":[\"q0\",\"q1\"],\"initial_state\":\"q0\","
                    + "\"transitions\":[[\"q0\",\"\",[\"q0\",\"q1\"]]],\"final_states\":[\"q1\"]}", compact.writeNfa(nfa));
        }
    }

    @Nested
    @DisplayName("读取文件 (Loading Fixtures)")
    class LoadTests {

        @Test
        @DisplayName("读取 dfa.json")
        void testLoadDfa() throws IOException {
            try (Reader in = resource("dfa.json")) {
                assertEquals(sixStateDfa(), codec.loadDfa(in));
            }
        }

        @Test
        @DisplayName("读取 nfa.json")
        void testLoadNfa() throws IOException {
            try (Reader in = resource("nfa.json")) {
                assertEquals(sixStateNfa(), codec.loadNfa(in));
            }
        }
    }

    @Nested
    @DisplayName("解码错误 (Decode Errors)")
    class DecodeErrorTests {

        private static final String HEADER = "\"alphabet\":[\"a\"],\"states\":[\"q0\",\"q1\"],\"initial_state\":\"q0\",";

        @Test
        @DisplayName("缺少字段")
        void testMissingField() {
            assertEquals("states", failingField("{\"alphabet\":[],\"initial_state\":\"q0\",\"transitions\":[],\"final_states\":[]}"));
            assertEquals("final_states", failingField("{" + HEADER + "\"transitions\":[]}"));
            assertEquals("initial_state", failingField("{\"alphabet\":[],\"states\":[\"q0\"],\"transitions\":[],\"final_states\":[]}"));
        }

        @Test
        @DisplayName("引用不存在的状态")
        void testDanglingState() {
            assertEquals("final_states", failingField("{" + HEADER + "\"transitions\":[],\"final_states\":[\"q9\"]}"));
            assertEquals("transitions", failingField("{" + HEADER + "\"transitions\":[[\"q0\",\"a\",\"q9\"]],\"final_states\":[]}"));
            assertEquals("initial_state", failingField("{\"alphabet\":[],\"states\":[\"q0\"],\"initial_state\":\"q9\",\"transitions\":[],\"final_states\":[]}"));
        }

        @Test
        @DisplayName("重复的迁移键")
        void testDuplicateKey() {
            assertEquals("transitions", failingField("{" + HEADER
                    + "\"transitions\":[[\"q0\",\"a\",\"q1\"],[\"q0\",\"a\",\"q0\"]],\"final_states\":[]}"));
        }

        @Test
        @DisplayName("DFA 迁移使用 epsilon 或未知符号")
        void testBadSymbols() {
            assertEquals("transitions", failingField("{" + HEADER + "\"transitions\":[[\"q0\",\"\",\"q1\"]],\"final_states\":[]}"));
            assertEquals("transitions", failingField("{" + HEADER + "\"transitions\":[[\"q0\",\"b\",\"q1\"]],\"final_states\":[]}"));
            assertEquals("transitions", failingField("{" + HEADER + "\"transitions\":[[\"q0\",\"a\"]],\"final_states\":[]}"));
        }

        @Test
        @DisplayName("NFA 目标列表为空")
        void testEmptyNfaTargets() {
            AutomatonDecodeException e = assertThrows(AutomatonDecodeException.class, () ->
                    codec.readNfa("{" + HEADER + "\"transitions\":[[\"q0\",\"a\",[]]],\"final_states\":[]}"));
            assertEquals("transitions", e.getField());
        }

        @Test
        @DisplayName("非法 JSON")
        void testMalformedJson() {
            assertEquals("$", failingField("{\"alphabet\": ["));
            assertEquals("$", failingField("[]"));
        }
    }
}
