package org.faalgebra.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.faalgebra.automata.base.Alphabet;
import org.faalgebra.automata.base.State;
import org.faalgebra.automata.base.Symbol;
import org.faalgebra.automata.base.TransitionKey;
import org.faalgebra.automata.models.Automaton;
import org.faalgebra.automata.models.DFA;
import org.faalgebra.automata.models.NFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 把 DFA / NFA 编码为 JSON，或从 JSON 解码。
 * <pre>
 * {
 *   "alphabet": [symbol, ...],
 *   "states": [state, ...],
 *   "initial_state": state,
 *   "transitions": [[state, symbol, target | [target, ...]], ...],
 *   "final_states": [state, ...]
 * }
 * </pre>
 * DFA 迁移的第三个元素是单个目标状态；NFA 是非空的目标列表，符号为空字符串表示 epsilon。
 * 编码时所有列表都排序，输出是确定的。解码会检查完整的结构并报告出错的字段。
 */
public final class AutomatonCodec {

    private static final Logger logger = LoggerFactory.getLogger(AutomatonCodec.class);

    public static final String ALPHABET = "alphabet";
    public static final String STATES = "states";
    public static final String INITIAL_STATE = "initial_state";
    public static final String TRANSITIONS = "transitions";
    public static final String FINAL_STATES = "final_states";

    private static final String ROOT = "$";

    private final ObjectMapper mapper;

    public AutomatonCodec() {
        this(true);
    }

    /**
     * @param prettyPrint 是否缩进输出。
     */
    public AutomatonCodec(boolean prettyPrint) {
        this.mapper = new ObjectMapper();
        // 流由调用方负责关闭
        this.mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        this.mapper.configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false);
        if (prettyPrint) {
            this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    // ---------------------------------------------------------------- DFA

    public void dumpDfa(Writer out, DFA dfa) throws IOException {
        mapper.writeValue(out, encode(dfa));
        logger.debug("写出 DFA：{} 个状态", dfa.getStates().size());
    }

    public String writeDfa(DFA dfa) throws IOException {
        StringWriter out = new StringWriter();
        dumpDfa(out, dfa);
        return out.toString();
    }

    public DFA loadDfa(Reader in) throws IOException {
        JsonNode root = parse(in);
        Header header = decodeHeader(root);
        Map<TransitionKey, State> transitions = new HashMap<>();
        for (JsonNode entry : requireArray(root, TRANSITIONS)) {
            TransitionKey key = decodeKey(entry, header, false);
            State target = decodeState(entry.get(2), header, TRANSITIONS);
            if (transitions.put(key, target) != null) {
                throw new AutomatonDecodeException(TRANSITIONS, "重复的迁移键 " + key);
            }
        }
        logger.debug("读入 DFA：{} 个状态，{} 条迁移", header.states.size(), transitions.size());
        return new DFA(header.alphabet, header.states, header.initialState, transitions, header.finalStates);
    }

    public DFA readDfa(String json) throws IOException {
        return loadDfa(new StringReader(json));
    }

    // ---------------------------------------------------------------- NFA

    public void dumpNfa(Writer out, NFA nfa) throws IOException {
        mapper.writeValue(out, encode(nfa));
        logger.debug("写出 NFA：{} 个状态", nfa.getStates().size());
    }

    public String writeNfa(NFA nfa) throws IOException {
        StringWriter out = new StringWriter();
        dumpNfa(out, nfa);
        return out.toString();
    }

    public NFA loadNfa(Reader in) throws IOException {
        JsonNode root = parse(in);
        Header header = decodeHeader(root);
        Map<TransitionKey, Set<State>> transitions = new HashMap<>();
        for (JsonNode entry : requireArray(root, TRANSITIONS)) {
            TransitionKey key = decodeKey(entry, header, true);
            JsonNode targetsNode = entry.get(2);
            if (!targetsNode.isArray() || targetsNode.isEmpty()) {
                throw new AutomatonDecodeException(TRANSITIONS, "NFA 迁移 " + key + " 的目标必须是非空列表");
            }
            Set<State> targets = new HashSet<>();
            for (JsonNode target : targetsNode) {
                targets.add(decodeState(target, header, TRANSITIONS));
            }
            if (transitions.put(key, targets) != null) {
                throw new AutomatonDecodeException(TRANSITIONS, "重复的迁移键 " + key);
            }
        }
        logger.debug("读入 NFA：{} 个状态，{} 条迁移", header.states.size(), transitions.size());
        return new NFA(header.alphabet, header.states, header.initialState, transitions, header.finalStates);
    }

    public NFA readNfa(String json) throws IOException {
        return loadNfa(new StringReader(json));
    }

    // ---------------------------------------------------------------- encoding

    private ObjectNode encode(DFA dfa) {
        ObjectNode root = encodeHeader(dfa);
        ArrayNode transitions = root.putArray(TRANSITIONS);
        new TreeMap<>(dfa.getTransitions()).forEach((key, target) -> transitions.addArray()
                .add(key.getSource().getLabel())
                .add(key.getSymbol().getLabel())
                .add(target.getLabel()));
        encodeStates(root.putArray(FINAL_STATES), dfa.getFinalStates());
        return root;
    }

    private ObjectNode encode(NFA nfa) {
        ObjectNode root = encodeHeader(nfa);
        ArrayNode transitions = root.putArray(TRANSITIONS);
        new TreeMap<>(nfa.getTransitions()).forEach((key, targets) -> {
            ArrayNode entry = transitions.addArray()
                    .add(key.getSource().getLabel())
                    .add(key.getSymbol().getLabel());
            encodeStates(entry.addArray(), targets);
        });
        encodeStates(root.putArray(FINAL_STATES), nfa.getFinalStates());
        return root;
    }

    private ObjectNode encodeHeader(Automaton automaton) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode alphabet = root.putArray(ALPHABET);
        automaton.getAlphabet().forEach(symbol -> alphabet.add(symbol.getLabel()));
        encodeStates(root.putArray(STATES), automaton.getStates());
        root.put(INITIAL_STATE, automaton.getInitialState().getLabel());
        return root;
    }

    private static void encodeStates(ArrayNode array, Set<State> states) {
        new TreeSet<>(states).forEach(state -> array.add(state.getLabel()));
    }

    // ---------------------------------------------------------------- decoding

    private JsonNode parse(Reader in) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new AutomatonDecodeException(ROOT, "不是合法的 JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new AutomatonDecodeException(ROOT, "顶层必须是 JSON 对象");
        }
        return root;
    }

    private Header decodeHeader(JsonNode root) throws AutomatonDecodeException {
        Set<Symbol> symbols = new HashSet<>();
        for (JsonNode node : requireArray(root, ALPHABET)) {
            String label = requireLabel(node, ALPHABET);
            symbols.add(Symbol.of(label));
        }
        Set<State> states = new HashSet<>();
        for (JsonNode node : requireArray(root, STATES)) {
            states.add(State.of(requireLabel(node, STATES)));
        }

        Header header = new Header(Alphabet.of(symbols), states);
        JsonNode initial = root.get(INITIAL_STATE);
        if (initial == null) {
            throw new AutomatonDecodeException(INITIAL_STATE, "缺少字段");
        }
        header.initialState = decodeState(initial, header, INITIAL_STATE);
        for (JsonNode node : requireArray(root, FINAL_STATES)) {
            header.finalStates.add(decodeState(node, header, FINAL_STATES));
        }
        return header;
    }

    private TransitionKey decodeKey(JsonNode entry, Header header, boolean epsilonAllowed) throws AutomatonDecodeException {
        if (!entry.isArray() || entry.size() != 3) {
            throw new AutomatonDecodeException(TRANSITIONS, "每条迁移必须是三元素列表: " + entry);
        }
        State source = decodeState(entry.get(0), header, TRANSITIONS);
        JsonNode symbolNode = entry.get(1);
        if (!symbolNode.isTextual()) {
            throw new AutomatonDecodeException(TRANSITIONS, "迁移符号必须是字符串: " + symbolNode);
        }
        Symbol symbol = Symbol.of(symbolNode.asText());
        if (symbol.isEpsilon()) {
            if (!epsilonAllowed) {
                throw new AutomatonDecodeException(TRANSITIONS, "DFA 迁移不能使用 epsilon: " + entry);
            }
        } else if (!header.alphabet.contains(symbol)) {
            throw new AutomatonDecodeException(TRANSITIONS, "符号 " + symbol + " 不在字母表中");
        }
        return TransitionKey.of(source, symbol);
    }

    private static State decodeState(JsonNode node, Header header, String field) throws AutomatonDecodeException {
        State state = State.of(requireLabel(node, field));
        if (!header.states.contains(state)) {
            throw new AutomatonDecodeException(field, "引用了不存在的状态 " + state);
        }
        return state;
    }

    private static JsonNode requireArray(JsonNode root, String field) throws AutomatonDecodeException {
        JsonNode node = root.get(field);
        if (node == null) {
            throw new AutomatonDecodeException(field, "缺少字段");
        }
        if (!node.isArray()) {
            throw new AutomatonDecodeException(field, "必须是列表");
        }
        return node;
    }

    private static String requireLabel(JsonNode node, String field) throws AutomatonDecodeException {
        if (node == null || !node.isTextual() || node.asText().isEmpty()) {
            throw new AutomatonDecodeException(field, "标签必须是非空字符串: " + node);
        }
        return node.asText();
    }

    /**
     * 两种自动机共有的字段。
     */
    private static final class Header {
        private final Alphabet alphabet;
        private final Set<State> states;
        private State initialState;
        private final Set<State> finalStates = new HashSet<>();

        private Header(Alphabet alphabet, Set<State> states) {
            this.alphabet = alphabet;
            this.states = states;
        }
    }
}
