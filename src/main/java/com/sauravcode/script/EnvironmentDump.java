package com.sauravcode.script;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sauravcode.script.parser.Environment;
import com.sauravcode.script.parser.Interpreter;
import com.sauravcode.script.parser.UserFunction;
import com.sauravcode.script.parser.Value;
import com.sauravcode.script.parser.ValueFormatter;

/**
 * JSON view of an interpreter session: its variables and user functions.
 *
 * <pre>
 * {
 *   "variables": { "n": 5, "names": ["a", "b"], "ages": [{"key": "bob", "value": 41}] },
 *   "functions": [ { "name": "add", "params": ["a", "b"] } ]
 * }
 * </pre>
 *
 * Maps become arrays of key/value pairs because their keys need not be strings.
 * Non-finite numbers become the strings {@code nan}, {@code inf} and {@code -inf}.
 */
public final class EnvironmentDump {

    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nodes = om.getNodeFactory();

    private EnvironmentDump() {}

    public static ObjectNode toTree(Interpreter interpreter) {
        Environment env = interpreter.environment();
        ObjectNode root = om.createObjectNode();

        ObjectNode vars = root.putObject("variables");
        for (Map.Entry<String, Value> e : env.variables().entrySet()) {
            vars.set(e.getKey(), toNode(e.getValue()));
        }

        ArrayNode fns = root.putArray("functions");
        for (UserFunction fn : env.functions().values()) {
            ObjectNode f = fns.addObject();
            f.put("name", fn.getName());
            ArrayNode params = f.putArray("params");
            for (String p : fn.getParameterNames()) params.add(p);
        }
        return root;
    }

    public static String toJson(Interpreter interpreter) throws JsonProcessingException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(interpreter));
    }

    static JsonNode toNode(Value v) {
        switch (v.getType()) {
            case NUMBER: {
                double d = v.asNumber();
                if (Double.isNaN(d) || Double.isInfinite(d)) return nodes.textNode(ValueFormatter.formatNumber(d));
                if (d == Math.rint(d) && Math.abs(d) < 1e15) return nodes.numberNode((long) d);
                return nodes.numberNode(d);
            }
            case BOOL:
                return nodes.booleanNode(v.asBool());
            case STRING:
                return nodes.textNode(v.asString());
            case LIST: {
                ArrayNode arr = nodes.arrayNode();
                List<Value> items = v.asList();
                for (Value item : items) arr.add(toNode(item));
                return arr;
            }
            case MAP: {
                ArrayNode arr = nodes.arrayNode();
                for (Map.Entry<Value, Value> e : v.asMap().entrySet()) {
                    ObjectNode pair = arr.addObject();
                    pair.set("key", toNode(e.getKey()));
                    pair.set("value", toNode(e.getValue()));
                }
                return arr;
            }
            default:
                return NullNode.instance;
        }
    }
}
