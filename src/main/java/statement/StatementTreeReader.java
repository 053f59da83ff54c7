package statement;

import com.google.gson.*;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads classifier output from JSON. Two top-level shapes are accepted:
 * <pre>
 * [ {statement}, ... ]                                  one function called "main"
 * { "functions": [ {"name": "f", "body": [ ... ]} ] }   several functions
 * </pre>
 * A statement is {@code {"tag": "If", "label": "x > 0", "sourceText": "...",
 * "children": {"then": [...], "else": [...]}}}. Loops, switches and jumps may
 * also carry a {@code "jumpLabel"} naming the source label they define or target.
 */
public class StatementTreeReader {

    public static final String DEFAULT_FUNCTION_NAME = "main";

    public List<FunctionBody> read(Path path) throws IOException, StatementTreeException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public List<FunctionBody> read(Reader reader) throws StatementTreeException {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new StatementTreeException("Input is not valid JSON: " + e.getMessage(), e);
        }
        return readRoot(root);
    }

    public List<FunctionBody> read(String json) throws StatementTreeException {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new StatementTreeException("Input is not valid JSON: " + e.getMessage(), e);
        }
        return readRoot(root);
    }

    private List<FunctionBody> readRoot(JsonElement root) throws StatementTreeException {
        if (root != null && root.isJsonArray()) {
            return List.of(new FunctionBody(DEFAULT_FUNCTION_NAME, readStatements(root.getAsJsonArray(), "$")));
        }
        if (root != null && root.isJsonObject() && root.getAsJsonObject().has("functions")) {
            JsonElement functions = root.getAsJsonObject().get("functions");
            if (!functions.isJsonArray()) {
                throw new StatementTreeException("$.functions must be an array");
            }
            List<FunctionBody> result = new ArrayList<>();
            JsonArray array = functions.getAsJsonArray();
            for (int i = 0; i < array.size(); i++) {
                String path = "$.functions[" + i + "]";
                JsonObject function = requireObject(array.get(i), path);
                String name = optionalString(function, "name", path);
                JsonElement body = function.get("body");
                if (body == null || !body.isJsonArray()) {
                    throw new StatementTreeException(path + ".body must be an array of statements");
                }
                result.add(new FunctionBody(name == null ? "function" + i : name,
                        readStatements(body.getAsJsonArray(), path + ".body")));
            }
            return result;
        }
        throw new StatementTreeException("Top-level input must be a statement array or an object with 'functions'");
    }

    private List<StatementNode> readStatements(JsonArray array, String path) throws StatementTreeException {
        List<StatementNode> statements = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            statements.add(readStatement(array.get(i), path + "[" + i + "]"));
        }
        return statements;
    }

    private StatementNode readStatement(JsonElement element, String path) throws StatementTreeException {
        JsonObject object = requireObject(element, path);
        String tagName = optionalString(object, "tag", path);
        StatementTag tag = StatementTag.fromName(tagName);
        if (tag == null) {
            throw new StatementTreeException(path + ".tag is missing or unknown: " + tagName);
        }
        String label = optionalString(object, "label", path);
        String sourceText = optionalString(object, "sourceText", path);
        String jumpLabel = optionalString(object, "jumpLabel", path);

        Map<String, List<StatementNode>> children = new LinkedHashMap<>();
        JsonElement childrenElement = object.get("children");
        if (childrenElement != null && !childrenElement.isJsonNull()) {
            JsonObject blocks = requireObject(childrenElement, path + ".children");
            for (Map.Entry<String, JsonElement> block : blocks.entrySet()) {
                String blockPath = path + ".children." + block.getKey();
                if (!block.getValue().isJsonArray()) {
                    throw new StatementTreeException(blockPath + " must be an array of statements");
                }
                children.put(block.getKey(), readStatements(block.getValue().getAsJsonArray(), blockPath));
            }
        }
        return new StatementNode(tag, label, sourceText, children, jumpLabel);
    }

    private JsonObject requireObject(JsonElement element, String path) throws StatementTreeException {
        if (element == null || !element.isJsonObject()) {
            throw new StatementTreeException(path + " must be an object");
        }
        return element.getAsJsonObject();
    }

    private String optionalString(JsonObject object, String key, String path) throws StatementTreeException {
        JsonElement value = object.get(key);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (!value.isJsonPrimitive()) {
            throw new StatementTreeException(path + "." + key + " must be a string");
        }
        return value.getAsString();
    }
}
