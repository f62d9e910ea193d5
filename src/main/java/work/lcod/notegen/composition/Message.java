package work.lcod.notegen.composition;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record Message(MessageRole role, String content) {
    public Message {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        out.put("role", role.wireName());
        out.put("content", content);
        return out;
    }
}
