package rail.program;

import rail.cfg.RailSystem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public record Program(Map<String, RailSystem> functions) {

    public Program {
        functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    public RailSystem get(String name) {
        return functions.get(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return functions.keySet();
    }
}
