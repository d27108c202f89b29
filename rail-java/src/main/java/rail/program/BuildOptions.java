package rail.program;

import rail.cfg.Key;
import rail.cfg.SystemBuilder;

// parallelism == 1: компиляция в вызывающем потоке
public record BuildOptions(Key entry, boolean simplify, int parallelism) {

    public BuildOptions {
        if (entry == null) throw new IllegalArgumentException("entry must not be null");
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
    }

    public static BuildOptions defaults() {
        return new BuildOptions(SystemBuilder.DEFAULT_ENTRY, true, 1);
    }

    public BuildOptions withSimplify(boolean simplify) {
        return new BuildOptions(entry, simplify, parallelism);
    }

    public BuildOptions withParallelism(int parallelism) {
        return new BuildOptions(entry, simplify, parallelism);
    }

    public BuildOptions withEntry(Key entry) {
        return new BuildOptions(entry, simplify, parallelism);
    }
}
