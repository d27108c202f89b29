package rail.program;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rail.cfg.RailSystem;
import rail.cfg.SystemBuilder;
import rail.grid.Grid;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public final class ProgramCompiler {
    private static final Logger logger = LoggerFactory.getLogger(ProgramCompiler.class);

    private record Unit(String name, String source) {}

    private final BuildOptions options;

    public ProgramCompiler() {
        this(BuildOptions.defaults());
    }

    public ProgramCompiler(BuildOptions options) {
        this.options = options;
    }

    public Program compile(String source) {
        // 1) разбиение на функции
        List<Unit> units = new ArrayList<>();
        for (String span : FunctionSplitter.split(source)) {
            Optional<String> name = FunctionSplitter.functionName(span);
            if (name.isPresent()) {
                units.add(new Unit(name.get(), span));
            } else {
                logger.debug("Dropping span without a function name: {}", firstLine(span));
            }
        }

        // 2) графы
        List<RailSystem> systems = options.parallelism() > 1 && units.size() > 1
                ? compileParallel(units)
                : compileSequential(units);

        // 3) таблица; повторное определение заменяет прежнее
        Map<String, RailSystem> table = new LinkedHashMap<>();
        for (int i = 0; i < units.size(); i++) {
            String name = units.get(i).name();
            if (table.containsKey(name)) {
                logger.warn("Function '{}' is defined more than once; the last definition wins", name);
                table.remove(name);
            }
            table.put(name, systems.get(i));
        }

        logger.debug("Compiled {} functions", table.size());
        return new Program(table);
    }

    public RailSystem compileFunction(String span) {
        return SystemBuilder.build(Grid.of(span), options.entry(), options.simplify());
    }

    private List<RailSystem> compileSequential(List<Unit> units) {
        List<RailSystem> out = new ArrayList<>();
        for (Unit u : units) out.add(compileUnit(u));
        return out;
    }

    private List<RailSystem> compileParallel(List<Unit> units) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(options.parallelism(), units.size()));
        try {
            List<Future<RailSystem>> futures = new ArrayList<>();
            for (Unit u : units) futures.add(pool.submit(() -> compileUnit(u)));

            List<RailSystem> out = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    out.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Failed to compile '" + units.get(i).name() + "'", e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while compiling functions", e);
                }
            }
            return out;
        } finally {
            pool.shutdownNow();
        }
    }

    private RailSystem compileUnit(Unit u) {
        RailSystem system = compileFunction(u.source());
        logger.debug("Function '{}': {} keys", u.name(), system.size());
        return system;
    }

    private static String firstLine(String span) {
        int nl = span.indexOf('\n');
        return nl < 0 ? span : span.substring(0, nl);
    }
}
