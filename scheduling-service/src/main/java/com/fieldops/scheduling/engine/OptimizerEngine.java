package com.fieldops.scheduling.engine;

import com.fieldops.scheduling.domain.OptimizationOptions.Algorithm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy insertion followed, for {@link Algorithm#INTELLIGENT}, by bounded local search.
 *
 * The engine is stateless and side-effect free: the same problem and limits give the same
 * solution unless the deadline cuts the search short.
 */
@Slf4j
@Component
public class OptimizerEngine {

    public static final String ALGORITHM_VERSION = "greedy-insertion+relocate-swap/1.2";

    public EngineResult solve(ProblemInstance problem, Algorithm algorithm, SearchLimits limits,
                              CancellationToken token) {
        List<Integer> jobs = new ArrayList<>(problem.jobCount());
        for (int j = 0; j < problem.jobCount(); j++) {
            jobs.add(j);
        }

        InsertionResult greedy = InsertionHeuristic.insertAll(problem, Solution.empty(problem), jobs, token);
        Solution initial = greedy.solution();
        long initialTravel = travelSeconds(initial);

        if (algorithm == Algorithm.GREEDY || greedy.cancelled()) {
            return new EngineResult(initial, greedy.unscheduled(), initial.cost(), initialTravel, 0, false,
                    greedy.cancelled());
        }

        LocalSearchResult improved = LocalSearch.improve(problem, initial, limits, token, null);
        log.debug("Local search: {} iteration(s), cost {} -> {}, timedOut={}, cancelled={}",
                improved.iterations(), initial.cost(), improved.solution().cost(),
                improved.timedOut(), improved.cancelled());

        return new EngineResult(improved.solution(), greedy.unscheduled(), initial.cost(), initialTravel,
                improved.iterations(), improved.timedOut(), improved.cancelled());
    }

    static long travelSeconds(Solution solution) {
        long total = 0;
        for (int t = 0; t < solution.technicianCount(); t++) {
            total += solution.schedule(t).travelSeconds();
        }
        return total;
    }
}
