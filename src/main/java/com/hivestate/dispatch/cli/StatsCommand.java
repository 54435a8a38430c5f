package com.hivestate.dispatch.cli;

import com.hivestate.core.model.Agent;
import com.hivestate.core.model.Task;
import com.hivestate.core.orchestration.StateManager;
import com.hivestate.core.orchestration.StateUnavailableException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: hivestate stats
 * <p>
 * Lists active agents and the head of the pending queue, then prints the orchestrator
 * counters accumulated while doing so.
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show agent, task and cache statistics")
@Component
public class StatsCommand implements Callable<Integer> {

    @Option(names = {"--pending-limit", "-n"}, description = "Pending tasks to show (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int pendingLimit;

    private final StateManager stateManager;

    public StatsCommand(StateManager stateManager) {
        this.stateManager = stateManager;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            List<Agent> agents = stateManager.getActiveAgents();
            ConsoleOutput.info("Active agents: " + agents.size());
            for (Agent agent : agents) {
                System.out.println("  " + agent.agentId() + "  " + agent.status().wireValue() +
                        agent.currentTask().map(t -> "  task " + t).orElse(""));
            }

            List<Task> pending = stateManager.getPendingTasks(pendingLimit);
            ConsoleOutput.info("Pending tasks (top " + pendingLimit + "): " + pending.size());
            for (Task task : pending) {
                System.out.println("  " + task.taskId() + "  priority " + task.priority());
            }
        } catch (StateUnavailableException e) {
            ConsoleOutput.error("State layer unavailable: " + e.getMessage());
            return 1;
        }

        ConsoleOutput.rule();
        ConsoleOutput.performance(stateManager.getPerformanceStats());
        return 0;
    }
}
