package com.fleetmind.dispatch.cli;

import com.fleetmind.core.model.Task;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;

/**
 * Task fields shared by {@code assign} and {@code redo}.
 */
public class TaskSpecOptions {

    @Option(names = {"--parent", "-p"}, description = "Parent (grouping) id")
    String parentId;

    @Option(names = {"--type", "-t"}, description = "Task type", defaultValue = "task")
    String type;

    @Option(names = {"--description", "-d"}, description = "What the worker should do")
    String description;

    @Option(names = {"--bloom", "-b"}, description = "Cognitive demand estimate, 1-6")
    Integer bloomLevel;

    @Option(names = {"--blocked-by"}, split = ",", description = "Predecessor task ids that must be done first")
    List<String> blockedBy = new ArrayList<>();

    Task toTask(String taskId, String redoOf) {
        return new Task(taskId, parentId, type, description, bloomLevel, blockedBy, redoOf, null, null);
    }
}
