package org.neuralchilli.hive.suggest;

import org.neuralchilli.hive.domain.Task;

import java.util.Collection;
import java.util.List;

/**
 * Infers likely dependency edges for a task from its description.
 */
public interface DependencySuggester {

    /**
     * @param taskId      task being analysed
     * @param description its description
     * @param candidates  other tasks that could take part in an edge
     * @return suggested edges, most confident first
     */
    List<SuggestedDependency> suggest(String taskId, String description, Collection<Task> candidates);
}
