package org.angnysa.mineinference.solver;

/**
 * Thrown when the knowledge base reaches a state no minefield can satisfy,
 * such as a sentence holding more mines than cells or a cell being both safe
 * and mined. Valid observations never lead there.
 */
public class InconsistentKnowledgeException extends IllegalStateException {

    public InconsistentKnowledgeException(String message) {
        super(message);
    }
}
