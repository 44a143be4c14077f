package ai.eigloo.contactflow.graph.layout;

/**
 * Canvas coordinate of a block's top-left corner. X grows to the right, Y downwards.
 */
public record Position(int x, int y) {
}
