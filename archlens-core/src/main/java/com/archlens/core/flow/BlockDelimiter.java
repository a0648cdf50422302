package com.archlens.core.flow;

import java.util.List;

/**
 * Strategy describing how a language delimits blocks.
 *
 * <p>The flow state machine is the same for every language; the delimiter supplies
 * the depth measure, the open test and the close predicate.
 *
 * @see BraceBlockDelimiter
 * @see IndentBlockDelimiter
 */
public interface BlockDelimiter {

    /**
     * Turns physical source lines into the lines the state machine consumes.
     *
     * <p>Comments and blank lines are removed. Implementations may split a physical
     * line so that every block opener and closer ends up on a line of its own.
     *
     * @param physicalLines source lines, already capped
     * @return logical lines
     */
    List<String> logicalLines(List<String> physicalLines);

    /**
     * Returns the nesting depth at the start of a line.
     *
     * @param line logical line
     * @param trackedDepth depth tracked from the previous lines
     * @return depth measure
     */
    int depthOf(String line, int trackedDepth);

    /**
     * Returns the tracked depth after consuming a line.
     *
     * @param line logical line
     * @param trackedDepth depth tracked before the line
     * @return depth tracked after the line
     */
    int trackedDepthAfter(String line, int trackedDepth);

    /**
     * Tests whether a line closes the given open block.
     *
     * @param line logical line, stripped of anything a previous close consumed
     * @param depth depth at the start of the line
     * @param frame innermost open block
     * @return true when the block ends at this line
     */
    boolean closes(String line, int depth, BlockFrame frame);

    /**
     * Returns what is left of a line once its closing token is consumed.
     *
     * @param line logical line
     * @return remainder, stripped
     */
    String afterClose(String line);

    /**
     * Returns the depth at which a header following a close starts.
     *
     * @param depth depth at the start of the line
     * @return depth after the close
     */
    int depthAfterClose(int depth);

    /**
     * Tests whether a header line opens a block.
     *
     * @param statement stripped statement text
     * @return true when a block body follows
     */
    boolean opensBlock(String statement);
}
