package com.archlens.core.flow;

/**
 * One open block on the reconstruction stack.
 *
 * @param openDepth depth measure at the header (bracket depth or indentation column)
 * @param headerId id of the step created for the header
 * @param keyword control keyword that opened the block
 * @param joinId hidden join step shared by an if/elif/else or match chain, null otherwise
 * @param lastDecisionId most recent decision step of the chain, null outside branch chains
 * @param hasElse true once the chain reached its else branch
 * @param exitId hidden decision a for/loop block leaves through, null otherwise
 */
public record BlockFrame(
    int openDepth,
    String headerId,
    ControlKeyword keyword,
    String joinId,
    String lastDecisionId,
    boolean hasElse,
    String exitId
) {

    /**
     * Returns true for blocks that a continuation keyword (else, elif, catch) may follow.
     *
     * @return true for branch chains and try/catch blocks
     */
    boolean continuesChain() {
        return joinId != null || keyword == ControlKeyword.TRY || keyword == ControlKeyword.CATCH;
    }
}
