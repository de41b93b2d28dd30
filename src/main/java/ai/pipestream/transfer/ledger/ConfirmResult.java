package ai.pipestream.transfer.ledger;

/**
 * Outcome of a chunk confirmation.
 *
 * @param newChunk      true only for the confirmation that created the record
 * @param uploadedCount number of distinct chunks confirmed in the session so far
 */
public record ConfirmResult(boolean newChunk, long uploadedCount) {
}
