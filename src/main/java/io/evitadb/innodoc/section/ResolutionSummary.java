package io.evitadb.innodoc.section;

/**
 * Counts of a link resolution run.
 *
 * @param resolved   references rewritten to a section URL
 * @param unresolved references whose target could not be found and were left untouched
 */
public record ResolutionSummary(int resolved, int unresolved) {

	public int total() {
		return this.resolved + this.unresolved;
	}
}
