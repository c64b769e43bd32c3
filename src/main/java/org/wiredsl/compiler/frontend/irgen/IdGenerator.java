package org.wiredsl.compiler.frontend.irgen;

import java.util.HashMap;
import java.util.Map;

/**
 * Issues sequential identifiers per prefix ({@code node_1}, {@code node_2}, ...).
 * Must be reset at the start of every run so that identical input yields identical ids.
 */
public final class IdGenerator {

	private final Map<String, Integer> counters = new HashMap<>();

	/**
	 * @param prefix The id prefix.
	 * @return The next id for that prefix, starting at {@code prefix_1}.
	 */
	public String generate(String prefix) {
		int next = counters.merge(prefix, 1, Integer::sum);
		return prefix + "_" + next;
	}

	/**
	 * Clears all counters.
	 */
	public void reset() {
		counters.clear();
	}
}
