package my.paymentplanner.app.editor;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Prior values of optimistic changes, keyed by entity. A change is staged before the request goes
 * out and either committed or rolled back when the response arrives.
 */
public class UndoBuffer<K, V> {
	private final Map<K, V> priorValues = new HashMap<>();

	public synchronized void stage(K key, V priorValue) {
		priorValues.putIfAbsent(key, priorValue);
	}

	public synchronized void commit(K key) {
		priorValues.remove(key);
	}

	/**
	 * Removes and returns the value to restore, if a change was staged.
	 */
	public synchronized Optional<V> rollback(K key) {
		return Optional.ofNullable(priorValues.remove(key));
	}

	public synchronized boolean hasPending(K key) {
		return priorValues.containsKey(key);
	}

	public synchronized void clear() {
		priorValues.clear();
	}
}
