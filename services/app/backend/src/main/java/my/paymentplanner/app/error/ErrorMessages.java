package my.paymentplanner.app.error;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class ErrorMessages {
	private static final String FALLBACK = "Unknown error";

	private ErrorMessages() {
	}

	/**
	 * Collapses a cause chain into one readable line, skipping async wrappers and repeated messages.
	 */
	public static String reduce(Throwable error) {
		if (error == null) {
			return FALLBACK;
		}
		Set<String> messages = new LinkedHashSet<>();
		Throwable current = error;
		int depth = 0;
		while (current != null && depth < 10) {
			if (!(current instanceof CompletionException) && !(current instanceof ExecutionException)) {
				String message = current.getMessage();
				if (message != null && !message.isBlank()) {
					messages.add(message.trim());
				}
			}
			current = current.getCause();
			depth++;
		}
		if (messages.isEmpty()) {
			return error.getClass().getSimpleName();
		}
		return String.join(", ", messages);
	}

	public static Throwable unwrap(Throwable error) {
		Throwable current = error;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}
}
