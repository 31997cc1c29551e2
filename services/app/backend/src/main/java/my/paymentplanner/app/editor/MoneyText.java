package my.paymentplanner.app.editor;

import my.paymentplanner.app.service.util.Money;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads money typed into a cell. Currency symbols, separators and other noise are stripped;
 * anything that still does not parse reads as zero once the cell is committed.
 */
public final class MoneyText {
	private static final Pattern NOISE = Pattern.compile("[^0-9.-]");

	private MoneyText() {
	}

	public static Optional<BigDecimal> tryParse(String raw) {
		if (raw == null) {
			return Optional.empty();
		}
		String cleaned = NOISE.matcher(raw).replaceAll("");
		if (cleaned.isEmpty() || "-".equals(cleaned) || ".".equals(cleaned)) {
			return Optional.empty();
		}
		try {
			return Optional.of(Money.round(new BigDecimal(cleaned)));
		} catch (NumberFormatException ex) {
			return Optional.empty();
		}
	}

	public static BigDecimal normalize(String raw) {
		return tryParse(raw).orElse(Money.ZERO);
	}
}
